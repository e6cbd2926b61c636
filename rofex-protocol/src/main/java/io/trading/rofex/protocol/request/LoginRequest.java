package io.trading.rofex.protocol.request;

/**
 * Streaming handshake carrying the authentication token.
 *
 * @param token Access token issued by the REST authentication endpoint
 */
public record LoginRequest(String token) {

    @Override
    public String toString() {
        // never log the token
        return "LoginRequest[token=***]";
    }
}
