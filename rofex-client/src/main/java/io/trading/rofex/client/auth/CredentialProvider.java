package io.trading.rofex.client.auth;

/**
 * Owns authentication and hands out tokens to the REST client and the streaming session.
 * Implementations must be thread-safe.
 */
public interface CredentialProvider {

    /**
     * Returns a token that has not expired, authenticating if needed.
     *
     * @throws io.trading.rofex.client.error.AuthenticationException if the credentials are rejected
     * @throws io.trading.rofex.client.error.TransportException if the authentication endpoint is unreachable
     */
    Token getToken();

    /**
     * Discards the current token and authenticates again.
     * Called after the gateway rejected a token it considered expired.
     *
     * @throws io.trading.rofex.client.error.AuthenticationException if the credentials are rejected
     * @throws io.trading.rofex.client.error.TransportException if the authentication endpoint is unreachable
     */
    Token refresh();
}
