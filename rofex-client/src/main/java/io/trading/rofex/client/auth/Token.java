package io.trading.rofex.client.auth;

import java.time.Instant;

/**
 * Access token issued by the authentication endpoint.
 *
 * @param value     The opaque token sent as X-Auth-Token
 * @param issuedAt  When the token was obtained
 * @param expiresAt When the token is assumed to expire
 */
public record Token(String value, Instant issuedAt, Instant expiresAt) {
    public Token {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("value cannot be null or empty");
        }
        if (issuedAt == null || expiresAt == null) {
            throw new IllegalArgumentException("issuedAt and expiresAt cannot be null");
        }
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    @Override
    public String toString() {
        return "Token[issuedAt=" + issuedAt + ", expiresAt=" + expiresAt + "]";
    }
}
