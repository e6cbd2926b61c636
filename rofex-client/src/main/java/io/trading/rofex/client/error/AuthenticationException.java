package io.trading.rofex.client.error;

import io.trading.rofex.protocol.error.RofexException;

/**
 * Credentials or token were rejected, or the login was not acknowledged in time.
 * Fatal to whatever operation raised it.
 */
public class AuthenticationException extends RofexException {

    private final int statusCode;

    public AuthenticationException(String message) {
        this(message, -1, null);
    }

    public AuthenticationException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public AuthenticationException(String message, int statusCode) {
        this(message, statusCode, null);
    }

    public AuthenticationException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status that caused the rejection, -1 when not caused by a response.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
