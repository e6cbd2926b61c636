package io.trading.rofex.protocol.error;

/**
 * Base class of every exception raised by the connector.
 * Unchecked: callers decide where to handle connector failures.
 */
public class RofexException extends RuntimeException {

    public RofexException(String message) {
        super(message);
    }

    public RofexException(String message, Throwable cause) {
        super(message, cause);
    }
}
