package io.trading.rofex.protocol.error;

/**
 * Raised when an outbound request is malformed.
 * Always thrown before anything is written to the transport.
 */
public class ValidationException extends RofexException {

    public ValidationException(String message) {
        super(message);
    }
}
