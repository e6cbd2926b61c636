package io.trading.rofex.client.error;

import io.trading.rofex.protocol.error.RofexException;

/**
 * Connection could not be established, was lost or timed out.
 * Recoverable unless {@link #isTerminal()} is true.
 */
public class TransportException extends RofexException {

    private final boolean terminal;

    public TransportException(String message) {
        this(message, null, false);
    }

    public TransportException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public TransportException(String message, Throwable cause, boolean terminal) {
        super(message, cause);
        this.terminal = terminal;
    }

    /**
     * Whether the session gave up after this failure.
     */
    public boolean isTerminal() {
        return terminal;
    }
}
