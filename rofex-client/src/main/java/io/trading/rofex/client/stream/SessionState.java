package io.trading.rofex.client.stream;

/**
 * Lifecycle of a streaming session.
 *
 * IDLE -> CONNECTING -> AUTHENTICATING -> ACTIVE on start. After a connection loss the
 * session stays RECONNECTING for the backoff waits and for every connect and handshake
 * attempt, then goes back to ACTIVE or ends CLOSED. CONNECTING and AUTHENTICATING are
 * only observed during the initial start.
 */
public enum SessionState {
    IDLE,
    CONNECTING,
    AUTHENTICATING,
    ACTIVE,
    RECONNECTING,
    CLOSING,
    CLOSED;

    public boolean isTerminal() {
        return this == CLOSING || this == CLOSED;
    }
}
