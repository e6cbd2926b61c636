package io.trading.rofex.client.stream;

/**
 * Work item of the session's worker thread.
 *
 * @param type       Kind of event
 * @param generation Connection the event belongs to; events of older connections are ignored
 * @param text       Frame text for FRAME and OUTBOUND
 * @param cause      Failure for ERROR
 * @param critical   For OUTBOUND: whether dropping the frame must be reported
 */
record SessionEvent(Type type, long generation, String text, Throwable cause, boolean critical) {

    enum Type {
        FRAME,
        OUTBOUND,
        ERROR,
        CLOSED,
        CLOSE_REQUESTED
    }

    static SessionEvent frame(long generation, String text) {
        return new SessionEvent(Type.FRAME, generation, text, null, false);
    }

    static SessionEvent outbound(long generation, String text, boolean critical) {
        return new SessionEvent(Type.OUTBOUND, generation, text, null, critical);
    }

    static SessionEvent error(long generation, Throwable cause) {
        return new SessionEvent(Type.ERROR, generation, null, cause, false);
    }

    static SessionEvent closed(long generation) {
        return new SessionEvent(Type.CLOSED, generation, null, null, false);
    }

    static SessionEvent closeRequested() {
        return new SessionEvent(Type.CLOSE_REQUESTED, -1, null, null, false);
    }
}
