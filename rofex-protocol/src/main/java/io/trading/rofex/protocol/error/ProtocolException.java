package io.trading.rofex.protocol.error;

/**
 * An inbound frame could not be parsed or carried an unsupported type.
 * Only affects the frame it was raised for.
 */
public class ProtocolException extends RofexException {

    private final String rawFrame;

    public ProtocolException(String message, String rawFrame) {
        super(message);
        this.rawFrame = rawFrame;
    }

    public ProtocolException(String message, String rawFrame, Throwable cause) {
        super(message, cause);
        this.rawFrame = rawFrame;
    }

    /**
     * The frame exactly as received.
     */
    public String getRawFrame() {
        return rawFrame;
    }
}
