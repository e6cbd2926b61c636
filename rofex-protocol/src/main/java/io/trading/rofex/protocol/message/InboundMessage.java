package io.trading.rofex.protocol.message;

/**
 * A decoded inbound frame: {@link MarketDataMessage}, {@link OrderReportMessage} or {@link ErrorMessage}.
 */
public interface InboundMessage {

    /**
     * The category used to pick the handlers of this message.
     */
    MessageCategory category();

    /**
     * The frame exactly as received, for diagnostics.
     */
    String raw();
}
