package io.trading.rofex.client.error;

import io.trading.rofex.protocol.error.RofexException;
import io.trading.rofex.protocol.message.InboundMessage;
import io.trading.rofex.protocol.message.MessageCategory;

/**
 * An application handler threw while processing a message.
 */
public class HandlerException extends RofexException {

    private final MessageCategory category;
    private final transient InboundMessage inboundMessage;

    public HandlerException(MessageCategory category, InboundMessage inboundMessage, Throwable cause) {
        super("Handler for " + category + " failed: " + cause, cause);
        this.category = category;
        this.inboundMessage = inboundMessage;
    }

    public MessageCategory getCategory() {
        return category;
    }

    /**
     * The message that was being dispatched.
     */
    public InboundMessage getInboundMessage() {
        return inboundMessage;
    }
}
