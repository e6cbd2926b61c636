package io.trading.rofex.protocol.message;

/**
 * Error notice: either sent by the gateway or produced locally for a frame
 * that could not be classified.
 *
 * @param source      Where the error comes from
 * @param code        Short error code or message
 * @param description Human readable description
 * @param raw         The frame as received
 */
public record ErrorMessage(
    Source source,
    String code,
    String description,
    String raw
) implements InboundMessage {
    public ErrorMessage {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
    }

    @Override
    public MessageCategory category() {
        return MessageCategory.ERROR;
    }

    /**
     * Origin of an {@link ErrorMessage}.
     */
    public enum Source {
        /** Error frame sent by the gateway. */
        GATEWAY,
        /** Well-formed frame with a missing or unknown type. */
        UNSUPPORTED,
        /** Frame that is not valid JSON. */
        MALFORMED
    }
}
