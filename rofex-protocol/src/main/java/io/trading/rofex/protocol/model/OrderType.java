package io.trading.rofex.protocol.model;

/**
 * Order types accepted by the gateway.
 */
public enum OrderType {
    LIMIT("limit"),
    MARKET("market"),
    MARKET_TO_LIMIT("market_to_limit");

    private final String wireValue;

    OrderType(String wireValue) {
        this.wireValue = wireValue;
    }

    public String getWireValue() {
        return wireValue;
    }

    /**
     * Lenient lookup used when decoding execution reports; returns null when unknown.
     */
    public static OrderType fromString(String value) {
        if (value == null) {
            return null;
        }
        for (OrderType type : values()) {
            if (type.wireValue.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        return null;
    }
}
