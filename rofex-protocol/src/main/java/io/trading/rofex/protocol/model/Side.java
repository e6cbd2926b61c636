package io.trading.rofex.protocol.model;

/**
 * Order side (buy or sell).
 */
public enum Side {
    BUY("buy"),
    SELL("sell"),
    UNKNOWN("unknown");

    private final String wireValue;

    Side(String wireValue) {
        this.wireValue = wireValue;
    }

    public String getWireValue() {
        return wireValue;
    }

    public static Side fromString(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        return switch (value.toLowerCase()) {
            case "buy", "b" -> BUY;
            case "sell", "s" -> SELL;
            default -> UNKNOWN;
        };
    }
}
