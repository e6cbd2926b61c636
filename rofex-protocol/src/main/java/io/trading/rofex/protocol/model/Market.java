package io.trading.rofex.protocol.model;

/**
 * Market identifiers accepted by the gateway.
 */
public enum Market {
    ROFEX("ROFX");

    private final String code;

    Market(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Resolves a wire market id, returns null when unknown.
     */
    public static Market fromCode(String code) {
        for (Market market : values()) {
            if (market.code.equalsIgnoreCase(code)) {
                return market;
            }
        }
        return null;
    }
}
