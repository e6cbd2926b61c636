package io.trading.rofex.protocol.message;

/**
 * Categories an inbound frame is classified into.
 * Handlers are registered per category.
 */
public enum MessageCategory {
    MARKET_DATA("market_data"),
    ORDER_REPORT("order_report"),
    ERROR("error");

    private final String displayName;

    MessageCategory(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
