package io.trading.rofex.protocol.model;

/**
 * Order status as reported in execution reports.
 */
public enum OrderStatus {
    PENDING_NEW,
    NEW,
    PARTIALLY_FILLED,
    FILLED,
    PENDING_CANCEL,
    CANCELLED,
    PENDING_REPLACE,
    REPLACED,
    REJECTED,
    EXPIRED,
    UNKNOWN;

    public static OrderStatus fromString(String value) {
        if (value == null || value.isEmpty()) {
            return UNKNOWN;
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }

    /**
     * Whether no further execution reports are expected for the order.
     */
    public boolean isFinal() {
        return this == FILLED || this == CANCELLED || this == REJECTED || this == EXPIRED;
    }
}
