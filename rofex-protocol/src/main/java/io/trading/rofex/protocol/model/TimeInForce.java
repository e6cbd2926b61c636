package io.trading.rofex.protocol.model;

/**
 * How long an order stays active.
 * GOOD_TILL_DATE requires an expire date on the order.
 */
public enum TimeInForce {
    DAY("Day"),
    IMMEDIATE_OR_CANCEL("IOC"),
    FILL_OR_KILL("FOK"),
    GOOD_TILL_DATE("GTD");

    private final String wireValue;

    TimeInForce(String wireValue) {
        this.wireValue = wireValue;
    }

    public String getWireValue() {
        return wireValue;
    }

    public static TimeInForce fromString(String value) {
        if (value == null) {
            return null;
        }
        for (TimeInForce tif : values()) {
            if (tif.wireValue.equalsIgnoreCase(value) || tif.name().equalsIgnoreCase(value)) {
                return tif;
            }
        }
        return null;
    }
}
