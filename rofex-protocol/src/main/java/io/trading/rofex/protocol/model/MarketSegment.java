package io.trading.rofex.protocol.model;

/**
 * Market segments used to filter instrument queries.
 */
public enum MarketSegment {
    DDA("DDA"),
    DDF("DDF"),
    DUAL("DUAL"),
    UDDA("U-DDA"),
    UDDF("U-DDF"),
    UDUAL("U-DUAL"),
    MERV("MERV");

    private final String code;

    MarketSegment(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
