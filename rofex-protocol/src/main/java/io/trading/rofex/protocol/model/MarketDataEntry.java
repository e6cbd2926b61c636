package io.trading.rofex.protocol.model;

import io.trading.rofex.protocol.error.ValidationException;

import java.util.List;

/**
 * Market data entries that can be requested for an instrument.
 */
public enum MarketDataEntry {
    BIDS("BI", true),
    OFFERS("OF", true),
    LAST("LA", false),
    OPENING_PRICE("OP", false),
    CLOSING_PRICE("CL", false),
    SETTLEMENT_PRICE("SE", false),
    HIGH_PRICE("HI", false),
    LOW_PRICE("LO", false),
    TRADE_VOLUME("TV", false),
    OPEN_INTEREST("OI", false),
    INDEX_VALUE("IV", false),
    TRADE_EFFECTIVE_VOLUME("EV", false),
    NOMINAL_VOLUME("NV", false),
    AUCTION_PRICE("ACP", false);

    private static final List<MarketDataEntry> ALL = List.of(values());

    private final String code;
    private final boolean book;

    MarketDataEntry(String code, boolean book) {
        this.code = code;
        this.book = book;
    }

    public String getCode() {
        return code;
    }

    /**
     * Whether the entry is a book side (a list of price levels).
     */
    public boolean isBook() {
        return book;
    }

    /**
     * Resolves a wire entry code.
     *
     * @throws ValidationException if the code does not name an entry
     */
    public static MarketDataEntry fromCode(String code) {
        MarketDataEntry entry = lookup(code);
        if (entry == null) {
            throw new ValidationException("Invalid Market Data Entry: " + code);
        }
        return entry;
    }

    /**
     * Same as {@link #fromCode(String)} but returns null for unknown codes.
     */
    public static MarketDataEntry lookup(String code) {
        if (code == null) {
            return null;
        }
        for (MarketDataEntry entry : ALL) {
            if (entry.code.equalsIgnoreCase(code)) {
                return entry;
            }
        }
        return null;
    }

    /**
     * Every entry, in declaration order. Used when a caller asks for no specific entries.
     */
    public static List<MarketDataEntry> all() {
        return ALL;
    }
}
