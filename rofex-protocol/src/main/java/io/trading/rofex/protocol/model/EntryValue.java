package io.trading.rofex.protocol.model;

import java.math.BigDecimal;

/**
 * One value of a market data entry: a book level, the last trade, a volume...
 *
 * @param price Price or value of the entry
 * @param size  Size when the entry carries one, otherwise null
 * @param date  Timestamp in milliseconds when the entry carries one, otherwise null
 */
public record EntryValue(BigDecimal price, BigDecimal size, Long date) {

    public static EntryValue of(BigDecimal price) {
        return new EntryValue(price, null, null);
    }
}
