package io.trading.rofex.protocol.request;

import io.trading.rofex.protocol.model.Market;
import io.trading.rofex.protocol.model.MarketDataEntry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Market data subscription for a set of instruments.
 * Validated by the codec when encoded, not on construction.
 *
 * @param tickers Instrument symbols
 * @param entries Requested entries
 * @param market  Market of the instruments
 * @param depth   Book depth for BI/OF entries
 */
public record MarketDataSubscription(
    List<String> tickers,
    List<MarketDataEntry> entries,
    Market market,
    int depth
) implements SubscriptionRequest {

    public static final int DEFAULT_DEPTH = 1;

    public MarketDataSubscription {
        tickers = tickers == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(tickers));
        entries = entries == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public static MarketDataSubscription of(Collection<String> tickers, Collection<MarketDataEntry> entries) {
        return new MarketDataSubscription(
            tickers == null ? null : new ArrayList<>(tickers),
            entries == null ? null : new ArrayList<>(entries),
            Market.ROFEX,
            DEFAULT_DEPTH
        );
    }

    @Override
    public String describe() {
        return "market data " + tickers + " " + entries + " depth=" + depth;
    }
}
