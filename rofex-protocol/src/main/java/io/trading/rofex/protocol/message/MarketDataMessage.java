package io.trading.rofex.protocol.message;

import io.trading.rofex.protocol.model.EntryValue;
import io.trading.rofex.protocol.model.InstrumentId;
import io.trading.rofex.protocol.model.MarketDataEntry;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Market data snapshot or update for one instrument.
 *
 * @param instrument The instrument the entries belong to
 * @param timestamp  Gateway timestamp in milliseconds (0 when absent)
 * @param entries    Values per requested entry; book entries hold one value per level
 * @param raw        The frame as received
 */
public record MarketDataMessage(
    InstrumentId instrument,
    long timestamp,
    Map<MarketDataEntry, List<EntryValue>> entries,
    String raw
) implements InboundMessage {
    public MarketDataMessage {
        if (instrument == null) {
            throw new IllegalArgumentException("instrument cannot be null");
        }
        entries = entries == null || entries.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new EnumMap<>(entries));
    }

    @Override
    public MessageCategory category() {
        return MessageCategory.MARKET_DATA;
    }

    /**
     * Values of an entry, empty if the entry was not present or null on the wire.
     */
    public List<EntryValue> entry(MarketDataEntry entry) {
        return entries.getOrDefault(entry, List.of());
    }

    /**
     * First value of an entry: top of book for book entries, the value itself otherwise.
     */
    public Optional<EntryValue> first(MarketDataEntry entry) {
        List<EntryValue> values = entry(entry);
        return values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    public Optional<EntryValue> last() {
        return first(MarketDataEntry.LAST);
    }

    public List<EntryValue> bids() {
        return entry(MarketDataEntry.BIDS);
    }

    public List<EntryValue> offers() {
        return entry(MarketDataEntry.OFFERS);
    }
}
