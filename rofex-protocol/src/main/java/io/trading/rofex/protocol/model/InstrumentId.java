package io.trading.rofex.protocol.model;

/**
 * Identifies an instrument on a market.
 *
 * @param marketId Market id as sent by the gateway (e.g., "ROFX")
 * @param symbol   Instrument symbol (e.g., "DLR/DIC23")
 */
public record InstrumentId(String marketId, String symbol) {
    public InstrumentId {
        if (symbol == null || symbol.isEmpty()) {
            throw new IllegalArgumentException("symbol cannot be null or empty");
        }
    }

    public static InstrumentId of(Market market, String symbol) {
        return new InstrumentId(market.getCode(), symbol);
    }
}
