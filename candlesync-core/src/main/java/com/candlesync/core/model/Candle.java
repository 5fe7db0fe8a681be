package com.candlesync.core.model;

import java.time.Instant;

/**
 * Canonical OHLCV candle as stored in a {@code <schema>.<symbol>_<timeframe>} table.
 *
 * Timestamps are epoch milliseconds, UTC. The candle color is not a component:
 * it is always derived from open and close, so no source can hand in a color
 * that disagrees with its own prices.
 */
public record Candle(
    MarketSymbol symbol,
    long timestamp,
    double open,
    double high,
    double low,
    double close,
    long volume
) {
    public Candle {
        if (symbol == null) {
            throw new IllegalArgumentException("Candle symbol is required");
        }
        if (volume < 0) {
            throw new IllegalArgumentException("Negative volume " + volume + " at " + Instant.ofEpochMilli(timestamp));
        }
    }

    public CandleColor color() {
        return CandleColor.of(open, close);
    }

    public Instant instant() {
        return Instant.ofEpochMilli(timestamp);
    }

    /**
     * Copy of this candle keyed at the same timestamp but carrying the prices
     * and volume of {@code other}.
     */
    public Candle withValuesOf(Candle other) {
        return new Candle(symbol, timestamp, other.open, other.high, other.low, other.close, other.volume);
    }
}
