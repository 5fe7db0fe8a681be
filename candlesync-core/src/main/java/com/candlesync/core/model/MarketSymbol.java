package com.candlesync.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;
import java.time.LocalTime;

/**
 * The closed set of instruments kept in the candle tables.
 *
 * Each symbol carries the timestamp alignment rules its stored history was
 * built with, so that provider candles land on the same keys:
 * - daily candles are anchored to a fixed UTC time of day
 * - some (symbol, timeframe) pairs are shifted to correct a provider clock offset
 */
public enum MarketSymbol {
    ES("es", LocalTime.MIDNIGHT),
    EURUSD("eurusd", LocalTime.MIDNIGHT),
    SPY("spy", LocalTime.of(14, 30));

    private final String id;
    private final LocalTime dailyAnchor;

    MarketSymbol(String id, LocalTime dailyAnchor) {
        this.id = id;
        this.dailyAnchor = dailyAnchor;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    /**
     * UTC time of day that daily candles of this symbol are stored at.
     */
    public LocalTime getDailyAnchor() {
        return dailyAnchor;
    }

    /**
     * Offset added to provider timestamps for the given timeframe.
     * The stored eurusd 5m series runs 5 hours ahead of the provider.
     */
    public Duration clockOffset(Timeframe timeframe) {
        if (this == EURUSD && timeframe == Timeframe.M5) {
            return Duration.ofHours(5);
        }
        return Duration.ZERO;
    }

    @JsonCreator
    public static MarketSymbol fromId(String id) {
        if (id != null) {
            for (MarketSymbol symbol : values()) {
                if (symbol.id.equalsIgnoreCase(id.trim())) {
                    return symbol;
                }
            }
        }
        throw new IllegalArgumentException("Unknown symbol: " + id);
    }

    @Override
    public String toString() {
        return id;
    }
}
