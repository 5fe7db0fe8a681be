package com.candlesync.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Candle sampling granularity. The id doubles as the table name suffix
 * ({@code es_1m}) and as the key used in configuration files.
 */
public enum Timeframe {
    M1("1m", "1m"),
    M5("5m", "5m"),
    M15("15m", "15m"),
    M30("30m", "30m"),
    H1("1h", "60m"),
    H4("4h", null),
    D1("1d", "1d");

    private final String id;
    private final String providerInterval;

    Timeframe(String id, String providerInterval) {
        this.id = id;
        this.providerInterval = providerInterval;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    /**
     * Interval name the chart provider expects, or null when the provider
     * has no native bars at this granularity.
     */
    public String getProviderInterval() {
        return providerInterval;
    }

    public boolean isDaily() {
        return this == D1;
    }

    /**
     * The finest granularity, the only one backfilled from the secondary store.
     */
    public boolean isFinest() {
        return this == M1;
    }

    @JsonCreator
    public static Timeframe fromId(String id) {
        if (id != null) {
            for (Timeframe tf : values()) {
                if (tf.id.equalsIgnoreCase(id.trim())) {
                    return tf;
                }
            }
        }
        throw new IllegalArgumentException("Unknown timeframe: " + id);
    }

    @Override
    public String toString() {
        return id;
    }
}
