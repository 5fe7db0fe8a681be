package com.candlesync.core.model;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * An OHLCV row as handed over by a provider or the secondary store, before
 * normalization.
 *
 * @param time   wall-clock time of the bar
 * @param zone   zone {@code time} is expressed in, or null for naive timestamps
 * @param volume null when the source marks volume as unavailable
 */
public record RawCandle(
    LocalDateTime time,
    ZoneId zone,
    double open,
    double high,
    double low,
    double close,
    Long volume
) {
    public RawCandle {
        if (time == null) {
            throw new IllegalArgumentException("Raw candle time is required");
        }
    }

    public static RawCandle naive(LocalDateTime time, double open, double high, double low, double close, Long volume) {
        return new RawCandle(time, null, open, high, low, close, volume);
    }

    public static RawCandle at(Instant instant, ZoneId zone, double open, double high, double low, double close, Long volume) {
        ZoneId effective = zone != null ? zone : ZoneOffset.UTC;
        return new RawCandle(LocalDateTime.ofInstant(instant, effective), effective, open, high, low, close, volume);
    }

    public boolean isNaive() {
        return zone == null;
    }
}
