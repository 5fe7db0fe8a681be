package com.candlesync.dataservice;

import com.candlesync.core.model.Candle;
import com.candlesync.core.model.MarketSymbol;
import com.candlesync.core.model.RawCandle;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Test builders for candles keyed by ISO-8601 instants.
 */
public final class CandleFixtures {

    private CandleFixtures() {
    }

    public static long millis(String iso) {
        return Instant.parse(iso).toEpochMilli();
    }

    public static Candle candle(MarketSymbol symbol, String iso, double open, double close) {
        return new Candle(symbol, millis(iso), open, Math.max(open, close) + 1, Math.min(open, close) - 1, close, 100L);
    }

    public static RawCandle raw(String iso, double open, double close) {
        LocalDateTime time = LocalDateTime.ofInstant(Instant.parse(iso), ZoneOffset.UTC);
        return RawCandle.naive(time, open, Math.max(open, close) + 1, Math.min(open, close) - 1, close, 100L);
    }
}
