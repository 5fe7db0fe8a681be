package com.candlesync.core.normalize;

import com.candlesync.core.model.Candle;
import com.candlesync.core.model.MarketSymbol;
import com.candlesync.core.model.RawCandle;
import com.candlesync.core.model.Timeframe;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns raw provider rows into canonical candles for one (symbol, timeframe) table.
 *
 * Steps, in order:
 * 1. naive timestamps are read as UTC, zoned ones converted to UTC
 * 2. daily bars are moved to the symbol's anchor time on the same UTC date
 * 3. the symbol's clock offset for the timeframe is added
 * 4. missing volume becomes 0
 */
public final class CandleNormalizer {

    private CandleNormalizer() {
    }

    public static Candle normalize(MarketSymbol symbol, Timeframe timeframe, RawCandle raw) {
        Instant instant = alignedInstant(symbol, timeframe, raw);
        long volume = raw.volume() != null ? raw.volume() : 0L;
        return new Candle(symbol, instant.toEpochMilli(), raw.open(), raw.high(), raw.low(), raw.close(), volume);
    }

    /**
     * Normalize a series, keeping its order.
     */
    public static List<Candle> normalizeAll(MarketSymbol symbol, Timeframe timeframe, List<RawCandle> rows) {
        List<Candle> candles = new ArrayList<>(rows.size());
        for (RawCandle raw : rows) {
            candles.add(normalize(symbol, timeframe, raw));
        }
        return candles;
    }

    static Instant alignedInstant(MarketSymbol symbol, Timeframe timeframe, RawCandle raw) {
        ZonedDateTime utc = raw.isNaive()
            ? raw.time().atZone(ZoneOffset.UTC)
            : raw.time().atZone(raw.zone()).withZoneSameInstant(ZoneOffset.UTC);

        if (timeframe.isDaily()) {
            LocalDate date = utc.toLocalDate();
            utc = date.atTime(symbol.getDailyAnchor()).atZone(ZoneOffset.UTC);
        }

        return utc.toInstant().plus(symbol.clockOffset(timeframe));
    }
}
