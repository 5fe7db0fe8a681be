package com.candlesync.dataservice.sync;

import com.candlesync.core.model.Candle;
import com.candlesync.core.model.MarketSymbol;
import com.candlesync.core.model.RawCandle;
import com.candlesync.core.model.Timeframe;
import com.candlesync.dataservice.provider.FakeMarketDataProvider;
import com.candlesync.dataservice.provider.MarketDataProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static com.candlesync.dataservice.CandleFixtures.millis;
import static com.candlesync.dataservice.CandleFixtures.raw;
import static org.junit.jupiter.api.Assertions.*;

class HistoryFetcherTest {

    @Test
    @DisplayName("History is normalized and sorted ascending")
    void sortsAscending() {
        FakeMarketDataProvider provider = new FakeMarketDataProvider()
            .withHistory(MarketSymbol.EURUSD, Timeframe.M5, List.of(
                raw("2025-01-01T00:10:00Z", 1.03, 1.04),
                raw("2025-01-01T00:00:00Z", 1.03, 1.04),
                raw("2025-01-01T00:05:00Z", 1.03, 1.04)));

        List<Candle> candles = new HistoryFetcher(provider).fetch(MarketSymbol.EURUSD, Timeframe.M5);

        assertEquals(3, candles.size());
        assertEquals(millis("2025-01-01T05:00:00Z"), candles.get(0).timestamp());
        assertEquals(millis("2025-01-01T05:05:00Z"), candles.get(1).timestamp());
        assertEquals(millis("2025-01-01T05:10:00Z"), candles.get(2).timestamp());
    }

    @Test
    @DisplayName("Provider failure yields an empty series")
    void failureIsEmpty() {
        FakeMarketDataProvider provider = new FakeMarketDataProvider().failing(MarketSymbol.ES, Timeframe.M1);

        assertTrue(new HistoryFetcher(provider).fetch(MarketSymbol.ES, Timeframe.M1).isEmpty());
    }

    @Test
    @DisplayName("Unchecked provider errors yield an empty series")
    void uncheckedFailureIsEmpty() {
        MarketDataProvider provider = new FakeMarketDataProvider() {
            @Override
            public List<RawCandle> fetchHistory(MarketSymbol symbol, Timeframe timeframe) {
                throw new IllegalStateException("malformed payload");
            }
        };

        assertTrue(new HistoryFetcher(provider).fetch(MarketSymbol.ES, Timeframe.M1).isEmpty());
    }

    @Test
    @DisplayName("A bar with negative volume empties the series")
    void invalidBarIsEmpty() {
        LocalDateTime time = LocalDateTime.of(2025, 1, 1, 0, 1);
        FakeMarketDataProvider provider = new FakeMarketDataProvider()
            .withHistory(MarketSymbol.ES, Timeframe.M1, List.of(
                raw("2025-01-01T00:00:00Z", 5000.0, 5001.0),
                RawCandle.naive(time, 5001.0, 5002.0, 5000.0, 5001.5, -4L)));

        assertTrue(new HistoryFetcher(provider).fetch(MarketSymbol.ES, Timeframe.M1).isEmpty());
    }

    @Test
    @DisplayName("No history yields an empty series")
    void emptyIsEmpty() {
        assertTrue(new HistoryFetcher(new FakeMarketDataProvider()).fetch(MarketSymbol.ES, Timeframe.M1).isEmpty());
    }
}
