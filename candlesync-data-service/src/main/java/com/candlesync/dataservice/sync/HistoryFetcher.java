package com.candlesync.dataservice.sync;

import com.candlesync.core.model.Candle;
import com.candlesync.core.model.MarketSymbol;
import com.candlesync.core.model.RawCandle;
import com.candlesync.core.model.Timeframe;
import com.candlesync.core.normalize.CandleNormalizer;
import com.candlesync.dataservice.provider.MarketDataProvider;
import com.candlesync.dataservice.provider.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Full provider history for a pair, normalized and sorted ascending.
 * Provider failures and bars that cannot be normalized yield an empty list.
 */
public class HistoryFetcher {

    private static final Logger log = LoggerFactory.getLogger(HistoryFetcher.class);

    private final MarketDataProvider provider;

    public HistoryFetcher(MarketDataProvider provider) {
        this.provider = provider;
    }

    public List<Candle> fetch(MarketSymbol symbol, Timeframe timeframe) {
        List<RawCandle> rows;
        try {
            rows = provider.fetchHistory(symbol, timeframe);
        } catch (ProviderException e) {
            log.error("History fetch failed for {} {}: {}", symbol, timeframe, e.getMessage());
            return List.of();
        } catch (RuntimeException e) {
            log.error("History fetch failed for {} {}", symbol, timeframe, e);
            return List.of();
        }
        if (rows == null || rows.isEmpty()) {
            log.warn("Provider returned no history for {} {}", symbol, timeframe);
            return List.of();
        }

        List<Candle> candles;
        try {
            candles = new ArrayList<>(CandleNormalizer.normalizeAll(symbol, timeframe, rows));
        } catch (RuntimeException e) {
            log.error("Provider history for {} {} could not be normalized: {}", symbol, timeframe, e.getMessage());
            return List.of();
        }
        candles.sort(Comparator.comparingLong(Candle::timestamp));
        log.debug("Fetched {} {} {} candles", candles.size(), symbol, timeframe);
        return candles;
    }
}
