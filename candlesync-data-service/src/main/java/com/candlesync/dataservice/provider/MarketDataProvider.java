package com.candlesync.dataservice.provider;

import com.candlesync.core.model.MarketSymbol;
import com.candlesync.core.model.RawCandle;
import com.candlesync.core.model.Timeframe;

import java.util.List;

/**
 * External source of authoritative candle history.
 *
 * Both calls are single bounded round-trips without retry. An empty answer is
 * not an error; callers treat both failure and emptiness as "no provider data".
 */
public interface MarketDataProvider {

    /**
     * The most recent bar, or null when the provider has none.
     */
    RawCandle fetchLatest(MarketSymbol symbol, Timeframe timeframe) throws ProviderException;

    /**
     * All bars the provider makes available, in provider order.
     */
    List<RawCandle> fetchHistory(MarketSymbol symbol, Timeframe timeframe) throws ProviderException;
}
