package com.candlesync.dataservice.sync;

import com.candlesync.core.model.Candle;
import com.candlesync.core.model.RawCandle;
import com.candlesync.core.normalize.CandleNormalizer;
import com.candlesync.dataservice.data.sqlite.CandleTable;
import com.candlesync.dataservice.data.sqlite.dao.CandleDao;
import com.candlesync.dataservice.provider.MarketDataProvider;
import com.candlesync.dataservice.provider.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Duration;

/**
 * Decides whether a table is current with the provider.
 * Up to date when the newest stored and newest provider timestamps are at most
 * the tolerance apart (inclusive).
 */
public class StalenessChecker {

    private static final Logger log = LoggerFactory.getLogger(StalenessChecker.class);

    private final MarketDataProvider provider;
    private final CandleDao candleDao;
    private final Duration tolerance;

    public StalenessChecker(MarketDataProvider provider, CandleDao candleDao, Duration tolerance) {
        this.provider = provider;
        this.candleDao = candleDao;
        this.tolerance = tolerance;
    }

    public StalenessResult check(CandleTable table) {
        Long providerLatest = fetchProviderLatest(table);
        if (providerLatest == null) {
            return StalenessResult.noData(table, null, null, StalenessResult.NO_PROVIDER_DATA);
        }

        Long storedLatest;
        try {
            storedLatest = candleDao.getLatestTimestamp(table);
        } catch (SQLException e) {
            log.error("Reading latest timestamp of {} failed: {}", table, e.getMessage());
            return StalenessResult.noData(table, null, providerLatest, "STORE ERROR: " + e.getMessage());
        }
        if (storedLatest == null) {
            return StalenessResult.noData(table, null, providerLatest, StalenessResult.NO_STORED_DATA);
        }

        return evaluate(table, storedLatest, providerLatest);
    }

    StalenessResult evaluate(CandleTable table, long storedLatest, long providerLatest) {
        long diffMs = Math.abs(providerLatest - storedLatest);
        StalenessResult.Freshness freshness = diffMs <= tolerance.toMillis()
            ? StalenessResult.Freshness.UP_TO_DATE
            : StalenessResult.Freshness.STALE;
        log.debug("{}: stored={} provider={} diff={}s -> {}", table,
            StalenessResult.formatTimestamp(storedLatest), StalenessResult.formatTimestamp(providerLatest),
            diffMs / 1000, freshness);
        return new StalenessResult(table, freshness, storedLatest, providerLatest, null);
    }

    private Long fetchProviderLatest(CandleTable table) {
        try {
            RawCandle raw = provider.fetchLatest(table.symbol(), table.timeframe());
            if (raw == null) {
                log.warn("No latest bar from provider for {} {}", table.symbol(), table.timeframe());
                return null;
            }
            Candle latest = CandleNormalizer.normalize(table.symbol(), table.timeframe(), raw);
            return latest.timestamp();
        } catch (ProviderException e) {
            log.error("Latest bar fetch failed for {} {}: {}", table.symbol(), table.timeframe(), e.getMessage());
            return null;
        } catch (RuntimeException e) {
            log.error("Latest bar for {} {} is unusable", table.symbol(), table.timeframe(), e);
            return null;
        }
    }
}
