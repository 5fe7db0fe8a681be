package com.candlesync.dataservice.sync;

import com.candlesync.core.model.Candle;
import com.candlesync.core.model.MarketSymbol;
import com.candlesync.dataservice.data.sqlite.CandleTable;
import com.candlesync.dataservice.data.sqlite.dao.CandleDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Checks the one fetched candle that overlaps the newest stored row.
 *
 * Only open and close are compared. On a mismatch the {@link ConflictPolicy}
 * picks a side; keeping the stored side rewrites that fetched candle in place so
 * the following bulk upsert writes the stored values back unchanged.
 */
public class BoundaryReconciler {

    private static final Logger log = LoggerFactory.getLogger(BoundaryReconciler.class);

    private final CandleDao candleDao;
    private final ToDoubleFunction<MarketSymbol> thresholds;
    private final ConflictPolicy policy;

    public BoundaryReconciler(CandleDao candleDao, ToDoubleFunction<MarketSymbol> thresholds, ConflictPolicy policy) {
        this.candleDao = candleDao;
        this.thresholds = thresholds;
        this.policy = policy;
    }

    /**
     * @param fetched      fetched series, sorted ascending; the boundary element may be replaced
     * @param storedLatest newest stored timestamp, or null for an empty table
     */
    public ReconcileResult reconcile(CandleTable table, Long storedLatest, List<Candle> fetched) throws SQLException {
        if (storedLatest == null) {
            return ReconcileResult.notChecked();
        }
        int index = indexOf(fetched, storedLatest);
        if (index < 0) {
            log.debug("{}: no fetched candle at stored latest {}", table, StalenessResult.formatTimestamp(storedLatest));
            return ReconcileResult.notChecked();
        }

        Candle stored = candleDao.findAt(table, storedLatest);
        if (stored == null) {
            return ReconcileResult.notChecked();
        }
        Candle candidate = fetched.get(index);
        double threshold = thresholds.applyAsDouble(table.symbol());

        if (withinThreshold(stored, candidate, threshold)) {
            log.debug("{}: boundary candle matches at {}", table, stored.instant());
            return new ReconcileResult(ReconcileResult.Outcome.MATCH, stored, candidate);
        }

        BoundaryConflict conflict = new BoundaryConflict(table, stored, candidate, threshold);
        ConflictPolicy.Resolution resolution = policy.resolve(conflict);
        log.warn("{}: boundary mismatch at {} (stored O={} C={}, fetched O={} C={}, diff O={} C={}, threshold {}) -> {}",
            table, stored.instant(), stored.open(), stored.close(), candidate.open(), candidate.close(),
            conflict.openDiff(), conflict.closeDiff(), threshold, resolution);

        if (resolution == ConflictPolicy.Resolution.KEEP_STORED) {
            fetched.set(index, candidate.withValuesOf(stored));
            return new ReconcileResult(ReconcileResult.Outcome.MISMATCH_KEPT_STORED, stored, candidate);
        }
        return new ReconcileResult(ReconcileResult.Outcome.MISMATCH_KEPT_PROVIDER, stored, candidate);
    }

    static boolean withinThreshold(Candle a, Candle b, double threshold) {
        return Math.abs(a.open() - b.open()) <= threshold
            && Math.abs(a.close() - b.close()) <= threshold;
    }

    private static int indexOf(List<Candle> candles, long timestamp) {
        int low = 0;
        int high = candles.size() - 1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            long ts = candles.get(mid).timestamp();
            if (ts < timestamp) {
                low = mid + 1;
            } else if (ts > timestamp) {
                high = mid - 1;
            } else {
                return mid;
            }
        }
        return -1;
    }
}
