package com.candlesync.dataservice.sync;

import com.candlesync.core.model.Candle;
import com.candlesync.dataservice.data.CandleWriter;
import com.candlesync.dataservice.data.sqlite.CandleTable;
import com.candlesync.dataservice.data.sqlite.dao.CandleDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.List;

/**
 * Runs one pair through fetch, boundary reconcile, gap backfill and bulk upsert,
 * strictly in that order.
 */
public class PairSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(PairSynchronizer.class);

    private final CandleDao candleDao;
    private final CandleWriter writer;
    private final HistoryFetcher historyFetcher;
    private final BoundaryReconciler reconciler;
    private final GapBackfiller backfiller;

    public PairSynchronizer(CandleDao candleDao, CandleWriter writer, HistoryFetcher historyFetcher,
                            BoundaryReconciler reconciler, GapBackfiller backfiller) {
        this.candleDao = candleDao;
        this.writer = writer;
        this.historyFetcher = historyFetcher;
        this.reconciler = reconciler;
        this.backfiller = backfiller;
    }

    public PairSyncResult sync(CandleTable table) {
        String step = "read latest";
        try {
            Long storedLatest = candleDao.getLatestTimestamp(table);

            step = "fetch history";
            List<Candle> fetched = historyFetcher.fetch(table.symbol(), table.timeframe());
            if (fetched.isEmpty()) {
                return PairSyncResult.skipped(table, "no provider data");
            }
            long fetchedOldest = fetched.get(0).timestamp();

            step = "reconcile boundary";
            ReconcileResult reconcile = reconciler.reconcile(table, storedLatest, fetched);

            step = "backfill gap";
            GapResult gap = backfiller.backfill(table, storedLatest, fetchedOldest);

            step = "upsert";
            int written = writer.upsert(table, fetched);
            if (reconcile.isMismatch() || gap.isDeadzoneDetected()) {
                log.warn("{}: wrote {} candles ({}; {})", table, written, reconcile.describe(), gap.describe());
            } else {
                log.info("{}: wrote {} candles ({}; {})", table, written, reconcile.describe(), gap.describe());
            }
            return PairSyncResult.updated(table, written, reconcile, gap);
        } catch (SQLException e) {
            log.error("{} {} failed during {}: {}", table.symbol(), table.timeframe(), step, e.getMessage(), e);
            return PairSyncResult.failed(table, step + ": " + e.getMessage());
        }
    }
}
