package com.candlesync.dataservice.sync;

import com.candlesync.dataservice.data.sqlite.CandleTable;
import com.candlesync.dataservice.report.StatusReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;

/**
 * Scans every configured table, reports the status table, then updates each
 * table that is not up to date.
 *
 * With parallelism above one, distinct tables are processed on a fixed pool.
 * A table's own steps always run on a single worker, in order.
 */
public class CandleSyncService {

    private static final Logger log = LoggerFactory.getLogger(CandleSyncService.class);

    private final StalenessChecker stalenessChecker;
    private final PairSynchronizer synchronizer;
    private final StatusReporter reporter;
    private final int parallelism;

    public CandleSyncService(StalenessChecker stalenessChecker, PairSynchronizer synchronizer,
                             StatusReporter reporter, int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1");
        }
        this.stalenessChecker = stalenessChecker;
        this.synchronizer = synchronizer;
        this.reporter = reporter;
        this.parallelism = parallelism;
    }

    public SyncSummary run(List<CandleTable> tables) {
        log.info("Checking {} tables", tables.size());
        List<StalenessResult> statuses = forEach(tables, this::checkSafely);
        reporter.printStatus(statuses);

        List<CandleTable> outdated = new ArrayList<>();
        for (StalenessResult status : statuses) {
            if (!status.isUpToDate()) {
                outdated.add(status.table());
            }
        }
        log.info("{} of {} tables need updating", outdated.size(), tables.size());

        List<PairSyncResult> results = forEach(outdated, this::syncSafely);
        reporter.printResults(results);

        SyncSummary summary = new SyncSummary(statuses, results);
        log.info("Sync finished: {} updated, {} skipped, {} failed, {} gap rows filled",
            summary.count(PairSyncResult.Status.UPDATED),
            summary.count(PairSyncResult.Status.SKIPPED),
            summary.count(PairSyncResult.Status.FAILED),
            summary.gapRowsFilled());
        return summary;
    }

    private StalenessResult checkSafely(CandleTable table) {
        try {
            return stalenessChecker.check(table);
        } catch (RuntimeException e) {
            log.error("Staleness check for {} failed", table, e);
            return StalenessResult.noData(table, null, null, "CHECK FAILED: " + e.getMessage());
        }
    }

    private PairSyncResult syncSafely(CandleTable table) {
        try {
            return synchronizer.sync(table);
        } catch (RuntimeException e) {
            log.error("Sync of {} failed", table, e);
            return PairSyncResult.failed(table, e.getMessage());
        }
    }

    /**
     * Apply {@code task} to every table, returning results in input order.
     */
    private <T> List<T> forEach(List<CandleTable> tables, Function<CandleTable, T> task) {
        List<T> results = new ArrayList<>(tables.size());
        if (parallelism == 1 || tables.size() < 2) {
            for (CandleTable table : tables) {
                results.add(task.apply(table));
            }
            return results;
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, tables.size()));
        try {
            List<Future<T>> futures = new ArrayList<>();
            for (CandleTable table : tables) {
                futures.add(executor.submit(() -> task.apply(table)));
            }
            for (Future<T> future : futures) {
                try {
                    results.add(future.get());
                } catch (ExecutionException e) {
                    // tasks catch their own failures; anything here is a bug
                    throw new IllegalStateException("Worker failed: " + e.getCause().getMessage(), e.getCause());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Sync interrupted", e);
                }
            }
            return results;
        } finally {
            executor.shutdown();
        }
    }
}
