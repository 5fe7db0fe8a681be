package com.candlesync.dataservice;

import com.candlesync.core.model.MarketSymbol;
import com.candlesync.core.model.Timeframe;
import com.candlesync.dataservice.config.SyncConfig;
import com.candlesync.dataservice.data.sqlite.CandleSchema;
import com.candlesync.dataservice.data.sqlite.CandleTable;
import com.candlesync.dataservice.data.sqlite.SqliteConnection;
import com.candlesync.dataservice.data.sqlite.dao.CandleDao;
import com.candlesync.dataservice.provider.MarketDataProvider;
import com.candlesync.dataservice.provider.YahooChartClient;
import com.candlesync.dataservice.report.StatusReporter;
import com.candlesync.dataservice.report.TableFormatter;
import com.candlesync.dataservice.sync.BoundaryReconciler;
import com.candlesync.dataservice.sync.CandleSyncService;
import com.candlesync.dataservice.sync.ConflictPolicy;
import com.candlesync.dataservice.sync.GapBackfiller;
import com.candlesync.dataservice.sync.GapFillPolicy;
import com.candlesync.dataservice.sync.HistoryFetcher;
import com.candlesync.dataservice.sync.PairSynchronizer;
import com.candlesync.dataservice.sync.StalenessChecker;
import com.candlesync.dataservice.sync.SyncSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Candle sync - scans the target tables against the provider and updates
 * every table that is behind.
 *
 * Exit code 0 on success, 1 if startup failed or any table failed to update.
 */
public class SyncApp {
    private static final Logger LOG = LoggerFactory.getLogger(SyncApp.class);

    public static void main(String[] args) {
        LOG.info("Starting candle sync...");
        int exitCode;
        try {
            SyncConfig config = SyncConfig.load();
            MarketDataProvider provider = new YahooChartClient(config::tickerFor, config.getProviderTimeout());
            exitCode = run(config, provider, System.out);
        } catch (Exception e) {
            LOG.error("Candle sync failed to start", e);
            exitCode = 1;
        }
        System.exit(exitCode);
    }

    /**
     * Wire the engine from configuration and run one scan-and-update pass.
     */
    static int run(SyncConfig config, MarketDataProvider provider, PrintStream out) throws Exception {
        Files.createDirectories(config.getDataPath());

        try (SqliteConnection conn = new SqliteConnection(config.getDataPath(),
                List.of(config.getTargetSchema(), config.getSecondarySchema()))) {
            List<CandleTable> tables = targetTables(config);
            CandleSchema.initialize(conn, tables);

            CandleDao candleDao = new CandleDao(conn);
            StalenessChecker checker = new StalenessChecker(provider, candleDao, config.getStalenessTolerance());
            PairSynchronizer synchronizer = new PairSynchronizer(
                candleDao,
                candleDao,
                new HistoryFetcher(provider),
                new BoundaryReconciler(candleDao, config::thresholdFor, ConflictPolicy.named(config.getConflictPolicy())),
                new GapBackfiller(candleDao, candleDao, config.getSecondarySchema(), GapFillPolicy.named(config.getGapFill())));
            StatusReporter reporter = new StatusReporter(out, TableFormatter.named(config.getReportFormat()),
                config.getTargetSchema().toUpperCase(Locale.ROOT) + " TABLE STATUS");

            SyncSummary summary = new CandleSyncService(checker, synchronizer, reporter, config.getParallelism())
                .run(tables);
            return summary.hasFailures() ? 1 : 0;
        }
    }

    static List<CandleTable> targetTables(SyncConfig config) {
        List<CandleTable> tables = new ArrayList<>();
        for (MarketSymbol symbol : config.getSymbols()) {
            for (Timeframe timeframe : config.getTimeframes()) {
                tables.add(new CandleTable(config.getTargetSchema(), symbol, timeframe));
            }
        }
        return tables;
    }
}
