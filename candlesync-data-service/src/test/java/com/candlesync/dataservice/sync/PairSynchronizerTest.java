package com.candlesync.dataservice.sync;

import com.candlesync.core.model.Candle;
import com.candlesync.core.model.MarketSymbol;
import com.candlesync.core.model.Timeframe;
import com.candlesync.dataservice.data.sqlite.CandleSchema;
import com.candlesync.dataservice.data.sqlite.CandleTable;
import com.candlesync.dataservice.data.sqlite.SqliteConnection;
import com.candlesync.dataservice.data.sqlite.dao.CandleDao;
import com.candlesync.dataservice.provider.FakeMarketDataProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import static com.candlesync.dataservice.CandleFixtures.candle;
import static com.candlesync.dataservice.CandleFixtures.millis;
import static com.candlesync.dataservice.CandleFixtures.raw;
import static org.junit.jupiter.api.Assertions.*;

class PairSynchronizerTest {

    @TempDir
    Path dataDir;

    private SqliteConnection conn;
    private CandleDao dao;
    private FakeMarketDataProvider provider;
    private RecordingCandleWriter writer;
    private final CandleTable target = new CandleTable("fronttest", MarketSymbol.EURUSD, Timeframe.M1);

    @BeforeEach
    void setUp() throws SQLException {
        conn = new SqliteConnection(dataDir, List.of("fronttest", "public"));
        CandleSchema.initialize(conn, List.of(target));
        dao = new CandleDao(conn);
        provider = new FakeMarketDataProvider();
        writer = new RecordingCandleWriter(dao);
    }

    @AfterEach
    void tearDown() {
        conn.close();
    }

    private PairSynchronizer synchronizer(ConflictPolicy conflictPolicy) {
        return new PairSynchronizer(dao, writer,
            new HistoryFetcher(provider),
            new BoundaryReconciler(dao, symbol -> 0.0005, conflictPolicy),
            new GapBackfiller(dao, writer, "public", GapFillPolicy.ALWAYS));
    }

    private void seedSecondary(String... isoTimes) throws SQLException {
        conn.executeInTransaction(c -> {
            try (Statement stmt = c.createStatement()) {
                stmt.execute("CREATE TABLE \"public\".\"eurusd_1m\" (symbol TEXT, timestamp INTEGER, open REAL, "
                    + "high REAL, low REAL, close REAL, volume INTEGER, candle_color TEXT, PRIMARY KEY (symbol, timestamp))");
            }
            try (PreparedStatement stmt = c.prepareStatement(
                    "INSERT INTO \"public\".\"eurusd_1m\" VALUES ('eurusd', ?, 1.0352, 1.0361, 1.0350, 1.0360, 10, 'green')")) {
                for (String iso : isoTimes) {
                    stmt.setLong(1, millis(iso));
                    stmt.executeUpdate();
                }
            }
        });
    }

    @Test
    @DisplayName("Gap rows are written before the fetched series")
    void gapFillPrecedesBulkUpsert() throws SQLException {
        dao.upsert(target, List.of(candle(MarketSymbol.EURUSD, "2025-01-01T00:00:00Z", 1.0350, 1.0352)));
        seedSecondary("2025-01-01T00:01:00Z", "2025-01-01T00:02:00Z", "2025-01-01T00:03:00Z");
        provider.withHistory(MarketSymbol.EURUSD, Timeframe.M1, List.of(
            raw("2025-01-01T00:06:00Z", 1.0365, 1.0370),
            raw("2025-01-01T00:05:00Z", 1.0360, 1.0365)));

        PairSyncResult result = synchronizer(ConflictPolicy.PREFER_PROVIDER).sync(target);

        assertEquals(PairSyncResult.Status.UPDATED, result.status());
        assertEquals(2, result.written());
        assertEquals(GapResult.Outcome.FILLED, result.gap().outcome());
        assertEquals(3, result.gapFilled());
        assertEquals(3, new SyncSummary(List.of(), List.of(result)).gapRowsFilled());
        assertEquals(ReconcileResult.Outcome.NOT_CHECKED, result.reconcile().outcome());

        List<RecordingCandleWriter.Call> calls = writer.getCalls();
        assertEquals(2, calls.size());
        assertEquals(3, calls.get(0).candles().size(), "gap fill first");
        assertEquals(millis("2025-01-01T00:01:00Z"), calls.get(0).candles().get(0).timestamp());
        assertEquals(2, calls.get(1).candles().size(), "fetched series second");
        assertEquals(millis("2025-01-01T00:05:00Z"), calls.get(1).candles().get(0).timestamp());

        assertEquals(6, dao.count(target));
    }

    @Test
    @DisplayName("Kept stored boundary values are written back unchanged")
    void keepStoredSurvivesBulkUpsert() throws SQLException {
        Candle stored = new Candle(MarketSymbol.EURUSD, millis("2025-01-01T00:00:00Z"), 1.0350, 1.0360, 1.0340, 1.0352, 9L);
        dao.upsert(target, List.of(stored));
        provider.withHistory(MarketSymbol.EURUSD, Timeframe.M1, List.of(
            raw("2025-01-01T00:00:00Z", 1.0400, 1.0410),
            raw("2025-01-01T00:01:00Z", 1.0410, 1.0420)));

        PairSyncResult result = synchronizer(ConflictPolicy.PREFER_STORED).sync(target);

        assertEquals(ReconcileResult.Outcome.MISMATCH_KEPT_STORED, result.reconcile().outcome());
        assertEquals(GapResult.Outcome.NONE, result.gap().outcome());
        assertEquals(stored, dao.findAt(target, stored.timestamp()));
        assertEquals(1.0410, dao.findAt(target, millis("2025-01-01T00:01:00Z")).open());
    }

    @Test
    @DisplayName("Provider mismatch overwrites the stored boundary candle")
    void keepProviderOverwrites() throws SQLException {
        Candle stored = new Candle(MarketSymbol.EURUSD, millis("2025-01-01T00:00:00Z"), 1.0350, 1.0360, 1.0340, 1.0352, 9L);
        dao.upsert(target, List.of(stored));
        provider.withHistory(MarketSymbol.EURUSD, Timeframe.M1, List.of(raw("2025-01-01T00:00:00Z", 1.0400, 1.0410)));

        PairSyncResult result = synchronizer(ConflictPolicy.PREFER_PROVIDER).sync(target);

        assertEquals(ReconcileResult.Outcome.MISMATCH_KEPT_PROVIDER, result.reconcile().outcome());
        assertEquals(1.0400, dao.findAt(target, stored.timestamp()).open());
    }

    @Test
    @DisplayName("Empty table is filled with the whole fetched series")
    void emptyTableGetsFullSeries() throws SQLException {
        provider.withHistory(MarketSymbol.EURUSD, Timeframe.M1, List.of(
            raw("2025-01-01T00:00:00Z", 1.0350, 1.0352),
            raw("2025-01-01T00:01:00Z", 1.0352, 1.0353)));

        PairSyncResult result = synchronizer(ConflictPolicy.PREFER_PROVIDER).sync(target);

        assertEquals(PairSyncResult.Status.UPDATED, result.status());
        assertEquals(GapResult.Outcome.NOT_ANCHORED, result.gap().outcome());
        assertEquals(2, dao.count(target));
    }

    @Test
    @DisplayName("No provider history skips the pair without writing")
    void noHistorySkips() {
        provider.failing(MarketSymbol.EURUSD, Timeframe.M1);

        PairSyncResult result = synchronizer(ConflictPolicy.PREFER_PROVIDER).sync(target);

        assertEquals(PairSyncResult.Status.SKIPPED, result.status());
        assertTrue(writer.getCalls().isEmpty());
        assertTrue(result.describe().startsWith("skipped"));
    }

    @Test
    @DisplayName("Write failure fails the pair")
    void writeFailureFails() {
        provider.withHistory(MarketSymbol.EURUSD, Timeframe.M1, List.of(raw("2025-01-01T00:00:00Z", 1.0350, 1.0352)));
        PairSynchronizer failing = new PairSynchronizer(dao,
            (table, candles) -> {
                throw new SQLException("disk full");
            },
            new HistoryFetcher(provider),
            new BoundaryReconciler(dao, symbol -> 0.0005, ConflictPolicy.PREFER_PROVIDER),
            new GapBackfiller(dao, dao, "public", GapFillPolicy.ALWAYS));

        PairSyncResult result = failing.sync(target);

        assertEquals(PairSyncResult.Status.FAILED, result.status());
        assertTrue(result.reason().contains("disk full"));
        assertTrue(result.reason().startsWith("upsert"));
    }
}
