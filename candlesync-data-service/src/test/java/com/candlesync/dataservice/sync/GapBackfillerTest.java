package com.candlesync.dataservice.sync;

import com.candlesync.core.model.Candle;
import com.candlesync.core.model.CandleColor;
import com.candlesync.core.model.MarketSymbol;
import com.candlesync.core.model.Timeframe;
import com.candlesync.dataservice.data.sqlite.CandleSchema;
import com.candlesync.dataservice.data.sqlite.CandleTable;
import com.candlesync.dataservice.data.sqlite.SqliteConnection;
import com.candlesync.dataservice.data.sqlite.dao.CandleDao;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.List;

import static com.candlesync.dataservice.CandleFixtures.candle;
import static com.candlesync.dataservice.CandleFixtures.millis;
import static org.junit.jupiter.api.Assertions.*;

class GapBackfillerTest {

    private static final String STORED_LATEST = "2025-01-01T00:00:00Z";
    private static final String FETCHED_OLDEST = "2025-01-01T00:05:00Z";

    @TempDir
    Path dataDir;

    private SqliteConnection conn;
    private CandleDao dao;
    private final CandleTable target = new CandleTable("fronttest", MarketSymbol.EURUSD, Timeframe.M1);

    @BeforeEach
    void setUp() throws SQLException {
        conn = new SqliteConnection(dataDir, List.of("fronttest", "public"));
        CandleSchema.initialize(conn, List.of(target));
        dao = new CandleDao(conn);
        dao.upsert(target, List.of(candle(MarketSymbol.EURUSD, STORED_LATEST, 1.0350, 1.0352)));
    }

    @AfterEach
    void tearDown() {
        conn.close();
    }

    private GapBackfiller backfiller(GapFillPolicy policy) {
        return new GapBackfiller(dao, dao, "public", policy);
    }

    /**
     * Secondary table as another process owns it: nullable volume, no derived color.
     */
    private void createSecondary(MarketSymbol symbol) throws SQLException {
        conn.executeInTransaction(c -> {
            try (Statement stmt = c.createStatement()) {
                stmt.execute("CREATE TABLE \"public\".\"" + symbol.getId() + "_1m\" ("
                    + "symbol TEXT, timestamp INTEGER, open REAL, high REAL, low REAL, close REAL, "
                    + "volume INTEGER, candle_color TEXT, PRIMARY KEY (symbol, timestamp))");
            }
        });
    }

    private void insertSecondary(MarketSymbol symbol, String iso, double open, double close, Long volume)
            throws SQLException {
        conn.executeInTransaction(c -> {
            try (PreparedStatement stmt = c.prepareStatement("INSERT INTO \"public\".\"" + symbol.getId()
                    + "_1m\" (symbol, timestamp, open, high, low, close, volume, candle_color) "
                    + "VALUES (?, ?, ?, ?, ?, ?, ?, 'stale')")) {
                stmt.setString(1, symbol.getId());
                stmt.setLong(2, millis(iso));
                stmt.setDouble(3, open);
                stmt.setDouble(4, Math.max(open, close));
                stmt.setDouble(5, Math.min(open, close));
                stmt.setDouble(6, close);
                if (volume == null) {
                    stmt.setNull(7, Types.INTEGER);
                } else {
                    stmt.setLong(7, volume);
                }
                stmt.executeUpdate();
            }
        });
    }

    @Nested
    @DisplayName("Detection")
    class Detection {

        @Test
        @DisplayName("Equal timestamps leave no gap")
        void equalIsNoGap() throws SQLException {
            GapResult result = backfiller(GapFillPolicy.ALWAYS)
                .backfill(target, millis(STORED_LATEST), millis(STORED_LATEST));

            assertEquals(GapResult.Outcome.NONE, result.outcome());
            assertFalse(result.isDeadzoneDetected());
        }

        @Test
        @DisplayName("Fetched series older than stored latest leaves no gap")
        void overlapIsNoGap() throws SQLException {
            GapResult result = backfiller(GapFillPolicy.ALWAYS)
                .backfill(target, millis(STORED_LATEST), millis("2024-12-31T23:00:00Z"));

            assertEquals(GapResult.Outcome.NONE, result.outcome());
        }

        @Test
        @DisplayName("One second later is a deadzone with an empty fill range")
        void oneSecondIsEmptyRange() throws SQLException {
            long stored = millis(STORED_LATEST);

            GapResult result = backfiller(GapFillPolicy.ALWAYS).backfill(target, stored, stored + 1000);

            assertEquals(GapResult.Outcome.EMPTY_RANGE, result.outcome());
            assertEquals(stored + 1000, result.deadzone().gapStart());
            assertEquals(stored, result.deadzone().gapEnd());
            assertEquals(1, dao.count(target));
        }

        @Test
        @DisplayName("Empty table is not anchored")
        void notAnchored() throws SQLException {
            GapResult result = backfiller(GapFillPolicy.ALWAYS).backfill(target, null, millis(FETCHED_OLDEST));

            assertEquals(GapResult.Outcome.NOT_ANCHORED, result.outcome());
        }

        @Test
        @DisplayName("Coarser timeframes only report the deadzone")
        void coarseNotFillable() throws SQLException {
            CandleTable fiveMinute = new CandleTable("fronttest", MarketSymbol.EURUSD, Timeframe.M5);

            GapResult result = backfiller(GapFillPolicy.ALWAYS)
                .backfill(fiveMinute, millis(STORED_LATEST), millis(FETCHED_OLDEST));

            assertEquals(GapResult.Outcome.DETECTED_NOT_FILLABLE, result.outcome());
            assertTrue(result.isDeadzoneDetected());
        }
    }

    @Nested
    @DisplayName("Fill")
    class Fill {

        @Test
        @DisplayName("Three secondary rows inside the gap are normalized and written")
        void fillsThreeRows() throws SQLException {
            createSecondary(MarketSymbol.EURUSD);
            insertSecondary(MarketSymbol.EURUSD, "2024-12-31T23:59:00Z", 1.0300, 1.0310, 5L);
            insertSecondary(MarketSymbol.EURUSD, "2025-01-01T00:01:00Z", 1.0352, 1.0360, 10L);
            insertSecondary(MarketSymbol.EURUSD, "2025-01-01T00:02:00Z", 1.0360, 1.0355, null);
            insertSecondary(MarketSymbol.EURUSD, "2025-01-01T00:04:59Z", 1.0355, 1.0355, 3L);
            insertSecondary(MarketSymbol.EURUSD, "2025-01-01T00:05:00Z", 1.0355, 1.0370, 8L);

            GapResult result = backfiller(GapFillPolicy.ALWAYS)
                .backfill(target, millis(STORED_LATEST), millis(FETCHED_OLDEST));

            assertEquals(GapResult.Outcome.FILLED, result.outcome());
            assertEquals(3, result.filled());
            assertEquals(4, dao.count(target));

            Candle green = dao.findAt(target, millis("2025-01-01T00:01:00Z"));
            Candle red = dao.findAt(target, millis("2025-01-01T00:02:00Z"));
            Candle doji = dao.findAt(target, millis("2025-01-01T00:04:59Z"));
            assertEquals(CandleColor.GREEN, green.color());
            assertEquals(CandleColor.RED, red.color());
            assertEquals(0L, red.volume());
            assertEquals(CandleColor.DOJI, doji.color());
            assertNull(dao.findAt(target, millis(FETCHED_OLDEST)), "Fetched oldest is outside the fill range");
        }

        @Test
        @DisplayName("Declined by policy")
        void skippedByPolicy() throws SQLException {
            createSecondary(MarketSymbol.EURUSD);
            insertSecondary(MarketSymbol.EURUSD, "2025-01-01T00:01:00Z", 1.0352, 1.0360, 10L);

            GapResult result = backfiller(GapFillPolicy.NEVER)
                .backfill(target, millis(STORED_LATEST), millis(FETCHED_OLDEST));

            assertEquals(GapResult.Outcome.SKIPPED_BY_POLICY, result.outcome());
            assertEquals(1, dao.count(target));
        }

        @Test
        @DisplayName("Secondary table without rows in range")
        void noSecondaryData() throws SQLException {
            createSecondary(MarketSymbol.EURUSD);

            GapResult result = backfiller(GapFillPolicy.ALWAYS)
                .backfill(target, millis(STORED_LATEST), millis(FETCHED_OLDEST));

            assertEquals(GapResult.Outcome.NO_SECONDARY_DATA, result.outcome());
        }

        @Test
        @DisplayName("Missing secondary table is reported as unavailable")
        void secondaryUnavailable() throws SQLException {
            GapResult result = backfiller(GapFillPolicy.ALWAYS)
                .backfill(target, millis(STORED_LATEST), millis(FETCHED_OLDEST));

            assertEquals(GapResult.Outcome.SECONDARY_UNAVAILABLE, result.outcome());
            assertEquals(1, dao.count(target));
        }

        @Test
        @DisplayName("Write failures propagate")
        void writeFailurePropagates() throws SQLException {
            createSecondary(MarketSymbol.EURUSD);
            insertSecondary(MarketSymbol.EURUSD, "2025-01-01T00:01:00Z", 1.0352, 1.0360, 10L);
            GapBackfiller failing = new GapBackfiller(dao, (table, candles) -> {
                throw new SQLException("disk full");
            }, "public", GapFillPolicy.ALWAYS);

            assertThrows(SQLException.class, () ->
                failing.backfill(target, millis(STORED_LATEST), millis(FETCHED_OLDEST)));
        }

        @Test
        @DisplayName("Policies resolve from configuration names")
        void namedPolicies() {
            assertSame(GapFillPolicy.ALWAYS, GapFillPolicy.named("always"));
            assertSame(GapFillPolicy.NEVER, GapFillPolicy.named("NEVER"));
            assertThrows(IllegalArgumentException.class, () -> GapFillPolicy.named("sometimes"));
        }
    }
}
