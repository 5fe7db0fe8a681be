package com.candlesync.dataservice.sync;

import com.candlesync.core.model.Candle;
import com.candlesync.core.model.RawCandle;
import com.candlesync.core.normalize.CandleNormalizer;
import com.candlesync.dataservice.data.CandleWriter;
import com.candlesync.dataservice.data.sqlite.CandleTable;
import com.candlesync.dataservice.data.sqlite.dao.CandleDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.List;

/**
 * Detects the deadzone between stored and fetched data and, at 1m, fills it
 * from the same symbol's table in the secondary schema.
 *
 * Fill rows are written straight away, before the caller writes the fetched
 * series. A secondary read failure is reported; a write failure is thrown.
 */
public class GapBackfiller {

    private static final Logger log = LoggerFactory.getLogger(GapBackfiller.class);

    private final CandleDao candleDao;
    private final CandleWriter writer;
    private final String secondarySchema;
    private final GapFillPolicy policy;

    public GapBackfiller(CandleDao candleDao, CandleWriter writer, String secondarySchema, GapFillPolicy policy) {
        this.candleDao = candleDao;
        this.writer = writer;
        this.secondarySchema = CandleTable.requireValidSchema(secondarySchema);
        this.policy = policy;
    }

    /**
     * @param storedLatest  newest stored timestamp, null for an empty table
     * @param fetchedOldest oldest fetched timestamp
     */
    public GapResult backfill(CandleTable table, Long storedLatest, long fetchedOldest) throws SQLException {
        if (storedLatest == null) {
            return GapResult.of(GapResult.Outcome.NOT_ANCHORED);
        }
        if (fetchedOldest <= storedLatest) {
            return GapResult.of(GapResult.Outcome.NONE);
        }

        Deadzone deadzone = new Deadzone(table, storedLatest, fetchedOldest);
        log.warn("Deadzone detected: {}", deadzone);

        if (!table.timeframe().isFinest()) {
            return GapResult.of(GapResult.Outcome.DETECTED_NOT_FILLABLE, deadzone);
        }
        if (!policy.shouldFill(deadzone)) {
            log.info("{}: gap fill declined", table);
            return GapResult.of(GapResult.Outcome.SKIPPED_BY_POLICY, deadzone);
        }
        if (deadzone.isEmptyRange()) {
            return GapResult.of(GapResult.Outcome.EMPTY_RANGE, deadzone);
        }

        CandleTable source = new CandleTable(secondarySchema, table.symbol(), table.timeframe());
        List<RawCandle> rows;
        try {
            rows = candleDao.queryRaw(source, deadzone.gapStart(), deadzone.gapEnd());
        } catch (SQLException e) {
            log.error("Secondary table {} unavailable for {}: {}", source, table, e.getMessage());
            return GapResult.of(GapResult.Outcome.SECONDARY_UNAVAILABLE, deadzone);
        }
        if (rows.isEmpty()) {
            log.warn("Secondary table {} has no rows in {}", source, deadzone);
            return GapResult.of(GapResult.Outcome.NO_SECONDARY_DATA, deadzone);
        }

        List<Candle> candles = CandleNormalizer.normalizeAll(table.symbol(), table.timeframe(), rows);
        int written = writer.upsert(table, candles);
        log.info("{}: filled gap with {} rows from {}", table, written, source);
        return GapResult.filled(deadzone, written);
    }
}
