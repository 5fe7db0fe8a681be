package com.candlesync.dataservice.data;

import com.candlesync.core.model.Candle;
import com.candlesync.dataservice.data.sqlite.CandleTable;

import java.sql.SQLException;
import java.util.List;

/**
 * Insert-or-update of candles keyed by (symbol, timestamp).
 *
 * Implementations overwrite every non-key column on conflict, write one call
 * atomically, and are safe to repeat with the same or overlapping input.
 */
@FunctionalInterface
public interface CandleWriter {

    /**
     * @return number of rows written
     */
    int upsert(CandleTable table, List<Candle> candles) throws SQLException;
}
