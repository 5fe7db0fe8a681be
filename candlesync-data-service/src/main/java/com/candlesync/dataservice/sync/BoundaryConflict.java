package com.candlesync.dataservice.sync;

import com.candlesync.core.model.Candle;
import com.candlesync.dataservice.data.sqlite.CandleTable;

/**
 * A stored and a fetched candle for the same timestamp whose open or close
 * differ by more than the symbol's threshold.
 */
public record BoundaryConflict(CandleTable table, Candle stored, Candle fetched, double threshold) {

    public double openDiff() {
        return Math.abs(stored.open() - fetched.open());
    }

    public double closeDiff() {
        return Math.abs(stored.close() - fetched.close());
    }
}
