package com.candlesync.dataservice.sync;

import com.candlesync.dataservice.data.sqlite.CandleTable;

/**
 * Uncovered span between the newest stored candle and the oldest fetched one.
 * The fill range excludes both ends: {@code [storedLatest + 1s, fetchedOldest - 1s]}.
 */
public record Deadzone(CandleTable table, long storedLatest, long fetchedOldest) {

    private static final long ONE_SECOND_MS = 1000L;

    public long gapStart() {
        return storedLatest + ONE_SECOND_MS;
    }

    public long gapEnd() {
        return fetchedOldest - ONE_SECOND_MS;
    }

    /**
     * True when the fill range holds no instant at all.
     */
    public boolean isEmptyRange() {
        return gapEnd() <= gapStart();
    }

    @Override
    public String toString() {
        return table + " [" + StalenessResult.formatTimestamp(gapStart())
            + " .. " + StalenessResult.formatTimestamp(gapEnd()) + "]";
    }
}
