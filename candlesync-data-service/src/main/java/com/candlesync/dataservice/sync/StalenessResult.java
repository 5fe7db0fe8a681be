package com.candlesync.dataservice.sync;

import com.candlesync.dataservice.data.sqlite.CandleTable;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Outcome of comparing a table's newest row with the provider's newest bar.
 *
 * @param storedLatest   newest stored timestamp (epoch millis), null when unknown
 * @param providerLatest newest provider timestamp after normalization, null when unknown
 * @param reason         why the state is {@link Freshness#NO_DATA}, otherwise null
 */
public record StalenessResult(
    CandleTable table,
    Freshness freshness,
    Long storedLatest,
    Long providerLatest,
    String reason
) {
    public static final String NO_PROVIDER_DATA = "NO PROVIDER DATA";
    public static final String NO_STORED_DATA = "NO STORED DATA";

    private static final DateTimeFormatter DISPLAY_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    public enum Freshness {
        UP_TO_DATE,
        STALE,
        NO_DATA
    }

    public static StalenessResult noData(CandleTable table, Long storedLatest, Long providerLatest, String reason) {
        return new StalenessResult(table, Freshness.NO_DATA, storedLatest, providerLatest, reason);
    }

    public boolean isUpToDate() {
        return freshness == Freshness.UP_TO_DATE;
    }

    /**
     * Text for the "latest stored candle" column of the status table.
     */
    public String latestDisplay() {
        if (freshness == Freshness.NO_DATA) {
            return reason;
        }
        return formatTimestamp(storedLatest);
    }

    public static String formatTimestamp(Long epochMillis) {
        return epochMillis == null ? "-" : DISPLAY_FORMAT.format(Instant.ofEpochMilli(epochMillis));
    }
}
