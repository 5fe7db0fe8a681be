package com.candlesync.dataservice.sync;

import com.candlesync.dataservice.data.sqlite.CandleTable;

/**
 * Final state of one pair after an update attempt.
 *
 * @param written   rows written by the bulk upsert (gap fill rows are counted in {@code gap})
 * @param reconcile boundary outcome, null unless the pair got that far
 * @param gap       deadzone outcome, null unless the pair got that far
 * @param reason    why the pair was skipped or failed, null when updated
 */
public record PairSyncResult(
    CandleTable table,
    Status status,
    int written,
    ReconcileResult reconcile,
    GapResult gap,
    String reason
) {
    public enum Status {
        UPDATED,
        SKIPPED,
        FAILED
    }

    public static PairSyncResult updated(CandleTable table, int written, ReconcileResult reconcile, GapResult gap) {
        return new PairSyncResult(table, Status.UPDATED, written, reconcile, gap, null);
    }

    public static PairSyncResult skipped(CandleTable table, String reason) {
        return new PairSyncResult(table, Status.SKIPPED, 0, null, null, reason);
    }

    public static PairSyncResult failed(CandleTable table, String reason) {
        return new PairSyncResult(table, Status.FAILED, 0, null, null, reason);
    }

    public int gapFilled() {
        return gap != null ? gap.filled() : 0;
    }

    /**
     * One-line summary for the decision log.
     */
    public String describe() {
        switch (status) {
            case UPDATED:
                return "updated " + written + " rows; " + reconcile.describe() + "; " + gap.describe();
            case SKIPPED:
                return "skipped: " + reason;
            default:
                return "failed: " + reason;
        }
    }
}
