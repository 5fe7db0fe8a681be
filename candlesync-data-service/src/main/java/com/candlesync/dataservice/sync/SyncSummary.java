package com.candlesync.dataservice.sync;

import java.util.List;

/**
 * Everything one scan-and-update run produced, in configured pair order.
 */
public record SyncSummary(List<StalenessResult> statuses, List<PairSyncResult> results) {

    public boolean hasFailures() {
        return results.stream().anyMatch(r -> r.status() == PairSyncResult.Status.FAILED);
    }

    public long count(PairSyncResult.Status status) {
        return results.stream().filter(r -> r.status() == status).count();
    }

    /**
     * Rows copied from the secondary store across all pairs.
     */
    public int gapRowsFilled() {
        return results.stream().mapToInt(PairSyncResult::gapFilled).sum();
    }
}
