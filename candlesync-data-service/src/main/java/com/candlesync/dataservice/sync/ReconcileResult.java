package com.candlesync.dataservice.sync;

import com.candlesync.core.model.Candle;

/**
 * What happened to the boundary candle of one pair.
 *
 * @param stored  stored candle at the boundary, null when not checked
 * @param fetched fetched candle at the boundary as it was before resolution, null when not checked
 */
public record ReconcileResult(Outcome outcome, Candle stored, Candle fetched) {

    public enum Outcome {
        NOT_CHECKED,
        MATCH,
        MISMATCH_KEPT_STORED,
        MISMATCH_KEPT_PROVIDER
    }

    public static ReconcileResult notChecked() {
        return new ReconcileResult(Outcome.NOT_CHECKED, null, null);
    }

    public boolean isMismatch() {
        return outcome == Outcome.MISMATCH_KEPT_STORED || outcome == Outcome.MISMATCH_KEPT_PROVIDER;
    }

    public String describe() {
        switch (outcome) {
            case NOT_CHECKED:
                return "boundary not checked";
            case MATCH:
                return "boundary match";
            case MISMATCH_KEPT_STORED:
                return "boundary mismatch, kept stored";
            default:
                return "boundary mismatch, kept provider";
        }
    }
}
