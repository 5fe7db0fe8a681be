package com.candlesync.dataservice.sync;

/**
 * Result of deadzone detection and, for 1m tables, the attempted fill.
 *
 * @param deadzone the detected gap, null for {@code NOT_ANCHORED} and {@code NONE}
 * @param filled   rows written from the secondary store
 */
public record GapResult(Outcome outcome, Deadzone deadzone, int filled) {

    public enum Outcome {
        NOT_ANCHORED,
        NONE,
        DETECTED_NOT_FILLABLE,
        SKIPPED_BY_POLICY,
        EMPTY_RANGE,
        NO_SECONDARY_DATA,
        SECONDARY_UNAVAILABLE,
        FILLED
    }

    static GapResult of(Outcome outcome) {
        return new GapResult(outcome, null, 0);
    }

    static GapResult of(Outcome outcome, Deadzone deadzone) {
        return new GapResult(outcome, deadzone, 0);
    }

    static GapResult filled(Deadzone deadzone, int filled) {
        return new GapResult(Outcome.FILLED, deadzone, filled);
    }

    public boolean isDeadzoneDetected() {
        return deadzone != null;
    }

    public String describe() {
        switch (outcome) {
            case NOT_ANCHORED:
                return "gap not checked";
            case NONE:
                return "no gap";
            case DETECTED_NOT_FILLABLE:
                return "gap detected, not fillable at this timeframe";
            case SKIPPED_BY_POLICY:
                return "gap detected, fill skipped";
            case EMPTY_RANGE:
                return "gap detected, empty range";
            case NO_SECONDARY_DATA:
                return "gap detected, no secondary data";
            case SECONDARY_UNAVAILABLE:
                return "gap detected, secondary store unavailable";
            default:
                return "gap filled with " + filled + " rows";
        }
    }
}
