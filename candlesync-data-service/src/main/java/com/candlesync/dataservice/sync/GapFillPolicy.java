package com.candlesync.dataservice.sync;

import java.util.Locale;

/**
 * Whether a detected 1m deadzone should be backfilled from the secondary store.
 */
@FunctionalInterface
public interface GapFillPolicy {

    /** Default. */
    GapFillPolicy ALWAYS = deadzone -> true;

    GapFillPolicy NEVER = deadzone -> false;

    boolean shouldFill(Deadzone deadzone);

    static GapFillPolicy named(String name) {
        switch (name == null ? "" : name.trim().toLowerCase(Locale.ROOT)) {
            case "always":
                return ALWAYS;
            case "never":
                return NEVER;
            default:
                throw new IllegalArgumentException("Unknown gap fill policy: " + name);
        }
    }
}
