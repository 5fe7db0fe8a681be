package com.candlesync.dataservice.sync;

import java.util.Locale;

/**
 * Decides which side wins when the boundary candle disagrees with storage.
 * Consulted once per mismatch.
 */
@FunctionalInterface
public interface ConflictPolicy {

    /** Default: the freshly fetched candle overwrites storage. */
    ConflictPolicy PREFER_PROVIDER = conflict -> Resolution.KEEP_PROVIDER;

    ConflictPolicy PREFER_STORED = conflict -> Resolution.KEEP_STORED;

    Resolution resolve(BoundaryConflict conflict);

    enum Resolution {
        KEEP_STORED,
        KEEP_PROVIDER
    }

    /**
     * Policy by configuration name: {@code prefer-provider} or {@code prefer-stored}.
     */
    static ConflictPolicy named(String name) {
        switch (name == null ? "" : name.trim().toLowerCase(Locale.ROOT)) {
            case "prefer-provider":
                return PREFER_PROVIDER;
            case "prefer-stored":
                return PREFER_STORED;
            default:
                throw new IllegalArgumentException("Unknown conflict policy: " + name);
        }
    }
}
