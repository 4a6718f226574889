package com.chuntfm.schedule.infrastructure.cache;

import java.time.Instant;

/**
 * Snapshot cache metrics.
 * {@code hits} are freshness checks that needed no rebuild, {@code misses} those that asked for one.
 */
public record CacheStats(
        Instant takenAt,
        int previousEntries,
        int nowEntries,
        int upNextEntries,
        long hits,
        long misses,
        long rebuilds,
        long failedRebuilds,
        long skippedRebuilds,
        boolean rebuildInProgress
) {
    public double hitRatio() {
        long total = hits + misses;
        return total > 0 ? (double) hits / total : 0.0;
    }

    public String summary() {
        return String.format("Snapshot: %s, Hit ratio: %.1f%%, Rebuilds: %d (%d failed, %d collapsed)",
                takenAt, hitRatio() * 100, rebuilds, failedRebuilds, skippedRebuilds);
    }
}
