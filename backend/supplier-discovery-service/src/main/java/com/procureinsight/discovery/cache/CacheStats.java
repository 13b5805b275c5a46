package com.procureinsight.discovery.cache;

import java.time.Duration;

/**
 * Snapshot of cache statistics reported to the health endpoints.
 *
 * @param oldestEntryAge age of the oldest live entry, {@code null} when the cache is empty
 * @param newestEntryAge age of the newest live entry, {@code null} when the cache is empty
 */
public record CacheStats(
        int totalEntries,
        long hitCount,
        long missCount,
        long errorCount,
        Duration oldestEntryAge,
        Duration newestEntryAge
) {
    public double hitRate() {
        long total = hitCount + missCount;
        return total > 0 ? (double) hitCount / total : 0.0;
    }
}
