package io.fmxform.core.path;

/**
 * Snapshot of {@link PathCache} counters.
 *
 * @param hits lookups answered from the cache
 * @param misses lookups that found nothing or an expired entry
 * @param evictions entries removed to make room
 * @param pathEntries current parsed-path entries
 * @param extractionEntries current extraction entries
 */
public record PathCacheMetrics(long hits, long misses, long evictions, int pathEntries, int extractionEntries) {

    /** Total number of cached entries. */
    public int size() {
        return pathEntries + extractionEntries;
    }

    /** Hits divided by lookups, or 0 when nothing was looked up. */
    public double hitRate() {
        long lookups = hits + misses;
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }
}
