package io.fmxform.core.path;

import java.util.Objects;

/**
 * Sizing and expiry settings for {@link PathCache}.
 *
 * <p>Immutable and thread-safe.
 *
 * @param maxPathEntries capacity of the parsed-path map
 * @param maxExtractionEntries capacity of the extraction-result map
 * @param pathTtlMs time-to-live of a parsed path in milliseconds
 * @param extractionTtlMs time-to-live of an extraction result in milliseconds
 * @param evictionPolicy how entries are chosen for eviction
 * @param enableMetrics whether hits and misses are counted
 */
public record PathCacheConfig(
        int maxPathEntries,
        int maxExtractionEntries,
        long pathTtlMs,
        long extractionTtlMs,
        EvictionPolicy evictionPolicy,
        boolean enableMetrics) {

    /** Default configuration: 1000 entries per map, five-minute TTL, LRU eviction. */
    public static final PathCacheConfig DEFAULT =
            new PathCacheConfig(1000, 1000, 300_000L, 300_000L, EvictionPolicy.LRU, true);

    public PathCacheConfig {
        if (maxPathEntries <= 0) {
            throw new IllegalArgumentException("maxPathEntries must be positive, got: " + maxPathEntries);
        }
        if (maxExtractionEntries <= 0) {
            throw new IllegalArgumentException("maxExtractionEntries must be positive, got: " + maxExtractionEntries);
        }
        if (pathTtlMs <= 0) {
            throw new IllegalArgumentException("pathTtlMs must be positive, got: " + pathTtlMs);
        }
        if (extractionTtlMs <= 0) {
            throw new IllegalArgumentException("extractionTtlMs must be positive, got: " + extractionTtlMs);
        }
        Objects.requireNonNull(evictionPolicy, "evictionPolicy must not be null");
    }

    /** Small, short-lived configuration for tests: 25 entries per map, one-second TTL. */
    public static PathCacheConfig forTesting() {
        return new PathCacheConfig(25, 25, 1000L, 1000L, EvictionPolicy.LRU, true);
    }

    public PathCacheConfig withEvictionPolicy(EvictionPolicy policy) {
        return new PathCacheConfig(maxPathEntries, maxExtractionEntries, pathTtlMs, extractionTtlMs, policy,
                enableMetrics);
    }
}
