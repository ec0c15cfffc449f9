package io.fmxform.core.path;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.LongSupplier;
import java.util.function.ToLongFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-lifetime memo of parsed property paths and path extraction results.
 *
 * <p>Two maps are kept: parsed paths keyed by expression, and extraction results keyed by {@code
 * extract:{dataHash}:{pathHash}}. An extraction hit also requires the stored data and path to
 * equal the requested ones. Entries expire after their TTL and are dropped when read expired or on
 * {@link #cleanupExpired()}. When a map is full, a {@code put} first evicts about a
 * tenth of its entries, chosen by the configured {@link EvictionPolicy}.
 *
 * <p>Counters are private to this class and only exposed as {@link PathCacheMetrics} snapshots.
 * All operations are synchronized on the cache instance, so a single cache may be shared by
 * document workers running on several threads.
 */
public final class PathCache {

    private static final Logger LOG = LoggerFactory.getLogger(PathCache.class);

    /** Milliseconds of access age one unit of parse complexity is worth when scoring entries. */
    static final long COMPLEXITY_WEIGHT_MS = 1000L;

    private final PathCacheConfig config;
    private final LongSupplier clock;

    // access-ordered: iteration starts at the least recently used entry
    private final LinkedHashMap<String, PathCacheEntry> paths = new LinkedHashMap<>(16, 0.75f, true);
    private final LinkedHashMap<String, ExtractionCacheEntry> extractions = new LinkedHashMap<>(16, 0.75f, true);

    private long hits;
    private long misses;
    private long evictions;

    public PathCache() {
        this(PathCacheConfig.DEFAULT);
    }

    public PathCache(PathCacheConfig config) {
        this(config, System::currentTimeMillis);
    }

    /**
     * Creates a cache with an explicit clock.
     *
     * @param config sizing and expiry settings
     * @param clock millisecond time source
     */
    public PathCache(PathCacheConfig config, LongSupplier clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /** Creates a cache sized for tests. */
    public static PathCache forTesting() {
        return new PathCache(PathCacheConfig.forTesting());
    }

    public PathCacheConfig config() {
        return config;
    }

    /** Returns the parsed path for {@code expression}, or empty on miss or expiry. */
    public synchronized Optional<PropertyPath> getParsedPath(String expression) {
        long now = clock.getAsLong();
        PathCacheEntry entry = paths.get(expression);
        if (entry == null) {
            recordMiss();
            return Optional.empty();
        }
        if (now - entry.createdAt() > config.pathTtlMs()) {
            paths.remove(expression);
            recordMiss();
            return Optional.empty();
        }
        entry.recordAccess(now);
        recordHit();
        return Optional.of(entry.path());
    }

    /** Stores a parsed path, evicting entries first if the path map is full. */
    public synchronized void putParsedPath(String expression, PropertyPath path, long parseTimeNanos) {
        Objects.requireNonNull(expression, "expression must not be null");
        Objects.requireNonNull(path, "path must not be null");
        if (!paths.containsKey(expression) && paths.size() >= config.maxPathEntries()) {
            evict(paths, PathCacheEntry::lastAccessed, PathCacheEntry::complexity);
        }
        paths.put(expression, new PathCacheEntry(path, parseTimeNanos, clock.getAsLong()));
    }

    /** Returns a cached extraction of {@code path} from {@code data}, or empty on miss or expiry. */
    public synchronized Optional<List<JsonNode>> getExtraction(JsonNode data, PropertyPath path) {
        long now = clock.getAsLong();
        String key = extractionKey(data, path);
        ExtractionCacheEntry entry = extractions.get(key);
        if (entry == null || !entry.matches(data, path)) {
            // a colliding key computed from other inputs is a miss
            recordMiss();
            return Optional.empty();
        }
        if (now - entry.timestamp() > config.extractionTtlMs()) {
            extractions.remove(key);
            recordMiss();
            return Optional.empty();
        }
        entry.recordAccess(now);
        recordHit();
        return Optional.of(copyOf(entry.result()));
    }

    /** Stores an extraction result, evicting entries first if the extraction map is full. */
    public synchronized void putExtraction(JsonNode data, PropertyPath path, List<JsonNode> result) {
        Objects.requireNonNull(result, "result must not be null");
        String key = extractionKey(data, path);
        if (!extractions.containsKey(key) && extractions.size() >= config.maxExtractionEntries()) {
            evict(extractions, ExtractionCacheEntry::lastAccessed, ExtractionCacheEntry::complexity);
        }
        extractions.put(key, new ExtractionCacheEntry(data.deepCopy(), path, copyOf(result), clock.getAsLong()));
    }

    /** Returns {@code true} if a live parsed path is cached for {@code expression}. */
    public synchronized boolean hasParsedPath(String expression) {
        PathCacheEntry entry = paths.get(expression);
        return entry != null && clock.getAsLong() - entry.createdAt() <= config.pathTtlMs();
    }

    /**
     * Removes every expired entry from both maps.
     *
     * @return the number of entries removed
     */
    public synchronized int cleanupExpired() {
        long now = clock.getAsLong();
        int before = paths.size() + extractions.size();
        paths.values().removeIf(e -> now - e.createdAt() > config.pathTtlMs());
        extractions.values().removeIf(e -> now - e.timestamp() > config.extractionTtlMs());
        int removed = before - paths.size() - extractions.size();
        if (removed > 0) {
            LOG.debug("Path cache cleanup: removed={}, remaining={}", removed, paths.size() + extractions.size());
        }
        return removed;
    }

    /** Removes all entries and resets the counters. */
    public synchronized void clear() {
        paths.clear();
        extractions.clear();
        hits = 0;
        misses = 0;
        evictions = 0;
    }

    public synchronized PathCacheMetrics metrics() {
        return new PathCacheMetrics(hits, misses, evictions, paths.size(), extractions.size());
    }

    /** Rough heap footprint of the cached entries in bytes. */
    public synchronized long estimateMemoryUsage() {
        long bytes = 0;
        for (Map.Entry<String, PathCacheEntry> e : paths.entrySet()) {
            bytes += 64L + 2L * e.getKey().length() + 48L * e.getValue().path().segments().size();
        }
        for (Map.Entry<String, ExtractionCacheEntry> e : extractions.entrySet()) {
            bytes += 96L + 2L * e.getKey().length();
            for (JsonNode node : e.getValue().result()) {
                bytes += 2L * node.toString().length();
            }
        }
        return bytes;
    }

    private <E> void evict(
            LinkedHashMap<String, E> map, ToLongFunction<E> lastAccessed, ToLongFunction<E> complexity) {
        int toRemove = Math.max(1, map.size() / 10);
        List<String> victims = new ArrayList<>(toRemove);
        if (config.evictionPolicy() == EvictionPolicy.LRU) {
            Iterator<String> it = map.keySet().iterator();
            while (it.hasNext() && victims.size() < toRemove) {
                victims.add(it.next());
            }
        } else {
            long now = clock.getAsLong();
            map.entrySet().stream()
                    .sorted(Comparator.comparingLong((Map.Entry<String, E> e) ->
                                    (now - lastAccessed.applyAsLong(e.getValue()))
                                            + complexity.applyAsLong(e.getValue()) * COMPLEXITY_WEIGHT_MS)
                            .reversed())
                    .limit(toRemove)
                    .forEach(e -> victims.add(e.getKey()));
        }
        victims.forEach(map::remove);
        evictions += victims.size();
        LOG.debug("Path cache eviction: policy={}, removed={}", config.evictionPolicy(), victims.size());
    }

    private void recordHit() {
        if (config.enableMetrics()) {
            hits++;
        }
    }

    private void recordMiss() {
        if (config.enableMetrics()) {
            misses++;
        }
    }

    private static String extractionKey(JsonNode data, PropertyPath path) {
        return "extract:" + hash(data.toString()) + ":" + hash(path.toString());
    }

    /** 31-multiplier string hash rendered in base 36. */
    static String hash(String value) {
        int h = 0;
        for (int i = 0; i < value.length(); i++) {
            h = 31 * h + value.charAt(i);
        }
        return Long.toString(Math.abs((long) h), 36);
    }

    private static List<JsonNode> copyOf(List<JsonNode> nodes) {
        List<JsonNode> copy = new ArrayList<>(nodes.size());
        for (JsonNode node : nodes) {
            copy.add(node.deepCopy());
        }
        return copy;
    }
}
