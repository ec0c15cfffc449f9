package io.fmxform.core.path;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * An extraction result held by {@link PathCache}. The hashed key only locates the entry; the
 * source data and path are kept so a hit can be confirmed against the actual inputs.
 */
final class ExtractionCacheEntry {

    private final JsonNode data;
    private final PropertyPath path;
    private final List<JsonNode> result;
    private final int complexity;
    private final long timestamp;
    private int accessCount;
    private long lastAccessed;

    ExtractionCacheEntry(JsonNode data, PropertyPath path, List<JsonNode> result, long now) {
        this.data = data;
        this.path = path;
        this.result = result;
        this.complexity = path.complexity();
        this.timestamp = now;
        this.lastAccessed = now;
    }

    /** Whether this entry was computed from exactly {@code otherData} and {@code otherPath}. */
    boolean matches(JsonNode otherData, PropertyPath otherPath) {
        return path.equals(otherPath) && data.equals(otherData);
    }

    List<JsonNode> result() {
        return result;
    }

    int complexity() {
        return complexity;
    }

    long timestamp() {
        return timestamp;
    }

    int accessCount() {
        return accessCount;
    }

    long lastAccessed() {
        return lastAccessed;
    }

    void recordAccess(long now) {
        accessCount++;
        lastAccessed = now;
    }
}
