package io.fmxform.core.path;

/** A parsed path held by {@link PathCache}. Access bookkeeping is updated on every hit. */
final class PathCacheEntry {

    private final PropertyPath path;
    private final long parseTimeNanos;
    private final long createdAt;
    private int accessCount;
    private long lastAccessed;

    PathCacheEntry(PropertyPath path, long parseTimeNanos, long now) {
        this.path = path;
        this.parseTimeNanos = parseTimeNanos;
        this.createdAt = now;
        this.lastAccessed = now;
    }

    PropertyPath path() {
        return path;
    }

    long parseTimeNanos() {
        return parseTimeNanos;
    }

    long createdAt() {
        return createdAt;
    }

    int accessCount() {
        return accessCount;
    }

    long lastAccessed() {
        return lastAccessed;
    }

    int complexity() {
        return path.complexity();
    }

    void recordAccess(long now) {
        accessCount++;
        lastAccessed = now;
    }
}
