package io.fmxform.core.path;

/** How {@link PathCache} chooses entries to drop when it is full. */
public enum EvictionPolicy {
    /** Least recently accessed entries first. */
    LRU,

    /** Entries with the highest combined score of parse complexity and access age first. */
    COMPLEXITY_WEIGHTED
}
