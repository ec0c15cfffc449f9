package io.fmxform.core.directive;

import java.util.Optional;

/**
 * Closed set of schema directives understood by the pipeline. Every kind has exactly one handler
 * in {@link StandardDirectiveHandlers}; adding a constant here without a handler fails
 * compilation there.
 */
public enum DirectiveKind {
    /** Marks where collected document front matter is placed. */
    FRONTMATTER_PART("x-frontmatter-part"),
    /** Collects front-matter fields whose names match a pattern. */
    COLLECT_PATTERN("x-collect-pattern"),
    /** Filters data with a JMESPath expression. */
    JMESPATH_FILTER("x-jmespath-filter"),
    /** Flattens a nested array inside each collected item. */
    FLATTEN_ARRAYS("x-flatten-arrays"),
    /** Derives a value list from a property path. */
    DERIVED_FROM("x-derived-from"),
    /** Counts values at a property path. */
    DERIVED_COUNT("x-derived-count"),
    /** Averages numeric values at a property path. */
    DERIVED_AVERAGE("x-derived-average"),
    /** Counts items matching a predicate. */
    DERIVED_COUNT_WHERE("x-derived-count-where"),
    /** Output format of the rendered artifact. */
    TEMPLATE_FORMAT("x-template-format"),
    /** Main template, inline or a file path. */
    TEMPLATE("x-template"),
    /** Data collection rendered once per item with the main template. */
    TEMPLATE_ITEMS("x-template-items");

    /** Modifier of {@link #DERIVED_FROM}: remove duplicate values. */
    public static final String DERIVED_UNIQUE_KEY = "x-derived-unique";

    /** Modifier of {@link #DERIVED_FROM}: flatten nested arrays before collecting. */
    public static final String DERIVED_FLATTEN_KEY = "x-derived-flatten";

    private final String key;

    DirectiveKind(String key) {
        this.key = key;
    }

    /** Schema key, e.g. {@code x-derived-from}. */
    public String key() {
        return key;
    }

    /** Looks up a kind by schema key. */
    public static Optional<DirectiveKind> fromKey(String key) {
        for (DirectiveKind kind : values()) {
            if (kind.key.equals(key)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
