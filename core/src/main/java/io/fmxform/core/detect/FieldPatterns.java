package io.fmxform.core.detect;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Property-name patterns used to recognise registry-shaped schemas when no {@code
 * x-frontmatter-part} directive is present.
 *
 * <p>A key matches if it fully matches a sequential pattern (e.g. {@code c1}, {@code c2}), equals
 * a named pattern (e.g. {@code commands}), or fully matches a custom pattern. Immutable and
 * thread-safe.
 */
public final class FieldPatterns {

    /** Default sequential pattern: {@code c1}, {@code c2}, ... */
    public static final String DEFAULT_SEQUENTIAL = "^c\\d+$";

    /** Default named patterns. */
    public static final List<String> DEFAULT_NAMED = List.of("commands", "tools");

    /** Default number of matching keys required for registry detection. */
    public static final int DEFAULT_MINIMUM_MATCH_COUNT = 2;

    private static final FieldPatterns DEFAULTS = builder().build();

    private final List<Pattern> sequentialPatterns;
    private final List<String> namedPatterns;
    private final List<Pattern> customPatterns;
    private final int minimumMatchCount;

    private FieldPatterns(Builder builder) {
        this.sequentialPatterns = compileAll(builder.sequentialPatterns);
        this.namedPatterns = List.copyOf(builder.namedPatterns);
        this.customPatterns = compileAll(builder.customPatterns);
        this.minimumMatchCount = builder.minimumMatchCount;
    }

    public static FieldPatterns defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Whether {@code key} matches any configured pattern. */
    public boolean matchesPattern(String key) {
        if (key == null) {
            return false;
        }
        if (namedPatterns.contains(key)) {
            return true;
        }
        for (Pattern pattern : sequentialPatterns) {
            if (pattern.matcher(key).matches()) {
                return true;
            }
        }
        for (Pattern pattern : customPatterns) {
            if (pattern.matcher(key).matches()) {
                return true;
            }
        }
        return false;
    }

    /** Whether at least one of {@code keys} matches. */
    public boolean hasAnyMatch(Collection<String> keys) {
        return keys.stream().anyMatch(this::matchesPattern);
    }

    /** Number of {@code keys} that match. */
    public int countMatches(Collection<String> keys) {
        return (int) keys.stream().filter(this::matchesPattern).count();
    }

    public boolean isNamedPattern(String key) {
        return namedPatterns.contains(key);
    }

    public List<String> namedPatterns() {
        return namedPatterns;
    }

    public int minimumMatchCount() {
        return minimumMatchCount;
    }

    @Override
    public String toString() {
        return "FieldPatterns{sequential=" + sequentialPatterns + ", named=" + namedPatterns + ", custom="
                + customPatterns + ", minimumMatchCount=" + minimumMatchCount + "}";
    }

    private static List<Pattern> compileAll(List<String> regexes) {
        List<Pattern> compiled = new ArrayList<>(regexes.size());
        for (String regex : regexes) {
            try {
                compiled.add(Pattern.compile(regex));
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("Invalid field pattern '" + regex + "': " + e.getDescription(), e);
            }
        }
        return List.copyOf(compiled);
    }

    /** Builder for {@link FieldPatterns}. Unset lists keep their defaults. */
    public static final class Builder {

        private List<String> sequentialPatterns = List.of(DEFAULT_SEQUENTIAL);
        private List<String> namedPatterns = DEFAULT_NAMED;
        private List<String> customPatterns = List.of();
        private int minimumMatchCount = DEFAULT_MINIMUM_MATCH_COUNT;

        private Builder() {}

        public Builder sequentialPatterns(List<String> patterns) {
            this.sequentialPatterns = List.copyOf(Objects.requireNonNull(patterns, "patterns must not be null"));
            return this;
        }

        public Builder namedPatterns(List<String> patterns) {
            this.namedPatterns = List.copyOf(Objects.requireNonNull(patterns, "patterns must not be null"));
            return this;
        }

        public Builder customPatterns(List<String> patterns) {
            this.customPatterns = List.copyOf(Objects.requireNonNull(patterns, "patterns must not be null"));
            return this;
        }

        public Builder minimumMatchCount(int count) {
            if (count < 1) {
                throw new IllegalArgumentException("minimumMatchCount must be >= 1, got " + count);
            }
            this.minimumMatchCount = count;
            return this;
        }

        public FieldPatterns build() {
            return new FieldPatterns(this);
        }
    }
}
