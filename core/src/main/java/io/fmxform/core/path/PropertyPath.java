package io.fmxform.core.path;

import io.fmxform.core.error.PropertyPathException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * A parsed dotted property path such as {@code items[].category}.
 *
 * <p>Each segment names an object field; a trailing {@code []} on a segment expands the array
 * found there so that the remaining segments apply to every element. A leading {@code $} or
 * {@code $.} is accepted and ignored. The empty path and {@code $} address the root.
 *
 * <p>Immutable and thread-safe.
 */
public final class PropertyPath {

    private static final Pattern SEGMENT_NAME = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_-]*$");

    private static final PropertyPath ROOT = new PropertyPath("", List.of());

    /** One path segment: a field name, optionally expanding an array. */
    public record Segment(String name, boolean expand) {
        @Override
        public String toString() {
            return expand ? name + "[]" : name;
        }
    }

    private final String expression;
    private final List<Segment> segments;

    private PropertyPath(String expression, List<Segment> segments) {
        this.expression = expression;
        this.segments = segments;
    }

    /** The root path. */
    public static PropertyPath root() {
        return ROOT;
    }

    /**
     * Parses a path expression.
     *
     * @throws PropertyPathException if a segment is empty, contains whitespace or brackets other
     *     than a trailing {@code []}, or does not start with a letter or underscore
     */
    public static PropertyPath parse(String expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        String body = expression.trim();
        if (body.startsWith("$.")) {
            body = body.substring(2);
        } else if (body.equals("$")) {
            body = "";
        }
        if (body.isEmpty()) {
            return ROOT;
        }
        if (body.startsWith(".") || body.endsWith(".") || body.contains("..")) {
            throw new PropertyPathException("Path must not start or end with '.' or contain '..': " + expression,
                    expression);
        }
        List<Segment> parsed = new ArrayList<>();
        for (String raw : body.split("\\.")) {
            boolean expand = raw.endsWith("[]");
            String name = expand ? raw.substring(0, raw.length() - 2) : raw;
            if (!SEGMENT_NAME.matcher(name).matches()) {
                throw new PropertyPathException("Invalid path segment '" + raw + "' in: " + expression, expression);
            }
            parsed.add(new Segment(name, expand));
        }
        return new PropertyPath(expression, List.copyOf(parsed));
    }

    /** Returns {@code true} if {@code expression} parses without error. */
    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (PropertyPathException e) {
            return false;
        }
    }

    public List<Segment> segments() {
        return segments;
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    /** Returns {@code true} if any segment expands an array. */
    public boolean hasExpansion() {
        return segments.stream().anyMatch(Segment::expand);
    }

    /** Returns {@code true} if the last segment expands an array. */
    public boolean endsWithExpansion() {
        return !segments.isEmpty() && segments.get(segments.size() - 1).expand();
    }

    /** Name of the last segment, or the empty string for the root. */
    public String lastName() {
        return segments.isEmpty() ? "" : segments.get(segments.size() - 1).name();
    }

    /** Parse complexity: one per segment plus two per expansion. */
    public int complexity() {
        int complexity = 0;
        for (Segment segment : segments) {
            complexity += segment.expand() ? 3 : 1;
        }
        return complexity;
    }

    /** The expression as given to {@link #parse(String)}. */
    public String expression() {
        return expression;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PropertyPath other && segments.equals(other.segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return segments.stream().map(Segment::toString).collect(Collectors.joining("."));
    }
}
