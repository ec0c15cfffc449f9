package io.fmxform.core.path;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves {@link PropertyPath} expressions against JSON trees, optionally memoizing parsed paths
 * and extraction results in a shared {@link PathCache}.
 *
 * <p>Thread-safe when the backing cache is (the provided {@link PathCache} is).
 */
public final class PropertyPathResolver {

    private final PathCache cache;

    /** Creates a resolver without caching. */
    public PropertyPathResolver() {
        this.cache = null;
    }

    public PropertyPathResolver(PathCache cache) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
    }

    /** The backing cache, if any. */
    public Optional<PathCache> cache() {
        return Optional.ofNullable(cache);
    }

    /**
     * Parses {@code expression}, consulting the cache first.
     *
     * @throws io.fmxform.core.error.PropertyPathException if the expression is invalid
     */
    public PropertyPath parse(String expression) {
        if (cache == null) {
            return PropertyPath.parse(expression);
        }
        Optional<PropertyPath> cached = cache.getParsedPath(expression);
        if (cached.isPresent()) {
            return cached.get();
        }
        long start = System.nanoTime();
        PropertyPath path = PropertyPath.parse(expression);
        cache.putParsedPath(expression, path, System.nanoTime() - start);
        return path;
    }

    /**
     * Resolves every value addressed by {@code expression}. Expanding segments fan out over array
     * elements; missing fields and expansions of non-arrays contribute nothing. JSON nulls that
     * are present are returned as {@code NullNode}.
     */
    public List<JsonNode> resolve(JsonNode data, String expression) {
        PropertyPath path = parse(expression);
        if (cache != null) {
            Optional<List<JsonNode>> cached = cache.getExtraction(data, path);
            if (cached.isPresent()) {
                return cached.get();
            }
        }
        List<JsonNode> result = walk(data, path);
        if (cache != null) {
            cache.putExtraction(data, path, result);
        }
        return result;
    }

    /**
     * Resolves {@code expression} to the live nodes inside {@code data}, bypassing the extraction
     * cache. Callers may mutate the returned containers in place.
     */
    public List<JsonNode> resolveReferences(JsonNode data, String expression) {
        return walk(data, parse(expression));
    }

    /**
     * Like {@link #resolve} but, when the path addresses a single array without expanding it,
     * returns that array's elements. {@code items} and {@code items[]} therefore both yield the
     * items.
     */
    public List<JsonNode> resolveAsList(JsonNode data, String expression) {
        PropertyPath path = parse(expression);
        List<JsonNode> values = resolve(data, expression);
        if (!path.endsWithExpansion() && values.size() == 1 && values.get(0).isArray()) {
            List<JsonNode> elements = new ArrayList<>();
            values.get(0).forEach(elements::add);
            return elements;
        }
        return values;
    }

    /** Returns the single value at a non-expanding path, or {@code null} if absent. */
    public JsonNode get(JsonNode data, PropertyPath path) {
        requireNoExpansion(path);
        JsonNode current = data;
        for (PropertyPath.Segment segment : path.segments()) {
            if (current == null || !current.isObject()) {
                return null;
            }
            current = current.get(segment.name());
        }
        return current;
    }

    /**
     * Sets {@code value} at a non-expanding, non-root path, creating intermediate objects.
     * Intermediate values that are not objects are replaced.
     */
    public void set(ObjectNode root, PropertyPath path, JsonNode value) {
        requireNoExpansion(path);
        if (path.isRoot()) {
            throw new IllegalArgumentException("Cannot set a value at the root path");
        }
        List<PropertyPath.Segment> segments = path.segments();
        ObjectNode current = root;
        for (int i = 0; i < segments.size() - 1; i++) {
            String name = segments.get(i).name();
            JsonNode next = current.get(name);
            if (next == null || !next.isObject()) {
                next = JsonNodeFactory.instance.objectNode();
                current.set(name, next);
            }
            current = (ObjectNode) next;
        }
        current.set(path.lastName(), value);
    }

    private static List<JsonNode> walk(JsonNode data, PropertyPath path) {
        List<JsonNode> current = new ArrayList<>();
        current.add(data);
        for (PropertyPath.Segment segment : path.segments()) {
            List<JsonNode> next = new ArrayList<>();
            for (JsonNode node : current) {
                if (node == null || !node.isObject()) {
                    continue;
                }
                JsonNode child = node.get(segment.name());
                if (child == null) {
                    continue;
                }
                if (segment.expand()) {
                    if (child.isArray()) {
                        child.forEach(next::add);
                    }
                } else {
                    next.add(child);
                }
            }
            current = next;
        }
        return current;
    }

    private static void requireNoExpansion(PropertyPath path) {
        if (path.hasExpansion()) {
            throw new IllegalArgumentException("Path must not expand arrays: " + path);
        }
    }
}
