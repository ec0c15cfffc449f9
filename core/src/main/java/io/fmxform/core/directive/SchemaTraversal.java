package io.fmxform.core.directive;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Depth-first walk over the schema nodes reachable through {@code properties} and {@code items},
 * using an explicit stack. Nodes are returned in document order: a node, then its properties in
 * declaration order (each fully explored), then its item schema.
 */
public final class SchemaTraversal {

    /** Walks deeper than this are rejected as malformed. */
    static final int MAX_DEPTH = 256;

    /** A schema node with its path. */
    public record SchemaNode(String path, JsonNode node, int depth) {}

    private SchemaTraversal() {}

    /** All schema nodes under {@code root}, the root first. */
    public static List<SchemaNode> nodes(JsonNode root) {
        List<SchemaNode> out = new ArrayList<>();
        Deque<SchemaNode> stack = new ArrayDeque<>();
        stack.push(new SchemaNode("", root, 0));
        while (!stack.isEmpty()) {
            SchemaNode current = stack.pop();
            out.add(current);
            if (current.depth() >= MAX_DEPTH) {
                throw new IllegalArgumentException("Schema nesting exceeds " + MAX_DEPTH + " levels at: "
                        + current.path());
            }
            // pushed in reverse so that properties pop in declaration order before items
            List<SchemaNode> children = children(current);
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return out;
    }

    /** The first node, in traversal order, that carries {@code key}. */
    public static Optional<SchemaNode> findFirstWithKey(JsonNode root, String key) {
        return nodes(root).stream().filter(n -> n.node().has(key)).findFirst();
    }

    /** Joins a parent path and a property name. */
    public static String child(String parent, String name) {
        return parent.isEmpty() ? name : parent + "." + name;
    }

    private static List<SchemaNode> children(SchemaNode parent) {
        List<SchemaNode> children = new ArrayList<>();
        JsonNode node = parent.node();
        if (!node.isObject()) {
            return children;
        }
        JsonNode properties = node.get("properties");
        if (properties != null && properties.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = properties.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getValue().isObject()) {
                    children.add(new SchemaNode(
                            child(parent.path(), field.getKey()), field.getValue(), parent.depth() + 1));
                }
            }
        }
        JsonNode items = node.get("items");
        if (items != null && items.isObject()) {
            children.add(new SchemaNode(parent.path() + "[]", items, parent.depth() + 1));
        }
        return children;
    }
}
