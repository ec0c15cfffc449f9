package io.fmxform.core.expr;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.OptionalDouble;

/** Shared JSON node helpers for predicate results and numeric derivations. Stateless. */
public final class JsonNodeUtils {

    private JsonNodeUtils() {}

    /**
     * Determines if a node is truthy in JSLT semantics.
     *
     * <ul>
     *   <li>{@code null}, {@code NullNode}, {@code MissingNode}: falsy
     *   <li>{@code BooleanNode}: its value
     *   <li>{@code TextNode("")}: falsy
     *   <li>any other node: truthy
     * </ul>
     */
    public static boolean isTruthy(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return false;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isTextual()) {
            return !node.asText().isEmpty();
        }
        return true;
    }

    /** Returns {@code true} for {@code null}, {@code NullNode} and {@code MissingNode}. */
    public static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    /**
     * Numeric value of a number node or of a text node holding a number; empty for anything
     * else.
     */
    public static OptionalDouble numericValue(JsonNode node) {
        if (node == null) {
            return OptionalDouble.empty();
        }
        if (node.isNumber()) {
            return OptionalDouble.of(node.doubleValue());
        }
        if (node.isTextual()) {
            try {
                return OptionalDouble.of(Double.parseDouble(node.asText().trim()));
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        }
        return OptionalDouble.empty();
    }

    /** Text rendering of a scalar; containers render as JSON. */
    public static String asText(JsonNode node) {
        if (node.isValueNode()) {
            return node.asText();
        }
        return node.toString();
    }

    /** Recursively flattens nested arrays into a new array. Non-array input is wrapped. */
    public static ArrayNode flatten(JsonNode node) {
        ArrayNode out = JsonNodeFactory.instance.arrayNode();
        flattenInto(node, out);
        return out;
    }

    private static void flattenInto(JsonNode node, ArrayNode out) {
        if (node.isArray()) {
            node.forEach(child -> flattenInto(child, out));
        } else {
            out.add(node);
        }
    }

    /** Nesting depth of arrays: 0 for a non-array, 1 for a flat array. */
    public static int arrayDepth(JsonNode node) {
        if (!node.isArray()) {
            return 0;
        }
        int max = 0;
        for (JsonNode child : node) {
            max = Math.max(max, arrayDepth(child));
        }
        return max + 1;
    }
}
