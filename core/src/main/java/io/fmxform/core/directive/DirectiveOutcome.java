package io.fmxform.core.directive;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Map;
import java.util.Objects;

/**
 * Result of applying one directive to one data scope.
 *
 * @param data the resulting scope data; may be the same node that was passed in
 * @param metadata handler-specific facts, e.g. {@code valuesCollected}
 */
public record DirectiveOutcome(ObjectNode data, Map<String, Object> metadata) {

    public DirectiveOutcome {
        Objects.requireNonNull(data, "data must not be null");
        metadata = Map.copyOf(metadata);
    }

    /** Data unchanged, no metadata. */
    public static DirectiveOutcome unchanged(ObjectNode data) {
        return new DirectiveOutcome(data, Map.of());
    }
}
