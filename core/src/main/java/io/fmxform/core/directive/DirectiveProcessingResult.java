package io.fmxform.core.directive;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Objects;

/**
 * Output of a {@link DirectiveProcessor} pass.
 *
 * @param data the transformed aggregate
 * @param applied directives in the order they were applied
 */
public record DirectiveProcessingResult(ObjectNode data, List<AppliedDirective> applied) {

    public DirectiveProcessingResult {
        Objects.requireNonNull(data, "data must not be null");
        applied = List.copyOf(applied);
    }
}
