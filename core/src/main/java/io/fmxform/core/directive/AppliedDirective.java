package io.fmxform.core.directive;

import java.util.Map;
import java.util.Objects;

/**
 * Record of one directive application.
 *
 * @param directive the directive applied
 * @param scopes number of data scopes it was applied to (1 for root scope, one per element for
 *     item-scoped directives)
 * @param metadata metadata reported by the handler for the last scope
 */
public record AppliedDirective(Directive directive, int scopes, Map<String, Object> metadata) {

    public AppliedDirective {
        Objects.requireNonNull(directive, "directive must not be null");
        metadata = Map.copyOf(metadata);
    }
}
