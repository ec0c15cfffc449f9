package io.fmxform.core.pipeline;

import java.util.Objects;

/**
 * One field constraint of the front-matter item schema.
 *
 * @param field property name
 * @param type declared JSON Schema type, or {@code null} if unconstrained
 * @param required whether the field is listed in {@code required}
 */
public record ValidationRule(String field, String type, boolean required) {

    public ValidationRule {
        Objects.requireNonNull(field, "field must not be null");
    }
}
