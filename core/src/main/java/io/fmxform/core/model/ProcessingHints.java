package io.fmxform.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Processing hints derived from a {@link StructureType}.
 *
 * @param requiresAggregation whether documents must be aggregated before rendering
 * @param expectedArrayFields field names expected to hold the document collection
 * @param derivationRules names of derived fields the structure conventionally carries
 * @param templateFormat preferred template format
 */
public record ProcessingHints(
        boolean requiresAggregation,
        List<String> expectedArrayFields,
        List<String> derivationRules,
        TemplateFormat templateFormat) {

    public ProcessingHints {
        expectedArrayFields = List.copyOf(expectedArrayFields);
        derivationRules = List.copyOf(derivationRules);
        Objects.requireNonNull(templateFormat, "templateFormat must not be null");
    }
}
