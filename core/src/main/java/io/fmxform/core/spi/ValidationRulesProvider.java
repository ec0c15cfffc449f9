package io.fmxform.core.spi;

import io.fmxform.core.model.Schema;
import io.fmxform.core.pipeline.ValidationRules;

/** Derives the per-document validation rules of a run from its schema. */
public interface ValidationRulesProvider {

    /**
     * Builds the rules documents are validated against.
     *
     * @throws io.fmxform.core.error.ValidationRulesException if the schema cannot yield rules;
     *     fatal for the run
     */
    ValidationRules rulesFor(Schema schema);
}
