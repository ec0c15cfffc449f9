package io.fmxform.core.model;

/** The five stages of a document transformation run, in execution order. */
public enum TransformationStage {
    VALIDATION_ADJUSTMENT,
    STRATEGY_SELECTION,
    DOCUMENT_PROCESSING,
    AGGREGATION,
    COMPLETION
}
