package io.fmxform.core.pipeline;

import io.fmxform.core.model.Schema;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Input of one coordinator run.
 *
 * @param documents document paths in input order
 * @param schema the annotated schema
 * @param aggregate whether stage 4 aggregation is requested
 * @param strategy explicit processing strategy, or {@code null} to choose by document count
 */
public record TransformationRequest(List<Path> documents, Schema schema, boolean aggregate, ProcessingStrategy strategy) {

    public TransformationRequest {
        documents = List.copyOf(Objects.requireNonNull(documents, "documents must not be null"));
        Objects.requireNonNull(schema, "schema must not be null");
    }

    /** A request without aggregation, using the default strategy. */
    public static TransformationRequest of(List<Path> documents, Schema schema) {
        return new TransformationRequest(documents, schema, false, null);
    }

    public TransformationRequest withAggregation() {
        return new TransformationRequest(documents, schema, true, strategy);
    }

    public TransformationRequest withStrategy(ProcessingStrategy override) {
        return new TransformationRequest(
                documents, schema, aggregate, Objects.requireNonNull(override, "override must not be null"));
    }

    /** The explicit strategy, if the caller set one. */
    public Optional<ProcessingStrategy> explicitStrategy() {
        return Optional.ofNullable(strategy);
    }
}
