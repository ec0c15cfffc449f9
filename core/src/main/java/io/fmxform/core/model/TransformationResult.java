package io.fmxform.core.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fmxform.core.error.FmxformException;
import java.util.List;
import java.util.Objects;

/**
 * Terminal state of a document transformation run. Exactly one of two states:
 *
 * <ul>
 *   <li>{@link Type#COMPLETED}: at least one document was processed. {@code processedData} and
 *       {@code documents} are in input order; {@code aggregatedData} is present only when
 *       aggregation was requested and succeeded.
 *   <li>{@link Type#FAILED}: a fatal error stopped the run. {@code error} holds the cause and
 *       {@code processedCount} how many documents had been processed.
 * </ul>
 *
 * <p>Documents that failed individually are listed in {@link #failures()} in both states.
 */
public final class TransformationResult {

    /** The type of run outcome. */
    public enum Type {
        COMPLETED,
        FAILED
    }

    private final Type type;
    private final List<FrontmatterData> processedData;
    private final List<MarkdownDocument> documents;
    private final ObjectNode aggregatedData;
    private final List<DocumentFailure> failures;
    private final FmxformException error;
    private final int processedCount;

    private TransformationResult(
            Type type,
            List<FrontmatterData> processedData,
            List<MarkdownDocument> documents,
            ObjectNode aggregatedData,
            List<DocumentFailure> failures,
            FmxformException error,
            int processedCount) {
        this.type = type;
        this.processedData = processedData;
        this.documents = documents;
        this.aggregatedData = aggregatedData;
        this.failures = failures;
        this.error = error;
        this.processedCount = processedCount;
    }

    /** Creates a COMPLETED result. {@code aggregatedData} may be {@code null}. */
    public static TransformationResult completed(
            List<MarkdownDocument> documents, ObjectNode aggregatedData, List<DocumentFailure> failures) {
        Objects.requireNonNull(documents, "documents must not be null for COMPLETED");
        Objects.requireNonNull(failures, "failures must not be null");
        List<FrontmatterData> data =
                documents.stream().map(MarkdownDocument::frontmatter).toList();
        return new TransformationResult(
                Type.COMPLETED,
                data,
                List.copyOf(documents),
                aggregatedData != null ? aggregatedData.deepCopy() : null,
                List.copyOf(failures),
                null,
                documents.size());
    }

    /** Creates a FAILED result. */
    public static TransformationResult failed(
            FmxformException error, int processedCount, List<DocumentFailure> failures) {
        Objects.requireNonNull(error, "error must not be null for FAILED");
        Objects.requireNonNull(failures, "failures must not be null");
        return new TransformationResult(
                Type.FAILED, List.of(), List.of(), null, List.copyOf(failures), error, processedCount);
    }

    public Type type() {
        return type;
    }

    /** Front matter of every processed document. Empty when FAILED. */
    public List<FrontmatterData> processedData() {
        return processedData;
    }

    /** Every processed document. Empty when FAILED. */
    public List<MarkdownDocument> documents() {
        return documents;
    }

    /** Aggregated data, or {@code null} when aggregation was not requested or did not succeed. */
    public ObjectNode aggregatedData() {
        return aggregatedData != null ? aggregatedData.deepCopy() : null;
    }

    public boolean hasAggregatedData() {
        return aggregatedData != null;
    }

    public List<DocumentFailure> failures() {
        return failures;
    }

    /** The fatal error. Only valid when {@code type() == FAILED}. */
    public FmxformException error() {
        return error;
    }

    public int processedCount() {
        return processedCount;
    }

    public boolean isCompleted() {
        return type == Type.COMPLETED;
    }

    public boolean isFailed() {
        return type == Type.FAILED;
    }

    @Override
    public String toString() {
        return switch (type) {
            case COMPLETED -> "TransformationResult[COMPLETED, processed=" + processedCount
                    + ", failed=" + failures.size()
                    + ", aggregated=" + (aggregatedData != null) + "]";
            case FAILED -> "TransformationResult[FAILED, processed=" + processedCount + ", error="
                    + error.getMessage() + "]";
        };
    }
}
