package io.fmxform.core.spi;

import io.fmxform.core.model.TransformationStage;
import java.nio.file.Path;

/**
 * Observability hook for document transformation runs.
 *
 * <p>All methods receive immutable event objects and have empty default implementations.
 * Implementations MUST be thread-safe: document events may arrive from worker threads. Exceptions
 * thrown by listeners are caught by the coordinator and logged; they do not affect the run.
 */
public interface TransformationListener {

    /** No-op listener. */
    TransformationListener NONE = new TransformationListener() {};

    /** Called when a stage begins. */
    default void onStageStarted(StageStartedEvent event) {}

    /** Called after each document, whether it succeeded or failed. */
    default void onDocumentProcessed(DocumentProcessedEvent event) {}

    /** Called when the run completes. */
    default void onTransformCompleted(TransformCompletedEvent event) {}

    /** Called when the run fails fatally. */
    default void onTransformFailed(TransformFailedEvent event) {}

    // --- Event records ---

    /** A stage started. */
    record StageStartedEvent(String runId, TransformationStage stage) {}

    /** A document was processed; {@code failureReason} is {@code null} on success. */
    record DocumentProcessedEvent(String runId, Path path, boolean succeeded, String failureReason) {}

    /** The run completed. */
    record TransformCompletedEvent(
            String runId, int processedCount, int failedCount, boolean aggregated, long durationMs) {}

    /** The run failed. */
    record TransformFailedEvent(String runId, String errorDetail, long durationMs) {}
}
