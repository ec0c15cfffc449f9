package io.fmxform.core.pipeline;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fmxform.core.error.CoordinatorConfigurationException;
import io.fmxform.core.error.FmxformException;
import io.fmxform.core.error.NoDocumentsException;
import io.fmxform.core.error.ValidationRulesException;
import io.fmxform.core.model.DocumentFailure;
import io.fmxform.core.model.FrontmatterData;
import io.fmxform.core.model.MarkdownDocument;
import io.fmxform.core.model.Schema;
import io.fmxform.core.model.TransformationResult;
import io.fmxform.core.model.TransformationStage;
import io.fmxform.core.spi.FileReader;
import io.fmxform.core.spi.FrontmatterExtraction;
import io.fmxform.core.spi.FrontmatterExtractor;
import io.fmxform.core.spi.TransformationListener;
import io.fmxform.core.spi.ValidationRulesProvider;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs a document transformation in five strictly sequential stages:
 *
 * <ol>
 *   <li><b>Validation adjustment</b>: derive per-document rules from the schema. Failure is fatal.
 *   <li><b>Strategy selection</b>: sequential, parallel or adaptive, by document count unless the
 *       request overrides it.
 *   <li><b>Document processing</b>: read, extract and validate every document. A failing document
 *       is recorded and excluded; the run continues.
 *   <li><b>Aggregation</b> (when requested): aggregate the processed front matter. Failure is
 *       logged as a warning and only omits the aggregated data.
 *   <li><b>Completion</b>: assemble the {@link TransformationResult}.
 * </ol>
 *
 * <p>{@link #transform} never throws for input problems; fatal errors are returned as a {@code
 * FAILED} result. Workers share no mutable state; their results are merged in input order, so
 * {@code processedData} is deterministic regardless of strategy.
 *
 * <p>Every log line of a run carries the MDC key {@value #MDC_RUN_ID}, in worker threads too.
 */
public final class DocumentTransformationCoordinator {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentTransformationCoordinator.class);

    /** MDC key holding the id of the current run. */
    public static final String MDC_RUN_ID = "runId";

    private static final AtomicInteger WORKER_SEQUENCE = new AtomicInteger();

    private final FileReader fileReader;
    private final FrontmatterExtractor extractor;
    private final ValidationRulesProvider rulesProvider;
    private final Aggregator aggregator;
    private final SchemaValidationMode validationMode;
    private final TransformationListener listener;

    public DocumentTransformationCoordinator(
            FileReader fileReader,
            FrontmatterExtractor extractor,
            ValidationRulesProvider rulesProvider,
            Aggregator aggregator,
            SchemaValidationMode validationMode) {
        this(fileReader, extractor, rulesProvider, aggregator, validationMode, TransformationListener.NONE);
    }

    /**
     * @throws CoordinatorConfigurationException if any collaborator is {@code null}
     */
    public DocumentTransformationCoordinator(
            FileReader fileReader,
            FrontmatterExtractor extractor,
            ValidationRulesProvider rulesProvider,
            Aggregator aggregator,
            SchemaValidationMode validationMode,
            TransformationListener listener) {
        this.fileReader = required(fileReader, "fileReader");
        this.extractor = required(extractor, "frontmatterExtractor");
        this.rulesProvider = required(rulesProvider, "validationRulesProvider");
        this.aggregator = required(aggregator, "aggregator");
        this.validationMode = required(validationMode, "validationMode");
        this.listener = required(listener, "listener");
    }

    /** Runs one transformation. Synchronous; returns when every stage has finished. */
    public TransformationResult transform(TransformationRequest request) {
        if (request == null) {
            throw new CoordinatorConfigurationException("request must not be null");
        }
        String runId = UUID.randomUUID().toString().substring(0, 8);
        MDC.put(MDC_RUN_ID, runId);
        try {
            return run(request, runId, System.nanoTime());
        } finally {
            MDC.remove(MDC_RUN_ID);
        }
    }

    private TransformationResult run(TransformationRequest request, String runId, long startNanos) {
        Schema schema = request.schema();
        List<Path> paths = request.documents();
        LOG.info("Transformation started: schema={}, documents={}, aggregate={}",
                schema.source(), paths.size(), request.aggregate());

        // Stage 1
        notifyStage(runId, TransformationStage.VALIDATION_ADJUSTMENT);
        ValidationRules rules;
        try {
            rules = rulesProvider.rulesFor(schema);
        } catch (FmxformException e) {
            return fail(runId, startNanos, e, 0, List.of());
        } catch (RuntimeException e) {
            return fail(runId, startNanos,
                    new ValidationRulesException(
                            "Failed to derive validation rules: " + e.getMessage(), e, schema.source()),
                    0, List.of());
        }
        LOG.debug("Validation rules adjusted: {}", rules);

        // Stage 2
        notifyStage(runId, TransformationStage.STRATEGY_SELECTION);
        if (paths.isEmpty()) {
            return fail(runId, startNanos, new NoDocumentsException("No documents to process"), 0, List.of());
        }
        ProcessingStrategy strategy =
                request.explicitStrategy().orElseGet(() -> ProcessingStrategy.forFileCount(paths.size()));
        int workers = strategy.workersFor(paths.size());
        LOG.info("Processing strategy selected: mode={}, workers={}, explicit={}",
                strategy.mode(), workers, request.explicitStrategy().isPresent());

        // Stage 3
        notifyStage(runId, TransformationStage.DOCUMENT_PROCESSING);
        List<DocumentOutcome> outcomes = workers <= 1
                ? processSequentially(paths, rules, runId)
                : processInParallel(paths, rules, runId, workers);
        List<MarkdownDocument> documents = new ArrayList<>();
        List<DocumentFailure> failures = new ArrayList<>();
        for (DocumentOutcome outcome : outcomes) {
            if (outcome.document() != null) {
                documents.add(outcome.document());
            } else {
                failures.add(outcome.failure());
            }
        }
        if (documents.isEmpty()) {
            return fail(runId, startNanos,
                    new NoDocumentsException("No valid documents found to process"), 0, failures);
        }

        // Stage 4
        ObjectNode aggregated = null;
        if (request.aggregate()) {
            notifyStage(runId, TransformationStage.AGGREGATION);
            List<FrontmatterData> processedData =
                    documents.stream().map(MarkdownDocument::frontmatter).toList();
            try {
                aggregated = aggregator.aggregate(processedData, schema);
            } catch (RuntimeException e) {
                LOG.warn("Aggregation failed, continuing without aggregated data: reason={}", e.getMessage(), e);
            }
        }

        // Stage 5
        notifyStage(runId, TransformationStage.COMPLETION);
        TransformationResult result = TransformationResult.completed(documents, aggregated, failures);
        long durationMs = elapsedMs(startNanos);
        LOG.info("Transformation completed: processed={}, failed={}, aggregated={}, durationMs={}",
                documents.size(), failures.size(), result.hasAggregatedData(), durationMs);
        notifyCompleted(new TransformationListener.TransformCompletedEvent(
                runId, documents.size(), failures.size(), result.hasAggregatedData(), durationMs));
        return result;
    }

    private List<DocumentOutcome> processSequentially(List<Path> paths, ValidationRules rules, String runId) {
        List<DocumentOutcome> outcomes = new ArrayList<>(paths.size());
        for (Path path : paths) {
            outcomes.add(processDocument(path, rules, runId));
        }
        return outcomes;
    }

    private List<DocumentOutcome> processInParallel(
            List<Path> paths, ValidationRules rules, String runId, int workers) {
        ExecutorService executor = Executors.newFixedThreadPool(workers, workerThreadFactory());
        try {
            List<Future<DocumentOutcome>> futures = new ArrayList<>(paths.size());
            for (Path path : paths) {
                futures.add(executor.submit(withMdc(() -> processDocument(path, rules, runId))));
            }
            // futures are in input order, so results are too
            List<DocumentOutcome> outcomes = new ArrayList<>(paths.size());
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(await(futures.get(i), paths.get(i)));
            }
            return outcomes;
        } finally {
            executor.shutdownNow();
        }
    }

    private static DocumentOutcome await(Future<DocumentOutcome> future, Path path) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DocumentOutcome.failed(path, "Interrupted while processing");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            LOG.warn("Document worker failed: path={}", path, cause);
            return DocumentOutcome.failed(path, String.valueOf(cause.getMessage()));
        }
    }

    private DocumentOutcome processDocument(Path path, ValidationRules rules, String runId) {
        DocumentOutcome outcome;
        try {
            outcome = extractAndValidate(path, rules);
        } catch (FmxformException e) {
            outcome = DocumentOutcome.failed(path, e.getMessage());
        } catch (RuntimeException e) {
            LOG.warn("Unexpected failure processing document: path={}", path, e);
            outcome = DocumentOutcome.failed(path, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        if (outcome.failure() != null) {
            LOG.warn("Document skipped: path={}, reason={}", path, outcome.failure().reason());
        } else {
            LOG.debug("Document processed: path={}, fields={}", path, outcome.document().frontmatter().size());
        }
        notifyDocument(new TransformationListener.DocumentProcessedEvent(
                runId, path, outcome.failure() == null,
                outcome.failure() != null ? outcome.failure().reason() : null));
        return outcome;
    }

    private DocumentOutcome extractAndValidate(Path path, ValidationRules rules) {
        String content = fileReader.read(path);
        FrontmatterExtraction extraction = extractor.extract(content);
        if (!(extraction instanceof FrontmatterExtraction.Present present)) {
            return DocumentOutcome.failed(path, "No valid front matter found");
        }
        FrontmatterData data = FrontmatterData.of(present.frontMatter());
        List<String> violations = rules.validate(data);
        if (!violations.isEmpty()) {
            if (validationMode == SchemaValidationMode.STRICT) {
                return DocumentOutcome.failed(path, "Front matter validation failed: " + String.join("; ", violations));
            }
            LOG.warn("Front matter violates rules, kept in lenient mode: path={}, violations={}", path, violations);
        }
        return DocumentOutcome.processed(new MarkdownDocument(path, data, present.body()));
    }

    private TransformationResult fail(
            String runId, long startNanos, FmxformException error, int processedCount, List<DocumentFailure> failures) {
        long durationMs = elapsedMs(startNanos);
        LOG.error("Transformation failed: category={}, reason={}, durationMs={}",
                error.category(), error.getMessage(), durationMs);
        notifyFailed(new TransformationListener.TransformFailedEvent(runId, error.getMessage(), durationMs));
        return TransformationResult.failed(error, processedCount, failures);
    }

    private static <T> Callable<T> withMdc(Callable<T> task) {
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();
        return () -> {
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            try {
                return task.call();
            } finally {
                MDC.clear();
            }
        };
    }

    private static ThreadFactory workerThreadFactory() {
        return runnable -> {
            Thread thread = new Thread(runnable, "fmxform-worker-" + WORKER_SEQUENCE.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    private static <T> T required(T value, String name) {
        if (value == null) {
            throw new CoordinatorConfigurationException(name + " is required");
        }
        return value;
    }

    // --- Listener notification: listener exceptions are logged and never affect the run ---

    private void notifyStage(String runId, TransformationStage stage) {
        LOG.debug("Stage started: stage={}", stage);
        try {
            listener.onStageStarted(new TransformationListener.StageStartedEvent(runId, stage));
        } catch (Exception e) {
            LOG.warn("TransformationListener.onStageStarted failed", e);
        }
    }

    private void notifyDocument(TransformationListener.DocumentProcessedEvent event) {
        try {
            listener.onDocumentProcessed(event);
        } catch (Exception e) {
            LOG.warn("TransformationListener.onDocumentProcessed failed", e);
        }
    }

    private void notifyCompleted(TransformationListener.TransformCompletedEvent event) {
        try {
            listener.onTransformCompleted(event);
        } catch (Exception e) {
            LOG.warn("TransformationListener.onTransformCompleted failed", e);
        }
    }

    private void notifyFailed(TransformationListener.TransformFailedEvent event) {
        try {
            listener.onTransformFailed(event);
        } catch (Exception e) {
            LOG.warn("TransformationListener.onTransformFailed failed", e);
        }
    }

    /** Result of one document: exactly one of {@code document} and {@code failure} is set. */
    private record DocumentOutcome(MarkdownDocument document, DocumentFailure failure) {

        static DocumentOutcome processed(MarkdownDocument document) {
            return new DocumentOutcome(document, null);
        }

        static DocumentOutcome failed(Path path, String reason) {
            return new DocumentOutcome(null, new DocumentFailure(path, reason));
        }
    }
}
