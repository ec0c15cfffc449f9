package io.fmxform.standalone.config;

import io.fmxform.core.detect.FieldPatterns;
import io.fmxform.core.engine.EngineOptions;
import io.fmxform.core.path.EvictionPolicy;
import io.fmxform.core.path.PathCacheConfig;
import io.fmxform.core.pipeline.ProcessingStrategy;
import io.fmxform.core.pipeline.SchemaValidationMode;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Root configuration of the standalone runner.
 *
 * <p>All fields have defaults except {@code schema} and {@code output}, which are required. Use
 * {@link #builder()} to construct instances.
 *
 * @param schema annotated schema file
 * @param documentsDir directory searched for documents
 * @param documentGlob glob, relative to {@code documentsDir}, selecting documents
 * @param output file the rendered artifact is written to
 * @param validationMode lenient or strict
 * @param strictAlignment require aggregate, schema and template to align before rendering
 * @param strategy auto, sequential, parallel or adaptive
 * @param maxWorkers worker count for parallel, base for adaptive; {@code null} for the mode default
 * @param reevaluationThreshold documents per worker for adaptive sizing
 * @param sequentialPatterns registry detection: sequential key patterns
 * @param namedPatterns registry detection: named keys
 * @param customPatterns registry detection: custom key patterns
 * @param minimumMatchCount registry detection: keys that must match
 * @param cacheMaxPathEntries path cache: parsed-path capacity
 * @param cacheMaxExtractionEntries path cache: extraction capacity
 * @param cachePathTtlMs path cache: parsed-path TTL
 * @param cacheExtractionTtlMs path cache: extraction TTL
 * @param cacheEviction lru or complexity-weighted
 * @param cacheMetrics count cache hits and misses
 * @param loggingFormat json or text
 * @param loggingLevel root log level
 */
public record XformConfig(
        String schema,
        String documentsDir,
        String documentGlob,
        String output,
        String validationMode,
        boolean strictAlignment,
        String strategy,
        Integer maxWorkers,
        int reevaluationThreshold,
        List<String> sequentialPatterns,
        List<String> namedPatterns,
        List<String> customPatterns,
        int minimumMatchCount,
        int cacheMaxPathEntries,
        int cacheMaxExtractionEntries,
        long cachePathTtlMs,
        long cacheExtractionTtlMs,
        String cacheEviction,
        boolean cacheMetrics,
        String loggingFormat,
        String loggingLevel) {

    /** Creates a new builder with defaults. */
    public static Builder builder() {
        return new Builder();
    }

    public Path schemaPath() {
        return Path.of(schema);
    }

    public Path documentsPath() {
        return Path.of(documentsDir);
    }

    public Path outputPath() {
        return Path.of(output);
    }

    /**
     * Converts the engine-related settings.
     *
     * @throws ConfigLoadException if an enumerated value is not recognised or a number is out of
     *     range
     */
    public EngineOptions engineOptions() {
        try {
            FieldPatterns patterns = FieldPatterns.builder()
                    .sequentialPatterns(sequentialPatterns)
                    .namedPatterns(namedPatterns)
                    .customPatterns(customPatterns)
                    .minimumMatchCount(minimumMatchCount)
                    .build();
            PathCacheConfig cache = new PathCacheConfig(
                    cacheMaxPathEntries,
                    cacheMaxExtractionEntries,
                    cachePathTtlMs,
                    cacheExtractionTtlMs,
                    evictionPolicy(),
                    cacheMetrics);
            return new EngineOptions(patterns, cache, schemaValidationMode(), processingStrategy(), strictAlignment);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid engine configuration: " + e.getMessage(), e);
        }
    }

    private SchemaValidationMode schemaValidationMode() {
        return switch (validationMode.toLowerCase(Locale.ROOT)) {
            case "lenient" -> SchemaValidationMode.LENIENT;
            case "strict" -> SchemaValidationMode.STRICT;
            default -> throw new ConfigLoadException(
                    "engine.validation-mode must be 'lenient' or 'strict', got '" + validationMode + "'");
        };
    }

    /** Explicit strategy, or {@code null} for auto. */
    private ProcessingStrategy processingStrategy() {
        return switch (strategy.toLowerCase(Locale.ROOT)) {
            case "auto" -> null;
            case "sequential" -> ProcessingStrategy.sequential();
            case "parallel" -> ProcessingStrategy.parallel(
                    maxWorkers != null ? maxWorkers : ProcessingStrategy.PARALLEL_WORKERS);
            case "adaptive" -> ProcessingStrategy.adaptive(
                    maxWorkers != null ? maxWorkers : ProcessingStrategy.ADAPTIVE_BASE_WORKERS,
                    reevaluationThreshold);
            default -> throw new ConfigLoadException(
                    "engine.strategy must be auto, sequential, parallel or adaptive, got '" + strategy + "'");
        };
    }

    private EvictionPolicy evictionPolicy() {
        return switch (cacheEviction.toLowerCase(Locale.ROOT)) {
            case "lru" -> EvictionPolicy.LRU;
            case "complexity-weighted", "complexity" -> EvictionPolicy.COMPLEXITY_WEIGHTED;
            default -> throw new ConfigLoadException(
                    "cache.eviction must be 'lru' or 'complexity-weighted', got '" + cacheEviction + "'");
        };
    }

    /** Builder for {@link XformConfig}. All fields have defaults except schema and output. */
    public static final class Builder {
        private String schema;
        private String documentsDir = ".";
        private String documentGlob = "**/*.md";
        private String output;
        private String validationMode = "lenient";
        private boolean strictAlignment = false;
        private String strategy = "auto";
        private Integer maxWorkers; // null → mode default
        private int reevaluationThreshold = ProcessingStrategy.DEFAULT_REEVALUATION_THRESHOLD;
        private List<String> sequentialPatterns = List.of(FieldPatterns.DEFAULT_SEQUENTIAL);
        private List<String> namedPatterns = FieldPatterns.DEFAULT_NAMED;
        private List<String> customPatterns = List.of();
        private int minimumMatchCount = FieldPatterns.DEFAULT_MINIMUM_MATCH_COUNT;
        private int cacheMaxPathEntries = PathCacheConfig.DEFAULT.maxPathEntries();
        private int cacheMaxExtractionEntries = PathCacheConfig.DEFAULT.maxExtractionEntries();
        private long cachePathTtlMs = PathCacheConfig.DEFAULT.pathTtlMs();
        private long cacheExtractionTtlMs = PathCacheConfig.DEFAULT.extractionTtlMs();
        private String cacheEviction = "lru";
        private boolean cacheMetrics = true;
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder schema(String schema) {
            this.schema = schema;
            return this;
        }

        public Builder documentsDir(String documentsDir) {
            this.documentsDir = documentsDir;
            return this;
        }

        public Builder documentGlob(String documentGlob) {
            this.documentGlob = documentGlob;
            return this;
        }

        public Builder output(String output) {
            this.output = output;
            return this;
        }

        public Builder validationMode(String validationMode) {
            this.validationMode = validationMode;
            return this;
        }

        public Builder strictAlignment(boolean strictAlignment) {
            this.strictAlignment = strictAlignment;
            return this;
        }

        public Builder strategy(String strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder maxWorkers(int maxWorkers) {
            this.maxWorkers = maxWorkers;
            return this;
        }

        public Builder reevaluationThreshold(int reevaluationThreshold) {
            this.reevaluationThreshold = reevaluationThreshold;
            return this;
        }

        public Builder sequentialPatterns(List<String> sequentialPatterns) {
            this.sequentialPatterns = List.copyOf(sequentialPatterns);
            return this;
        }

        public Builder namedPatterns(List<String> namedPatterns) {
            this.namedPatterns = List.copyOf(namedPatterns);
            return this;
        }

        public Builder customPatterns(List<String> customPatterns) {
            this.customPatterns = List.copyOf(customPatterns);
            return this;
        }

        public Builder minimumMatchCount(int minimumMatchCount) {
            this.minimumMatchCount = minimumMatchCount;
            return this;
        }

        public Builder cacheMaxPathEntries(int cacheMaxPathEntries) {
            this.cacheMaxPathEntries = cacheMaxPathEntries;
            return this;
        }

        public Builder cacheMaxExtractionEntries(int cacheMaxExtractionEntries) {
            this.cacheMaxExtractionEntries = cacheMaxExtractionEntries;
            return this;
        }

        public Builder cachePathTtlMs(long cachePathTtlMs) {
            this.cachePathTtlMs = cachePathTtlMs;
            return this;
        }

        public Builder cacheExtractionTtlMs(long cacheExtractionTtlMs) {
            this.cacheExtractionTtlMs = cacheExtractionTtlMs;
            return this;
        }

        public Builder cacheEviction(String cacheEviction) {
            this.cacheEviction = cacheEviction;
            return this;
        }

        public Builder cacheMetrics(boolean cacheMetrics) {
            this.cacheMetrics = cacheMetrics;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        /**
         * Builds the {@link XformConfig}.
         *
         * @throws ConfigLoadException if {@code schema} or {@code output} is missing
         */
        public XformConfig build() {
            if (schema == null || schema.isBlank()) {
                throw new ConfigLoadException("Missing required configuration key: schema");
            }
            if (output == null || output.isBlank()) {
                throw new ConfigLoadException("Missing required configuration key: output.path");
            }
            return new XformConfig(
                    schema,
                    documentsDir,
                    documentGlob,
                    output,
                    validationMode,
                    strictAlignment,
                    strategy,
                    maxWorkers,
                    reevaluationThreshold,
                    sequentialPatterns,
                    namedPatterns,
                    customPatterns,
                    minimumMatchCount,
                    cacheMaxPathEntries,
                    cacheMaxExtractionEntries,
                    cachePathTtlMs,
                    cacheExtractionTtlMs,
                    cacheEviction,
                    cacheMetrics,
                    loggingFormat,
                    loggingLevel);
        }
    }
}
