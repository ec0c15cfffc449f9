package io.fmxform.core.engine;

import io.fmxform.core.detect.FieldPatterns;
import io.fmxform.core.path.PathCacheConfig;
import io.fmxform.core.pipeline.ProcessingStrategy;
import io.fmxform.core.pipeline.SchemaValidationMode;
import java.util.Objects;

/**
 * Tunables of a {@link FrontmatterTransformEngine}.
 *
 * @param fieldPatterns registry detection patterns
 * @param pathCache path cache sizing and eviction
 * @param validationMode per-document validation mode
 * @param strategy explicit processing strategy, or {@code null} to choose by document count
 * @param strictAlignment whether aggregated data, schema and template must align before rendering
 */
public record EngineOptions(
        FieldPatterns fieldPatterns,
        PathCacheConfig pathCache,
        SchemaValidationMode validationMode,
        ProcessingStrategy strategy,
        boolean strictAlignment) {

    public static final EngineOptions DEFAULT = new EngineOptions(
            FieldPatterns.defaults(), PathCacheConfig.DEFAULT, SchemaValidationMode.LENIENT, null, false);

    public EngineOptions {
        Objects.requireNonNull(fieldPatterns, "fieldPatterns must not be null");
        Objects.requireNonNull(pathCache, "pathCache must not be null");
        Objects.requireNonNull(validationMode, "validationMode must not be null");
    }
}
