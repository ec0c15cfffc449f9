package io.fmxform.core.engine;

import io.fmxform.core.model.OutputFormat;
import io.fmxform.core.model.TransformationResult;
import java.util.Objects;

/**
 * Output of a full engine run.
 *
 * @param content the rendered artifact
 * @param format its format
 * @param result the coordinator result it was rendered from
 */
public record RenderedOutput(String content, OutputFormat format, TransformationResult result) {

    public RenderedOutput {
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(format, "format must not be null");
        Objects.requireNonNull(result, "result must not be null");
    }
}
