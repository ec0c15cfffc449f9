package io.fmxform.core.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A document excluded from a run because it could not be read, parsed or validated.
 *
 * @param path the source file
 * @param reason human-readable cause
 */
public record DocumentFailure(Path path, String reason) {

    public DocumentFailure {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
    }
}
