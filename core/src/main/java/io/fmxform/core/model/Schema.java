package io.fmxform.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A parsed JSON Schema annotated with {@code x-*} directives.
 *
 * @param root the schema tree; always an object node
 * @param location the file the schema was loaded from, or {@code null} for in-memory schemas
 */
public record Schema(JsonNode root, Path location) {

    public Schema {
        Objects.requireNonNull(root, "root must not be null");
    }

    /** Creates an in-memory schema with no file location. */
    public static Schema of(JsonNode root) {
        return new Schema(root, null);
    }

    /** Directory template paths are resolved against, or {@code null} for in-memory schemas. */
    public Path directory() {
        if (location == null) {
            return null;
        }
        return location.toAbsolutePath().getParent();
    }

    /** Label for logs and error locations. */
    public String source() {
        return location != null ? location.toString() : "<inline>";
    }
}
