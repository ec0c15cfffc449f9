package io.fmxform.core.error;

/**
 * Thrown when a value cannot be described by a single structure: heterogeneous arrays, a schema
 * that is not an object, or an unsupported schema type. Also raised when data, schema and template
 * are not structurally aligned. The location is the structure path where the problem was found.
 */
public final class StructureMismatchException extends ValidationException {

    private static final long serialVersionUID = 1L;

    public StructureMismatchException(String message, String path) {
        super(message, path);
    }
}
