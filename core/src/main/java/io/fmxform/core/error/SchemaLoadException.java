package io.fmxform.core.error;

/** Thrown when a schema file cannot be read or parsed, or its root is not an object. */
public final class SchemaLoadException extends ConfigurationException {

    private static final long serialVersionUID = 1L;

    public SchemaLoadException(String message, String source) {
        super(message, source);
    }

    public SchemaLoadException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
