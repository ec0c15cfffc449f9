package io.fmxform.core.error;

/** Thrown when validation rules cannot be derived from the schema. Aborts the whole run. */
public final class ValidationRulesException extends ConfigurationException {

    private static final long serialVersionUID = 1L;

    public ValidationRulesException(String message, String schemaPath) {
        super(message, schemaPath);
    }

    public ValidationRulesException(String message, Throwable cause, String schemaPath) {
        super(message, cause, schemaPath);
    }
}
