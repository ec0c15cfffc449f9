package io.fmxform.core.error;

/**
 * Thrown when a directive handler fails to transform collected data. Propagated to the caller of
 * the handler invocation; the registry never swallows it.
 */
public final class DirectiveProcessingException extends ProcessingException {

    private static final long serialVersionUID = 1L;

    private final String directiveName;

    public DirectiveProcessingException(String message, String directiveName, String schemaPath) {
        super(message, schemaPath);
        this.directiveName = directiveName;
    }

    public DirectiveProcessingException(String message, Throwable cause, String directiveName, String schemaPath) {
        super(message, cause, schemaPath);
        this.directiveName = directiveName;
    }

    /** The directive key whose handler failed. */
    public String directiveName() {
        return directiveName;
    }
}
