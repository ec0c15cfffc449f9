package io.fmxform.core.error;

/** Thrown when an expression fails to compile (syntax error, unknown engine). */
public final class ExpressionCompileException extends ConfigurationException {

    private static final long serialVersionUID = 1L;

    public ExpressionCompileException(String message, String location) {
        super(message, location);
    }

    public ExpressionCompileException(String message, Throwable cause, String location) {
        super(message, cause, location);
    }
}
