package io.fmxform.core.error;

/** Thrown when a compiled expression fails at evaluation time. */
public final class ExpressionEvalException extends ProcessingException {

    private static final long serialVersionUID = 1L;

    public ExpressionEvalException(String message, Throwable cause, String location) {
        super(message, cause, location);
    }
}
