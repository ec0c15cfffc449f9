package io.fmxform.core.error;

/**
 * Abstract parent for validation errors: structural misalignment and rule violations. Fatal to the
 * operation in which they occur but never corrupt shared state.
 */
public abstract class ValidationException extends FmxformException {

    private static final long serialVersionUID = 1L;

    protected ValidationException(String message, String location) {
        super(message, Category.VALIDATION, location);
    }

    protected ValidationException(String message, Throwable cause, String location) {
        super(message, cause, Category.VALIDATION, location);
    }
}
