package io.fmxform.core.error;

/** Thrown when a property path such as {@code items[].category} is syntactically invalid. */
public final class PropertyPathException extends ValidationException {

    private static final long serialVersionUID = 1L;

    public PropertyPathException(String message, String path) {
        super(message, path);
    }
}
