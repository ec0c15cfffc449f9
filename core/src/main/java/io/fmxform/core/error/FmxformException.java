package io.fmxform.core.error;

/**
 * Abstract base for all frontmatter-xform exceptions. Never thrown directly; use the concrete
 * subclasses under {@link ConfigurationException}, {@link ValidationException} or {@link
 * ProcessingException}.
 *
 * <p>Every exception carries the {@link Category} it belongs to and an optional location (schema
 * path, document path or file) that points an operator at the input to fix.
 */
public abstract class FmxformException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Origin of the failure. */
    public enum Category {
        /** Missing or malformed directive, missing collaborator. Always fatal. */
        CONFIGURATION,
        /** Structural misalignment or rule violation. Fatal to the operation it occurs in. */
        VALIDATION,
        /** A handler or collaborator failed while transforming data. */
        PROCESSING
    }

    private final Category category;
    private final String location;

    protected FmxformException(String message, Category category, String location) {
        super(message);
        this.category = category;
        this.location = location;
    }

    protected FmxformException(String message, Throwable cause, Category category, String location) {
        super(message, cause);
        this.category = category;
        this.location = location;
    }

    /** The category this failure belongs to. */
    public Category category() {
        return category;
    }

    /** Schema path, document path or file that caused the error, or {@code null} if unknown. */
    public String location() {
        return location;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }
}
