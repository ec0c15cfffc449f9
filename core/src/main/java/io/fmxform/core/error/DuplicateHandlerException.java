package io.fmxform.core.error;

/** Thrown when a directive handler is registered under a name that already has a handler. */
public final class DuplicateHandlerException extends ConfigurationException {

    private static final long serialVersionUID = 1L;

    private final String directiveName;

    public DuplicateHandlerException(String directiveName) {
        super("Handler for directive '" + directiveName + "' already registered", null);
        this.directiveName = directiveName;
    }

    /** The directive name that collided. */
    public String directiveName() {
        return directiveName;
    }
}
