package io.fmxform.core.error;

/**
 * Abstract parent for configuration errors: missing or malformed directives, unresolvable templates
 * and missing collaborators. Always fatal, never retried.
 */
public abstract class ConfigurationException extends FmxformException {

    private static final long serialVersionUID = 1L;

    protected ConfigurationException(String message, String location) {
        super(message, Category.CONFIGURATION, location);
    }

    protected ConfigurationException(String message, Throwable cause, String location) {
        super(message, cause, Category.CONFIGURATION, location);
    }
}
