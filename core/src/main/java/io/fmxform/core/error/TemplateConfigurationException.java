package io.fmxform.core.error;

/** Thrown when template directives are missing or a template file cannot be resolved. */
public final class TemplateConfigurationException extends ConfigurationException {

    private static final long serialVersionUID = 1L;

    public TemplateConfigurationException(String message, String location) {
        super(message, location);
    }

    public TemplateConfigurationException(String message, Throwable cause, String location) {
        super(message, cause, location);
    }
}
