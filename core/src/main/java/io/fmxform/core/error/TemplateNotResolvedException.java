package io.fmxform.core.error;

/**
 * Thrown when resolved template content or output format is requested before {@code
 * resolveTemplateFiles} completed.
 */
public final class TemplateNotResolvedException extends ConfigurationException {

    private static final long serialVersionUID = 1L;

    public TemplateNotResolvedException(String message) {
        super(message, null);
    }
}
