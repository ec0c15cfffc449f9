package io.fmxform.core.error;

/** Thrown when a pipeline component is constructed without a required collaborator. */
public final class CoordinatorConfigurationException extends ConfigurationException {

    private static final long serialVersionUID = 1L;

    public CoordinatorConfigurationException(String message) {
        super(message, null);
    }
}
