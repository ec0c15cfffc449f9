package io.fmxform.core.error;

/**
 * Thrown when directive handler dependencies form a cycle. The message names one handler that
 * participates in the cycle.
 */
public final class DependencyCycleException extends ConfigurationException {

    private static final long serialVersionUID = 1L;

    private final String handlerName;

    public DependencyCycleException(String handlerName) {
        super("Circular dependency detected involving " + handlerName, null);
        this.handlerName = handlerName;
    }

    /** A handler that participates in the cycle. */
    public String handlerName() {
        return handlerName;
    }
}
