package io.fmxform.standalone.config;

/**
 * Thrown when configuration loading fails: missing file, invalid YAML, a missing required key or a
 * value that cannot be converted. The message is suitable for startup error output.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
