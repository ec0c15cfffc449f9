package io.fmxform.core.error;

/**
 * Thrown when a directive is present on a schema node but its value is malformed (wrong JSON
 * type, invalid path, uncompilable pattern). The location is the schema path of the node.
 */
public final class DirectiveConfigException extends ConfigurationException {

    private static final long serialVersionUID = 1L;

    private final String directiveName;

    public DirectiveConfigException(String message, String directiveName, String schemaPath) {
        super(message, schemaPath);
        this.directiveName = directiveName;
    }

    public DirectiveConfigException(String message, Throwable cause, String directiveName, String schemaPath) {
        super(message, cause, schemaPath);
        this.directiveName = directiveName;
    }

    /** The directive key, e.g. {@code x-flatten-arrays}. */
    public String directiveName() {
        return directiveName;
    }
}
