package io.fmxform.core.error;

/** Thrown by a {@link io.fmxform.core.spi.FileReader} when a file cannot be read. */
public final class FileReadException extends ProcessingException {

    private static final long serialVersionUID = 1L;

    /** Why the read failed. */
    public enum Reason {
        NOT_FOUND,
        PERMISSION_DENIED,
        READ_ERROR
    }

    private final Reason reason;

    public FileReadException(String message, Reason reason, String path) {
        super(message, path);
        this.reason = reason;
    }

    public FileReadException(String message, Throwable cause, Reason reason, String path) {
        super(message, cause, path);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
