package io.fmxform.core.error;

/**
 * Abstract parent for errors raised while transforming data: a directive handler, a file read or an
 * expression evaluation failed.
 */
public abstract class ProcessingException extends FmxformException {

    private static final long serialVersionUID = 1L;

    protected ProcessingException(String message, String location) {
        super(message, Category.PROCESSING, location);
    }

    protected ProcessingException(String message, Throwable cause, String location) {
        super(message, cause, Category.PROCESSING, location);
    }
}
