package io.fmxform.core.error;

/** Thrown when a run has no documents to process, or none of them could be processed. */
public final class NoDocumentsException extends ProcessingException {

    private static final long serialVersionUID = 1L;

    public NoDocumentsException(String message) {
        super(message, null);
    }
}
