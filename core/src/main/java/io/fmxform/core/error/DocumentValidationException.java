package io.fmxform.core.error;

import java.util.List;

/** Thrown when a document's front matter violates the adjusted validation rules. */
public final class DocumentValidationException extends ValidationException {

    private static final long serialVersionUID = 1L;

    private final List<String> violations;

    public DocumentValidationException(String message, String documentPath, List<String> violations) {
        super(message, documentPath);
        this.violations = List.copyOf(violations);
    }

    /** Individual rule violations, one message each. */
    public List<String> violations() {
        return violations;
    }
}
