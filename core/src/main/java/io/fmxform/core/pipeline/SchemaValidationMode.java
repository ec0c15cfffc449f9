package io.fmxform.core.pipeline;

/**
 * How per-document validation failures are treated.
 *
 * <ul>
 *   <li>{@link #STRICT}: a document whose front matter violates the rules is recorded as a failure
 *       and excluded from the run.
 *   <li>{@link #LENIENT}: violations are logged as warnings and the document is kept (default).
 * </ul>
 */
public enum SchemaValidationMode {
    /** Exclude documents with rule violations. */
    STRICT,

    /** Log violations and keep the document (default). */
    LENIENT
}
