package io.fmxform.core.match;

import java.util.Objects;

/**
 * Outcome of a structural alignment check. Either aligned, or failed with the pair of structures
 * that disagreed, the first mismatching path and a message.
 */
public final class AlignmentResult {

    /** Which comparison failed. */
    public enum Pair {
        /** Data against schema. */
        DATA_SCHEMA,
        /** Schema against template. */
        SCHEMA_TEMPLATE,
        /** One of the inputs could not be analyzed. */
        ANALYSIS
    }

    private static final AlignmentResult ALIGNED = new AlignmentResult(null, null, null);

    private final Pair pair;
    private final String path;
    private final String message;

    private AlignmentResult(Pair pair, String path, String message) {
        this.pair = pair;
        this.path = path;
        this.message = message;
    }

    public static AlignmentResult aligned() {
        return ALIGNED;
    }

    public static AlignmentResult failed(Pair pair, String path, String message) {
        Objects.requireNonNull(pair, "pair must not be null");
        Objects.requireNonNull(message, "message must not be null");
        return new AlignmentResult(pair, path, message);
    }

    public boolean isAligned() {
        return pair == null;
    }

    /** The failing pair, or {@code null} when aligned. */
    public Pair pair() {
        return pair;
    }

    /** First mismatching path ({@code ""} for the root), or {@code null} when aligned. */
    public String path() {
        return path;
    }

    public String message() {
        return message;
    }

    @Override
    public String toString() {
        if (isAligned()) {
            return "AlignmentResult{ALIGNED}";
        }
        return "AlignmentResult{FAILED, pair=" + pair + ", path='" + path + "', message='" + message + "'}";
    }
}
