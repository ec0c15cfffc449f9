package io.fmxform.core.pipeline;

import java.util.Objects;

/**
 * How documents are processed in stage 3 of a run.
 *
 * @param mode sequential, parallel or adaptive
 * @param maxWorkers worker count for {@code PARALLEL}; the base (upper bound) for {@code ADAPTIVE};
 *     always 1 for {@code SEQUENTIAL}
 * @param reevaluationThreshold documents per worker used by {@code ADAPTIVE} to size the pool
 */
public record ProcessingStrategy(Mode mode, int maxWorkers, int reevaluationThreshold) {

    /** Processing mode. */
    public enum Mode {
        SEQUENTIAL,
        PARALLEL,
        ADAPTIVE
    }

    /** Up to this many documents are processed sequentially. */
    public static final int SEQUENTIAL_LIMIT = 5;

    /** Up to this many documents are processed in parallel with {@link #PARALLEL_WORKERS}. */
    public static final int PARALLEL_LIMIT = 20;

    public static final int PARALLEL_WORKERS = 4;
    public static final int ADAPTIVE_BASE_WORKERS = 8;
    public static final int DEFAULT_REEVALUATION_THRESHOLD = 10;

    public ProcessingStrategy {
        Objects.requireNonNull(mode, "mode must not be null");
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be >= 1, got " + maxWorkers);
        }
        if (reevaluationThreshold < 1) {
            throw new IllegalArgumentException("reevaluationThreshold must be >= 1, got " + reevaluationThreshold);
        }
        if (mode == Mode.SEQUENTIAL && maxWorkers != 1) {
            throw new IllegalArgumentException("SEQUENTIAL strategy uses exactly 1 worker, got " + maxWorkers);
        }
    }

    public static ProcessingStrategy sequential() {
        return new ProcessingStrategy(Mode.SEQUENTIAL, 1, DEFAULT_REEVALUATION_THRESHOLD);
    }

    public static ProcessingStrategy parallel(int workers) {
        return new ProcessingStrategy(Mode.PARALLEL, workers, DEFAULT_REEVALUATION_THRESHOLD);
    }

    public static ProcessingStrategy adaptive(int baseWorkers, int reevaluationThreshold) {
        return new ProcessingStrategy(Mode.ADAPTIVE, baseWorkers, reevaluationThreshold);
    }

    /** Default strategy for {@code fileCount} documents: at most 5 sequential, at most 20 parallel. */
    public static ProcessingStrategy forFileCount(int fileCount) {
        if (fileCount <= SEQUENTIAL_LIMIT) {
            return sequential();
        }
        if (fileCount <= PARALLEL_LIMIT) {
            return parallel(PARALLEL_WORKERS);
        }
        return adaptive(ADAPTIVE_BASE_WORKERS, DEFAULT_REEVALUATION_THRESHOLD);
    }

    /**
     * Number of workers to use for {@code fileCount} documents. Adaptive sizing gives each worker
     * about {@code reevaluationThreshold} documents, capped at {@code maxWorkers}.
     */
    public int workersFor(int fileCount) {
        return switch (mode) {
            case SEQUENTIAL -> 1;
            case PARALLEL -> Math.max(1, Math.min(maxWorkers, fileCount));
            case ADAPTIVE -> {
                int wanted = (fileCount + reevaluationThreshold - 1) / reevaluationThreshold;
                yield Math.max(1, Math.min(maxWorkers, wanted));
            }
        };
    }
}
