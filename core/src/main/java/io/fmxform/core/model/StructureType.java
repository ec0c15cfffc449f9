package io.fmxform.core.model;

import java.util.Objects;

/**
 * Inferred shape of a dataset. Produced once per schema analysis and never reinterpreted; the
 * processing hints are derived from it, not stored on it.
 */
public sealed interface StructureType {

    /** Short label used in logs: {@code registry}, {@code collection} or {@code custom}. */
    String label();

    /** A keyed set of named entries, e.g. {@code tools.commands}. */
    record Registry() implements StructureType {
        @Override
        public String label() {
            return "registry";
        }
    }

    /** A homogeneous array at {@code path}. */
    record Collection(String path) implements StructureType {
        public Collection {
            Objects.requireNonNull(path, "path must not be null");
        }

        @Override
        public String label() {
            return "collection";
        }
    }

    /** An arbitrary nested shape rooted at {@code path}. */
    record Custom(String path) implements StructureType {
        public Custom {
            Objects.requireNonNull(path, "path must not be null");
        }

        @Override
        public String label() {
            return "custom";
        }
    }
}
