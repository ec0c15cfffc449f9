package io.fmxform.core.directive;

import java.util.Objects;

/** Typed configuration of a present directive. */
public sealed interface DirectiveValue {

    /** A string value: a path, pattern, expression, template or format. */
    record Text(String value) implements DirectiveValue {
        public Text {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /** A boolean marker. */
    record Flag(boolean value) implements DirectiveValue {}

    /** {@code x-derived-from} with its modifiers. */
    record DerivedSource(String path, boolean unique, boolean flatten) implements DirectiveValue {
        public DerivedSource {
            Objects.requireNonNull(path, "path must not be null");
        }
    }

    /** {@code x-derived-count-where}: items at {@code from} counted where {@code where} holds. */
    record CountWhere(String from, String where) implements DirectiveValue {
        public CountWhere {
            Objects.requireNonNull(from, "from must not be null");
            Objects.requireNonNull(where, "where must not be null");
        }
    }
}
