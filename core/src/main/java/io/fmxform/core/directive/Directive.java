package io.fmxform.core.directive;

import java.util.Objects;

/**
 * One directive found on one schema node.
 *
 * <p>The schema path joins property names with {@code .} and marks array item schemas with
 * {@code []}, e.g. {@code items[].tags}. A directive below an item schema is scoped to each
 * element of that array: {@link #scopePath()} is the array ({@code items[]}) and {@link
 * #dataPath()} is relative to each element ({@code tags}).
 *
 * @param kind directive kind
 * @param schemaPath path of the schema node carrying the directive; empty for the root
 * @param value typed configuration, or {@code null} when not present
 * @param present whether the directive is present and enabled on the node
 */
public record Directive(DirectiveKind kind, String schemaPath, DirectiveValue value, boolean present) {

    public Directive {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(schemaPath, "schemaPath must not be null");
        if (present) {
            Objects.requireNonNull(value, "value must not be null for a present directive");
        }
    }

    public static Directive of(DirectiveKind kind, String schemaPath, DirectiveValue value) {
        return new Directive(kind, schemaPath, value, true);
    }

    public static Directive absent(DirectiveKind kind, String schemaPath) {
        return new Directive(kind, schemaPath, null, false);
    }

    /** Path of the innermost enclosing array, ending in {@code []}, or empty for root scope. */
    public String scopePath() {
        int idx = schemaPath.lastIndexOf("[]");
        return idx < 0 ? "" : schemaPath.substring(0, idx + 2);
    }

    /** Data path relative to the scope; empty when the directive sits on the scope itself. */
    public String dataPath() {
        int idx = schemaPath.lastIndexOf("[]");
        if (idx < 0) {
            return schemaPath;
        }
        String rest = schemaPath.substring(idx + 2);
        return rest.startsWith(".") ? rest.substring(1) : rest;
    }

    /** The text configuration; only valid for {@link DirectiveValue.Text} values. */
    public String text() {
        if (value instanceof DirectiveValue.Text text) {
            return text.value();
        }
        throw new IllegalStateException(kind.key() + " at '" + schemaPath + "' has no text value");
    }

    /** Location label for error messages. */
    public String location() {
        return schemaPath.isEmpty() ? "<root>" : schemaPath;
    }
}
