package io.fmxform.core.directive;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fmxform.core.error.DirectiveConfigException;
import io.fmxform.core.error.DirectiveProcessingException;
import java.util.AbstractMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Base class for directive handlers. Handles absence, kind checks and extension extraction;
 * subclasses parse the raw value and implement the transformation.
 */
public abstract class AbstractDirectiveHandler implements DirectiveHandler {

    private final DirectiveKind kind;
    private final int priority;
    private final List<DirectiveKind> dependencies;

    protected AbstractDirectiveHandler(DirectiveKind kind, int priority, List<DirectiveKind> dependencies) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.priority = priority;
        this.dependencies = List.copyOf(dependencies);
    }

    @Override
    public final DirectiveKind kind() {
        return kind;
    }

    @Override
    public final int priority() {
        return priority;
    }

    @Override
    public final List<DirectiveKind> dependencies() {
        return dependencies;
    }

    @Override
    public final Directive extractConfig(JsonNode schemaNode, String schemaPath) {
        JsonNode raw = schemaNode != null && schemaNode.isObject() ? schemaNode.get(kind.key()) : null;
        if (raw == null || raw.isNull()) {
            return Directive.absent(kind, schemaPath);
        }
        DirectiveValue value = parseValue(raw, schemaNode, schemaPath);
        return value != null ? Directive.of(kind, schemaPath, value) : Directive.absent(kind, schemaPath);
    }

    @Override
    public final DirectiveOutcome processData(ObjectNode data, Directive directive, DirectiveContext context) {
        Objects.requireNonNull(data, "data must not be null");
        Objects.requireNonNull(directive, "directive must not be null");
        if (directive.kind() != kind) {
            throw new IllegalArgumentException(
                    name() + " handler cannot process " + directive.kind().key() + " directives");
        }
        if (!directive.present()) {
            return DirectiveOutcome.unchanged(data);
        }
        return process(data, directive, context);
    }

    @Override
    public Optional<Map.Entry<String, JsonNode>> extractExtension(JsonNode schemaNode) {
        if (schemaNode == null || !schemaNode.has(kind.key())) {
            return Optional.empty();
        }
        return Optional.of(new AbstractMap.SimpleImmutableEntry<>(kind.key(), schemaNode.get(kind.key()).deepCopy()));
    }

    /**
     * Converts a non-null raw value into typed configuration.
     *
     * @param raw the directive value
     * @param schemaNode the node carrying it, for modifier keys
     * @param schemaPath node path for error locations
     * @return the configuration, or {@code null} if the value disables the directive
     * @throws DirectiveConfigException if the value is malformed
     */
    protected abstract DirectiveValue parseValue(JsonNode raw, JsonNode schemaNode, String schemaPath);

    /** Applies a present directive. */
    protected abstract DirectiveOutcome process(ObjectNode data, Directive directive, DirectiveContext context);

    /** Requires a non-blank string value. */
    protected final String requireText(JsonNode raw, String schemaPath) {
        if (!raw.isTextual()) {
            throw configError(name() + " must be a string, got " + raw.getNodeType().name().toLowerCase(Locale.ROOT), schemaPath);
        }
        String text = raw.asText();
        if (text.isBlank()) {
            throw configError(name() + " must not be empty", schemaPath);
        }
        return text;
    }

    /** Requires the directive to annotate a property rather than the scope itself. */
    protected final void requireProperty(String schemaPath) {
        Directive located = Directive.absent(kind, schemaPath);
        if (located.dataPath().isEmpty()) {
            throw configError(name() + " must annotate a property", schemaPath);
        }
    }

    protected final DirectiveConfigException configError(String message, String schemaPath) {
        return new DirectiveConfigException(message + " (at '" + label(schemaPath) + "')", name(), schemaPath);
    }

    protected final DirectiveConfigException configError(String message, Throwable cause, String schemaPath) {
        return new DirectiveConfigException(
                message + " (at '" + label(schemaPath) + "')", cause, name(), schemaPath);
    }

    protected final DirectiveProcessingException processingError(String message, Directive directive) {
        return new DirectiveProcessingException(
                name() + " at '" + directive.location() + "': " + message, name(), directive.schemaPath());
    }

    private static String label(String schemaPath) {
        return schemaPath.isEmpty() ? "<root>" : schemaPath;
    }
}
