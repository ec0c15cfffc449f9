package io.fmxform.core.directive;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns one {@link DirectiveKind}: validates its raw schema value, applies it to collected data,
 * and extracts it as an extension pair.
 *
 * <p>Handlers are registered once into a {@link DirectiveRegistry}. Implementations MUST be
 * thread-safe.
 */
public interface DirectiveHandler {

    /** The directive this handler owns. */
    DirectiveKind kind();

    /** Directive key, e.g. {@code x-template}. */
    default String name() {
        return kind().key();
    }

    /** Ordering priority; lower runs earlier among handlers with no dependency between them. */
    int priority();

    /** Kinds whose handlers must run before this one. Unregistered kinds are ignored. */
    List<DirectiveKind> dependencies();

    /**
     * Reads the directive from a schema node.
     *
     * @param schemaNode the schema node to inspect
     * @param schemaPath path of the node, used for scoping and error locations
     * @return the directive, with {@code present == false} when the key is absent or disabled
     * @throws io.fmxform.core.error.DirectiveConfigException if the key is present but malformed
     */
    Directive extractConfig(JsonNode schemaNode, String schemaPath);

    /**
     * Applies a present directive to one data scope.
     *
     * @param data the scope data; handlers may mutate it and return it
     * @param directive a present directive of this handler's kind
     * @param context shared processing state
     * @return the resulting data and handler metadata
     * @throws io.fmxform.core.error.DirectiveProcessingException if the data cannot be transformed
     */
    DirectiveOutcome processData(ObjectNode data, Directive directive, DirectiveContext context);

    /**
     * Extracts the raw directive as a {@code (key, value)} pair, or empty when the node does not
     * carry it.
     */
    Optional<Map.Entry<String, JsonNode>> extractExtension(JsonNode schemaNode);
}
