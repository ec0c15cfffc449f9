package io.fmxform.core.directive.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fmxform.core.directive.AbstractDirectiveHandler;
import io.fmxform.core.directive.Directive;
import io.fmxform.core.directive.DirectiveContext;
import io.fmxform.core.directive.DirectiveKind;
import io.fmxform.core.directive.DirectiveOutcome;
import io.fmxform.core.directive.DirectiveValue;
import io.fmxform.core.model.FrontmatterData;
import io.fmxform.core.path.PropertyPath;
import java.util.List;
import java.util.Map;

/**
 * {@code x-frontmatter-part}: marks where the documents' front matter is collected.
 *
 * <p>Accepted forms are {@code true} on an array property (the property itself receives the
 * collection) or a property path string on any root-scope node (the path, relative to the data
 * root, receives it). {@code false} disables the directive.
 */
public final class FrontmatterPartHandler extends AbstractDirectiveHandler {

    public FrontmatterPartHandler() {
        super(DirectiveKind.FRONTMATTER_PART, 1, List.of());
    }

    @Override
    protected DirectiveValue parseValue(JsonNode raw, JsonNode schemaNode, String schemaPath) {
        if (schemaPath.contains("[]")) {
            throw configError(name() + " cannot be declared inside an item schema", schemaPath);
        }
        if (raw.isBoolean()) {
            if (!raw.booleanValue()) {
                return null;
            }
            if (schemaPath.isEmpty()) {
                throw configError(name() + ": true must annotate an array property", schemaPath);
            }
            return new DirectiveValue.Flag(true);
        }
        if (raw.isTextual()) {
            String path = requireText(raw, schemaPath);
            if (!PropertyPath.isValid(path) || PropertyPath.parse(path).hasExpansion()
                    || PropertyPath.parse(path).isRoot()) {
                throw configError(name() + " path is not a plain property path: '" + path + "'", schemaPath);
            }
            return new DirectiveValue.Text(path);
        }
        throw configError(name() + " must be a boolean or a property path", schemaPath);
    }

    @Override
    protected DirectiveOutcome process(ObjectNode data, Directive directive, DirectiveContext context) {
        ArrayNode collected = JsonNodeFactory.instance.arrayNode();
        for (FrontmatterData document : context.documents()) {
            collected.add(document.asObjectNode());
        }
        String target = targetPath(directive);
        context.resolver().set(data, context.resolver().parse(target), collected);
        return new DirectiveOutcome(data, Map.of("documentsCollected", collected.size(), "targetPath", target));
    }

    /** Data path that receives the collection for a present directive. */
    public static String targetPath(Directive directive) {
        if (directive.value() instanceof DirectiveValue.Text text) {
            return text.value();
        }
        return directive.dataPath();
    }
}
