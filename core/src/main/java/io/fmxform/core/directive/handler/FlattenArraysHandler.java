package io.fmxform.core.directive.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fmxform.core.directive.AbstractDirectiveHandler;
import io.fmxform.core.directive.Directive;
import io.fmxform.core.directive.DirectiveContext;
import io.fmxform.core.directive.DirectiveKind;
import io.fmxform.core.directive.DirectiveOutcome;
import io.fmxform.core.directive.DirectiveValue;
import io.fmxform.core.error.PropertyPathException;
import io.fmxform.core.expr.JsonNodeUtils;
import io.fmxform.core.path.PropertyPath;
import java.util.List;
import java.util.Map;

/**
 * {@code x-flatten-arrays}: recursively flattens the array at a property path. The path is
 * resolved against the directive's scope, so a directive declared inside the front-matter item
 * schema flattens that field in every collected document.
 */
public final class FlattenArraysHandler extends AbstractDirectiveHandler {

    public FlattenArraysHandler() {
        super(DirectiveKind.FLATTEN_ARRAYS, 4, List.of(DirectiveKind.FRONTMATTER_PART));
    }

    @Override
    protected DirectiveValue parseValue(JsonNode raw, JsonNode schemaNode, String schemaPath) {
        String target = requireText(raw, schemaPath);
        if (target.chars().anyMatch(Character::isWhitespace)) {
            throw configError(name() + " path must not contain whitespace: '" + target + "'", schemaPath);
        }
        try {
            PropertyPath path = PropertyPath.parse(target);
            if (path.hasExpansion() || path.isRoot()) {
                throw configError(name() + " path must be a plain property path: '" + target + "'", schemaPath);
            }
        } catch (PropertyPathException e) {
            throw configError(name() + " path is invalid: " + e.getMessage(), e, schemaPath);
        }
        return new DirectiveValue.Text(target);
    }

    @Override
    protected DirectiveOutcome process(ObjectNode data, Directive directive, DirectiveContext context) {
        PropertyPath target = context.resolver().parse(directive.text());
        JsonNode value = context.resolver().get(data, target);
        if (value == null || !value.isArray()) {
            return new DirectiveOutcome(data, Map.of("flatteningApplied", false));
        }
        int originalDepth = JsonNodeUtils.arrayDepth(value);
        ArrayNode flattened = JsonNodeUtils.flatten(value);
        context.resolver().set(data, target, flattened);
        return new DirectiveOutcome(
                data,
                Map.of(
                        "flatteningApplied", true,
                        "originalDepth", originalDepth,
                        "finalDepth", JsonNodeUtils.arrayDepth(flattened),
                        "itemsProcessed", flattened.size()));
    }
}
