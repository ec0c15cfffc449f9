package io.fmxform.core.directive.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fmxform.core.directive.AbstractDirectiveHandler;
import io.fmxform.core.directive.Directive;
import io.fmxform.core.directive.DirectiveContext;
import io.fmxform.core.directive.DirectiveKind;
import io.fmxform.core.directive.DirectiveOutcome;
import io.fmxform.core.directive.DirectiveSupport;
import io.fmxform.core.directive.DirectiveValue;
import io.fmxform.core.expr.JsonNodeUtils;
import io.fmxform.core.path.PropertyPath;
import java.util.List;
import java.util.Map;

/**
 * {@code x-derived-count}: writes the number of non-null values found at a property path. A path
 * that addresses an array without expanding it counts the array's elements.
 */
public final class DerivedCountHandler extends AbstractDirectiveHandler {

    public DerivedCountHandler() {
        super(DirectiveKind.DERIVED_COUNT, 6, List.of(DirectiveKind.JMESPATH_FILTER));
    }

    @Override
    protected DirectiveValue parseValue(JsonNode raw, JsonNode schemaNode, String schemaPath) {
        String source = requireText(raw, schemaPath);
        requireProperty(schemaPath);
        if (!PropertyPath.isValid(source)) {
            throw configError(name() + " path is invalid: '" + source + "'", schemaPath);
        }
        return new DirectiveValue.Text(source);
    }

    @Override
    protected DirectiveOutcome process(ObjectNode data, Directive directive, DirectiveContext context) {
        int count = 0;
        for (JsonNode value : context.resolver().resolveAsList(data, directive.text())) {
            if (!JsonNodeUtils.isAbsent(value)) {
                count++;
            }
        }
        DirectiveSupport.writeAtDataPath(context.resolver(), data, directive, IntNode.valueOf(count));
        return new DirectiveOutcome(data, Map.of("count", count));
    }
}
