package io.fmxform.core.directive.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
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
import java.util.OptionalDouble;

/**
 * {@code x-derived-average}: writes the arithmetic mean of the numeric values found at a property
 * path. Strings holding numbers count as numbers; other values are skipped. A path with no numeric
 * value at all is a processing error.
 */
public final class DerivedAverageHandler extends AbstractDirectiveHandler {

    public DerivedAverageHandler() {
        super(DirectiveKind.DERIVED_AVERAGE, 6, List.of(DirectiveKind.JMESPATH_FILTER));
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
        double sum = 0;
        int count = 0;
        for (JsonNode value : context.resolver().resolveAsList(data, directive.text())) {
            OptionalDouble number = JsonNodeUtils.numericValue(value);
            if (number.isPresent()) {
                sum += number.getAsDouble();
                count++;
            }
        }
        if (count == 0) {
            throw processingError("no numeric values found at '" + directive.text() + "'", directive);
        }
        double average = sum / count;
        DirectiveSupport.writeAtDataPath(context.resolver(), data, directive, DoubleNode.valueOf(average));
        return new DirectiveOutcome(data, Map.of("average", average, "valuesAveraged", count));
    }
}
