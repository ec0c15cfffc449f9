package io.fmxform.core.directive.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fmxform.core.directive.AbstractDirectiveHandler;
import io.fmxform.core.directive.Directive;
import io.fmxform.core.directive.DirectiveContext;
import io.fmxform.core.directive.DirectiveKind;
import io.fmxform.core.directive.DirectiveOutcome;
import io.fmxform.core.directive.DirectiveValue;
import io.fmxform.core.path.PropertyPath;
import java.util.List;
import java.util.Map;

/**
 * {@code x-template-items}: names the data collection the main template is rendered against once
 * per item. Data passes through unchanged.
 */
public final class TemplateItemsHandler extends AbstractDirectiveHandler {

    public TemplateItemsHandler() {
        super(DirectiveKind.TEMPLATE_ITEMS, 10, List.of(DirectiveKind.TEMPLATE));
    }

    @Override
    protected DirectiveValue parseValue(JsonNode raw, JsonNode schemaNode, String schemaPath) {
        String collection = requireText(raw, schemaPath);
        if (!PropertyPath.isValid(collection)) {
            throw configError(name() + " must name a data collection path: '" + collection + "'", schemaPath);
        }
        return new DirectiveValue.Text(collection);
    }

    @Override
    protected DirectiveOutcome process(ObjectNode data, Directive directive, DirectiveContext context) {
        return new DirectiveOutcome(data, Map.of("itemsCollection", directive.text()));
    }
}
