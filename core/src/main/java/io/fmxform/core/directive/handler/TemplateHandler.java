package io.fmxform.core.directive.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fmxform.core.directive.AbstractDirectiveHandler;
import io.fmxform.core.directive.Directive;
import io.fmxform.core.directive.DirectiveContext;
import io.fmxform.core.directive.DirectiveKind;
import io.fmxform.core.directive.DirectiveOutcome;
import io.fmxform.core.directive.DirectiveValue;
import java.util.List;
import java.util.Map;

/**
 * {@code x-template}: the main template, inline or a file path. Consumed by template resolution;
 * data passes through unchanged.
 */
public final class TemplateHandler extends AbstractDirectiveHandler {

    public TemplateHandler() {
        super(DirectiveKind.TEMPLATE, 9, List.of());
    }

    @Override
    protected DirectiveValue parseValue(JsonNode raw, JsonNode schemaNode, String schemaPath) {
        return new DirectiveValue.Text(requireText(raw, schemaPath));
    }

    @Override
    protected DirectiveOutcome process(ObjectNode data, Directive directive, DirectiveContext context) {
        return new DirectiveOutcome(data, Map.of("template", directive.text()));
    }
}
