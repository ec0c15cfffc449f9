package io.fmxform.core.directive.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fmxform.core.directive.AbstractDirectiveHandler;
import io.fmxform.core.directive.Directive;
import io.fmxform.core.directive.DirectiveContext;
import io.fmxform.core.directive.DirectiveKind;
import io.fmxform.core.directive.DirectiveOutcome;
import io.fmxform.core.directive.DirectiveValue;
import io.fmxform.core.model.OutputFormat;
import java.util.List;
import java.util.Map;

/** {@code x-template-format}: explicit output format (json, yaml, xml or markdown). */
public final class TemplateFormatHandler extends AbstractDirectiveHandler {

    public TemplateFormatHandler() {
        super(DirectiveKind.TEMPLATE_FORMAT, 8, List.of());
    }

    @Override
    protected DirectiveValue parseValue(JsonNode raw, JsonNode schemaNode, String schemaPath) {
        String format = requireText(raw, schemaPath);
        OutputFormat resolved = OutputFormat.fromId(format)
                .orElseThrow(() -> configError(
                        name() + " must be one of json, yaml, xml, markdown; got '" + format + "'", schemaPath));
        return new DirectiveValue.Text(resolved.id());
    }

    @Override
    protected DirectiveOutcome process(ObjectNode data, Directive directive, DirectiveContext context) {
        return new DirectiveOutcome(data, Map.of("format", directive.text()));
    }
}
