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
import io.fmxform.core.directive.DirectiveSupport;
import io.fmxform.core.directive.DirectiveValue;
import io.fmxform.core.model.FrontmatterData;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * {@code x-collect-pattern}: collects, into the annotated property, the value of every front-matter
 * field whose name matches a regular expression. Documents are visited in input order and fields
 * in document order.
 */
public final class CollectPatternHandler extends AbstractDirectiveHandler {

    private final Map<String, Pattern> compiled = new ConcurrentHashMap<>();

    public CollectPatternHandler() {
        super(DirectiveKind.COLLECT_PATTERN, 2, List.of(DirectiveKind.FRONTMATTER_PART));
    }

    @Override
    protected DirectiveValue parseValue(JsonNode raw, JsonNode schemaNode, String schemaPath) {
        String regex = requireText(raw, schemaPath);
        requireProperty(schemaPath);
        try {
            compiled.computeIfAbsent(regex, Pattern::compile);
        } catch (PatternSyntaxException e) {
            throw configError(name() + " is not a valid regular expression: " + e.getDescription(), e, schemaPath);
        }
        return new DirectiveValue.Text(regex);
    }

    @Override
    protected DirectiveOutcome process(ObjectNode data, Directive directive, DirectiveContext context) {
        Pattern pattern = compiled.computeIfAbsent(directive.text(), Pattern::compile);
        ArrayNode values = JsonNodeFactory.instance.arrayNode();
        int fieldsMatched = 0;
        for (FrontmatterData document : context.documents()) {
            for (String field : document.fieldNames()) {
                if (pattern.matcher(field).find()) {
                    values.add(document.get(field));
                    fieldsMatched++;
                }
            }
        }
        DirectiveSupport.writeAtDataPath(context.resolver(), data, directive, values);
        return new DirectiveOutcome(data, Map.of("valuesCollected", fieldsMatched));
    }
}
