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
import io.fmxform.core.expr.JsonNodeUtils;
import io.fmxform.core.path.PropertyPath;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * {@code x-derived-from}: fills the annotated property with the values found at a property path,
 * e.g. {@code items[].category}.
 *
 * <p>Null values are dropped and the rest are rendered as strings and sorted. With {@code
 * x-derived-flatten: true} nested arrays are flattened first; with {@code x-derived-unique: true}
 * duplicates are removed.
 */
public final class DerivedFromHandler extends AbstractDirectiveHandler {

    public DerivedFromHandler() {
        super(DirectiveKind.DERIVED_FROM, 5, List.of(DirectiveKind.FLATTEN_ARRAYS, DirectiveKind.JMESPATH_FILTER));
    }

    @Override
    protected DirectiveValue parseValue(JsonNode raw, JsonNode schemaNode, String schemaPath) {
        String source = requireText(raw, schemaPath);
        requireProperty(schemaPath);
        if (!PropertyPath.isValid(source)) {
            throw configError(name() + " path is invalid: '" + source + "'", schemaPath);
        }
        boolean unique = modifier(schemaNode, DirectiveKind.DERIVED_UNIQUE_KEY, schemaPath);
        boolean flatten = modifier(schemaNode, DirectiveKind.DERIVED_FLATTEN_KEY, schemaPath);
        return new DirectiveValue.DerivedSource(source, unique, flatten);
    }

    @Override
    protected DirectiveOutcome process(ObjectNode data, Directive directive, DirectiveContext context) {
        DirectiveValue.DerivedSource source = (DirectiveValue.DerivedSource) directive.value();
        List<JsonNode> resolved = context.resolver().resolve(data, source.path());

        List<JsonNode> candidates = new ArrayList<>();
        for (JsonNode value : resolved) {
            if (source.flatten() && value.isArray()) {
                JsonNodeUtils.flatten(value).forEach(candidates::add);
            } else {
                candidates.add(value);
            }
        }

        List<String> values = new ArrayList<>();
        for (JsonNode candidate : candidates) {
            if (!JsonNodeUtils.isAbsent(candidate)) {
                values.add(JsonNodeUtils.asText(candidate));
            }
        }
        if (source.unique()) {
            values = new ArrayList<>(new LinkedHashSet<>(values));
        }
        values.sort(null);

        ArrayNode out = JsonNodeFactory.instance.arrayNode();
        values.forEach(out::add);
        DirectiveSupport.writeAtDataPath(context.resolver(), data, directive, out);
        return new DirectiveOutcome(
                data, Map.of("valuesCollected", out.size(), "sourcePath", source.path(), "unique", source.unique()));
    }

    private boolean modifier(JsonNode schemaNode, String key, String schemaPath) {
        JsonNode value = schemaNode.get(key);
        if (value == null || value.isNull()) {
            return false;
        }
        if (!value.isBoolean()) {
            throw configError(key + " must be a boolean", schemaPath);
        }
        return value.booleanValue();
    }
}
