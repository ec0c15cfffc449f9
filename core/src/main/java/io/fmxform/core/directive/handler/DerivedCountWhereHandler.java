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
import io.fmxform.core.error.ExpressionCompileException;
import io.fmxform.core.expr.JsonNodeUtils;
import io.fmxform.core.path.PropertyPath;
import io.fmxform.core.spi.CompiledExpression;
import io.fmxform.core.spi.ExpressionEngine;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@code x-derived-count-where}: {@code {from: <path>, where: <predicate>}}. Writes the number of
 * items found at {@code from} for which the predicate is truthy. The predicate is an expression of
 * the configured engine (JSLT by default), evaluated with the item as input and the whole
 * aggregate bound to {@code $root}; for example {@code .status == "active"}.
 */
public final class DerivedCountWhereHandler extends AbstractDirectiveHandler {

    private final ExpressionEngine engine;
    private final Map<String, CompiledExpression> compiled = new ConcurrentHashMap<>();

    public DerivedCountWhereHandler(ExpressionEngine engine) {
        super(DirectiveKind.DERIVED_COUNT_WHERE, 6, List.of(DirectiveKind.JMESPATH_FILTER));
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    @Override
    protected DirectiveValue parseValue(JsonNode raw, JsonNode schemaNode, String schemaPath) {
        if (!raw.isObject()) {
            throw configError(name() + " must be an object with 'from' and 'where'", schemaPath);
        }
        requireProperty(schemaPath);
        JsonNode from = raw.get("from");
        JsonNode where = raw.get("where");
        if (from == null || !from.isTextual() || from.asText().isBlank()) {
            throw configError(name() + ".from must be a non-empty string", schemaPath);
        }
        if (where == null || !where.isTextual() || where.asText().isBlank()) {
            throw configError(name() + ".where must be a non-empty string", schemaPath);
        }
        if (!PropertyPath.isValid(from.asText())) {
            throw configError(name() + ".from path is invalid: '" + from.asText() + "'", schemaPath);
        }
        try {
            compiled.computeIfAbsent(where.asText(), w -> engine.compile(w, schemaPath));
        } catch (ExpressionCompileException e) {
            throw configError(name() + ".where does not compile: " + e.getMessage(), e, schemaPath);
        }
        return new DirectiveValue.CountWhere(from.asText(), where.asText());
    }

    @Override
    protected DirectiveOutcome process(ObjectNode data, Directive directive, DirectiveContext context) {
        DirectiveValue.CountWhere config = (DirectiveValue.CountWhere) directive.value();
        CompiledExpression predicate =
                compiled.computeIfAbsent(config.where(), w -> engine.compile(w, directive.schemaPath()));
        Map<String, JsonNode> variables = Map.of("root", context.root());

        List<JsonNode> items = context.resolver().resolveAsList(data, config.from());
        int matched = 0;
        for (JsonNode item : items) {
            if (JsonNodeUtils.isTruthy(predicate.evaluate(item, variables))) {
                matched++;
            }
        }
        DirectiveSupport.writeAtDataPath(context.resolver(), data, directive, IntNode.valueOf(matched));
        return new DirectiveOutcome(data, Map.of("count", matched, "itemsEvaluated", items.size()));
    }
}
