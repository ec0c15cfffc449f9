package io.fmxform.core.directive.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.burt.jmespath.Expression;
import io.burt.jmespath.JmesPath;
import io.burt.jmespath.JmesPathException;
import io.burt.jmespath.jackson.JacksonRuntime;
import io.fmxform.core.directive.AbstractDirectiveHandler;
import io.fmxform.core.directive.Directive;
import io.fmxform.core.directive.DirectiveContext;
import io.fmxform.core.directive.DirectiveKind;
import io.fmxform.core.directive.DirectiveOutcome;
import io.fmxform.core.directive.DirectiveSupport;
import io.fmxform.core.directive.DirectiveValue;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@code x-jmespath-filter}: replaces the value of the annotated node with the result of a JMESPath
 * expression evaluated against it.
 *
 * <p>A null result leaves the data unchanged. On the root node an array result is wrapped as
 * {@code {"items": [...]}} and an object result replaces the root; a scalar result there is a
 * processing error.
 */
public final class JmesPathFilterHandler extends AbstractDirectiveHandler {

    private static final String FORBIDDEN_LEADING = "()&|<>!";

    private final JmesPath<JsonNode> jmespath = new JacksonRuntime();
    private final Map<String, Expression<JsonNode>> compiled = new ConcurrentHashMap<>();

    public JmesPathFilterHandler() {
        super(DirectiveKind.JMESPATH_FILTER, 3, List.of(DirectiveKind.FRONTMATTER_PART));
    }

    @Override
    protected DirectiveValue parseValue(JsonNode raw, JsonNode schemaNode, String schemaPath) {
        String expression = requireText(raw, schemaPath).trim();
        if (FORBIDDEN_LEADING.indexOf(expression.charAt(0)) >= 0) {
            throw configError(name() + " must not start with '" + expression.charAt(0) + "'", schemaPath);
        }
        if (!balanced(expression, '[', ']') || !balanced(expression, '(', ')')) {
            throw configError(name() + " has unbalanced brackets: '" + expression + "'", schemaPath);
        }
        try {
            compiled.computeIfAbsent(expression, jmespath::compile);
        } catch (JmesPathException e) {
            throw configError(name() + " is not a valid JMESPath expression: " + e.getMessage(), e, schemaPath);
        }
        return new DirectiveValue.Text(expression);
    }

    @Override
    protected DirectiveOutcome process(ObjectNode data, Directive directive, DirectiveContext context) {
        Expression<JsonNode> expression = compiled.computeIfAbsent(directive.text(), jmespath::compile);
        JsonNode input = DirectiveSupport.readAtDataPath(context.resolver(), data, directive);
        if (input == null) {
            return new DirectiveOutcome(data, Map.of("filterApplied", false));
        }
        JsonNode result;
        try {
            result = expression.search(input);
        } catch (JmesPathException e) {
            throw processingError("evaluation failed: " + e.getMessage(), directive);
        }
        if (result == null || result.isNull() || result.isMissingNode()) {
            return new DirectiveOutcome(data, Map.of("filterApplied", false));
        }
        int resultSize = result.isContainerNode() ? result.size() : 1;
        if (!directive.dataPath().isEmpty()) {
            DirectiveSupport.writeAtDataPath(context.resolver(), data, directive, result);
            return new DirectiveOutcome(data, Map.of("filterApplied", true, "resultSize", resultSize));
        }
        if (result.isArray()) {
            ObjectNode wrapped = JsonNodeFactory.instance.objectNode();
            wrapped.set("items", result);
            return new DirectiveOutcome(wrapped, Map.of("filterApplied", true, "resultSize", resultSize));
        }
        if (result.isObject()) {
            return new DirectiveOutcome((ObjectNode) result, Map.of("filterApplied", true, "resultSize", resultSize));
        }
        throw processingError("a root filter must produce an object or an array, got "
                + result.getNodeType(), directive);
    }

    private static boolean balanced(String expression, char open, char close) {
        int depth = 0;
        for (int i = 0; i < expression.length(); i++) {
            char c = expression.charAt(i);
            if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth < 0) {
                    return false;
                }
            }
        }
        return depth == 0;
    }
}
