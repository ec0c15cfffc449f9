package io.fmxform.core.expr;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.schibsted.spt.data.jslt.Expression;
import com.schibsted.spt.data.jslt.JsltException;
import com.schibsted.spt.data.jslt.Parser;
import io.fmxform.core.error.ExpressionCompileException;
import io.fmxform.core.error.ExpressionEvalException;
import io.fmxform.core.spi.CompiledExpression;
import io.fmxform.core.spi.ExpressionEngine;
import java.util.Map;

/**
 * JSLT expression engine. Compiles predicates such as {@code .status == "active"} with the
 * Schibsted JSLT library; variables are exposed to the expression as {@code $name}.
 */
public final class JsltExpressionEngine implements ExpressionEngine {

    /** Engine identifier. */
    public static final String ENGINE_ID = "jslt";

    @Override
    public String id() {
        return ENGINE_ID;
    }

    @Override
    public CompiledExpression compile(String expression, String location) {
        try {
            return new JsltCompiledExpression(expression, Parser.compileString(expression), location);
        } catch (JsltException e) {
            throw new ExpressionCompileException(
                    "Failed to compile JSLT expression '" + expression + "': " + e.getMessage(), e, location);
        }
    }

    /** Thread-safe compiled JSLT expression handle. */
    private static final class JsltCompiledExpression implements CompiledExpression {

        private final String source;
        private final Expression jsltExpression;
        private final String location;

        JsltCompiledExpression(String source, Expression jsltExpression, String location) {
            this.source = source;
            this.jsltExpression = jsltExpression;
            this.location = location;
        }

        @Override
        public JsonNode evaluate(JsonNode input, Map<String, JsonNode> variables) {
            try {
                JsonNode result = jsltExpression.apply(variables, input);
                return result != null ? result : NullNode.getInstance();
            } catch (JsltException e) {
                throw new ExpressionEvalException(
                        "JSLT evaluation of '" + source + "' failed: " + e.getMessage(), e, location);
            }
        }

        @Override
        public String source() {
            return source;
        }
    }
}
