package io.fmxform.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;

/**
 * An immutable, thread-safe compiled expression produced by {@link
 * ExpressionEngine#compile(String, String)}. A single instance may be evaluated by several
 * document workers at once.
 */
public interface CompiledExpression {

    /**
     * Evaluates this expression against {@code input}.
     *
     * @param input the context node, e.g. one collection item
     * @param variables named variables visible to the expression (e.g. {@code root})
     * @return the result node, never {@code null} ({@code NullNode} for no result)
     * @throws io.fmxform.core.error.ExpressionEvalException if evaluation fails
     */
    JsonNode evaluate(JsonNode input, Map<String, JsonNode> variables);

    /** The expression source this handle was compiled from. */
    String source();
}
