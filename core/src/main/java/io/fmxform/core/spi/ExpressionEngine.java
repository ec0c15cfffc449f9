package io.fmxform.core.spi;

/**
 * Pluggable expression language used by directives that evaluate predicates, such as the {@code
 * where} clause of {@code x-derived-count-where}. Implementations are registered in an {@link
 * io.fmxform.core.expr.EngineRegistry} under their {@link #id()}.
 *
 * <p>Implementations MUST be stateless and thread-safe.
 */
public interface ExpressionEngine {

    /**
     * Returns the engine identifier, e.g. {@code "jslt"}.
     *
     * @return a non-null, non-empty identifier (lowercase, no spaces)
     */
    String id();

    /**
     * Compiles an expression into an immutable, thread-safe handle.
     *
     * @param expression the expression source
     * @param location schema path or file the expression came from, used in error messages
     * @return a compiled expression ready for evaluation
     * @throws io.fmxform.core.error.ExpressionCompileException if the expression has syntax errors
     */
    CompiledExpression compile(String expression, String location);
}
