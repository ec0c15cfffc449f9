package io.fmxform.core.directive;

import io.fmxform.core.directive.handler.CollectPatternHandler;
import io.fmxform.core.directive.handler.DerivedAverageHandler;
import io.fmxform.core.directive.handler.DerivedCountHandler;
import io.fmxform.core.directive.handler.DerivedCountWhereHandler;
import io.fmxform.core.directive.handler.DerivedFromHandler;
import io.fmxform.core.directive.handler.FlattenArraysHandler;
import io.fmxform.core.directive.handler.FrontmatterPartHandler;
import io.fmxform.core.directive.handler.JmesPathFilterHandler;
import io.fmxform.core.directive.handler.TemplateFormatHandler;
import io.fmxform.core.directive.handler.TemplateHandler;
import io.fmxform.core.directive.handler.TemplateItemsHandler;
import io.fmxform.core.expr.EngineRegistry;
import io.fmxform.core.expr.JsltExpressionEngine;

/** Factory for the built-in handler of every {@link DirectiveKind}. */
public final class StandardDirectiveHandlers {

    private StandardDirectiveHandlers() {}

    /**
     * Creates the built-in handler for {@code kind}. The switch has no default branch: a kind
     * without a handler does not compile.
     */
    public static DirectiveHandler forKind(DirectiveKind kind, EngineRegistry engines) {
        return switch (kind) {
            case FRONTMATTER_PART -> new FrontmatterPartHandler();
            case COLLECT_PATTERN -> new CollectPatternHandler();
            case JMESPATH_FILTER -> new JmesPathFilterHandler();
            case FLATTEN_ARRAYS -> new FlattenArraysHandler();
            case DERIVED_FROM -> new DerivedFromHandler();
            case DERIVED_COUNT -> new DerivedCountHandler();
            case DERIVED_AVERAGE -> new DerivedAverageHandler();
            case DERIVED_COUNT_WHERE -> new DerivedCountWhereHandler(
                    engines.requireEngine(JsltExpressionEngine.ENGINE_ID));
            case TEMPLATE_FORMAT -> new TemplateFormatHandler();
            case TEMPLATE -> new TemplateHandler();
            case TEMPLATE_ITEMS -> new TemplateItemsHandler();
        };
    }

    /** Creates a registry holding one built-in handler per kind. */
    public static DirectiveRegistry newRegistry(EngineRegistry engines) {
        DirectiveRegistry registry = new DirectiveRegistry();
        for (DirectiveKind kind : DirectiveKind.values()) {
            registry.register(forKind(kind, engines));
        }
        return registry;
    }

    /** Creates a registry with the default expression engines. */
    public static DirectiveRegistry newRegistry() {
        return newRegistry(EngineRegistry.withDefaults());
    }
}
