package io.fmxform.core.expr;

import io.fmxform.core.spi.ExpressionEngine;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of expression engines keyed by engine id. Thread-safe: registration and lookup can
 * happen concurrently.
 */
public final class EngineRegistry {

    private final Map<String, ExpressionEngine> engines = new ConcurrentHashMap<>();

    /** Creates a registry with the JSLT engine registered. */
    public static EngineRegistry withDefaults() {
        EngineRegistry registry = new EngineRegistry();
        registry.register(new JsltExpressionEngine());
        return registry;
    }

    /**
     * Registers an expression engine, replacing any engine with the same id.
     *
     * @throws NullPointerException if engine or engine.id() is null
     * @throws IllegalArgumentException if engine.id() is empty
     */
    public void register(ExpressionEngine engine) {
        if (engine == null) {
            throw new NullPointerException("engine must not be null");
        }
        String id = engine.id();
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("engine id must not be null or empty");
        }
        engines.put(id, engine);
    }

    public Optional<ExpressionEngine> getEngine(String engineId) {
        return Optional.ofNullable(engines.get(engineId));
    }

    /**
     * Looks up an engine by id, throwing if not found.
     *
     * @throws IllegalArgumentException if no engine is registered with the given id
     */
    public ExpressionEngine requireEngine(String engineId) {
        return getEngine(engineId)
                .orElseThrow(() ->
                        new IllegalArgumentException("No expression engine registered for id: '" + engineId + "'"));
    }

    public int size() {
        return engines.size();
    }

    public boolean hasEngine(String engineId) {
        return engines.containsKey(engineId);
    }
}
