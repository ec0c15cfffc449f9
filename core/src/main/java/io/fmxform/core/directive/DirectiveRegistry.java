package io.fmxform.core.directive;

import com.fasterxml.jackson.databind.JsonNode;
import io.fmxform.core.error.DependencyCycleException;
import io.fmxform.core.error.DuplicateHandlerException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of directive handlers keyed by {@link DirectiveKind}.
 *
 * <p>The registry knows nothing about directive semantics beyond name, priority and dependency
 * bookkeeping. It is an ordinary value: build one with {@link StandardDirectiveHandlers#newRegistry}
 * or register handlers explicitly, then pass it to the components that need it.
 *
 * <p>Thread-safe: registration and lookup can happen concurrently.
 */
public final class DirectiveRegistry {

    /** Orders handlers by ascending priority, then by kind declaration order. */
    private static final Comparator<DirectiveHandler> BY_PRIORITY =
            Comparator.comparingInt(DirectiveHandler::priority).thenComparingInt(h -> h.kind().ordinal());

    private final Map<DirectiveKind, DirectiveHandler> handlers = new ConcurrentHashMap<>();

    /**
     * Registers a handler.
     *
     * @throws DuplicateHandlerException if a handler for the same kind is already registered
     * @throws NullPointerException if handler or its kind is null
     */
    public void register(DirectiveHandler handler) {
        Objects.requireNonNull(handler, "handler must not be null");
        DirectiveKind kind = Objects.requireNonNull(handler.kind(), "handler kind must not be null");
        if (handlers.putIfAbsent(kind, handler) != null) {
            throw new DuplicateHandlerException(kind.key());
        }
    }

    public Optional<DirectiveHandler> getHandler(DirectiveKind kind) {
        return Optional.ofNullable(handlers.get(kind));
    }

    /**
     * Looks up a handler, throwing if none is registered.
     *
     * @throws IllegalArgumentException if no handler is registered for {@code kind}
     */
    public DirectiveHandler requireHandler(DirectiveKind kind) {
        return getHandler(kind)
                .orElseThrow(() -> new IllegalArgumentException("No handler registered for directive: '"
                        + kind.key() + "'"));
    }

    public boolean hasHandler(DirectiveKind kind) {
        return handlers.containsKey(kind);
    }

    public int size() {
        return handlers.size();
    }

    /**
     * Applies every registered handler's extension extractor to {@code schemaNode}, in processing
     * order, and adds the literal {@code description} field when present.
     *
     * @return directive key to raw value, insertion-ordered
     */
    public Map<String, JsonNode> extractAllExtensions(JsonNode schemaNode) {
        Map<String, JsonNode> extensions = new LinkedHashMap<>();
        for (DirectiveHandler handler : getProcessingOrder()) {
            handler.extractExtension(schemaNode).ifPresent(e -> extensions.put(e.getKey(), e.getValue()));
        }
        JsonNode description = schemaNode.get("description");
        if (description != null && !description.isNull()) {
            extensions.put("description", description.deepCopy());
        }
        return extensions;
    }

    /**
     * Returns the handlers in processing order: every handler appears after all registered
     * handlers it depends on; otherwise lower priority numbers come first. The result is stable for
     * a given set of handlers.
     *
     * @throws DependencyCycleException if dependencies form a cycle
     */
    public List<DirectiveHandler> getProcessingOrder() {
        List<DirectiveHandler> sorted = new ArrayList<>(handlers.values());
        sorted.sort(BY_PRIORITY);

        List<DirectiveHandler> ordered = new ArrayList<>(sorted.size());
        Set<DirectiveKind> visited = new HashSet<>();
        Set<DirectiveKind> visiting = new HashSet<>();
        for (DirectiveHandler handler : sorted) {
            visit(handler, visited, visiting, ordered);
        }
        return List.copyOf(ordered);
    }

    private void visit(
            DirectiveHandler handler,
            Set<DirectiveKind> visited,
            Set<DirectiveKind> visiting,
            List<DirectiveHandler> ordered) {
        DirectiveKind kind = handler.kind();
        if (visited.contains(kind)) {
            return;
        }
        if (!visiting.add(kind)) {
            throw new DependencyCycleException(handler.name());
        }
        List<DirectiveHandler> dependencies = new ArrayList<>();
        for (DirectiveKind dependency : handler.dependencies()) {
            DirectiveHandler dependencyHandler = handlers.get(dependency);
            if (dependencyHandler != null) {
                dependencies.add(dependencyHandler);
            }
        }
        dependencies.sort(BY_PRIORITY);
        for (DirectiveHandler dependency : dependencies) {
            visit(dependency, visited, visiting, ordered);
        }
        visiting.remove(kind);
        visited.add(kind);
        ordered.add(handler);
    }
}
