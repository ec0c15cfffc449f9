package io.fmxform.core.directive;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fmxform.core.error.DirectiveProcessingException;
import io.fmxform.core.error.FmxformException;
import io.fmxform.core.model.FrontmatterData;
import io.fmxform.core.model.Schema;
import io.fmxform.core.path.PropertyPathResolver;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Discovers the directives of a schema and applies them to aggregated data.
 *
 * <p>Discovery walks the schema with {@link SchemaTraversal} and asks every registered handler to
 * extract its directive from each node. Application runs handlers in {@link
 * DirectiveRegistry#getProcessingOrder()} and, per handler, its directives in traversal order.
 * Root-scoped directives receive the whole aggregate; item-scoped directives (declared under an
 * {@code items} schema) receive each object element of the enclosing array in turn.
 *
 * <p>Handler failures are propagated, never swallowed.
 */
public final class DirectiveProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(DirectiveProcessor.class);

    private final DirectiveRegistry registry;
    private final PropertyPathResolver resolver;

    public DirectiveProcessor(DirectiveRegistry registry, PropertyPathResolver resolver) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
    }

    public DirectiveRegistry registry() {
        return registry;
    }

    /**
     * Extracts every present directive of {@code schema}, grouped by handler in processing order.
     *
     * @throws io.fmxform.core.error.DirectiveConfigException if a present directive is malformed
     * @throws io.fmxform.core.error.DependencyCycleException if handler dependencies are cyclic
     */
    public Map<DirectiveKind, List<Directive>> discover(Schema schema) {
        List<DirectiveHandler> order = registry.getProcessingOrder();
        Map<DirectiveKind, List<Directive>> found = new LinkedHashMap<>();
        for (DirectiveHandler handler : order) {
            found.put(handler.kind(), new ArrayList<>());
        }
        for (SchemaTraversal.SchemaNode node : SchemaTraversal.nodes(schema.root())) {
            for (DirectiveHandler handler : order) {
                Directive directive = handler.extractConfig(node.node(), node.path());
                if (directive.present()) {
                    found.get(handler.kind()).add(directive);
                }
            }
        }
        found.values().removeIf(List::isEmpty);
        return found;
    }

    /**
     * Applies every directive of {@code schema} to a copy of {@code data}.
     *
     * @param data the initial aggregate; not modified
     * @param schema the annotated schema
     * @param documents front matter of the processed documents, in input order
     * @return transformed data and application records
     * @throws FmxformException if discovery or any handler fails
     */
    public DirectiveProcessingResult apply(ObjectNode data, Schema schema, List<FrontmatterData> documents) {
        ObjectNode current = data.deepCopy();
        List<AppliedDirective> applied = new ArrayList<>();
        for (Map.Entry<DirectiveKind, List<Directive>> entry : discover(schema).entrySet()) {
            DirectiveHandler handler = registry.requireHandler(entry.getKey());
            for (Directive directive : entry.getValue()) {
                DirectiveContext context = new DirectiveContext(schema, documents, current, resolver);
                if (directive.scopePath().isEmpty()) {
                    DirectiveOutcome outcome = invoke(handler, current, directive, context);
                    current = outcome.data();
                    applied.add(new AppliedDirective(directive, 1, outcome.metadata()));
                } else {
                    applied.add(applyToItems(handler, current, directive, context));
                }
                LOG.debug("Directive applied: directive={}, path={}", directive.kind().key(), directive.location());
            }
        }
        return new DirectiveProcessingResult(current, applied);
    }

    private AppliedDirective applyToItems(
            DirectiveHandler handler, ObjectNode root, Directive directive, DirectiveContext context) {
        String scope = directive.scopePath();
        String containerPath = scope.substring(0, scope.length() - 2);
        int scopes = 0;
        Map<String, Object> metadata = Map.of();
        for (JsonNode container : containers(root, containerPath)) {
            if (!container.isArray()) {
                continue;
            }
            ArrayNode array = (ArrayNode) container;
            for (int i = 0; i < array.size(); i++) {
                if (!array.get(i).isObject()) {
                    continue;
                }
                DirectiveOutcome outcome = invoke(handler, (ObjectNode) array.get(i), directive, context);
                array.set(i, outcome.data());
                metadata = outcome.metadata();
                scopes++;
            }
        }
        return new AppliedDirective(directive, scopes, metadata);
    }

    private List<JsonNode> containers(ObjectNode root, String containerPath) {
        if (containerPath.isEmpty()) {
            return List.of(root);
        }
        return resolver.resolveReferences(root, containerPath);
    }

    private static DirectiveOutcome invoke(
            DirectiveHandler handler, ObjectNode data, Directive directive, DirectiveContext context) {
        try {
            return handler.processData(data, directive, context);
        } catch (FmxformException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DirectiveProcessingException(
                    "Directive " + directive.kind().key() + " failed at '" + directive.location() + "': "
                            + e.getMessage(),
                    e,
                    directive.kind().key(),
                    directive.schemaPath());
        }
    }
}
