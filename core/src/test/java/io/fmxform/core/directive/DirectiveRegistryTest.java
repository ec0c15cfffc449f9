package io.fmxform.core.directive;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fmxform.core.error.DependencyCycleException;
import io.fmxform.core.error.DuplicateHandlerException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link DirectiveRegistry}: registration, lookup and processing order. */
class DirectiveRegistryTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Minimal handler with configurable ordering metadata. */
    private static final class StubHandler extends AbstractDirectiveHandler {

        StubHandler(DirectiveKind kind, int priority, List<DirectiveKind> dependencies) {
            super(kind, priority, dependencies);
        }

        @Override
        protected DirectiveValue parseValue(JsonNode raw, JsonNode schemaNode, String schemaPath) {
            return new DirectiveValue.Text(raw.asText());
        }

        @Override
        protected DirectiveOutcome process(ObjectNode data, Directive directive, DirectiveContext context) {
            return DirectiveOutcome.unchanged(data);
        }
    }

    @Test
    void standardRegistryHasOneHandlerPerKind() {
        DirectiveRegistry registry = StandardDirectiveHandlers.newRegistry();

        assertThat(registry.size()).isEqualTo(DirectiveKind.values().length);
        for (DirectiveKind kind : DirectiveKind.values()) {
            assertThat(registry.hasHandler(kind)).as(kind.key()).isTrue();
            assertThat(registry.requireHandler(kind).name()).isEqualTo(kind.key());
        }
    }

    @Test
    void standardProcessingOrderRespectsDependenciesAndPriority() {
        List<DirectiveKind> order = StandardDirectiveHandlers.newRegistry().getProcessingOrder().stream()
                .map(DirectiveHandler::kind)
                .toList();

        assertThat(order)
                .containsExactly(
                        DirectiveKind.FRONTMATTER_PART,
                        DirectiveKind.COLLECT_PATTERN,
                        DirectiveKind.JMESPATH_FILTER,
                        DirectiveKind.FLATTEN_ARRAYS,
                        DirectiveKind.DERIVED_FROM,
                        DirectiveKind.DERIVED_COUNT,
                        DirectiveKind.DERIVED_AVERAGE,
                        DirectiveKind.DERIVED_COUNT_WHERE,
                        DirectiveKind.TEMPLATE_FORMAT,
                        DirectiveKind.TEMPLATE,
                        DirectiveKind.TEMPLATE_ITEMS);
    }

    @Test
    void dependencyRunsFirstEvenWithHigherPriorityNumber() {
        DirectiveRegistry registry = new DirectiveRegistry();
        registry.register(new StubHandler(DirectiveKind.DERIVED_COUNT, 1, List.of(DirectiveKind.TEMPLATE)));
        registry.register(new StubHandler(DirectiveKind.TEMPLATE, 50, List.of()));

        assertThat(registry.getProcessingOrder())
                .extracting(DirectiveHandler::kind)
                .containsExactly(DirectiveKind.TEMPLATE, DirectiveKind.DERIVED_COUNT);
    }

    @Test
    void unregisteredDependenciesAreIgnored() {
        DirectiveRegistry registry = new DirectiveRegistry();
        registry.register(new StubHandler(DirectiveKind.DERIVED_COUNT, 1, List.of(DirectiveKind.JMESPATH_FILTER)));

        assertThat(registry.getProcessingOrder()).hasSize(1);
    }

    @Test
    void duplicateRegistrationIsRejected() {
        DirectiveRegistry registry = new DirectiveRegistry();
        registry.register(new StubHandler(DirectiveKind.TEMPLATE, 1, List.of()));

        assertThatThrownBy(() -> registry.register(new StubHandler(DirectiveKind.TEMPLATE, 2, List.of())))
                .isInstanceOf(DuplicateHandlerException.class)
                .hasMessageContaining("x-template");
    }

    @Test
    void dependencyCycleIsDetected() {
        DirectiveRegistry registry = new DirectiveRegistry();
        registry.register(new StubHandler(DirectiveKind.DERIVED_COUNT, 1, List.of(DirectiveKind.DERIVED_AVERAGE)));
        registry.register(new StubHandler(DirectiveKind.DERIVED_AVERAGE, 2, List.of(DirectiveKind.DERIVED_COUNT)));

        assertThatThrownBy(registry::getProcessingOrder).isInstanceOf(DependencyCycleException.class);
    }

    @Test
    void requireHandlerThrowsWhenMissing() {
        DirectiveRegistry registry = new DirectiveRegistry();

        assertThat(registry.getHandler(DirectiveKind.TEMPLATE)).isEmpty();
        assertThatThrownBy(() -> registry.requireHandler(DirectiveKind.TEMPLATE))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("x-template");
    }

    @Test
    void extractAllExtensionsCollectsDirectivesAndDescription() throws Exception {
        JsonNode node = MAPPER.readTree("""
                {"type": "array", "description": "All commands",
                 "x-frontmatter-part": true, "x-template": "out.json", "x-unknown": 1}
                """);

        Map<String, JsonNode> extensions = StandardDirectiveHandlers.newRegistry().extractAllExtensions(node);

        assertThat(extensions).containsOnlyKeys("x-frontmatter-part", "x-template", "description");
        assertThat(extensions.keySet()).containsExactly("x-frontmatter-part", "x-template", "description");
        assertThat(extensions.get("description").asText()).isEqualTo("All commands");
    }
}
