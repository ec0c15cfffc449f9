package io.fmxform.core.directive;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fmxform.core.error.DirectiveConfigException;
import io.fmxform.core.error.DirectiveProcessingException;
import io.fmxform.core.model.FrontmatterData;
import io.fmxform.core.model.Schema;
import io.fmxform.core.path.PropertyPathResolver;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests for {@link DirectiveProcessor}: discovery, ordering and item scoping. */
class DirectiveProcessorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String SCHEMA = """
            {
              "type": "object",
              "properties": {
                "items": {
                  "type": "array",
                  "x-frontmatter-part": true,
                  "items": {
                    "type": "object",
                    "x-flatten-arrays": "tags",
                    "properties": {"tags": {"type": "array"}}
                  }
                },
                "categories": {"type": "array", "x-derived-from": "items[].category", "x-derived-unique": true},
                "total": {"type": "integer", "x-derived-count": "items"},
                "avgScore": {"type": "number", "x-derived-average": "items[].score"},
                "activeCount": {
                  "type": "integer",
                  "x-derived-count-where": {"from": "items", "where": ".status == \\"active\\""}
                }
              }
            }
            """;

    private DirectiveProcessor processor;
    private List<FrontmatterData> documents;

    @BeforeEach
    void setUp() throws Exception {
        processor = new DirectiveProcessor(StandardDirectiveHandlers.newRegistry(), new PropertyPathResolver());
        documents = List.of(
                doc("{\"category\":\"x\",\"score\":2,\"status\":\"active\",\"tags\":[[\"a\",\"b\"],\"c\"]}"),
                doc("{\"category\":\"y\",\"score\":\"4\",\"status\":\"draft\",\"tags\":[\"d\"]}"),
                doc("{\"category\":\"x\",\"score\":3,\"status\":\"active\",\"tags\":[]}"));
    }

    private static FrontmatterData doc(String json) throws Exception {
        return FrontmatterData.of((ObjectNode) MAPPER.readTree(json));
    }

    private static Schema schema(String json) throws Exception {
        return Schema.of(MAPPER.readTree(json));
    }

    @Test
    void appliesAllDirectivesInOrder() throws Exception {
        ObjectNode input = MAPPER.createObjectNode();

        DirectiveProcessingResult result = processor.apply(input, schema(SCHEMA), documents);

        JsonNode data = result.data();
        assertThat(data.get("items").size()).isEqualTo(3);
        assertThat(data.at("/items/0/tags").toString()).isEqualTo("[\"a\",\"b\",\"c\"]");
        assertThat(data.get("categories").toString()).isEqualTo("[\"x\",\"y\"]");
        assertThat(data.get("total").asInt()).isEqualTo(3);
        assertThat(data.get("avgScore").asDouble()).isEqualTo(3.0);
        assertThat(data.get("activeCount").asInt()).isEqualTo(2);
        assertThat(input.isEmpty()).as("input is not modified").isTrue();
    }

    @Test
    void recordsEveryAppliedDirective() throws Exception {
        DirectiveProcessingResult result = processor.apply(MAPPER.createObjectNode(), schema(SCHEMA), documents);

        assertThat(result.applied())
                .extracting(a -> a.directive().kind())
                .containsExactly(
                        DirectiveKind.FRONTMATTER_PART,
                        DirectiveKind.FLATTEN_ARRAYS,
                        DirectiveKind.DERIVED_FROM,
                        DirectiveKind.DERIVED_COUNT,
                        DirectiveKind.DERIVED_AVERAGE,
                        DirectiveKind.DERIVED_COUNT_WHERE);
        AppliedDirective flatten = result.applied().get(1);
        assertThat(flatten.scopes()).as("one scope per collected item").isEqualTo(3);
    }

    @Test
    void discoverGroupsPresentDirectivesByKind() throws Exception {
        Map<DirectiveKind, List<Directive>> found = processor.discover(schema(SCHEMA));

        assertThat(found).containsOnlyKeys(
                DirectiveKind.FRONTMATTER_PART,
                DirectiveKind.FLATTEN_ARRAYS,
                DirectiveKind.DERIVED_FROM,
                DirectiveKind.DERIVED_COUNT,
                DirectiveKind.DERIVED_AVERAGE,
                DirectiveKind.DERIVED_COUNT_WHERE);
        Directive flatten = found.get(DirectiveKind.FLATTEN_ARRAYS).get(0);
        assertThat(flatten.schemaPath()).isEqualTo("items[]");
        assertThat(flatten.scopePath()).isEqualTo("items[]");
        assertThat(flatten.dataPath()).isEmpty();
    }

    @Test
    void schemaWithoutDirectivesLeavesDataUnchanged() throws Exception {
        ObjectNode input = (ObjectNode) MAPPER.readTree("{\"a\":1}");

        DirectiveProcessingResult result =
                processor.apply(input, schema("{\"type\":\"object\",\"properties\":{\"a\":{\"type\":\"integer\"}}}"),
                        documents);

        assertThat(result.data()).isEqualTo(input);
        assertThat(result.applied()).isEmpty();
    }

    @Test
    void malformedDirectiveFailsDiscovery() throws Exception {
        Schema bad = schema("{\"properties\":{\"total\":{\"x-derived-count\":42}}}");

        assertThatThrownBy(() -> processor.discover(bad))
                .isInstanceOf(DirectiveConfigException.class)
                .hasMessageContaining("x-derived-count")
                .hasMessageContaining("total");
    }

    @Test
    void handlerFailurePropagates() throws Exception {
        Schema schema = schema("""
                {"properties": {
                  "items": {"type": "array", "x-frontmatter-part": true},
                  "avg": {"x-derived-average": "items[].missing"}
                }}
                """);

        assertThatThrownBy(() -> processor.apply(MAPPER.createObjectNode(), schema, documents))
                .isInstanceOf(DirectiveProcessingException.class)
                .hasMessageContaining("no numeric values");
    }
}
