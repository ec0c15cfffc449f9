package io.fmxform.core.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fmxform.core.detect.SchemaStructureDetector;
import io.fmxform.core.directive.DirectiveProcessor;
import io.fmxform.core.directive.StandardDirectiveHandlers;
import io.fmxform.core.model.FrontmatterData;
import io.fmxform.core.model.Schema;
import io.fmxform.core.path.PropertyPathResolver;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class AggregatorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Aggregator aggregator;

    AggregatorTest() {
        aggregator = new Aggregator(
                new DirectiveProcessor(StandardDirectiveHandlers.newRegistry(), new PropertyPathResolver()),
                new SchemaStructureDetector());
    }

    private static Schema schema(String json) throws Exception {
        return Schema.of(MAPPER.readTree(json));
    }

    private static List<FrontmatterData> docs(String... titles) {
        return Arrays.stream(titles)
                .map(t -> FrontmatterData.of(MAPPER.createObjectNode().put("title", t)))
                .toList();
    }

    @Test
    void partDirectivePlacesDocumentsAndDerivesCount() throws Exception {
        ObjectNode result = aggregator.aggregate(docs("a", "b"), schema("""
                {"properties": {
                  "entries": {"type": "array", "x-frontmatter-part": true},
                  "total": {"type": "integer", "x-derived-count": "entries"}
                }}
                """));

        assertThat(result.get("entries").size()).isEqualTo(2);
        assertThat(result.get("total").asInt()).isEqualTo(2);
    }

    @Test
    void collectionWithoutPartUsesFirstArrayProperty() throws Exception {
        ObjectNode result = aggregator.aggregate(docs("a"), schema("""
                {"properties": {
                  "version": {"type": "string", "default": "1.0"},
                  "entries": {"type": "array"}
                }}
                """));

        assertThat(result.at("/entries/0/title").asText()).isEqualTo("a");
        assertThat(result.get("version").asText()).isEqualTo("1.0");
    }

    @Test
    void registryWithoutPartPlacesDocumentsUnderToolsCommands() throws Exception {
        ObjectNode result = aggregator.aggregate(docs("a", "b"), schema("""
                {"properties": {"tools": {"type": "object"}, "commands": {"type": "array"}}}
                """));

        assertThat(result.at("/tools/commands").size()).isEqualTo(2);
        assertThat(result.at("/tools/commands/1/title").asText()).isEqualTo("b");
    }

    @Test
    void defaultsNeverOverwriteAggregatedValues() throws Exception {
        ObjectNode result = aggregator.aggregate(docs("a", "b", "c"), schema("""
                {"properties": {
                  "entries": {"type": "array", "x-frontmatter-part": true},
                  "total": {"type": "integer", "default": 0, "x-derived-count": "entries"}
                }}
                """));

        assertThat(result.get("total").asInt()).isEqualTo(3);
    }

    @Test
    void aggregateDoesNotShareNodesWithDocuments() throws Exception {
        List<FrontmatterData> documents = docs("a");

        ObjectNode result = aggregator.aggregate(documents, schema("""
                {"properties": {"entries": {"type": "array", "x-frontmatter-part": true}}}
                """));
        ((ObjectNode) result.at("/entries/0")).put("title", "changed");

        assertThat(documents.get(0).get("title").asText()).isEqualTo("a");
    }
}
