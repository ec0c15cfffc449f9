package io.fmxform.core.match;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fmxform.core.error.StructureMismatchException;
import io.fmxform.core.model.NodeKind;
import io.fmxform.core.model.StructureNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link StrictStructureMatcher}. */
class StrictStructureMatcherTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final StrictStructureMatcher matcher = new StrictStructureMatcher();

    private static JsonNode json(String text) throws Exception {
        return MAPPER.readTree(text);
    }

    @Nested
    @DisplayName("Value analysis")
    class ValueAnalysis {

        @Test
        @DisplayName("Heterogeneous array → mismatch at the offending index")
        void heterogeneousArrayIsRejected() throws Exception {
            JsonNode data = json("{\"a\":[{\"x\":1},{\"x\":\"s\"}]}");

            assertThatThrownBy(() -> matcher.analyzeYAMLStructure(data))
                    .isInstanceOf(StructureMismatchException.class)
                    .hasMessageContaining("Array at 'a' has inconsistent structures: element 1")
                    .isInstanceOfSatisfying(StructureMismatchException.class, e -> assertThat(e.location())
                            .isEqualTo("a[1]"));
        }

        @Test
        void homogeneousArrayRecordsElementShape() throws Exception {
            StructureNode node = matcher.analyzeYAMLStructure(json("{\"a\":[{\"x\":1},{\"x\":2.5}]}"));

            StructureNode array = node.children().get("a");
            assertThat(array.kind()).isEqualTo(NodeKind.ARRAY);
            assertThat(array.elementType().children()).containsOnlyKeys("x");
            assertThat(array.elementType().path()).isEqualTo("a[]");
            assertThat(array.elementType().children().get("x").path()).isEqualTo("a[].x");
        }

        @Test
        void analysisIsReflexive() throws Exception {
            JsonNode data = json("{\"a\":{\"b\":[1,2]},\"c\":null,\"d\":true}");

            assertThat(matcher.structuresEqual(matcher.analyzeYAMLStructure(data), matcher.analyzeYAMLStructure(data)))
                    .isTrue();
        }

        @Test
        void valuesDoNotAffectShape() throws Exception {
            StructureNode first = matcher.analyzeYAMLStructure(json("{\"n\":1,\"s\":\"a\",\"l\":[true]}"));
            StructureNode second = matcher.analyzeYAMLStructure(json("{\"n\":99,\"s\":\"zzz\",\"l\":[false,true]}"));

            assertThat(matcher.structuresEqual(first, second)).isTrue();
        }

        @Test
        void keySetsMustMatchExactly() throws Exception {
            StructureNode first = matcher.analyzeYAMLStructure(json("{\"a\":1}"));
            StructureNode second = matcher.analyzeYAMLStructure(json("{\"a\":1,\"b\":2}"));

            assertThat(matcher.structuresEqual(first, second)).isFalse();
        }

        @Test
        void keyOrderDoesNotMatter() throws Exception {
            StructureNode first = matcher.analyzeYAMLStructure(json("{\"a\":1,\"b\":\"x\"}"));
            StructureNode second = matcher.analyzeYAMLStructure(json("{\"b\":\"y\",\"a\":2}"));

            assertThat(matcher.structuresEqual(first, second)).isTrue();
        }

        @Test
        void emptyArrayDiffersFromPopulatedArray() throws Exception {
            StructureNode empty = matcher.analyzeYAMLStructure(json("[]"));
            StructureNode populated = matcher.analyzeYAMLStructure(json("[1]"));

            assertThat(matcher.structuresEqual(empty, populated)).isFalse();
            assertThat(matcher.structuresEqual(empty, matcher.analyzeYAMLStructure(json("[]")))).isTrue();
        }
    }

    @Nested
    @DisplayName("Schema analysis")
    class SchemaAnalysis {

        @Test
        void integerCountsAsNumber() throws Exception {
            StructureNode schema = matcher.analyzeSchemaStructure(json(
                    "{\"type\":\"object\",\"properties\":{\"n\":{\"type\":\"integer\"}}}"));

            assertThat(schema.children().get("n").kind()).isEqualTo(NodeKind.NUMBER);
            assertThat(matcher.structuresEqual(schema, matcher.analyzeYAMLStructure(json("{\"n\":1.5}")))).isTrue();
        }

        @Test
        void missingTypeIsInferredFromKeywords() throws Exception {
            StructureNode schema = matcher.analyzeSchemaStructure(json(
                    "{\"properties\":{\"l\":{\"items\":{\"type\":\"string\"}}}}"));

            assertThat(schema.kind()).isEqualTo(NodeKind.OBJECT);
            assertThat(schema.children().get("l").kind()).isEqualTo(NodeKind.ARRAY);
        }

        @Test
        void unsupportedTypeIsRejected() {
            assertThatThrownBy(() -> matcher.analyzeSchemaStructure(json("{\"type\":[\"string\",\"null\"]}")))
                    .isInstanceOf(StructureMismatchException.class)
                    .hasMessageContaining("Unsupported schema type");
            assertThatThrownBy(() -> matcher.analyzeSchemaStructure(json("{\"description\":\"x\"}")))
                    .isInstanceOf(StructureMismatchException.class);
        }

        @Test
        void nonObjectSchemaIsRejected() {
            assertThatThrownBy(() -> matcher.analyzeSchemaStructure(json("{\"type\":\"object\",\"properties\":{\"a\":1}}")))
                    .isInstanceOf(StructureMismatchException.class)
                    .hasMessageContaining("Schema must be an object at 'a'");
        }
    }

    @Nested
    @DisplayName("validateStructuralAlignment")
    class Alignment {

        private static final String SCHEMA = """
                {"type": "object", "properties": {
                  "title": {"type": "string"},
                  "items": {"type": "array", "items": {"type": "object", "properties": {"x": {"type": "number"}}}}
                }}
                """;

        @Test
        void alignedTriple() throws Exception {
            AlignmentResult result = matcher.validateStructuralAlignment(
                    json("{\"title\":\"t\",\"items\":[{\"x\":1}]}"),
                    json(SCHEMA),
                    json("{\"title\":\"{{title}}\",\"items\":[{\"x\":0}]}"));

            assertThat(result.isAligned()).isTrue();
        }

        @Test
        void heterogeneousDataFailsAnalysis() throws Exception {
            AlignmentResult result = matcher.validateStructuralAlignment(
                    json("{\"a\":[{\"x\":1},{\"x\":\"s\"}]}"), json(SCHEMA), json("{}"));

            assertThat(result.isAligned()).isFalse();
            assertThat(result.pair()).isEqualTo(AlignmentResult.Pair.ANALYSIS);
            assertThat(result.path()).isEqualTo("a[1]");
        }

        @Test
        void dataSchemaMismatchIsReportedFirst() throws Exception {
            AlignmentResult result = matcher.validateStructuralAlignment(
                    json("{\"title\":1,\"items\":[{\"x\":1}]}"), json(SCHEMA), json("{\"other\":1}"));

            assertThat(result.pair()).isEqualTo(AlignmentResult.Pair.DATA_SCHEMA);
            assertThat(result.path()).isEqualTo("title");
            assertThat(result.message()).isEqualTo("YAML structure does not match Schema at 'title'");
        }

        @Test
        void schemaTemplateMismatch() throws Exception {
            AlignmentResult result = matcher.validateStructuralAlignment(
                    json("{\"title\":\"t\",\"items\":[{\"x\":1}]}"),
                    json(SCHEMA),
                    json("{\"title\":\"t\",\"items\":[]}"));

            assertThat(result.pair()).isEqualTo(AlignmentResult.Pair.SCHEMA_TEMPLATE);
            assertThat(result.message()).startsWith("Schema structure does not match Template");
        }
    }
}
