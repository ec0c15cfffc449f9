package io.fmxform.core.path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fmxform.core.error.PropertyPathException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link PropertyPath} parsing and {@link PropertyPathResolver} resolution. */
class PropertyPathTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static JsonNode json(String text) throws Exception {
        return MAPPER.readTree(text);
    }

    @Nested
    @DisplayName("Parsing")
    class Parsing {

        @Test
        void dottedPathWithExpansion() {
            PropertyPath path = PropertyPath.parse("items[].category");

            assertThat(path.segments())
                    .containsExactly(new PropertyPath.Segment("items", true), new PropertyPath.Segment("category", false));
            assertThat(path.hasExpansion()).isTrue();
            assertThat(path.endsWithExpansion()).isFalse();
            assertThat(path.lastName()).isEqualTo("category");
            assertThat(path).hasToString("items[].category");
        }

        @Test
        void dollarPrefixIsIgnored() {
            assertThat(PropertyPath.parse("$.a.b")).isEqualTo(PropertyPath.parse("a.b"));
            assertThat(PropertyPath.parse("$").isRoot()).isTrue();
            assertThat(PropertyPath.parse("").isRoot()).isTrue();
        }

        @Test
        void complexityCountsExpansionsTriple() {
            assertThat(PropertyPath.parse("a.b").complexity()).isEqualTo(2);
            assertThat(PropertyPath.parse("a[].b").complexity()).isEqualTo(4);
        }

        @Test
        void malformedPathsAreRejected() {
            assertThat(PropertyPath.isValid("a..b")).isFalse();
            assertThat(PropertyPath.isValid(".a")).isFalse();
            assertThat(PropertyPath.isValid("a.")).isFalse();
            assertThat(PropertyPath.isValid("a b")).isFalse();
            assertThat(PropertyPath.isValid("1abc")).isFalse();
            assertThat(PropertyPath.isValid("a[0]")).isFalse();
            assertThatThrownBy(() -> PropertyPath.parse("a..b"))
                    .isInstanceOf(PropertyPathException.class)
                    .hasMessageContaining("a..b");
        }

        @Test
        void hyphensAndUnderscoresAreAllowed() {
            assertThat(PropertyPath.isValid("_meta.sub-title")).isTrue();
        }
    }

    @Nested
    @DisplayName("Resolution")
    class Resolution {

        private final PropertyPathResolver resolver = new PropertyPathResolver();

        @Test
        void expansionFansOutOverElements() throws Exception {
            JsonNode data = json("{\"items\":[{\"c\":\"x\"},{\"c\":\"y\"},{\"d\":1}]}");

            List<JsonNode> values = resolver.resolve(data, "items[].c");

            assertThat(values).extracting(JsonNode::asText).containsExactly("x", "y");
        }

        @Test
        void missingSegmentsYieldNothing() throws Exception {
            JsonNode data = json("{\"a\":{\"b\":1}}");

            assertThat(resolver.resolve(data, "a.c")).isEmpty();
            assertThat(resolver.resolve(data, "a.b[]")).isEmpty();
            assertThat(resolver.resolve(data, "x.y.z")).isEmpty();
        }

        @Test
        void presentNullIsReturned() throws Exception {
            JsonNode data = json("{\"a\":null}");

            assertThat(resolver.resolve(data, "a")).singleElement().satisfies(n -> assertThat(n.isNull()).isTrue());
        }

        @Test
        void resolveAsListUnwrapsSingleArray() throws Exception {
            JsonNode data = json("{\"items\":[1,2,3]}");

            assertThat(resolver.resolveAsList(data, "items")).hasSize(3);
            assertThat(resolver.resolveAsList(data, "items[]")).hasSize(3);
        }

        @Test
        void setCreatesIntermediateObjects() {
            ObjectNode root = MAPPER.createObjectNode();

            resolver.set(root, PropertyPath.parse("tools.commands"), MAPPER.createArrayNode().add(1));

            assertThat(root.at("/tools/commands/0").asInt()).isEqualTo(1);
            assertThat(resolver.get(root, PropertyPath.parse("tools.commands")).isArray()).isTrue();
            assertThat(resolver.get(root, PropertyPath.parse("tools.missing"))).isNull();
        }

        @Test
        void setRejectsRootAndExpansion() {
            ObjectNode root = MAPPER.createObjectNode();

            assertThatThrownBy(() -> resolver.set(root, PropertyPath.root(), root))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> resolver.set(root, PropertyPath.parse("a[].b"), root))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void cachedResolverReturnsIndependentCopies() throws Exception {
            PropertyPathResolver cached = new PropertyPathResolver(PathCache.forTesting());
            JsonNode data = json("{\"a\":{\"b\":1}}");

            cached.resolve(data, "a");
            List<JsonNode> fromCache = cached.resolve(data, "a");
            ((ObjectNode) fromCache.get(0)).put("b", 99);
            List<JsonNode> again = cached.resolve(data, "a");

            assertThat(data.get("a").get("b").asInt()).isEqualTo(1);
            assertThat(again.get(0).get("b").asInt()).isEqualTo(1);
            assertThat(cached.cache().orElseThrow().metrics().hits()).isGreaterThan(0);
        }

        @Test
        void cachedResolverDistinguishesInputsWithEqualHashes() throws Exception {
            PropertyPathResolver cached = new PropertyPathResolver(PathCache.forTesting());

            List<JsonNode> first = cached.resolve(json("{\"k\":\"Aa\"}"), "k");
            List<JsonNode> second = cached.resolve(json("{\"k\":\"BB\"}"), "k");

            assertThat(first).singleElement().satisfies(n -> assertThat(n.asText()).isEqualTo("Aa"));
            assertThat(second).singleElement().satisfies(n -> assertThat(n.asText()).isEqualTo("BB"));
        }
    }
}
