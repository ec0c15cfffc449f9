package io.fmxform.core.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fmxform.core.error.ValidationRulesException;
import io.fmxform.core.model.FrontmatterData;
import io.fmxform.core.model.Schema;
import org.junit.jupiter.api.Test;

/** Tests for {@link SchemaValidationRulesProvider}. */
class SchemaValidationRulesProviderTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final SchemaValidationRulesProvider provider = new SchemaValidationRulesProvider();

    private static Schema schema(String json) throws Exception {
        return Schema.of(MAPPER.readTree(json));
    }

    private static FrontmatterData doc(String json) throws Exception {
        return FrontmatterData.of((ObjectNode) MAPPER.readTree(json));
    }

    @Test
    void itemSchemaBecomesDocumentRules() throws Exception {
        ValidationRules rules = provider.rulesFor(schema("""
                {"properties": {"docs": {
                  "type": "array", "x-frontmatter-part": true,
                  "items": {"type": "object", "required": ["title"],
                            "x-flatten-arrays": "tags",
                            "properties": {"title": {"type": "string"}, "tags": {"type": "array"}}}
                }}}
                """));

        assertThat(rules.isPermissive()).isFalse();
        assertThat(rules.source()).isEqualTo("docs[]");
        assertThat(rules.rules())
                .containsExactly(new ValidationRule("title", "string", true), new ValidationRule("tags", "array", false));
        assertThat(rules.validate(doc("{\"title\":\"ok\",\"tags\":[]}"))).isEmpty();
        assertThat(rules.validate(doc("{\"tags\":[]}"))).singleElement().asString().contains("title");
        assertThat(rules.validate(doc("{\"title\":5}"))).isNotEmpty();
    }

    @Test
    void pathValueResolvesThroughProperties() throws Exception {
        ValidationRules rules = provider.rulesFor(schema("""
                {"x-frontmatter-part": "tools.commands",
                 "properties": {"tools": {"properties": {"commands": {
                   "type": "array", "items": {"properties": {"c": {"type": "string"}}, "required": ["c"]}}}}}}
                """));

        assertThat(rules.source()).isEqualTo("tools.commands[]");
        assertThat(rules.validate(doc("{}"))).isNotEmpty();
    }

    @Test
    void noFrontmatterPartIsPermissive() throws Exception {
        ValidationRules rules = provider.rulesFor(schema("{\"properties\":{\"c1\":{\"type\":\"string\"}}}"));

        assertThat(rules.isPermissive()).isTrue();
        assertThat(rules.validate(doc("{\"anything\":1}"))).isEmpty();
    }

    @Test
    void unresolvedTargetIsPermissive() throws Exception {
        assertThat(provider.rulesFor(schema("{\"x-frontmatter-part\": \"items\"}")).isPermissive()).isTrue();
    }

    @Test
    void arrayWithoutItemSchemaIsPermissive() throws Exception {
        ValidationRules rules =
                provider.rulesFor(schema("{\"properties\":{\"d\":{\"type\":\"array\",\"x-frontmatter-part\":true}}}"));

        assertThat(rules.isPermissive()).isTrue();
    }

    @Test
    void nonArrayTargetIsRejected() {
        assertThatThrownBy(() -> provider.rulesFor(schema(
                        "{\"properties\":{\"d\":{\"type\":\"object\",\"x-frontmatter-part\":true}}}")))
                .isInstanceOf(ValidationRulesException.class)
                .hasMessageContaining("must be an array schema");
    }

    @Test
    void stripDirectivesRemovesExtensionKeysRecursively() throws Exception {
        ObjectNode node = (ObjectNode) MAPPER.readTree(
                "{\"x-a\":1,\"type\":\"object\",\"properties\":{\"p\":{\"x-b\":2,\"type\":\"string\"}}}");

        SchemaValidationRulesProvider.stripDirectives(node);

        assertThat(node.toString()).isEqualTo("{\"type\":\"object\",\"properties\":{\"p\":{\"type\":\"string\"}}}");
    }
}
