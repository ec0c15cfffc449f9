package io.fmxform.core.directive.handler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fmxform.core.directive.Directive;
import io.fmxform.core.directive.DirectiveContext;
import io.fmxform.core.directive.DirectiveHandler;
import io.fmxform.core.directive.DirectiveKind;
import io.fmxform.core.directive.DirectiveOutcome;
import io.fmxform.core.directive.DirectiveValue;
import io.fmxform.core.error.DirectiveConfigException;
import io.fmxform.core.error.DirectiveProcessingException;
import io.fmxform.core.expr.JsltExpressionEngine;
import io.fmxform.core.model.FrontmatterData;
import io.fmxform.core.model.Schema;
import io.fmxform.core.path.PropertyPathResolver;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for the built-in directive handlers, one nested class per directive. */
class DirectiveHandlersTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static JsonNode json(String text) {
        try {
            return MAPPER.readTree(text);
        } catch (Exception e) {
            throw new IllegalArgumentException(e);
        }
    }

    private static ObjectNode object(String text) {
        return (ObjectNode) json(text);
    }

    private static DirectiveContext context(ObjectNode root, String... documents) {
        List<FrontmatterData> docs = new ArrayList<>();
        for (String document : documents) {
            docs.add(FrontmatterData.of(object(document)));
        }
        return new DirectiveContext(
                Schema.of(MAPPER.createObjectNode()), docs, root, new PropertyPathResolver());
    }

    /** Extracts the directive from {@code schemaNode} and applies it to {@code data}. */
    private static DirectiveOutcome run(
            DirectiveHandler handler, String schemaNode, String schemaPath, ObjectNode data, String... documents) {
        Directive directive = handler.extractConfig(json(schemaNode), schemaPath);
        assertThat(directive.present()).isTrue();
        return handler.processData(data, directive, context(data, documents));
    }

    @Nested
    @DisplayName("x-frontmatter-part")
    class FrontmatterPart {

        private final FrontmatterPartHandler handler = new FrontmatterPartHandler();

        @Test
        void flagCollectsDocumentsIntoAnnotatedProperty() {
            ObjectNode data = MAPPER.createObjectNode();

            DirectiveOutcome outcome = run(handler, "{\"x-frontmatter-part\": true}", "commands", data,
                    "{\"c1\":\"a\"}", "{\"c1\":\"b\"}");

            assertThat(outcome.data().get("commands").size()).isEqualTo(2);
            assertThat(outcome.metadata()).containsEntry("documentsCollected", 2).containsEntry("targetPath", "commands");
        }

        @Test
        void pathValuePlacesDocumentsAtPath() {
            ObjectNode data = MAPPER.createObjectNode();

            DirectiveOutcome outcome = run(handler, "{\"x-frontmatter-part\": \"tools.commands\"}", "", data,
                    "{\"name\":\"a\"}");

            assertThat(outcome.data().at("/tools/commands/0/name").asText()).isEqualTo("a");
        }

        @Test
        void falseDisablesDirective() {
            assertThat(handler.extractConfig(json("{\"x-frontmatter-part\": false}"), "items").present())
                    .isFalse();
        }

        @Test
        void absentKeyIsNotPresent() {
            assertThat(handler.extractConfig(json("{\"type\": \"array\"}"), "items").present()).isFalse();
        }

        @Test
        void flagOnRootIsRejected() {
            assertThatThrownBy(() -> handler.extractConfig(json("{\"x-frontmatter-part\": true}"), ""))
                    .isInstanceOf(DirectiveConfigException.class)
                    .hasMessageContaining("<root>");
        }

        @Test
        void declarationInsideItemSchemaIsRejected() {
            assertThatThrownBy(() -> handler.extractConfig(json("{\"x-frontmatter-part\": true}"), "items[].sub"))
                    .isInstanceOf(DirectiveConfigException.class);
        }

        @Test
        void expandingPathIsRejected() {
            assertThatThrownBy(() -> handler.extractConfig(json("{\"x-frontmatter-part\": \"a[].b\"}"), ""))
                    .isInstanceOf(DirectiveConfigException.class);
        }

        @Test
        void processingRequiresMatchingKind() {
            Directive other = Directive.of(DirectiveKind.TEMPLATE, "", new DirectiveValue.Text("t"));

            assertThatThrownBy(() -> handler.processData(MAPPER.createObjectNode(), other, context(
                            MAPPER.createObjectNode())))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("x-collect-pattern")
    class CollectPattern {

        private final CollectPatternHandler handler = new CollectPatternHandler();

        @Test
        void collectsMatchingFieldsInOrder() {
            ObjectNode data = MAPPER.createObjectNode();

            DirectiveOutcome outcome = run(handler, "{\"x-collect-pattern\": \"^c\\\\d+$\"}", "all", data,
                    "{\"c1\":\"a\",\"name\":\"n\",\"c2\":\"b\"}", "{\"c3\":\"c\"}");

            assertThat(outcome.data().get("all").toString()).isEqualTo("[\"a\",\"b\",\"c\"]");
            assertThat(outcome.metadata()).containsEntry("valuesCollected", 3);
        }

        @Test
        void invalidRegexIsRejected() {
            assertThatThrownBy(() -> handler.extractConfig(json("{\"x-collect-pattern\": \"[unclosed\"}"), "all"))
                    .isInstanceOf(DirectiveConfigException.class)
                    .hasMessageContaining("regular expression");
        }

        @Test
        void mustAnnotateAProperty() {
            assertThatThrownBy(() -> handler.extractConfig(json("{\"x-collect-pattern\": \"a\"}"), ""))
                    .isInstanceOf(DirectiveConfigException.class)
                    .hasMessageContaining("must annotate a property");
        }

        @Test
        void emptyValueIsRejected() {
            assertThatThrownBy(() -> handler.extractConfig(json("{\"x-collect-pattern\": \"  \"}"), "all"))
                    .isInstanceOf(DirectiveConfigException.class)
                    .hasMessageContaining("must not be empty");
        }
    }

    @Nested
    @DisplayName("x-jmespath-filter")
    class JmesPathFilter {

        private final JmesPathFilterHandler handler = new JmesPathFilterHandler();

        @Test
        void rootArrayResultIsWrappedAsItems() {
            ObjectNode data = object("{\"items\":[{\"s\":\"on\"},{\"s\":\"off\"},{\"s\":\"on\"}]}");

            DirectiveOutcome outcome = run(handler, "{\"x-jmespath-filter\": \"items[?s=='on']\"}", "", data);

            assertThat(outcome.data().get("items").size()).isEqualTo(2);
            assertThat(outcome.metadata()).containsEntry("filterApplied", true).containsEntry("resultSize", 2);
        }

        @Test
        void propertyResultReplacesProperty() {
            ObjectNode data = object("{\"list\":[{\"n\":1},{\"n\":5}]}");

            DirectiveOutcome outcome = run(handler, "{\"x-jmespath-filter\": \"[?n > `2`]\"}", "list", data);

            assertThat(outcome.data().get("list").toString()).isEqualTo("[{\"n\":5}]");
        }

        @Test
        void nullResultLeavesDataUnchanged() {
            ObjectNode data = object("{\"a\":1}");

            DirectiveOutcome outcome = run(handler, "{\"x-jmespath-filter\": \"missing\"}", "", data);

            assertThat(outcome.data()).isEqualTo(object("{\"a\":1}"));
            assertThat(outcome.metadata()).containsEntry("filterApplied", false);
        }

        @Test
        void scalarRootResultIsAProcessingError() {
            ObjectNode data = object("{\"items\":[1,2]}");

            assertThatThrownBy(() -> run(handler, "{\"x-jmespath-filter\": \"length(items)\"}", "", data))
                    .isInstanceOf(DirectiveProcessingException.class)
                    .hasMessageContaining("object or an array");
        }

        @Test
        void forbiddenLeadingCharacterIsRejected() {
            assertThatThrownBy(() -> handler.extractConfig(json("{\"x-jmespath-filter\": \"| a\"}"), ""))
                    .isInstanceOf(DirectiveConfigException.class)
                    .hasMessageContaining("must not start with '|'");
        }

        @Test
        void unbalancedBracketsAreRejected() {
            assertThatThrownBy(() -> handler.extractConfig(json("{\"x-jmespath-filter\": \"items[?a\"}"), ""))
                    .isInstanceOf(DirectiveConfigException.class)
                    .hasMessageContaining("unbalanced");
        }
    }

    @Nested
    @DisplayName("x-flatten-arrays")
    class FlattenArrays {

        private final FlattenArraysHandler handler = new FlattenArraysHandler();

        @Test
        void flattensNestedArray() {
            ObjectNode data = object("{\"tags\":[[\"a\",[\"b\"]],\"c\"]}");

            DirectiveOutcome outcome = run(handler, "{\"x-flatten-arrays\": \"tags\"}", "items[]", data);

            assertThat(outcome.data().get("tags").toString()).isEqualTo("[\"a\",\"b\",\"c\"]");
            assertThat(outcome.metadata())
                    .containsEntry("flatteningApplied", true)
                    .containsEntry("originalDepth", 3)
                    .containsEntry("finalDepth", 1)
                    .containsEntry("itemsProcessed", 3);
        }

        @Test
        void nonArrayIsLeftAlone() {
            ObjectNode data = object("{\"tags\":\"single\"}");

            DirectiveOutcome outcome = run(handler, "{\"x-flatten-arrays\": \"tags\"}", "items[]", data);

            assertThat(outcome.data().get("tags").asText()).isEqualTo("single");
            assertThat(outcome.metadata()).containsEntry("flatteningApplied", false);
        }

        @Test
        void whitespaceInPathIsRejected() {
            assertThatThrownBy(() -> handler.extractConfig(json("{\"x-flatten-arrays\": \"a b\"}"), ""))
                    .isInstanceOf(DirectiveConfigException.class)
                    .hasMessageContaining("whitespace");
        }

        @Test
        void expandingPathIsRejected() {
            assertThatThrownBy(() -> handler.extractConfig(json("{\"x-flatten-arrays\": \"a[]\"}"), ""))
                    .isInstanceOf(DirectiveConfigException.class);
        }
    }

    @Nested
    @DisplayName("x-derived-from")
    class DerivedFrom {

        private final DerivedFromHandler handler = new DerivedFromHandler();

        @Test
        void collectsSortedValuesDroppingNulls() {
            ObjectNode data = object("{\"items\":[{\"c\":\"b\"},{\"c\":null},{\"c\":\"a\"},{\"c\":\"b\"}]}");

            DirectiveOutcome outcome = run(handler, "{\"x-derived-from\": \"items[].c\"}", "cats", data);

            assertThat(outcome.data().get("cats").toString()).isEqualTo("[\"a\",\"b\",\"b\"]");
        }

        @Test
        void uniqueAndFlattenModifiers() {
            ObjectNode data = object("{\"items\":[{\"t\":[\"x\",\"y\"]},{\"t\":[\"y\",[\"z\"]]}]}");

            DirectiveOutcome outcome = run(handler,
                    "{\"x-derived-from\": \"items[].t\", \"x-derived-unique\": true, \"x-derived-flatten\": true}",
                    "tags", data);

            assertThat(outcome.data().get("tags").toString()).isEqualTo("[\"x\",\"y\",\"z\"]");
            assertThat(outcome.metadata()).containsEntry("unique", true).containsEntry("valuesCollected", 3);
        }

        @Test
        void nonBooleanModifierIsRejected() {
            assertThatThrownBy(() -> handler.extractConfig(
                            json("{\"x-derived-from\": \"a\", \"x-derived-unique\": \"yes\"}"), "b"))
                    .isInstanceOf(DirectiveConfigException.class)
                    .hasMessageContaining("x-derived-unique");
        }

        @Test
        void invalidPathIsRejected() {
            assertThatThrownBy(() -> handler.extractConfig(json("{\"x-derived-from\": \"a..b\"}"), "b"))
                    .isInstanceOf(DirectiveConfigException.class);
        }
    }

    @Nested
    @DisplayName("x-derived-count / x-derived-average")
    class Aggregates {

        @Test
        void countCountsArrayElements() {
            ObjectNode data = object("{\"items\":[1,null,3]}");

            DirectiveOutcome outcome =
                    run(new DerivedCountHandler(), "{\"x-derived-count\": \"items\"}", "stats.total", data);

            assertThat(outcome.data().at("/stats/total").asInt()).isEqualTo(2);
        }

        @Test
        void averageAcceptsNumericStrings() {
            ObjectNode data = object("{\"items\":[{\"s\":1},{\"s\":\"2\"},{\"s\":\"n/a\"},{\"s\":6}]}");

            DirectiveOutcome outcome =
                    run(new DerivedAverageHandler(), "{\"x-derived-average\": \"items[].s\"}", "avg", data);

            assertThat(outcome.data().get("avg").asDouble()).isEqualTo(3.0);
            assertThat(outcome.metadata()).containsEntry("valuesAveraged", 3);
        }

        @Test
        void averageWithoutNumbersFails() {
            ObjectNode data = object("{\"items\":[]}");

            assertThatThrownBy(() ->
                            run(new DerivedAverageHandler(), "{\"x-derived-average\": \"items[].s\"}", "avg", data))
                    .isInstanceOf(DirectiveProcessingException.class);
        }
    }

    @Nested
    @DisplayName("x-derived-count-where")
    class DerivedCountWhere {

        private final DerivedCountWhereHandler handler = new DerivedCountWhereHandler(new JsltExpressionEngine());

        @Test
        void countsItemsMatchingPredicate() {
            ObjectNode data = object("{\"items\":[{\"status\":\"active\"},{\"status\":\"draft\"},{\"status\":\"active\"}]}");

            DirectiveOutcome outcome = run(handler,
                    "{\"x-derived-count-where\": {\"from\": \"items\", \"where\": \".status == \\\"active\\\"\"}}",
                    "active", data);

            assertThat(outcome.data().get("active").asInt()).isEqualTo(2);
            assertThat(outcome.metadata()).containsEntry("itemsEvaluated", 3);
        }

        @Test
        void nonObjectValueIsRejected() {
            assertThatThrownBy(() -> handler.extractConfig(json("{\"x-derived-count-where\": \"items\"}"), "n"))
                    .isInstanceOf(DirectiveConfigException.class)
                    .hasMessageContaining("'from' and 'where'");
        }

        @Test
        void missingWhereIsRejected() {
            assertThatThrownBy(() -> handler.extractConfig(
                            json("{\"x-derived-count-where\": {\"from\": \"items\"}}"), "n"))
                    .isInstanceOf(DirectiveConfigException.class)
                    .hasMessageContaining(".where");
        }

        @Test
        void uncompilablePredicateIsRejected() {
            assertThatThrownBy(() -> handler.extractConfig(
                            json("{\"x-derived-count-where\": {\"from\": \"items\", \"where\": \".a ==\"}}"), "n"))
                    .isInstanceOf(DirectiveConfigException.class)
                    .hasMessageContaining("does not compile");
        }
    }

    @Nested
    @DisplayName("x-template / x-template-items / x-template-format")
    class Templates {

        @Test
        void templatePassesDataThrough() {
            ObjectNode data = object("{\"a\":1}");

            DirectiveOutcome outcome = run(new TemplateHandler(), "{\"x-template\": \"out.json\"}", "", data);

            assertThat(outcome.data()).isEqualTo(object("{\"a\":1}"));
            assertThat(outcome.metadata()).containsEntry("template", "out.json");
        }

        @Test
        void templateMustBeText() {
            assertThatThrownBy(() -> new TemplateHandler().extractConfig(json("{\"x-template\": 3}"), ""))
                    .isInstanceOf(DirectiveConfigException.class)
                    .hasMessageContaining("must be a string");
        }

        @Test
        void formatIsNormalized() {
            Directive directive = new TemplateFormatHandler().extractConfig(json("{\"x-template-format\": \"YML\"}"), "");

            assertThat(directive.text()).isEqualTo("yaml");
        }

        @Test
        void unknownFormatIsRejected() {
            assertThatThrownBy(() ->
                            new TemplateFormatHandler().extractConfig(json("{\"x-template-format\": \"pdf\"}"), ""))
                    .isInstanceOf(DirectiveConfigException.class)
                    .hasMessageContaining("pdf");
        }

        @Test
        void itemsMustBeAPath() {
            assertThat(new TemplateItemsHandler().extractConfig(json("{\"x-template-items\": \"commands\"}"), "")
                            .text())
                    .isEqualTo("commands");
            assertThatThrownBy(() ->
                            new TemplateItemsHandler().extractConfig(json("{\"x-template-items\": \"a b\"}"), ""))
                    .isInstanceOf(DirectiveConfigException.class);
        }
    }
}
