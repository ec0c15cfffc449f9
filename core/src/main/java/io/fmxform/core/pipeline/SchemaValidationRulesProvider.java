package io.fmxform.core.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import io.fmxform.core.directive.Directive;
import io.fmxform.core.directive.DirectiveKind;
import io.fmxform.core.directive.DirectiveValue;
import io.fmxform.core.directive.SchemaTraversal;
import io.fmxform.core.directive.handler.FrontmatterPartHandler;
import io.fmxform.core.error.ValidationRulesException;
import io.fmxform.core.model.Schema;
import io.fmxform.core.spi.ValidationRulesProvider;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives document validation rules from the item schema of the {@code x-frontmatter-part} array.
 *
 * <p>Documents are validated against that item schema only, so constraints of the aggregate (its
 * own {@code required} list, derived fields) never apply to individual documents. Directive keys are
 * stripped before compilation. Without an {@code x-frontmatter-part}, or when the part declares no
 * item schema, rules are permissive.
 */
public final class SchemaValidationRulesProvider implements ValidationRulesProvider {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaValidationRulesProvider.class);

    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private final FrontmatterPartHandler frontmatterPart = new FrontmatterPartHandler();

    @Override
    public ValidationRules rulesFor(Schema schema) {
        JsonNode root = schema.root();
        String partPath = null;
        JsonNode arraySchema = null;
        for (SchemaTraversal.SchemaNode node : SchemaTraversal.nodes(root)) {
            if (!node.node().has(DirectiveKind.FRONTMATTER_PART.key())) {
                continue;
            }
            Directive directive = frontmatterPart.extractConfig(node.node(), node.path());
            if (directive.present()) {
                partPath = FrontmatterPartHandler.targetPath(directive);
                arraySchema = directive.value() instanceof DirectiveValue.Flag
                        ? node.node()
                        : schemaAt(root, partPath);
                break;
            }
        }
        if (partPath == null) {
            LOG.debug("No x-frontmatter-part declared, document rules are permissive: schema={}", schema.source());
            return ValidationRules.permissive();
        }
        if (arraySchema == null) {
            LOG.debug("x-frontmatter-part target has no schema, document rules are permissive: path={}", partPath);
            return ValidationRules.permissive();
        }
        JsonNode type = arraySchema.get("type");
        if (type != null && !"array".equals(type.asText())) {
            throw new ValidationRulesException(
                    "x-frontmatter-part target '" + partPath + "' must be an array schema, got type '"
                            + type.asText() + "'",
                    partPath);
        }
        JsonNode items = arraySchema.get("items");
        if (items == null || !items.isObject()) {
            return ValidationRules.permissive();
        }

        ObjectNode itemSchema = items.deepCopy();
        stripDirectives(itemSchema);
        JsonSchema compiled;
        try {
            compiled = SCHEMA_FACTORY.getSchema(itemSchema);
        } catch (RuntimeException e) {
            throw new ValidationRulesException(
                    "Invalid front-matter item schema at '" + partPath + "': " + e.getMessage(), e, partPath);
        }
        List<ValidationRule> rules = fieldRules(itemSchema);
        LOG.debug("Document rules derived: path={}, rules={}", partPath, rules.size());
        return ValidationRules.of(compiled, rules, partPath + "[]");
    }

    private static JsonNode schemaAt(JsonNode root, String dataPath) {
        JsonNode current = root;
        for (String segment : dataPath.split("\\.")) {
            current = current.path("properties").get(segment);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    private static List<ValidationRule> fieldRules(ObjectNode itemSchema) {
        Set<String> required = new HashSet<>();
        itemSchema.path("required").forEach(r -> required.add(r.asText()));
        List<ValidationRule> rules = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = itemSchema.path("properties").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode type = field.getValue().get("type");
            rules.add(new ValidationRule(
                    field.getKey(), type != null && type.isTextual() ? type.asText() : null,
                    required.contains(field.getKey())));
        }
        return rules;
    }

    /** Removes every {@code x-*} key, recursively. */
    static void stripDirectives(JsonNode node) {
        if (node.isObject()) {
            ObjectNode object = (ObjectNode) node;
            List<String> directiveKeys = new ArrayList<>();
            object.fieldNames().forEachRemaining(name -> {
                if (name.startsWith("x-")) {
                    directiveKeys.add(name);
                }
            });
            object.remove(directiveKeys);
        }
        for (JsonNode child : node) {
            stripDirectives(child);
        }
    }
}
