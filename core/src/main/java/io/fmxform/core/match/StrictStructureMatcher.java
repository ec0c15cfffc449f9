package io.fmxform.core.match;

import com.fasterxml.jackson.databind.JsonNode;
import io.fmxform.core.error.StructureMismatchException;
import io.fmxform.core.model.NodeKind;
import io.fmxform.core.model.StructureNode;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Proves that data, schema and template describe exactly the same shape before rendering.
 *
 * <p>Each analyzer reduces its input to a {@link StructureNode} tree. Arrays take the shape of
 * their first element and every further element must have an identical shape. Comparison is
 * exact: same kind at every node, identical key sets for objects, equal element shapes for arrays
 * (or both absent). Primitive values are ignored; only their kinds matter. There is no tolerance
 * for optional fields.
 *
 * <p>Stateless and thread-safe.
 */
public final class StrictStructureMatcher {

    private static final Logger LOG = LoggerFactory.getLogger(StrictStructureMatcher.class);

    static final String DATA_SCHEMA_MISMATCH = "YAML structure does not match Schema";
    static final String SCHEMA_TEMPLATE_MISMATCH = "Schema structure does not match Template";

    /**
     * Analyzes a data value (parsed YAML or JSON).
     *
     * @throws StructureMismatchException if an array holds elements of different shapes
     */
    public StructureNode analyzeYAMLStructure(JsonNode value) {
        return analyzeValue(value, "");
    }

    /**
     * Analyzes a template tree. Templates are compared by the shape they produce, so a template is
     * analyzed exactly like data.
     *
     * @throws StructureMismatchException if an array holds elements of different shapes
     */
    public StructureNode analyzeTemplateStructure(JsonNode value) {
        return analyzeValue(value, "");
    }

    /**
     * Analyzes a JSON Schema by its {@code type}, {@code properties} and {@code items} keywords.
     * {@code integer} counts as {@code number}. A schema without {@code type} is an object if it
     * declares {@code properties} and an array if it declares {@code items}.
     *
     * @throws StructureMismatchException if a schema node is not an object or has an unsupported
     *     type
     */
    public StructureNode analyzeSchemaStructure(JsonNode schema) {
        return analyzeSchema(schema, "");
    }

    /** Exact structural equality; see the class description. */
    public boolean structuresEqual(StructureNode a, StructureNode b) {
        return firstMismatch(a, b).isEmpty();
    }

    /**
     * Checks that data equals schema and schema equals template. Never throws: analysis failures
     * and mismatches are returned as a failed {@link AlignmentResult}.
     */
    public AlignmentResult validateStructuralAlignment(JsonNode data, JsonNode schema, JsonNode template) {
        StructureNode dataShape;
        StructureNode schemaShape;
        StructureNode templateShape;
        try {
            dataShape = analyzeYAMLStructure(data);
            schemaShape = analyzeSchemaStructure(schema);
            templateShape = analyzeTemplateStructure(template);
        } catch (StructureMismatchException e) {
            LOG.debug("Structure analysis failed: path={}, reason={}", e.location(), e.getMessage());
            return AlignmentResult.failed(AlignmentResult.Pair.ANALYSIS, e.location(), e.getMessage());
        }

        Optional<String> dataMismatch = firstMismatch(dataShape, schemaShape);
        if (dataMismatch.isPresent()) {
            return AlignmentResult.failed(
                    AlignmentResult.Pair.DATA_SCHEMA,
                    dataMismatch.get(),
                    DATA_SCHEMA_MISMATCH + " at '" + label(dataMismatch.get()) + "'");
        }
        Optional<String> templateMismatch = firstMismatch(schemaShape, templateShape);
        if (templateMismatch.isPresent()) {
            return AlignmentResult.failed(
                    AlignmentResult.Pair.SCHEMA_TEMPLATE,
                    templateMismatch.get(),
                    SCHEMA_TEMPLATE_MISMATCH + " at '" + label(templateMismatch.get()) + "'");
        }
        return AlignmentResult.aligned();
    }

    private StructureNode analyzeValue(JsonNode value, String path) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return StructureNode.primitive(path, NodeKind.NULL);
        }
        if (value.isObject()) {
            Map<String, StructureNode> children = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                children.put(field.getKey(), analyzeValue(field.getValue(), childPath(path, field.getKey())));
            }
            return StructureNode.object(path, children);
        }
        if (value.isArray()) {
            if (value.isEmpty()) {
                return StructureNode.array(path, null);
            }
            String elementPath = path + "[]";
            StructureNode first = analyzeValue(value.get(0), elementPath);
            for (int i = 1; i < value.size(); i++) {
                StructureNode next = analyzeValue(value.get(i), elementPath);
                if (!structuresEqual(first, next)) {
                    throw new StructureMismatchException(
                            "Array at '" + label(path) + "' has inconsistent structures: element " + i
                                    + " (" + next + ") differs from element 0 (" + first + ")",
                            path + "[" + i + "]");
                }
            }
            return StructureNode.array(path, first);
        }
        if (value.isNumber()) {
            return StructureNode.primitive(path, NodeKind.NUMBER);
        }
        if (value.isBoolean()) {
            return StructureNode.primitive(path, NodeKind.BOOLEAN);
        }
        return StructureNode.primitive(path, NodeKind.STRING);
    }

    private StructureNode analyzeSchema(JsonNode schema, String path) {
        if (schema == null || !schema.isObject()) {
            throw new StructureMismatchException("Schema must be an object at '" + label(path) + "'", path);
        }
        String type = schemaType(schema, path);
        switch (type) {
            case "object": {
                Map<String, StructureNode> children = new LinkedHashMap<>();
                JsonNode properties = schema.path("properties");
                if (properties.isObject()) {
                    Iterator<Map.Entry<String, JsonNode>> fields = properties.fields();
                    while (fields.hasNext()) {
                        Map.Entry<String, JsonNode> field = fields.next();
                        children.put(
                                field.getKey(), analyzeSchema(field.getValue(), childPath(path, field.getKey())));
                    }
                }
                return StructureNode.object(path, children);
            }
            case "array": {
                JsonNode items = schema.get("items");
                return StructureNode.array(path, items != null ? analyzeSchema(items, path + "[]") : null);
            }
            case "string":
                return StructureNode.primitive(path, NodeKind.STRING);
            case "number":
            case "integer":
                return StructureNode.primitive(path, NodeKind.NUMBER);
            case "boolean":
                return StructureNode.primitive(path, NodeKind.BOOLEAN);
            case "null":
                return StructureNode.primitive(path, NodeKind.NULL);
            default:
                throw new StructureMismatchException(
                        "Unsupported schema type '" + type + "' at '" + label(path) + "'", path);
        }
    }

    private static String schemaType(JsonNode schema, String path) {
        JsonNode type = schema.get("type");
        if (type == null) {
            if (schema.has("properties")) {
                return "object";
            }
            if (schema.has("items")) {
                return "array";
            }
            throw new StructureMismatchException(
                    "Unsupported schema type: no 'type' declared at '" + label(path) + "'", path);
        }
        if (!type.isTextual()) {
            throw new StructureMismatchException(
                    "Unsupported schema type " + type + " at '" + label(path) + "'", path);
        }
        return type.asText();
    }

    /** Path of the first node where the two trees differ, or empty if they are equal. */
    private static Optional<String> firstMismatch(StructureNode a, StructureNode b) {
        if (a == null || b == null) {
            return a == b ? Optional.empty() : Optional.of(a != null ? a.path() : b.path());
        }
        if (a.kind() != b.kind()) {
            return Optional.of(a.path());
        }
        if (a.kind() == NodeKind.OBJECT) {
            if (!a.children().keySet().equals(b.children().keySet())) {
                return Optional.of(a.path());
            }
            for (Map.Entry<String, StructureNode> child : a.children().entrySet()) {
                Optional<String> mismatch = firstMismatch(child.getValue(), b.children().get(child.getKey()));
                if (mismatch.isPresent()) {
                    return mismatch;
                }
            }
            return Optional.empty();
        }
        if (a.kind() == NodeKind.ARRAY) {
            if (a.elementType() == null && b.elementType() == null) {
                return Optional.empty();
            }
            if (a.elementType() == null || b.elementType() == null) {
                return Optional.of(a.path());
            }
            return firstMismatch(a.elementType(), b.elementType());
        }
        return Optional.empty();
    }

    private static String childPath(String parent, String key) {
        return parent.isEmpty() ? key : parent + "." + key;
    }

    private static String label(String path) {
        return path.isEmpty() ? "<root>" : path;
    }
}
