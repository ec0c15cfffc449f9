package io.fmxform.core.detect;

import com.fasterxml.jackson.databind.JsonNode;
import io.fmxform.core.directive.Directive;
import io.fmxform.core.directive.DirectiveKind;
import io.fmxform.core.directive.SchemaTraversal;
import io.fmxform.core.directive.handler.FrontmatterPartHandler;
import io.fmxform.core.error.DirectiveConfigException;
import io.fmxform.core.model.ProcessingHints;
import io.fmxform.core.model.Schema;
import io.fmxform.core.model.StructureType;
import io.fmxform.core.model.TemplateFormat;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Infers the dataset shape described by a schema.
 *
 * <p>Detection order, first match wins:
 *
 * <ol>
 *   <li>the first {@code x-frontmatter-part} found by traversal, classified by its path;
 *   <li>registry detection: at least {@link FieldPatterns#minimumMatchCount()} root property keys
 *       match the configured patterns;
 *   <li>inference from root properties: the first array property is a registry if its key matches
 *       a pattern, else a collection at that key; failing that, the first pattern-matching
 *       property is a custom structure;
 *   <li>{@code Collection("items")}.
 * </ol>
 *
 * <p>Detection is total: it never throws for an object or non-object schema.
 */
public final class SchemaStructureDetector {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaStructureDetector.class);

    static final String DEFAULT_COLLECTION_PATH = "items";
    static final String REGISTRY_DERIVATION_RULE = "availableConfigs";

    private final FieldPatterns patterns;
    private final FrontmatterPartHandler frontmatterPart = new FrontmatterPartHandler();

    public SchemaStructureDetector() {
        this(FieldPatterns.defaults());
    }

    public SchemaStructureDetector(FieldPatterns patterns) {
        this.patterns = Objects.requireNonNull(patterns, "patterns must not be null");
    }

    public FieldPatterns patterns() {
        return patterns;
    }

    /** Detects the structure type of {@code schema}. */
    public StructureType detectStructureType(Schema schema) {
        Objects.requireNonNull(schema, "schema must not be null");
        JsonNode root = schema.root();

        Optional<String> partPath = findFrontmatterPartPath(root);
        if (partPath.isPresent()) {
            StructureType type = fromPath(partPath.get());
            LOG.debug("Structure detected from x-frontmatter-part: path={}, type={}", partPath.get(), type.label());
            return type;
        }

        List<String> keys = rootPropertyKeys(root);
        if (!keys.isEmpty() && patterns.countMatches(keys) >= patterns.minimumMatchCount()) {
            LOG.debug("Structure detected by pattern match: type=registry, keys={}", keys);
            return new StructureType.Registry();
        }

        Optional<StructureType> inferred = inferFromProperties(root);
        if (inferred.isPresent()) {
            LOG.debug("Structure inferred from properties: type={}", inferred.get());
            return inferred.get();
        }

        return new StructureType.Collection(DEFAULT_COLLECTION_PATH);
    }

    /**
     * Derives processing hints for {@code type}. Pure: no I/O and no failure mode.
     */
    public ProcessingHints getProcessingHints(StructureType type) {
        Objects.requireNonNull(type, "type must not be null");
        if (type instanceof StructureType.Registry) {
            return new ProcessingHints(
                    true, patterns.namedPatterns(), List.of(REGISTRY_DERIVATION_RULE), TemplateFormat.JSON);
        }
        if (type instanceof StructureType.Collection collection) {
            return new ProcessingHints(false, List.of(collection.path()), List.of(), TemplateFormat.AUTO);
        }
        StructureType.Custom custom = (StructureType.Custom) type;
        return new ProcessingHints(true, List.of(lastSegment(custom.path())), List.of(), TemplateFormat.AUTO);
    }

    /**
     * Classifies an {@code x-frontmatter-part} data path: one segment is a collection, a nested path
     * through a named pattern (e.g. {@code tools.commands}) is a registry, anything else custom.
     */
    public StructureType fromPath(String path) {
        String[] segments = path.split("\\.");
        if (segments.length == 1) {
            return new StructureType.Collection(path);
        }
        for (String segment : segments) {
            if (patterns.isNamedPattern(segment)) {
                return new StructureType.Registry();
            }
        }
        return new StructureType.Custom(path);
    }

    /**
     * Data path of the first enabled {@code x-frontmatter-part} in traversal order. Empty when there
     * is none or the schema is nested too deeply to walk.
     */
    public Optional<String> findFrontmatterPartPath(JsonNode root) {
        List<SchemaTraversal.SchemaNode> nodes;
        try {
            nodes = SchemaTraversal.nodes(root);
        } catch (IllegalArgumentException e) {
            LOG.debug("Skipping x-frontmatter-part detection: {}", e.getMessage());
            return Optional.empty();
        }
        for (SchemaTraversal.SchemaNode node : nodes) {
            if (!node.node().has(DirectiveKind.FRONTMATTER_PART.key())) {
                continue;
            }
            try {
                Directive directive = frontmatterPart.extractConfig(node.node(), node.path());
                if (directive.present()) {
                    return Optional.of(FrontmatterPartHandler.targetPath(directive));
                }
            } catch (DirectiveConfigException e) {
                LOG.debug("Ignoring malformed x-frontmatter-part during detection: {}", e.getMessage());
            }
        }
        return Optional.empty();
    }

    private Optional<StructureType> inferFromProperties(JsonNode root) {
        JsonNode properties = root.path("properties");
        if (!properties.isObject()) {
            return Optional.empty();
        }
        Iterator<Map.Entry<String, JsonNode>> fields = properties.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if ("array".equals(field.getValue().path("type").asText())) {
                if (patterns.matchesPattern(field.getKey())) {
                    return Optional.of(new StructureType.Registry());
                }
                return Optional.of(new StructureType.Collection(field.getKey()));
            }
        }
        Iterator<String> names = properties.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (patterns.matchesPattern(name)) {
                return Optional.of(new StructureType.Custom(name));
            }
        }
        return Optional.empty();
    }

    private static List<String> rootPropertyKeys(JsonNode root) {
        List<String> keys = new ArrayList<>();
        JsonNode properties = root.path("properties");
        if (properties.isObject()) {
            properties.fieldNames().forEachRemaining(keys::add);
        }
        return keys;
    }

    private static String lastSegment(String path) {
        int idx = path.lastIndexOf('.');
        String last = idx < 0 ? path : path.substring(idx + 1);
        return last.isEmpty() ? DEFAULT_COLLECTION_PATH : last;
    }
}
