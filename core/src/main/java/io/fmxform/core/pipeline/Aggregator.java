package io.fmxform.core.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fmxform.core.detect.SchemaStructureDetector;
import io.fmxform.core.directive.DirectiveProcessingResult;
import io.fmxform.core.directive.DirectiveProcessor;
import io.fmxform.core.model.FrontmatterData;
import io.fmxform.core.model.Schema;
import io.fmxform.core.model.StructureType;
import io.fmxform.core.path.PropertyPath;
import io.fmxform.core.path.PropertyPathResolver;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the aggregate of a run from the processed documents.
 *
 * <ol>
 *   <li>Place the documents' front matter: the {@code x-frontmatter-part} handler does this when
 *       the schema declares one; otherwise the documents go to the detected structure path
 *       ({@code tools.commands} for a registry).
 *   <li>Apply every directive of the schema with the {@link DirectiveProcessor}.
 *   <li>Fill root properties still absent from the aggregate with their schema {@code default}.
 * </ol>
 */
public final class Aggregator {

    private static final Logger LOG = LoggerFactory.getLogger(Aggregator.class);

    static final String REGISTRY_PATH = "tools.commands";

    private final DirectiveProcessor processor;
    private final SchemaStructureDetector detector;

    public Aggregator(DirectiveProcessor processor, SchemaStructureDetector detector) {
        this.processor = Objects.requireNonNull(processor, "processor must not be null");
        this.detector = Objects.requireNonNull(detector, "detector must not be null");
    }

    /**
     * Aggregates {@code documents} against {@code schema}.
     *
     * @return a new aggregate owned by the caller
     * @throws io.fmxform.core.error.FmxformException if a directive is malformed or fails
     */
    public ObjectNode aggregate(List<FrontmatterData> documents, Schema schema) {
        Objects.requireNonNull(documents, "documents must not be null");
        Objects.requireNonNull(schema, "schema must not be null");
        PropertyPathResolver resolver = new PropertyPathResolver();

        ObjectNode data = JsonNodeFactory.instance.objectNode();
        if (detector.findFrontmatterPartPath(schema.root()).isEmpty()) {
            String target = placementPath(detector.detectStructureType(schema));
            ArrayNode collected = data.arrayNode();
            documents.forEach(d -> collected.add(d.asObjectNode()));
            resolver.set(data, PropertyPath.parse(target), collected);
            LOG.debug("Documents placed by structure type: path={}, count={}", target, collected.size());
        }

        DirectiveProcessingResult result = processor.apply(data, schema, documents);
        ObjectNode aggregated = result.data();
        int defaults = applyDefaults(aggregated, schema.root());
        LOG.debug(
                "Aggregation finished: documents={}, directives={}, defaults={}",
                documents.size(),
                result.applied().size(),
                defaults);
        return aggregated;
    }

    private static String placementPath(StructureType type) {
        if (type instanceof StructureType.Collection collection) {
            return collection.path();
        }
        if (type instanceof StructureType.Custom custom) {
            return custom.path();
        }
        return REGISTRY_PATH;
    }

    private static int applyDefaults(ObjectNode data, JsonNode schemaRoot) {
        JsonNode properties = schemaRoot.path("properties");
        int applied = 0;
        Iterator<Map.Entry<String, JsonNode>> fields = properties.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode defaultValue = field.getValue().get("default");
            if (defaultValue != null && !data.has(field.getKey())) {
                data.set(field.getKey(), defaultValue.deepCopy());
                applied++;
            }
        }
        return applied;
    }
}
