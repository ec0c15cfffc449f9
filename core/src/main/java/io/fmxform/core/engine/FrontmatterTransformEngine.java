package io.fmxform.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.fmxform.core.detect.SchemaStructureDetector;
import io.fmxform.core.directive.DirectiveProcessor;
import io.fmxform.core.directive.StandardDirectiveHandlers;
import io.fmxform.core.error.StructureMismatchException;
import io.fmxform.core.error.TemplateConfigurationException;
import io.fmxform.core.expr.EngineRegistry;
import io.fmxform.core.match.AlignmentResult;
import io.fmxform.core.match.StrictStructureMatcher;
import io.fmxform.core.model.MarkdownDocument;
import io.fmxform.core.model.OutputFormat;
import io.fmxform.core.model.ProcessingHints;
import io.fmxform.core.model.ResolvedTemplateConfiguration;
import io.fmxform.core.model.Schema;
import io.fmxform.core.model.StructureType;
import io.fmxform.core.model.TransformationResult;
import io.fmxform.core.path.PathCache;
import io.fmxform.core.path.PropertyPathResolver;
import io.fmxform.core.pipeline.Aggregator;
import io.fmxform.core.pipeline.DocumentTransformationCoordinator;
import io.fmxform.core.pipeline.LocalFileReader;
import io.fmxform.core.pipeline.SchemaValidationRulesProvider;
import io.fmxform.core.pipeline.TransformationRequest;
import io.fmxform.core.pipeline.YamlFrontmatterExtractor;
import io.fmxform.core.spi.FileReader;
import io.fmxform.core.spi.TransformationListener;
import io.fmxform.core.template.TemplateRenderer;
import io.fmxform.core.template.TemplateResolutionService;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Top-level facade: schema file and document files in, rendered artifact out.
 *
 * <p>A run loads the schema, detects its structure, resolves its templates, runs the coordinator
 * with aggregation, optionally proves strict alignment of aggregate, schema and template, and
 * renders. The directive registry, expression engines and path cache are built once per engine and
 * shared by all runs; the engine is thread-safe.
 */
public final class FrontmatterTransformEngine {

    private static final Logger LOG = LoggerFactory.getLogger(FrontmatterTransformEngine.class);

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private final EngineOptions options;
    private final FileReader fileReader;
    private final SchemaLoader schemaLoader;
    private final SchemaStructureDetector detector;
    private final StrictStructureMatcher matcher = new StrictStructureMatcher();
    private final PathCache pathCache;
    private final PropertyPathResolver resolver;
    private final TemplateRenderer renderer;
    private final DocumentTransformationCoordinator coordinator;

    /** Creates an engine with default options over the local file system. */
    public FrontmatterTransformEngine() {
        this(EngineOptions.DEFAULT);
    }

    public FrontmatterTransformEngine(EngineOptions options) {
        this(options, new LocalFileReader(), TransformationListener.NONE);
    }

    /**
     * @param options engine tunables
     * @param fileReader reader for schemas, templates and documents
     * @param listener run observer
     */
    public FrontmatterTransformEngine(EngineOptions options, FileReader fileReader, TransformationListener listener) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.fileReader = Objects.requireNonNull(fileReader, "fileReader must not be null");
        this.schemaLoader = new SchemaLoader(fileReader);
        this.detector = new SchemaStructureDetector(options.fieldPatterns());
        this.pathCache = new PathCache(options.pathCache());

        EngineRegistry engines = EngineRegistry.withDefaults();
        this.resolver = new PropertyPathResolver(pathCache);
        DirectiveProcessor processor =
                new DirectiveProcessor(StandardDirectiveHandlers.newRegistry(engines), resolver);
        this.renderer = new TemplateRenderer(resolver);
        this.coordinator = new DocumentTransformationCoordinator(
                fileReader,
                new YamlFrontmatterExtractor(),
                new SchemaValidationRulesProvider(),
                new Aggregator(processor, detector),
                options.validationMode(),
                listener);
    }

    /**
     * Transforms {@code documents} according to the schema at {@code schemaPath}.
     *
     * @throws io.fmxform.core.error.FmxformException if the schema or templates are invalid, the
     *     run fails, or strict alignment is enabled and does not hold
     */
    public RenderedOutput transform(Path schemaPath, List<Path> documents) {
        Schema schema = schemaLoader.load(schemaPath);

        StructureType structure = detector.detectStructureType(schema);
        ProcessingHints hints = detector.getProcessingHints(structure);
        LOG.info("Schema loaded: source={}, structure={}, expectedArrayFields={}",
                schema.source(), structure.label(), hints.expectedArrayFields());

        TemplateResolutionService templates = new TemplateResolutionService(fileReader);
        templates.extractTemplateConfiguration(schema);
        ResolvedTemplateConfiguration resolved = templates.resolveTemplateFiles(schemaPath);

        TransformationRequest request = TransformationRequest.of(documents, schema).withAggregation();
        if (options.strategy() != null) {
            request = request.withStrategy(options.strategy());
        }
        TransformationResult result = coordinator.transform(request);
        if (result.isFailed()) {
            throw result.error();
        }

        ObjectNode data = result.hasAggregatedData() ? result.aggregatedData() : fallbackData(result, hints);
        if (options.strictAlignment()) {
            requireAlignment(data, schema, resolved);
        }
        String content = renderer.render(resolved, data);
        LOG.debug("Rendered output: format={}, chars={}, pathCache={}",
                resolved.outputFormat().id(), content.length(), pathCache.metrics());
        return new RenderedOutput(content, resolved.outputFormat(), result);
    }

    /** Shared path cache, exposed for metrics and cleanup. */
    public PathCache pathCache() {
        return pathCache;
    }

    /** Raw documents under the first expected array field, used when aggregation degraded. */
    private static ObjectNode fallbackData(TransformationResult result, ProcessingHints hints) {
        String field = hints.expectedArrayFields().isEmpty() ? "items" : hints.expectedArrayFields().get(0);
        ObjectNode data = JSON_MAPPER.createObjectNode();
        ArrayNode items = data.putArray(field);
        for (MarkdownDocument document : result.documents()) {
            items.add(document.frontmatter().asObjectNode());
        }
        LOG.warn("Rendering without aggregated data: documents placed under '{}'", field);
        return data;
    }

    private void requireAlignment(ObjectNode data, Schema schema, ResolvedTemplateConfiguration resolved) {
        OutputFormat format = resolved.outputFormat();
        if (format != OutputFormat.JSON && format != OutputFormat.YAML) {
            LOG.debug("Strict alignment skipped for text template: format={}", format.id());
            return;
        }
        String templateText = resolved.hasItemsTemplate()
                ? resolved.itemsTemplateContent()
                : resolved.mainTemplateContent();
        JsonNode template;
        try {
            template = (format == OutputFormat.JSON ? JSON_MAPPER : YAML_MAPPER).readTree(templateText);
        } catch (JsonProcessingException e) {
            throw new TemplateConfigurationException(
                    "Template is not valid " + format.id() + ": " + e.getOriginalMessage(), e, format.id());
        }
        if (resolved.hasItemsTemplate()) {
            requireItemAlignment(data, schema, resolved.itemsCollection(), template);
            return;
        }
        requireAligned(matcher.validateStructuralAlignment(data, schema.root(), template), "");
    }

    /** An items template renders each item on its own, so each item is aligned with the item schema. */
    private void requireItemAlignment(ObjectNode data, Schema schema, String collection, JsonNode template) {
        JsonNode itemSchema = itemSchemaOf(schema.root(), collection);
        if (itemSchema == null) {
            throw new StructureMismatchException(
                    "x-template-items collection '" + collection + "' has no item schema", collection);
        }
        List<JsonNode> items = resolver.resolveAsList(data, collection);
        if (items.isEmpty()) {
            if (!matcher.structuresEqual(
                    matcher.analyzeSchemaStructure(itemSchema), matcher.analyzeTemplateStructure(template))) {
                throw new StructureMismatchException(
                        "Schema structure does not match Template (SCHEMA_TEMPLATE)", collection + "[]");
            }
            return;
        }
        for (int i = 0; i < items.size(); i++) {
            requireAligned(matcher.validateStructuralAlignment(items.get(i), itemSchema, template),
                    collection + "[" + i + "]");
        }
    }

    private static void requireAligned(AlignmentResult alignment, String prefix) {
        if (alignment.isAligned()) {
            return;
        }
        String path = alignment.path();
        String location = prefix.isEmpty()
                ? path
                : (path == null || path.isEmpty() || "<root>".equals(path) ? prefix : prefix + "." + path);
        throw new StructureMismatchException(alignment.message() + " (" + alignment.pair() + ")", location);
    }

    /** Schema of one element of the array at {@code dataPath}, or {@code null} if undeclared. */
    private static JsonNode itemSchemaOf(JsonNode root, String dataPath) {
        JsonNode current = root;
        for (String segment : dataPath.split("\\.")) {
            current = current.path("properties").get(segment);
            if (current == null) {
                return null;
            }
        }
        JsonNode items = current.get("items");
        return items != null && items.isObject() ? items : null;
    }
}
