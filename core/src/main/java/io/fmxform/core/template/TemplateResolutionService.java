package io.fmxform.core.template;

import com.fasterxml.jackson.databind.JsonNode;
import io.fmxform.core.directive.DirectiveKind;
import io.fmxform.core.error.FileReadException;
import io.fmxform.core.error.TemplateConfigurationException;
import io.fmxform.core.error.TemplateNotResolvedException;
import io.fmxform.core.model.OutputFormat;
import io.fmxform.core.model.ResolvedTemplateConfiguration;
import io.fmxform.core.model.Schema;
import io.fmxform.core.model.TemplateConfiguration;
import io.fmxform.core.spi.FileReader;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the template directives of a schema into template content and an output format.
 *
 * <p>Usage is two-phase: {@link #extractTemplateConfiguration} reads the directives, then {@link
 * #resolveTemplateFiles} loads the main template. The getters fail with {@link
 * TemplateNotResolvedException} until resolution has succeeded.
 *
 * <p>A main template is inline when it contains <code>{{</code> or <code>{%</code>, has a newline,
 * or starts with {@code #}; otherwise it is a file path, resolved against the schema's directory
 * unless absolute. {@code x-template-items} names a data collection; its template is the main
 * template applied per item. The output format is the {@code x-template-format} value, else
 * inferred from the template file extension, else {@code json}.
 *
 * <p>Instances are stateful and synchronized.
 */
public final class TemplateResolutionService {

    private static final Logger LOG = LoggerFactory.getLogger(TemplateResolutionService.class);

    private final FileReader fileReader;

    private TemplateConfiguration configuration;
    private Path schemaLocation;
    private ResolvedTemplateConfiguration resolved;

    public TemplateResolutionService(FileReader fileReader) {
        this.fileReader = Objects.requireNonNull(fileReader, "fileReader must not be null");
    }

    /**
     * Reads {@code x-template}, {@code x-template-items} and {@code x-template-format}, each the
     * first occurrence in a depth-first search of the whole schema tree. Discards any earlier
     * resolution.
     *
     * @throws TemplateConfigurationException if {@code x-template} is missing or not a non-empty
     *     string
     */
    public synchronized TemplateConfiguration extractTemplateConfiguration(Schema schema) {
        Objects.requireNonNull(schema, "schema must not be null");
        String main = findText(schema.root(), DirectiveKind.TEMPLATE.key())
                .orElseThrow(() -> new TemplateConfigurationException(
                        "x-template missing: the schema declares no main template", schema.source()));
        String items = findText(schema.root(), DirectiveKind.TEMPLATE_ITEMS.key()).orElse(null);
        String format = findText(schema.root(), DirectiveKind.TEMPLATE_FORMAT.key()).orElse(null);

        this.configuration = new TemplateConfiguration(main, items, format);
        this.schemaLocation = schema.location();
        this.resolved = null;
        LOG.debug("Template configuration extracted: inline={}, items={}, format={}",
                isInline(main), items, format);
        return configuration;
    }

    /**
     * Loads the main template and determines the output format.
     *
     * @param schemaPath schema file that relative template paths are resolved against; {@code null}
     *     to use the location of the schema passed to {@link #extractTemplateConfiguration}
     * @throws TemplateConfigurationException if no configuration was extracted, the template file
     *     cannot be read or the declared format is unknown
     */
    public synchronized ResolvedTemplateConfiguration resolveTemplateFiles(Path schemaPath) {
        if (configuration == null) {
            throw new TemplateConfigurationException(
                    "No template configuration: call extractTemplateConfiguration first", null);
        }
        String main = configuration.mainTemplate();
        boolean inline = isInline(main);
        String content = inline ? main : readTemplate(main, schemaPath != null ? schemaPath : schemaLocation);
        OutputFormat format = resolveFormat(configuration.outputFormat(), inline ? null : main);
        String itemsCollection = configuration.itemsTemplate();

        this.resolved = new ResolvedTemplateConfiguration(
                content, itemsCollection != null ? content : null, itemsCollection, format);
        LOG.debug("Templates resolved: source={}, format={}, items={}",
                inline ? "<inline>" : main, format.id(), itemsCollection);
        return resolved;
    }

    public synchronized boolean hasResolvedConfiguration() {
        return resolved != null;
    }

    /** The resolved configuration. */
    public synchronized ResolvedTemplateConfiguration getResolvedConfiguration() {
        return requireResolved("getResolvedConfiguration");
    }

    public synchronized String getMainTemplate() {
        return requireResolved("getMainTemplate").mainTemplateContent();
    }

    /** Per-item template content; empty when the schema declares no {@code x-template-items}. */
    public synchronized Optional<String> getItemsTemplate() {
        return Optional.ofNullable(requireResolved("getItemsTemplate").itemsTemplateContent());
    }

    public synchronized OutputFormat getOutputFormat() {
        return requireResolved("getOutputFormat").outputFormat();
    }

    /** Whether {@code template} is inline content rather than a file path. */
    public static boolean isInline(String template) {
        return template.contains("{{")
                || template.contains("{%")
                || template.indexOf('\n') >= 0
                || template.startsWith("#");
    }

    /**
     * Resolves the output format: the declared format if any, else the template file extension,
     * else JSON.
     *
     * @param declared {@code x-template-format} value or {@code null}
     * @param templateFile template file path or {@code null} for inline templates
     */
    public static OutputFormat resolveFormat(String declared, String templateFile) {
        if (declared != null) {
            return OutputFormat.fromId(declared)
                    .orElseThrow(() -> new TemplateConfigurationException(
                            "Unknown x-template-format '" + declared + "': expected json, yaml, xml or markdown",
                            DirectiveKind.TEMPLATE_FORMAT.key()));
        }
        if (templateFile != null) {
            Optional<OutputFormat> inferred = OutputFormat.fromExtension(templateFile);
            if (inferred.isPresent()) {
                return inferred.get();
            }
        }
        return OutputFormat.JSON;
    }

    private String readTemplate(String template, Path schemaPath) {
        Path path = Path.of(template);
        if (!path.isAbsolute() && schemaPath != null) {
            Path directory = schemaPath.toAbsolutePath().getParent();
            if (directory != null) {
                path = directory.resolve(path);
            }
        }
        try {
            return fileReader.read(path);
        } catch (FileReadException e) {
            throw new TemplateConfigurationException(
                    "Template file could not be read (" + e.reason() + "): " + path, e, path.toString());
        }
    }

    private ResolvedTemplateConfiguration requireResolved(String operation) {
        if (resolved == null) {
            throw new TemplateNotResolvedException(
                    operation + " called before templates were resolved; call resolveTemplateFiles first");
        }
        return resolved;
    }

    /** First non-blank string value of {@code key}, depth-first over every object and array. */
    private static Optional<String> findText(JsonNode root, String key) {
        Deque<JsonNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            JsonNode node = stack.pop();
            if (node.isObject()) {
                JsonNode value = node.get(key);
                if (value != null) {
                    if (value.isTextual() && !value.asText().isBlank()) {
                        return Optional.of(value.asText());
                    }
                    throw new TemplateConfigurationException(
                            key + " must be a non-empty string, got " + value.getNodeType(), key);
                }
            }
            if (node.isContainerNode()) {
                List<JsonNode> children = new ArrayList<>();
                Iterator<JsonNode> it = node.elements();
                it.forEachRemaining(children::add);
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(children.get(i));
                }
            }
        }
        return Optional.empty();
    }
}
