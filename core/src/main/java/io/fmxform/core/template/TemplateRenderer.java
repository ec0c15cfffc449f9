package io.fmxform.core.template;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.fmxform.core.error.TemplateConfigurationException;
import io.fmxform.core.model.OutputFormat;
import io.fmxform.core.model.ResolvedTemplateConfiguration;
import io.fmxform.core.path.PropertyPath;
import io.fmxform.core.path.PropertyPathResolver;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders a resolved template against aggregated data with {@code {{path}}} placeholders.
 *
 * <p>JSON and YAML templates are parsed into a tree first. A string that consists of a single
 * placeholder is replaced by the value node itself, so arrays and objects keep their type; any
 * other string has its placeholders interpolated as text. Object keys are left alone. XML and
 * Markdown templates are interpolated as text. Missing values render as {@code null} (whole-string
 * placeholders) or as the empty string (interpolation).
 *
 * <p>With an items collection the template is rendered once per item, with the item as context.
 * Tree formats produce an array of rendered items; text formats join them with a blank line.
 */
public final class TemplateRenderer {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([^{}]+?)\\s*}}");
    private static final Pattern WHOLE_PLACEHOLDER = Pattern.compile("^\\s*\\{\\{\\s*([^{}]+?)\\s*}}\\s*$");

    private final PropertyPathResolver resolver;

    public TemplateRenderer() {
        this(new PropertyPathResolver());
    }

    public TemplateRenderer(PropertyPathResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
    }

    /**
     * Renders {@code templates} against {@code data}.
     *
     * @throws TemplateConfigurationException if a JSON or YAML template cannot be parsed
     */
    public String render(ResolvedTemplateConfiguration templates, JsonNode data) {
        Objects.requireNonNull(templates, "templates must not be null");
        Objects.requireNonNull(data, "data must not be null");
        OutputFormat format = templates.outputFormat();
        List<JsonNode> contexts = templates.hasItemsTemplate()
                ? resolver.resolveAsList(data, templates.itemsCollection())
                : List.of(data);
        String template = templates.hasItemsTemplate()
                ? templates.itemsTemplateContent()
                : templates.mainTemplateContent();

        if (format == OutputFormat.JSON || format == OutputFormat.YAML) {
            ObjectMapper mapper = format == OutputFormat.JSON ? JSON_MAPPER : YAML_MAPPER;
            JsonNode tree = parseTemplate(template, mapper, format);
            JsonNode rendered;
            if (templates.hasItemsTemplate()) {
                ArrayNode items = JsonNodeFactory.instance.arrayNode();
                contexts.forEach(context -> items.add(substitute(tree, context)));
                rendered = items;
            } else {
                rendered = substitute(tree, data);
            }
            return write(rendered, mapper);
        }

        List<String> parts = new ArrayList<>(contexts.size());
        for (JsonNode context : contexts) {
            parts.add(interpolate(template, context));
        }
        return String.join("\n\n", parts);
    }

    /** Returns a copy of {@code template} with every placeholder substituted from {@code context}. */
    JsonNode substitute(JsonNode template, JsonNode context) {
        if (template.isTextual()) {
            Matcher whole = WHOLE_PLACEHOLDER.matcher(template.asText());
            if (whole.matches()) {
                JsonNode value = lookup(context, whole.group(1));
                return value != null ? value.deepCopy() : NullNode.getInstance();
            }
            return TextNode.valueOf(interpolate(template.asText(), context));
        }
        if (template.isObject()) {
            ObjectNode out = JsonNodeFactory.instance.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = template.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                out.set(field.getKey(), substitute(field.getValue(), context));
            }
            return out;
        }
        if (template.isArray()) {
            ArrayNode out = JsonNodeFactory.instance.arrayNode();
            template.forEach(element -> out.add(substitute(element, context)));
            return out;
        }
        return template.deepCopy();
    }

    /** Replaces every placeholder in {@code text} with the textual value it names. */
    String interpolate(String text, JsonNode context) {
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String expression = matcher.group(1);
            String replacement = PropertyPath.isValid(expression)
                    ? asText(lookup(context, expression))
                    : matcher.group();
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private JsonNode lookup(JsonNode context, String expression) {
        if (!PropertyPath.isValid(expression)) {
            return null;
        }
        PropertyPath path = resolver.parse(expression);
        if (path.isRoot()) {
            return context;
        }
        List<JsonNode> values = resolver.resolve(context, expression);
        if (values.isEmpty()) {
            return null;
        }
        if (!path.hasExpansion()) {
            return values.get(0);
        }
        ArrayNode all = JsonNodeFactory.instance.arrayNode();
        values.forEach(all::add);
        return all;
    }

    private static String asText(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return "";
        }
        if (value.isValueNode()) {
            return value.asText();
        }
        return value.toString();
    }

    private static JsonNode parseTemplate(String template, ObjectMapper mapper, OutputFormat format) {
        try {
            JsonNode tree = mapper.readTree(template);
            if (tree == null || tree.isMissingNode()) {
                throw new TemplateConfigurationException("Template is empty", format.id());
            }
            return tree;
        } catch (JsonProcessingException e) {
            throw new TemplateConfigurationException(
                    "Template is not valid " + format.id() + ": " + e.getOriginalMessage(), e, format.id());
        }
    }

    private static String write(JsonNode rendered, ObjectMapper mapper) {
        try {
            return mapper == JSON_MAPPER
                    ? mapper.writerWithDefaultPrettyPrinter().writeValueAsString(rendered)
                    : mapper.writeValueAsString(rendered);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Rendered output could not be serialized", e);
        }
    }
}
