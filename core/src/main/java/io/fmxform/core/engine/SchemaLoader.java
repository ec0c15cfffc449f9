package io.fmxform.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.fmxform.core.error.FileReadException;
import io.fmxform.core.error.SchemaLoadException;
import io.fmxform.core.model.Schema;
import io.fmxform.core.spi.FileReader;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/** Loads annotated schemas from JSON or YAML files, chosen by file extension. */
public final class SchemaLoader {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private final FileReader fileReader;

    public SchemaLoader(FileReader fileReader) {
        this.fileReader = Objects.requireNonNull(fileReader, "fileReader must not be null");
    }

    /**
     * Reads and parses the schema at {@code path}. {@code .yaml} and {@code .yml} files are parsed
     * as YAML, anything else as JSON.
     *
     * @throws SchemaLoadException if the file cannot be read, does not parse or is not an object
     */
    public Schema load(Path path) {
        String content;
        try {
            content = fileReader.read(path);
        } catch (FileReadException e) {
            throw new SchemaLoadException("Cannot read schema: " + e.getMessage(), e, path.toString());
        }
        return new Schema(parse(content, isYaml(path), path.toString()), path);
    }

    /** Parses schema text. */
    public static JsonNode parse(String content, boolean yaml, String source) {
        JsonNode root;
        try {
            root = (yaml ? YAML_MAPPER : JSON_MAPPER).readTree(content);
        } catch (JsonProcessingException e) {
            throw new SchemaLoadException(
                    "Schema is not valid " + (yaml ? "YAML" : "JSON") + ": " + e.getOriginalMessage(), e, source);
        }
        if (root == null || !root.isObject()) {
            throw new SchemaLoadException("Schema must be an object", source);
        }
        return root;
    }

    private static boolean isYaml(Path path) {
        String name = path.getFileName() != null ? path.getFileName().toString().toLowerCase(Locale.ROOT) : "";
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }
}
