package io.fmxform.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * Loads {@link XformConfig} from a YAML file with an optional environment variable overlay.
 *
 * <p>Supports two invocation patterns:
 *
 * <ul>
 *   <li>Default: loads {@code fmxform.yaml} from the current directory
 *   <li>{@code --config /path/to/config.yaml}: loads from the specified path
 * </ul>
 *
 * <p>YAML keys are mapped through {@link XformConfig.Builder}; missing keys keep the builder
 * defaults. Every key can be overridden by an {@code FMXFORM_*} environment variable, which takes
 * precedence over YAML. An env var is "set" if and only if it is defined and its trimmed value is
 * non-empty; blank values leave the YAML value in place. List values are comma-separated.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    static final String DEFAULT_CONFIG_FILE = "fmxform.yaml";
    static final String ENV_PREFIX = "FMXFORM_";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from {@code configPath}, overlaying {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or contains invalid YAML or values
     */
    public static XformConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from {@code configPath}, overlaying the supplied environment lookup.
     * Returning {@code null} from {@code envLookup} means the variable is not defined.
     *
     * @throws ConfigLoadException if the file is missing or contains invalid YAML or values
     */
    public static XformConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root != null ? root : YAML_MAPPER.createObjectNode(), envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (RuntimeException e) {
            throw new ConfigLoadException("Failed to load configuration from: " + configPath, e);
        }
    }

    /**
     * Resolves the config file path from CLI arguments.
     *
     * @throws IllegalArgumentException if {@code --config} has no value
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    private static XformConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        XformConfig.Builder builder = XformConfig.builder();

        // --- YAML mapping ---

        if (root.has("schema")) builder.schema(root.get("schema").asText());

        JsonNode documents = root.path("documents");
        if (documents.has("dir")) builder.documentsDir(documents.get("dir").asText());
        if (documents.has("glob")) builder.documentGlob(documents.get("glob").asText());

        JsonNode output = root.path("output");
        if (output.has("path")) builder.output(output.get("path").asText());

        JsonNode engine = root.path("engine");
        if (engine.has("validation-mode"))
            builder.validationMode(engine.get("validation-mode").asText());
        if (engine.has("strict-alignment"))
            builder.strictAlignment(engine.get("strict-alignment").asBoolean());
        if (engine.has("strategy")) builder.strategy(engine.get("strategy").asText());
        if (engine.has("max-workers")) builder.maxWorkers(engine.get("max-workers").asInt());
        if (engine.has("reevaluation-threshold"))
            builder.reevaluationThreshold(engine.get("reevaluation-threshold").asInt());

        JsonNode detection = root.path("detection");
        if (detection.has("sequential-patterns"))
            builder.sequentialPatterns(textList(detection.get("sequential-patterns")));
        if (detection.has("named-patterns"))
            builder.namedPatterns(textList(detection.get("named-patterns")));
        if (detection.has("custom-patterns"))
            builder.customPatterns(textList(detection.get("custom-patterns")));
        if (detection.has("minimum-match-count"))
            builder.minimumMatchCount(detection.get("minimum-match-count").asInt());

        JsonNode cache = root.path("cache");
        if (cache.has("max-path-entries"))
            builder.cacheMaxPathEntries(cache.get("max-path-entries").asInt());
        if (cache.has("max-extraction-entries"))
            builder.cacheMaxExtractionEntries(cache.get("max-extraction-entries").asInt());
        if (cache.has("path-ttl-ms")) builder.cachePathTtlMs(cache.get("path-ttl-ms").asLong());
        if (cache.has("extraction-ttl-ms"))
            builder.cacheExtractionTtlMs(cache.get("extraction-ttl-ms").asLong());
        if (cache.has("eviction")) builder.cacheEviction(cache.get("eviction").asText());
        if (cache.has("metrics")) builder.cacheMetrics(cache.get("metrics").asBoolean());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        // --- Environment variable overlay ---
        applyEnvOverrides(builder, envLookup);

        return builder.build();
    }

    private static void applyEnvOverrides(XformConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, "SCHEMA", builder::schema);
        envString(envLookup, "DOCUMENTS_DIR", builder::documentsDir);
        envString(envLookup, "DOCUMENT_GLOB", builder::documentGlob);
        envString(envLookup, "OUTPUT", builder::output);
        envString(envLookup, "VALIDATION_MODE", builder::validationMode);
        envString(envLookup, "STRATEGY", builder::strategy);
        envString(envLookup, "CACHE_EVICTION", builder::cacheEviction);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);

        envInt(envLookup, "MAX_WORKERS", builder::maxWorkers);
        envInt(envLookup, "REEVALUATION_THRESHOLD", builder::reevaluationThreshold);
        envInt(envLookup, "MINIMUM_MATCH_COUNT", builder::minimumMatchCount);
        envInt(envLookup, "CACHE_MAX_PATH_ENTRIES", builder::cacheMaxPathEntries);
        envInt(envLookup, "CACHE_MAX_EXTRACTION_ENTRIES", builder::cacheMaxExtractionEntries);
        envLong(envLookup, "CACHE_PATH_TTL_MS", builder::cachePathTtlMs);
        envLong(envLookup, "CACHE_EXTRACTION_TTL_MS", builder::cacheExtractionTtlMs);

        envBool(envLookup, "STRICT_ALIGNMENT", builder::strictAlignment);
        envBool(envLookup, "CACHE_METRICS", builder::cacheMetrics);

        envList(envLookup, "SEQUENTIAL_PATTERNS", builder::sequentialPatterns);
        envList(envLookup, "NAMED_PATTERNS", builder::namedPatterns);
        envList(envLookup, "CUSTOM_PATTERNS", builder::customPatterns);
    }

    // --- Env var helpers ---

    /** Returns {@code true} if the env var is "set": defined AND non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String name) {
        String value = envLookup.apply(ENV_PREFIX + name);
        return value != null && !value.trim().isEmpty();
    }

    private static String envValue(Function<String, String> envLookup, String name) {
        return envLookup.apply(ENV_PREFIX + name).trim();
    }

    private static void envString(Function<String, String> envLookup, String name, Consumer<String> setter) {
        if (isSet(envLookup, name)) {
            setter.accept(envValue(envLookup, name));
        }
    }

    private static void envInt(Function<String, String> envLookup, String name, IntConsumer setter) {
        if (isSet(envLookup, name)) {
            setter.accept(parse(name, envValue(envLookup, name), Integer::parseInt));
        }
    }

    private static void envLong(Function<String, String> envLookup, String name, LongConsumer setter) {
        if (isSet(envLookup, name)) {
            setter.accept(parse(name, envValue(envLookup, name), Long::parseLong));
        }
    }

    private static void envBool(Function<String, String> envLookup, String name, Consumer<Boolean> setter) {
        if (isSet(envLookup, name)) {
            setter.accept(Boolean.parseBoolean(envValue(envLookup, name)));
        }
    }

    private static void envList(Function<String, String> envLookup, String name, Consumer<List<String>> setter) {
        if (isSet(envLookup, name)) {
            setter.accept(Arrays.stream(envValue(envLookup, name).split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toList());
        }
    }

    private static <T> T parse(String name, String value, Function<String, T> parser) {
        try {
            return parser.apply(value);
        } catch (NumberFormatException e) {
            throw new ConfigLoadException(ENV_PREFIX + name + " must be a number, got '" + value + "'", e);
        }
    }

    // --- YAML helpers ---

    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(v -> values.add(v.asText()));
        } else if (!node.isNull()) {
            values.add(node.asText());
        }
        return values;
    }
}
