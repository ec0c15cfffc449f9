package io.fmxform.core.model;

import java.util.Locale;
import java.util.Optional;

/** Format of the rendered output artifact. */
public enum OutputFormat {
    JSON("json"),
    YAML("yaml"),
    XML("xml"),
    MARKDOWN("markdown");

    private final String id;

    OutputFormat(String id) {
        this.id = id;
    }

    /** Identifier as written in {@code x-template-format}. */
    public String id() {
        return id;
    }

    /** Parses an {@code x-template-format} value. Case-insensitive; {@code yml} maps to YAML. */
    public static Optional<OutputFormat> fromId(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("yml".equals(normalized)) {
            return Optional.of(YAML);
        }
        if ("md".equals(normalized)) {
            return Optional.of(MARKDOWN);
        }
        for (OutputFormat format : values()) {
            if (format.id.equals(normalized)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }

    /** Infers the format from a file name extension, or empty if the extension is not known. */
    public static Optional<OutputFormat> fromExtension(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".json")) return Optional.of(JSON);
        if (lower.endsWith(".yml") || lower.endsWith(".yaml")) return Optional.of(YAML);
        if (lower.endsWith(".xml")) return Optional.of(XML);
        if (lower.endsWith(".md")) return Optional.of(MARKDOWN);
        return Optional.empty();
    }
}
