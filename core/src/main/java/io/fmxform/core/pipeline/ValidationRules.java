package io.fmxform.core.pipeline;

import com.networknt.schema.JsonSchema;
import com.networknt.schema.ValidationMessage;
import io.fmxform.core.model.FrontmatterData;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Validation rules for one run: the compiled front-matter item schema plus the field rules it
 * declares. Permissive rules accept every document.
 *
 * <p>Immutable and thread-safe; {@link JsonSchema} instances are safe for concurrent validation.
 */
public final class ValidationRules {

    private static final ValidationRules PERMISSIVE = new ValidationRules(null, List.of(), "<none>");

    private final JsonSchema schema;
    private final List<ValidationRule> rules;
    private final String source;

    private ValidationRules(JsonSchema schema, List<ValidationRule> rules, String source) {
        this.schema = schema;
        this.rules = List.copyOf(rules);
        this.source = source;
    }

    /** Rules that accept every document. */
    public static ValidationRules permissive() {
        return PERMISSIVE;
    }

    /**
     * @param schema compiled item schema
     * @param rules field rules declared by the schema
     * @param source schema path the rules were derived from, for logging
     */
    public static ValidationRules of(JsonSchema schema, List<ValidationRule> rules, String source) {
        Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(rules, "rules must not be null");
        return new ValidationRules(schema, rules, Objects.requireNonNull(source, "source must not be null"));
    }

    /** Validates one document's front matter; returns violation messages in stable order. */
    public List<String> validate(FrontmatterData data) {
        if (schema == null) {
            return List.of();
        }
        Set<ValidationMessage> errors = schema.validate(data.asObjectNode());
        return errors.stream().map(ValidationMessage::getMessage).sorted().toList();
    }

    public boolean isPermissive() {
        return schema == null;
    }

    public List<ValidationRule> rules() {
        return rules;
    }

    public String source() {
        return source;
    }

    @Override
    public String toString() {
        return isPermissive()
                ? "ValidationRules[permissive]"
                : "ValidationRules[" + source + ", rules=" + rules.size() + "]";
    }
}
