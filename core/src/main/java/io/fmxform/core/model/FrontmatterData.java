package io.fmxform.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Ordered field map extracted from one document's front matter.
 *
 * <p>The backing tree is copied on construction and on every read, so an instance is owned
 * exclusively by its document and aggregated copies are independent of it.
 */
public final class FrontmatterData {

    private final ObjectNode fields;

    private FrontmatterData(ObjectNode fields) {
        this.fields = fields;
    }

    /** Wraps a copy of the given object node. */
    public static FrontmatterData of(ObjectNode fields) {
        Objects.requireNonNull(fields, "fields must not be null");
        return new FrontmatterData(fields.deepCopy());
    }

    /** Returns a copy of the field map as a JSON object. */
    public ObjectNode asObjectNode() {
        return fields.deepCopy();
    }

    /** Returns a copy of the value of {@code field}, or {@code null} if absent. */
    public JsonNode get(String field) {
        JsonNode value = fields.get(field);
        return value != null ? value.deepCopy() : null;
    }

    public boolean has(String field) {
        return fields.has(field);
    }

    /** Field names in document order. */
    public List<String> fieldNames() {
        List<String> names = new ArrayList<>();
        Iterator<String> it = fields.fieldNames();
        it.forEachRemaining(names::add);
        return names;
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FrontmatterData other && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "FrontmatterData" + fields;
    }
}
