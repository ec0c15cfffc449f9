package io.fmxform.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Recursive shape descriptor used for structural comparison of data, schema and template.
 *
 * <p>An {@link NodeKind#OBJECT} node carries its children keyed by property name; an {@link
 * NodeKind#ARRAY} node carries the shape of its elements, or {@code null} when the array is empty
 * or declares no items. Primitive nodes carry only their kind: values are never recorded.
 *
 * <p>Immutable and thread-safe.
 */
public final class StructureNode {

    private final String path;
    private final NodeKind kind;
    private final Map<String, StructureNode> children;
    private final StructureNode elementType;

    private StructureNode(String path, NodeKind kind, Map<String, StructureNode> children, StructureNode elementType) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.children = children;
        this.elementType = elementType;
    }

    /** Creates a primitive node of the given kind. */
    public static StructureNode primitive(String path, NodeKind kind) {
        if (!kind.isPrimitive()) {
            throw new IllegalArgumentException("Not a primitive kind: " + kind);
        }
        return new StructureNode(path, kind, null, null);
    }

    /** Creates an object node. Child iteration order follows the given map. */
    public static StructureNode object(String path, Map<String, StructureNode> children) {
        Objects.requireNonNull(children, "children must not be null");
        return new StructureNode(
                path, NodeKind.OBJECT, Collections.unmodifiableMap(new LinkedHashMap<>(children)), null);
    }

    /** Creates an array node; {@code elementType} may be {@code null} for an empty array. */
    public static StructureNode array(String path, StructureNode elementType) {
        return new StructureNode(path, NodeKind.ARRAY, null, elementType);
    }

    public String path() {
        return path;
    }

    public NodeKind kind() {
        return kind;
    }

    /** Children of an object node; empty for any other kind. */
    public Map<String, StructureNode> children() {
        return children != null ? children : Map.of();
    }

    /** Element shape of an array node, or {@code null}. */
    public StructureNode elementType() {
        return elementType;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case OBJECT -> "object" + children().keySet();
            case ARRAY -> "array<" + (elementType != null ? elementType : "none") + ">";
            default -> kind.label();
        };
    }
}
