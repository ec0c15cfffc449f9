package io.fmxform.core.model;

/** Shape kind of a {@link StructureNode}. */
public enum NodeKind {
    OBJECT("object"),
    ARRAY("array"),
    STRING("string"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    NULL("null");

    private final String label;

    NodeKind(String label) {
        this.label = label;
    }

    /** Lower-case label as used by JSON Schema {@code type}. */
    public String label() {
        return label;
    }

    public boolean isPrimitive() {
        return this != OBJECT && this != ARRAY;
    }
}
