package io.fmxform.core.model;

/** Template format hint derived from the structure type. */
public enum TemplateFormat {
    JSON,
    YAML,
    AUTO
}
