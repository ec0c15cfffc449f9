package io.fmxform.core.model;

/**
 * Template directives extracted from a schema. Any component may be {@code null}.
 *
 * @param mainTemplate {@code x-template} value: inline content or a file path
 * @param itemsTemplate {@code x-template-items} value: the data collection rendered per item
 * @param outputFormat {@code x-template-format} value
 */
public record TemplateConfiguration(String mainTemplate, String itemsTemplate, String outputFormat) {}
