package io.fmxform.core.model;

import java.util.Objects;

/**
 * Template configuration after file resolution.
 *
 * @param mainTemplateContent the main template text
 * @param itemsTemplateContent template applied per item, or {@code null} when no items collection
 *     is configured; always the main template content
 * @param itemsCollection data collection named by {@code x-template-items}, or {@code null}
 * @param outputFormat resolved output format, never ambiguous
 */
public record ResolvedTemplateConfiguration(
        String mainTemplateContent, String itemsTemplateContent, String itemsCollection, OutputFormat outputFormat) {

    public ResolvedTemplateConfiguration {
        Objects.requireNonNull(mainTemplateContent, "mainTemplateContent must not be null");
        Objects.requireNonNull(outputFormat, "outputFormat must not be null");
    }

    public boolean hasItemsTemplate() {
        return itemsCollection != null;
    }
}
