package io.fmxform.core.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A successfully processed Markdown document.
 *
 * @param path the source file
 * @param frontmatter validated front matter
 * @param body Markdown content after the front matter block
 */
public record MarkdownDocument(Path path, FrontmatterData frontmatter, String body) {

    public MarkdownDocument {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(frontmatter, "frontmatter must not be null");
        Objects.requireNonNull(body, "body must not be null");
    }
}
