package io.fmxform.core.spi;

/**
 * Splits raw document text into front matter and body.
 *
 * <p>Implementations MUST NOT throw: any parse failure degrades to {@link
 * FrontmatterExtraction.Absent} carrying the original content.
 */
public interface FrontmatterExtractor {

    FrontmatterExtraction extract(String content);
}
