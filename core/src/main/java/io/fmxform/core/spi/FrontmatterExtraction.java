package io.fmxform.core.spi;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/** Result of splitting a Markdown document into front matter and body. */
public sealed interface FrontmatterExtraction {

    /** The document body (everything after the front matter, or the whole text when absent). */
    String body();

    /** Front matter was found and parsed into an object. */
    record Present(ObjectNode frontMatter, String body) implements FrontmatterExtraction {
        public Present {
            Objects.requireNonNull(frontMatter, "frontMatter must not be null");
            Objects.requireNonNull(body, "body must not be null");
        }
    }

    /** No usable front matter: missing, unterminated, unparsable or not an object. */
    record Absent(String body) implements FrontmatterExtraction {
        public Absent {
            Objects.requireNonNull(body, "body must not be null");
        }
    }
}
