package io.fmxform.core.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.fmxform.core.spi.FrontmatterExtraction;
import io.fmxform.core.spi.FrontmatterExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts front matter delimited by {@code ---} lines at the top of a document. The block is
 * parsed as YAML, which also accepts JSON objects. The closing delimiter may be {@code ---} or
 * {@code ...}.
 *
 * <p>Never throws: anything other than a parsable object yields {@link FrontmatterExtraction.Absent}
 * with the original content.
 */
public final class YamlFrontmatterExtractor implements FrontmatterExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(YamlFrontmatterExtractor.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private static final String DELIMITER = "---";
    private static final String ALT_CLOSING_DELIMITER = "...";

    @Override
    public FrontmatterExtraction extract(String content) {
        if (content == null) {
            return new FrontmatterExtraction.Absent("");
        }
        String text = content.startsWith("\uFEFF") ? content.substring(1) : content;
        int firstEol = text.indexOf('\n');
        if (firstEol < 0 || !text.substring(0, firstEol).strip().equals(DELIMITER)) {
            return new FrontmatterExtraction.Absent(content);
        }

        int lineStart = firstEol + 1;
        while (lineStart <= text.length()) {
            int lineEnd = text.indexOf('\n', lineStart);
            int end = lineEnd < 0 ? text.length() : lineEnd;
            String line = text.substring(lineStart, end).strip();
            if (line.equals(DELIMITER) || line.equals(ALT_CLOSING_DELIMITER)) {
                String block = text.substring(firstEol + 1, lineStart);
                String body = lineEnd < 0 ? "" : text.substring(lineEnd + 1);
                return parse(block, body, content);
            }
            if (lineEnd < 0) {
                break;
            }
            lineStart = lineEnd + 1;
        }
        LOG.debug("Front matter is not terminated");
        return new FrontmatterExtraction.Absent(content);
    }

    private static FrontmatterExtraction parse(String block, String body, String original) {
        if (block.isBlank()) {
            return new FrontmatterExtraction.Present(YAML_MAPPER.createObjectNode(), body);
        }
        try {
            JsonNode tree = YAML_MAPPER.readTree(block);
            if (tree instanceof ObjectNode object) {
                return new FrontmatterExtraction.Present(object, body);
            }
            LOG.debug("Front matter is not an object: type={}", tree == null ? "empty" : tree.getNodeType());
            return new FrontmatterExtraction.Absent(original);
        } catch (JsonProcessingException e) {
            LOG.debug("Front matter could not be parsed: {}", e.getOriginalMessage());
            return new FrontmatterExtraction.Absent(original);
        }
    }
}
