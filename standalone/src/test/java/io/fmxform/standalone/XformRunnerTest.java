package io.fmxform.standalone;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fmxform.core.engine.RenderedOutput;
import io.fmxform.core.error.NoDocumentsException;
import io.fmxform.standalone.config.XformConfig;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Discovery, transformation and output writing against a real directory tree. */
class XformRunnerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    private Path docs;
    private Path schema;

    @BeforeEach
    void setUp() throws Exception {
        docs = Files.createDirectories(tempDir.resolve("docs/commands"));
        Files.writeString(docs.resolve("build.md"), "---\nname: build\ndescription: Compile sources\n---\n");
        Files.writeString(docs.resolve("deploy.md"), "---\nname: deploy\ndescription: Ship it\n---\n");
        Files.writeString(docs.resolve("README.txt"), "not a document");

        schema = tempDir.resolve("schema.json");
        Files.writeString(schema, """
                {
                  "x-template": "registry.json",
                  "properties": {
                    "commands": {"type": "array", "x-frontmatter-part": true},
                    "count": {"type": "integer", "x-derived-count": "commands"}
                  }
                }
                """);
        Files.writeString(tempDir.resolve("registry.json"), """
                {"total": "{{count}}", "names": "{{commands[].name}}"}
                """);
    }

    private XformConfig.Builder config() {
        return XformConfig.builder()
                .schema(schema.toString())
                .documentsDir(tempDir.resolve("docs").toString())
                .output(tempDir.resolve("dist/nested/registry.json").toString());
    }

    @Test
    void writesRenderedArtifactCreatingParentDirectories() throws Exception {
        RenderedOutput output = new XformRunner(config().build()).run();

        Path written = tempDir.resolve("dist/nested/registry.json");
        assertThat(written).exists();
        JsonNode json = MAPPER.readTree(Files.readString(written, StandardCharsets.UTF_8));
        assertThat(json.get("total").asInt()).isEqualTo(2);
        assertThat(json.get("names").toString()).isEqualTo("[\"build\",\"deploy\"]");
        assertThat(output.result().processedCount()).isEqualTo(2);
    }

    @Test
    void globSelectsDocuments() throws Exception {
        new XformRunner(config().documentGlob("**/build.md").build()).run();

        JsonNode json = MAPPER.readTree(tempDir.resolve("dist/nested/registry.json").toFile());
        assertThat(json.get("total").asInt()).isEqualTo(1);
    }

    @Test
    void noMatchingDocumentsFailsWithoutWritingOutput() {
        XformRunner runner = new XformRunner(config().documentGlob("**/*.rst").build());

        assertThatThrownBy(runner::run).isInstanceOf(NoDocumentsException.class);
        assertThat(tempDir.resolve("dist/nested/registry.json")).doesNotExist();
    }
}
