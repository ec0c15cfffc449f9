package io.fmxform.core.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.fmxform.core.error.FileReadException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocalFileReaderTest {

    @TempDir
    Path tempDir;

    private final LocalFileReader reader = new LocalFileReader();

    @Test
    void readsUtf8Content() throws Exception {
        Path file = tempDir.resolve("doc.md");
        Files.writeString(file, "---\ntitle: Café\n---\n", StandardCharsets.UTF_8);

        assertThat(reader.read(file)).isEqualTo("---\ntitle: Café\n---\n");
    }

    @Test
    void missingFileIsNotFound() {
        Path missing = tempDir.resolve("missing.md");

        assertThatThrownBy(() -> reader.read(missing))
                .isInstanceOfSatisfying(FileReadException.class, e -> {
                    assertThat(e.reason()).isEqualTo(FileReadException.Reason.NOT_FOUND);
                    assertThat(e.location()).isEqualTo(missing.toString());
                })
                .hasMessageStartingWith("File not found");
    }

    @Test
    void directoryIsAReadError() {
        assertThatThrownBy(() -> reader.read(tempDir))
                .isInstanceOfSatisfying(FileReadException.class,
                        e -> assertThat(e.reason()).isNotEqualTo(FileReadException.Reason.NOT_FOUND));
    }
}
