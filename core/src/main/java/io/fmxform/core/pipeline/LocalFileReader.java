package io.fmxform.core.pipeline;

import io.fmxform.core.error.FileReadException;
import io.fmxform.core.spi.FileReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/** {@link FileReader} over the local file system. Stateless and thread-safe. */
public final class LocalFileReader implements FileReader {

    @Override
    public String read(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new FileReadException(
                    "File not found: " + path, e, FileReadException.Reason.NOT_FOUND, path.toString());
        } catch (AccessDeniedException e) {
            throw new FileReadException(
                    "Permission denied: " + path, e, FileReadException.Reason.PERMISSION_DENIED, path.toString());
        } catch (IOException e) {
            throw new FileReadException(
                    "Failed to read " + path + ": " + e.getMessage(),
                    e,
                    FileReadException.Reason.READ_ERROR,
                    path.toString());
        }
    }
}
