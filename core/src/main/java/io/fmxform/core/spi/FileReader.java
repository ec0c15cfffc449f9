package io.fmxform.core.spi;

import java.nio.file.Path;

/**
 * Reads text files for the pipeline: template files relative to a schema and discovered Markdown
 * documents.
 *
 * <p>Implementations MUST be thread-safe; documents may be read from several worker threads.
 */
public interface FileReader {

    /**
     * Reads the whole file as UTF-8 text.
     *
     * @param path the file to read
     * @return the file content
     * @throws io.fmxform.core.error.FileReadException with reason {@code NOT_FOUND}, {@code
     *     PERMISSION_DENIED} or {@code READ_ERROR}
     */
    String read(Path path);
}
