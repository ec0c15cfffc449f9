package io.fmxform.standalone;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the documents of a run: regular files under a directory whose path relative to it matches
 * a glob. Results are sorted so that runs are reproducible.
 */
public final class DocumentDiscovery {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentDiscovery.class);

    private DocumentDiscovery() {
        // utility class
    }

    /**
     * Lists matching documents.
     *
     * <p>A glob starting with <code>**&#47;</code> also matches files directly in {@code root}.
     *
     * @param root directory to search
     * @param glob glob such as {@code **}{@code /*.md}
     * @return matching files, sorted by path
     * @throws UncheckedIOException if the directory cannot be walked
     */
    public static List<Path> discover(Path root, String glob) {
        if (!Files.isDirectory(root)) {
            throw new UncheckedIOException(new IOException("Documents directory not found: " + root));
        }
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + glob);
        PathMatcher topLevel = glob.startsWith("**/")
                ? FileSystems.getDefault().getPathMatcher("glob:" + glob.substring(3))
                : matcher;
        try (Stream<Path> walk = Files.walk(root)) {
            List<Path> documents = walk.filter(Files::isRegularFile)
                    .filter(path -> {
                        Path relative = root.relativize(path);
                        return matcher.matches(relative) || topLevel.matches(relative);
                    })
                    .sorted()
                    .toList();
            LOG.info("Documents discovered: dir={}, glob={}, count={}", root, glob, documents.size());
            return documents;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to walk documents directory " + root, e);
        }
    }
}
