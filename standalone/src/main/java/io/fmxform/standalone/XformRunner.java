package io.fmxform.standalone;

import io.fmxform.core.engine.FrontmatterTransformEngine;
import io.fmxform.core.engine.RenderedOutput;
import io.fmxform.standalone.config.XformConfig;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One command-line run: discover documents, transform them with the configured engine and write
 * the rendered artifact.
 */
public final class XformRunner {

    private static final Logger LOG = LoggerFactory.getLogger(XformRunner.class);

    private final XformConfig config;
    private final FrontmatterTransformEngine engine;

    public XformRunner(XformConfig config) {
        this(config, new FrontmatterTransformEngine(config.engineOptions()));
    }

    XformRunner(XformConfig config, FrontmatterTransformEngine engine) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    /**
     * Runs the transformation and writes the output file, creating parent directories.
     *
     * @return the rendered output
     * @throws io.fmxform.core.error.FmxformException if the transformation fails
     * @throws UncheckedIOException if discovery or writing fails
     */
    public RenderedOutput run() {
        List<Path> documents = DocumentDiscovery.discover(config.documentsPath(), config.documentGlob());
        RenderedOutput output = engine.transform(config.schemaPath(), documents);

        Path target = config.outputPath();
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, output.content(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write output " + target, e);
        }
        LOG.info("Output written: path={}, format={}, documents={}, skipped={}",
                target, output.format().id(), output.result().processedCount(), output.result().failures().size());
        return output;
    }
}
