package io.fmxform.standalone;

import io.fmxform.standalone.config.ConfigLoader;
import io.fmxform.standalone.config.XformConfig;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the command-line runner.
 *
 * <p>Loads configuration ({@code --config <path>}, default {@code fmxform.yaml}), configures
 * logging and runs {@link XformRunner}. On failure, logs the error and exits with status 1.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    private StandaloneMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments (e.g. {@code --config path/to/fmxform.yaml})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            Path configPath = ConfigLoader.resolveConfigPath(args);
            XformConfig config = ConfigLoader.load(configPath);
            LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
            LOG.info("Configuration loaded: path={}", configPath);
            new XformRunner(config).run();
        } catch (Exception e) {
            LOG.error("Run failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
