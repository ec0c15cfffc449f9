package io.fmxform.standalone;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LogbackConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private final Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);

    @AfterEach
    void restoreTextLogging() {
        LogbackConfigurator.configure("text", "INFO");
    }

    @SuppressWarnings("unchecked")
    private ConsoleAppender<ILoggingEvent> stderr() {
        return (ConsoleAppender<ILoggingEvent>) root.getAppender("STDERR");
    }

    @Test
    void jsonFormatUsesJsonEncoder() {
        LogbackConfigurator.configure("json", "DEBUG");

        assertThat(root.getLevel()).isEqualTo(Level.DEBUG);
        assertThat(stderr().getEncoder()).isInstanceOf(JsonEncoder.class);
    }

    @Test
    void textFormatPrintsRunId() {
        LogbackConfigurator.configure("text", "warn");

        assertThat(root.getLevel()).isEqualTo(Level.WARN);
        assertThat(stderr().getEncoder()).isInstanceOfSatisfying(PatternLayoutEncoder.class,
                encoder -> assertThat(encoder.getPattern()).contains("%X{runId}"));
    }

    @Test
    void unknownLevelFallsBackToInfoAndSchemaValidatorIsQuiet() {
        LogbackConfigurator.configure("text", "chatty");

        assertThat(root.getLevel()).isEqualTo(Level.INFO);
        assertThat(context.getLogger("com.networknt.schema").getLevel()).isEqualTo(Level.ERROR);
    }
}
