package org.gridrealm.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.gridrealm.junit.extensions.logging.ExpectLog;
import org.gridrealm.junit.extensions.logging.LogLevel;
import org.gridrealm.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the LoggingConfigurator class.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LoggingConfiguratorTest {

    private static final String SAMPLE_LOGGER = "org.gridrealm.sample";

    private LoggerContext context;
    private Level rootLevel;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        context = (LoggerContext) LoggerFactory.getILoggerFactory();
        rootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
        context.getLogger(SAMPLE_LOGGER).setLevel(null);
        context.putProperty(LoggingConfigurator.FORMAT_PROPERTY, "STDOUT");
        System.clearProperty(LoggingConfigurator.FORMAT_PROPERTY);
        LoggingConfigurator.reset();
    }

    @Test
    void configure_plainFormatSelectsPatternAppender() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging { format = \"PLAIN\" }"));

        assertThat(context.getProperty(LoggingConfigurator.FORMAT_PROPERTY)).isEqualTo("STDOUT");
    }

    @Test
    void configure_jsonFormatSelectsJsonAppender() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging { format = \"json\" }"));

        assertThat(context.getProperty(LoggingConfigurator.FORMAT_PROPERTY)).isEqualTo("STDOUT_JSON");
        assertThat(System.getProperty(LoggingConfigurator.FORMAT_PROPERTY)).isEqualTo("STDOUT_JSON");
    }

    @Test
    void configure_appliesDefaultAndSpecificLevels() {
        final Config config = ConfigFactory.parseString("""
            logging {
              default-level = "ERROR"
              levels {
                "org.gridrealm.sample" = "DEBUG"
              }
            }
            """);

        LoggingConfigurator.configure(config);

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(context.getLogger(SAMPLE_LOGGER).getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void configure_isIdempotentUntilReset() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.gridrealm.sample\" = \"DEBUG\" }"));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.gridrealm.sample\" = \"ERROR\" }"));

        assertThat(context.getLogger(SAMPLE_LOGGER).getLevel()).isEqualTo(Level.DEBUG);

        LoggingConfigurator.reset();
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.gridrealm.sample\" = \"ERROR\" }"));

        assertThat(context.getLogger(SAMPLE_LOGGER).getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*LoggingConfigurator", messagePattern = ".*unknown log level 'LOUD'.*")
    void configure_skipsUnknownLevels() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.gridrealm.sample\" = \"LOUD\" }"));

        assertThat(context.getLogger(SAMPLE_LOGGER).getLevel()).isNull();
    }

    @Test
    void configure_withoutLoggingSectionLeavesLevelsAlone() {
        LoggingConfigurator.configure(ConfigFactory.empty());

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(rootLevel);
    }
}
