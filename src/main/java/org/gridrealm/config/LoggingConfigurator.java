package org.gridrealm.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Applies the {@code logging} section of the configuration to Logback at runtime.
 *
 * <pre>
 * logging {
 *   format = "PLAIN"          # PLAIN or JSON
 *   default-level = "INFO"    # root logger level
 *   levels {
 *     "org.gridrealm.runtime" = "DEBUG"
 *   }
 * }
 * </pre>
 * The format is handed to {@code logback.xml} through the {@value #FORMAT_PROPERTY} property,
 * which picks the {@code STDOUT} or {@code STDOUT_JSON} appender. Only the first call to
 * {@link #configure(Config)} has an effect until {@link #reset()}.
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOG = LoggerFactory.getLogger(LoggingConfigurator.class);
    static final String FORMAT_PROPERTY = "gridrealm.logging.format";

    private static boolean applied = false;

    private LoggingConfigurator() {
    }

    /**
     * Reads the logging section and applies it, once.
     * @param config The application configuration.
     */
    public static void configure(final Config config) {
        if (applied) {
            LOG.debug("Logging already configured, skipping.");
            return;
        }
        applied = true;
        if (!config.hasPath("logging")) {
            LOG.debug("No logging section, keeping logback.xml settings.");
            return;
        }
        try {
            apply(Settings.from(config.getConfig("logging")), (LoggerContext) LoggerFactory.getILoggerFactory());
        } catch (final ConfigException e) {
            LOG.error("Invalid logging section, keeping logback.xml settings.", e);
        }
    }

    private static void apply(final Settings settings, final LoggerContext context) {
        context.putProperty(FORMAT_PROPERTY, settings.appender());
        System.setProperty(FORMAT_PROPERTY, settings.appender());

        if (settings.defaultLevel() != null) {
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(settings.defaultLevel());
        }
        settings.levels().forEach((name, level) -> context.getLogger(name).setLevel(level));
        LOG.debug("Logging set to {} with default level {} and {} logger overrides",
                settings.appender(), settings.defaultLevel(), settings.levels().size());
    }

    /**
     * Forgets that logging was configured. Used by tests.
     */
    public static void reset() {
        applied = false;
    }

    /**
     * The parsed logging section.
     *
     * @param appender The appender name {@code logback.xml} should route to.
     * @param defaultLevel The root level, or null to keep the current one.
     * @param levels Per-logger levels in declaration order.
     */
    private record Settings(String appender, Level defaultLevel, Map<String, Level> levels) {

        static Settings from(final Config logging) {
            final String format = logging.hasPath("format") ? logging.getString("format") : "PLAIN";
            final String appender = "JSON".equalsIgnoreCase(format) ? "STDOUT_JSON" : "STDOUT";

            Level root = null;
            if (logging.hasPath("default-level")) {
                root = parseLevel(logging.getString("default-level"), Logger.ROOT_LOGGER_NAME);
            }

            final Map<String, Level> levels = new LinkedHashMap<>();
            if (logging.hasPath("levels")) {
                for (final Map.Entry<String, ConfigValue> entry : logging.getConfig("levels").root().entrySet()) {
                    final Level level = parseLevel(String.valueOf(entry.getValue().unwrapped()), entry.getKey());
                    if (level != null) {
                        levels.put(entry.getKey(), level);
                    }
                }
            }
            return new Settings(appender, root, levels);
        }

        private static Level parseLevel(final String name, final String loggerName) {
            final Level level = Level.toLevel(name, null);
            if (level == null) {
                LOG.warn("Ignoring unknown log level '{}' for logger '{}'", name, loggerName);
            }
            return level;
        }
    }
}
