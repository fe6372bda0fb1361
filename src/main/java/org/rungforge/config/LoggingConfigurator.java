package org.rungforge.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies the {@code logging} block of the configuration to Logback at runtime.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * logging {
 *   format = "PLAIN"          # PLAIN or VERBOSE
 *   default-level = "WARN"
 *   levels {
 *     "org.rungforge.logic.frontend.parser" = "DEBUG"
 *   }
 * }
 * </pre>
 * The format selects one of the appenders of {@code logback.xml} through the
 * {@value #FORMAT_PROPERTY} property. The command line sets that property and reloads Logback
 * before calling {@link #configure(Config)}, since a reload resets all logger levels.
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);

    public static final String FORMAT_PROPERTY = "rungforge.logging.format";
    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String FORMAT_KEY = "format";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";

    private static boolean loggingConfigured = false;

    private LoggingConfigurator() {
    }

    /**
     * Configures the logging system based on the provided configuration.
     * Calling it again has no effect until {@link #reset()} is called.
     *
     * @param config The application configuration containing logging settings.
     */
    public static void configure(final Config config) {
        if (loggingConfigured) {
            LOGGER.debug("Logging already configured, skipping.");
            return;
        }
        loggingConfigured = true;

        if (!config.hasPath(LOGGING_CONFIG_PATH)) {
            LOGGER.debug("No logging configuration found, using Logback defaults.");
            return;
        }

        final Config loggingConfig = config.getConfig(LOGGING_CONFIG_PATH);
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        configureFormat(loggingConfig, context);
        configureDefaultLevel(loggingConfig, context);
        configureSpecificLevels(loggingConfig, context);
        LOGGER.debug("Logging configuration applied successfully.");
    }

    /**
     * Maps the configured format to the name of a {@code logback.xml} appender.
     *
     * @param format The configured format.
     * @return {@code STDOUT} for VERBOSE, {@code STDOUT_PLAIN} otherwise.
     */
    public static String appenderFor(final String format) {
        return "VERBOSE".equalsIgnoreCase(format) ? "STDOUT" : "STDOUT_PLAIN";
    }

    /**
     * Resolves the appender selected by the {@code logging.format} setting of a configuration.
     *
     * @param config The application configuration.
     * @return The appender name, {@code STDOUT_PLAIN} when no format is configured.
     */
    public static String appenderFor(final Config config) {
        final String path = LOGGING_CONFIG_PATH + "." + FORMAT_KEY;
        return appenderFor(config.hasPath(path) ? config.getString(path) : "PLAIN");
    }

    private static void configureFormat(final Config loggingConfig, final LoggerContext context) {
        final String format = loggingConfig.hasPath(FORMAT_KEY) ? loggingConfig.getString(FORMAT_KEY) : "PLAIN";
        final String appender = appenderFor(format);
        // Takes effect when logback.xml is (re)loaded.
        context.putProperty(FORMAT_PROPERTY, appender);
        System.setProperty(FORMAT_PROPERTY, appender);
        LOGGER.debug("Configured logging format: {}", format.toUpperCase());
    }

    private static void configureDefaultLevel(final Config loggingConfig, final LoggerContext context) {
        if (loggingConfig.hasPath(DEFAULT_LEVEL_KEY)) {
            final Level level = Level.toLevel(loggingConfig.getString(DEFAULT_LEVEL_KEY), Level.WARN);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
            LOGGER.debug("Configured default log level: {}", level);
        }
    }

    private static void configureSpecificLevels(final Config loggingConfig, final LoggerContext context) {
        if (!loggingConfig.hasPath(LEVELS_KEY)) {
            return;
        }
        int configuredCount = 0;
        for (final Map.Entry<String, ConfigValue> entry : loggingConfig.getConfig(LEVELS_KEY).root().entrySet()) {
            final String loggerName = entry.getKey();
            final String levelName = String.valueOf(entry.getValue().unwrapped());
            final Level level = Level.toLevel(levelName, null);
            if (level == null) {
                LOGGER.warn("Ignoring unknown level '{}' for logger '{}'", levelName, loggerName);
                continue;
            }
            context.getLogger(loggerName).setLevel(level);
            configuredCount++;
        }
        LOGGER.debug("Configured {} specific logger levels.", configuredCount);
    }

    /**
     * Resets the configuration state. Used by tests.
     */
    public static void reset() {
        loggingConfigured = false;
    }
}
