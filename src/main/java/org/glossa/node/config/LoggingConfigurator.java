package org.glossa.node.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.util.Map;

/**
 * Applies the {@code logging} configuration block to Logback at runtime.
 *
 * <pre>
 * logging {
 *   format = "PLAIN"            # PLAIN or JSON, defaults to PLAIN
 *   default-level = "INFO"      # root logger level
 *   levels {
 *     "org.glossa.workspace" = "DEBUG"
 *   }
 * }
 * </pre>
 *
 * The format is communicated to {@code logback.xml} through the {@value #FORMAT_PROPERTY}
 * property, which selects the {@code STDOUT_PLAIN} or {@code STDOUT_JSON} appender.
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);

    /**
     * Logback property naming the appender to attach to the root logger.
     */
    public static final String FORMAT_PROPERTY = "glossa.logging.format";

    private static final String DEFAULT_APPENDER = "STDOUT_PLAIN";
    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String FORMAT_KEY = "format";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";

    private static boolean loggingConfigured = false;

    private LoggingConfigurator() {
        // Private constructor to prevent instantiation
    }

    /**
     * Configures Logback from the given configuration. Only the first call has an effect.
     *
     * @param config the application configuration
     */
    public static synchronized void configure(final Config config) {
        if (loggingConfigured) {
            LOGGER.debug("Logging already configured, skipping.");
            return;
        }
        loggingConfigured = true;

        if (!config.hasPath(LOGGING_CONFIG_PATH)) {
            LOGGER.debug("No logging configuration found, using Logback defaults.");
            return;
        }

        try {
            final Config loggingConfig = config.getConfig(LOGGING_CONFIG_PATH);
            final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
            configureFormat(loggingConfig, context);
            configureDefaultLevel(loggingConfig, context);
            configureSpecificLevels(loggingConfig, context);
        } catch (final Exception e) {
            LOGGER.error("Failed to configure logging, using Logback defaults.", e);
        }
    }

    private static void configureFormat(final Config loggingConfig, final LoggerContext context) throws JoranException {
        final String format = loggingConfig.hasPath(FORMAT_KEY) ? loggingConfig.getString(FORMAT_KEY) : "PLAIN";
        final String appender = "JSON".equalsIgnoreCase(format) ? "STDOUT_JSON" : DEFAULT_APPENDER;
        final String current = context.getProperty(FORMAT_PROPERTY);
        // logback.xml falls back to STDOUT_PLAIN when the property is unset
        if (appender.equals(current == null ? DEFAULT_APPENDER : current)) {
            return;
        }

        System.setProperty(FORMAT_PROPERTY, appender);
        final URL configUrl = LoggingConfigurator.class.getClassLoader().getResource("logback.xml");
        if (configUrl != null) {
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            context.putProperty(FORMAT_PROPERTY, appender);
            configurator.doConfigure(configUrl);
        } else {
            context.putProperty(FORMAT_PROPERTY, appender);
        }
        LOGGER.debug("Configured logging format: {}", appender);
    }

    private static void configureDefaultLevel(final Config loggingConfig, final LoggerContext context) {
        if (loggingConfig.hasPath(DEFAULT_LEVEL_KEY)) {
            final Level level = Level.toLevel(loggingConfig.getString(DEFAULT_LEVEL_KEY), Level.INFO);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
            LOGGER.debug("Configured default log level: {}", level);
        }
    }

    private static void configureSpecificLevels(final Config loggingConfig, final LoggerContext context) {
        if (!loggingConfig.hasPath(LEVELS_KEY)) {
            return;
        }
        // Logger names contain dots, so read the raw object instead of dot-notation paths
        for (final Map.Entry<String, ConfigValue> entry : loggingConfig.getObject(LEVELS_KEY).entrySet()) {
            final String levelName = entry.getValue().unwrapped().toString();
            context.getLogger(entry.getKey()).setLevel(Level.toLevel(levelName, null));
            LOGGER.debug("Configured logger '{}' to level: {}", entry.getKey(), levelName);
        }
    }

    /**
     * Allows {@link #configure(Config)} to run again. Intended for tests.
     */
    public static synchronized void reset() {
        loggingConfigured = false;
    }
}
