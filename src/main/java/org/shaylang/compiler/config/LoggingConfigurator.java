package org.shaylang.compiler.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.joran.spi.JoranException;
import ch.qos.logback.core.joran.util.ConfigurationWatchListUtil;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Applies the {@code logging} section of the HOCON configuration to Logback at runtime.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * logging {
 *   format = "PLAIN"        # "PLAIN" or "JSON"
 *   default-level = "WARN"  # level of the root logger
 *   levels {
 *     "org.shaylang.compiler.frontend.parser" = "DEBUG"
 *   }
 * }
 * </pre>
 * <p>
 * {@code logback.xml} picks its console appender from the {@code shaylang.logging.format} property when it is
 * read, so switching the format reloads that file. Levels are applied after the reload.
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String FORMAT_KEY = "format";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";
    /** Property read by logback.xml to pick the console appender. */
    static final String FORMAT_PROPERTY = "shaylang.logging.format";
    static final String PLAIN_APPENDER = "STDOUT_PLAIN";
    static final String JSON_APPENDER = "STDOUT_JSON";

    private static boolean loggingConfigured = false;

    private LoggingConfigurator() {
    }

    /**
     * Configures the logging system. Idempotent: only the first call has an effect until {@link #reset()}.
     *
     * @param config The configuration containing the logging settings.
     */
    public static void configure(final Config config) {
        if (loggingConfigured) {
            LOGGER.debug("Logging already configured, skipping.");
            return;
        }

        if (!config.hasPath(LOGGING_CONFIG_PATH)) {
            LOGGER.debug("No logging configuration found, using Logback defaults.");
            loggingConfigured = true;
            return;
        }

        final Config loggingConfig = config.getConfig(LOGGING_CONFIG_PATH);
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        configureFormat(loggingConfig, context);
        configureDefaultLevel(loggingConfig, context);
        configureSpecificLevels(loggingConfig, context);

        loggingConfigured = true;
        LOGGER.debug("Logging configuration applied.");
    }

    private static void configureFormat(final Config loggingConfig, final LoggerContext context) {
        final String format = loggingConfig.hasPath(FORMAT_KEY) ? loggingConfig.getString(FORMAT_KEY) : "PLAIN";
        final boolean json = "JSON".equalsIgnoreCase(format);
        final String appender = json ? JSON_APPENDER : PLAIN_APPENDER;
        final String replaced = json ? PLAIN_APPENDER : JSON_APPENDER;
        context.putProperty(FORMAT_PROPERTY, appender);
        System.setProperty(FORMAT_PROPERTY, appender);

        // Only the production logback.xml attaches one of the two console appenders.
        if (context.getLogger(Logger.ROOT_LOGGER_NAME).getAppender(replaced) != null) {
            reload(context, appender);
        }
        LOGGER.debug("Configured logging format: {}", appender);
    }

    private static void reload(final LoggerContext context, final String appender) {
        URL source = ConfigurationWatchListUtil.getMainWatchURL(context);
        if (source == null) {
            source = LoggingConfigurator.class.getResource("/logback.xml");
        }
        if (source == null) {
            LOGGER.warn("Cannot switch logging format to {}: logback.xml not found", appender);
            return;
        }

        final List<TurboFilter> turboFilters = new ArrayList<>(context.getTurboFilterList());
        context.reset();
        context.putProperty(FORMAT_PROPERTY, appender);
        for (final TurboFilter filter : turboFilters) {
            filter.start();
            context.addTurboFilter(filter);
        }

        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        try {
            configurator.doConfigure(source);
        } catch (JoranException e) {
            LOGGER.warn("Failed to reload logging configuration from {}", source, e);
        }
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
            final String levelName = entry.getValue().unwrapped().toString();
            final Level level = Level.toLevel(levelName, null);
            if (level == null) {
                LOGGER.warn("Ignoring unknown log level '{}' for logger '{}'", levelName, loggerName);
                continue;
            }
            context.getLogger(loggerName).setLevel(level);
            configuredCount++;
        }
        LOGGER.debug("Configured {} specific logger levels.", configuredCount);
    }

    /**
     * Resets the configured flag so the next {@link #configure(Config)} applies again. Intended for tests.
     */
    public static void reset() {
        loggingConfigured = false;
    }
}
