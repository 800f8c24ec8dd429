package org.shaylang.compiler.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.ConfigFactory;
import org.shaylang.junit.extensions.logging.AllowLog;
import org.shaylang.junit.extensions.logging.ExpectLog;
import org.shaylang.junit.extensions.logging.LogLevel;
import org.shaylang.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests that the {@code logging} section is applied to the Logback context.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LoggingConfiguratorTest {

    private static final String NOISY_LOGGER = "com.example.noisy";

    private LoggerContext context;
    private Level originalRootLevel;
    private boolean productionConfigLoaded;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        context = (LoggerContext) LoggerFactory.getILoggerFactory();
        originalRootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void restoreLogging() throws JoranException {
        LoggingConfigurator.reset();
        System.clearProperty(LoggingConfigurator.FORMAT_PROPERTY);
        if (productionConfigLoaded) {
            loadLogbackConfiguration("/logback-test.xml");
        }
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(originalRootLevel);
        context.getLogger(NOISY_LOGGER).setLevel(null);
        context.putProperty(LoggingConfigurator.FORMAT_PROPERTY, "STDOUT_PLAIN");
    }

    /** Replaces the context configuration, keeping the log watch filter installed for the test. */
    private void loadLogbackConfiguration(String resource) throws JoranException {
        List<TurboFilter> filters = new ArrayList<>(context.getTurboFilterList());
        context.reset();
        for (TurboFilter filter : filters) {
            filter.start();
            context.addTurboFilter(filter);
        }
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        configurator.doConfigure(getClass().getResource(resource));
    }

    @Test
    void configure_appliesLevelsAndFormat() {
        // Arrange
        String hocon = "logging { format = \"json\", default-level = \"ERROR\", levels { \"" + NOISY_LOGGER + "\" = \"TRACE\" } }";

        // Act
        LoggingConfigurator.configure(ConfigFactory.parseString(hocon));

        // Assert
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(context.getLogger(NOISY_LOGGER).getLevel()).isEqualTo(Level.TRACE);
        assertThat(System.getProperty(LoggingConfigurator.FORMAT_PROPERTY)).isEqualTo("STDOUT_JSON");
    }

    @Test
    void configure_switchesConsoleAppenderToJson() throws JoranException {
        // Arrange
        productionConfigLoaded = true;
        loadLogbackConfiguration("/logback.xml");
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        assertThat(root.getAppender(LoggingConfigurator.PLAIN_APPENDER)).isNotNull();

        // Act
        LoggingConfigurator.configure(ConfigFactory.parseString("logging { format = \"JSON\", default-level = \"ERROR\" }"));

        // Assert
        root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        assertThat(root.getAppender(LoggingConfigurator.JSON_APPENDER)).isNotNull();
        assertThat(root.getAppender(LoggingConfigurator.PLAIN_APPENDER)).isNull();
        assertThat(root.getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    void configure_keepsPlainAppenderWithoutReload() throws JoranException {
        productionConfigLoaded = true;
        loadLogbackConfiguration("/logback.xml");
        Appender<ILoggingEvent> plain = context.getLogger(Logger.ROOT_LOGGER_NAME).getAppender(LoggingConfigurator.PLAIN_APPENDER);

        LoggingConfigurator.configure(ConfigFactory.parseString("logging.format = \"plain\""));

        assertThat(plain).isNotNull();
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getAppender(LoggingConfigurator.PLAIN_APPENDER)).isSameAs(plain);
    }

    @Test
    void configure_isIdempotentUntilReset() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"" + NOISY_LOGGER + "\" = \"DEBUG\" }"));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"" + NOISY_LOGGER + "\" = \"ERROR\" }"));

        assertThat(context.getLogger(NOISY_LOGGER).getLevel()).isEqualTo(Level.DEBUG);

        LoggingConfigurator.reset();
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"" + NOISY_LOGGER + "\" = \"ERROR\" }"));

        assertThat(context.getLogger(NOISY_LOGGER).getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    void configure_defaultsToPlainFormat() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels {}"));

        assertThat(System.getProperty(LoggingConfigurator.FORMAT_PROPERTY)).isEqualTo("STDOUT_PLAIN");
    }

    /**
     * Verifies that an unknown level is reported and leaves the logger untouched.
     */
    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*LoggingConfigurator",
            messagePattern = "Ignoring unknown log level 'LOUD' for logger 'com.example.noisy'")
    void configure_warnsAboutUnknownLevel() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"" + NOISY_LOGGER + "\" = \"LOUD\" }"));

        assertThat(context.getLogger(NOISY_LOGGER).getLevel()).isNull();
    }

    @Test
    @AllowLog(level = LogLevel.WARN, messagePattern = "Ignoring unknown log level .*")
    void configure_appliesValidLevelsDespiteUnknownOnes() {
        LoggingConfigurator.configure(ConfigFactory.parseString(
                "logging.levels { \"com.example.quiet\" = \"verbose\", \"" + NOISY_LOGGER + "\" = \"INFO\" }"));

        assertThat(context.getLogger(NOISY_LOGGER).getLevel()).isEqualTo(Level.INFO);
        assertThat(context.getLogger("com.example.quiet").getLevel()).isNull();
    }

    @Test
    void configure_withoutLoggingSectionChangesNothing() {
        LoggingConfigurator.configure(ConfigFactory.empty());

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(originalRootLevel);
        assertThat(System.getProperty(LoggingConfigurator.FORMAT_PROPERTY)).isNull();
    }
}
