package org.shaylang.junit.extensions.logging;

import ch.qos.logback.classic.Level;

/**
 * Log levels that {@link LogWatchExtension} rules can refer to.
 */
public enum LogLevel {
    DEBUG(Level.DEBUG),
    INFO(Level.INFO),
    WARN(Level.WARN),
    ERROR(Level.ERROR);

    private final Level logback;

    LogLevel(Level logback) {
        this.logback = logback;
    }

    Level toLogback() {
        return logback;
    }
}
