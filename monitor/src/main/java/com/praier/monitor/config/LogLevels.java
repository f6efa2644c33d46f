package com.praier.monitor.config;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Set;

/**
 * Applies the configured log level to the Logback root logger.
 */
public final class LogLevels {

    static final Set<String> SUPPORTED = Set.of("TRACE", "DEBUG", "INFO", "WARN", "WARNING", "ERROR");

    private LogLevels() {
    }

    public static boolean isSupported(String level) {
        return level != null && SUPPORTED.contains(level.trim().toUpperCase(Locale.ROOT));
    }

    public static void apply(String level) {
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(toLevel(level));
        }
    }

    static Level toLevel(String level) {
        if (level == null) {
            return Level.INFO;
        }
        String normalized = level.trim().toUpperCase(Locale.ROOT);
        if ("WARNING".equals(normalized)) {
            return Level.WARN;
        }
        return Level.toLevel(normalized, Level.INFO);
    }
}
