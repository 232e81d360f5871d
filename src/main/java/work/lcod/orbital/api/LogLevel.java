package work.lcod.orbital.api;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import java.util.Locale;
import org.slf4j.LoggerFactory;

/**
 * Runtime log thresholds accepted by the CLI and scenario runs.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    FATAL;

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return FATAL;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }

    /**
     * Logback level for this threshold; FATAL silences everything below ERROR-level failures.
     */
    public Level toLogbackLevel() {
        return switch (this) {
            case TRACE -> Level.TRACE;
            case DEBUG -> Level.DEBUG;
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
            case FATAL -> Level.OFF;
        };
    }

    /**
     * Applies this threshold to the {@code work.lcod.orbital} loggers.
     */
    public void apply() {
        if (LoggerFactory.getLogger("work.lcod.orbital") instanceof Logger logger) {
            logger.setLevel(toLogbackLevel());
        }
    }
}
