package work.lcod.scriptgen.api;

import java.util.Locale;

import ch.qos.logback.classic.Level;
import org.slf4j.LoggerFactory;

/**
 * Log threshold for the engine's loggers. {@code FATAL} silences them.
 */
public enum LogLevel {
    TRACE(Level.TRACE),
    DEBUG(Level.DEBUG),
    INFO(Level.INFO),
    WARN(Level.WARN),
    ERROR(Level.ERROR),
    FATAL(Level.OFF);

    static final String ENGINE_LOGGER = "work.lcod.scriptgen";

    private final Level level;

    LogLevel(Level level) {
        this.level = level;
    }

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return WARN;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }

    /** Sets the threshold of every engine logger when Logback is the active binding. */
    public void apply() {
        if (LoggerFactory.getLogger(ENGINE_LOGGER) instanceof ch.qos.logback.classic.Logger logger) {
            logger.setLevel(level);
        }
    }
}
