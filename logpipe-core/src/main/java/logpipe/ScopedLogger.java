package logpipe;

import java.util.Map;

/**
 * Logging methods bound to a fixed scope and context.
 *
 * @see StructuredLogger#scope(String)
 */
public interface ScopedLogger {

    /**
     * Logs a message at {@code level} with optional metadata.
     *
     * @param level    severity
     * @param message  the message
     * @param metadata extra fields, may be {@code null}
     */
    void log(LogLevel level, String message, Map<String, ?> metadata);

    default void debug(String message) {
        log(LogLevel.DEBUG, message, null);
    }

    default void debug(String message, Map<String, ?> metadata) {
        log(LogLevel.DEBUG, message, metadata);
    }

    default void info(String message) {
        log(LogLevel.INFO, message, null);
    }

    default void info(String message, Map<String, ?> metadata) {
        log(LogLevel.INFO, message, metadata);
    }

    default void warn(String message) {
        log(LogLevel.WARN, message, null);
    }

    default void warn(String message, Map<String, ?> metadata) {
        log(LogLevel.WARN, message, metadata);
    }

    default void error(String message) {
        log(LogLevel.ERROR, message, null);
    }

    default void error(String message, Map<String, ?> metadata) {
        log(LogLevel.ERROR, message, metadata);
    }
}
