package logpipe;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Ordered severity of a {@link LogEntry}: {@code DEBUG < INFO < WARN < ERROR}.
 */
public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR;

    /**
     * Returns {@code true} if this level ranks at or above {@code threshold}.
     *
     * @param threshold the minimum level
     * @return whether an entry at this level passes the threshold
     */
    public boolean isAtLeast(LogLevel threshold) {
        return compareTo(threshold) >= 0;
    }

    /** Lower-case wire name, e.g. {@code "warn"}. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a level name, ignoring case and surrounding whitespace.
     *
     * @param value the level name
     * @return the matching level
     * @throws IllegalArgumentException if {@code value} names no level
     */
    public static LogLevel parse(String value) {
        Objects.requireNonNull(value, "level");
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (LogLevel level : values()) {
            if (level.name().equals(normalized)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Invalid log level: \"" + value + "\". Must be one of: "
                + Arrays.stream(values()).map(LogLevel::label).collect(Collectors.joining(", ")));
    }
}
