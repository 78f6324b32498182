package logpipe;

import logpipe.dispatch.DestinationBinding;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Settings applied by {@link StructuredLogger#configure(LogConfig)}. Fields left unset keep
 * the logger's current value.
 *
 * <p>Validation happens in {@link Builder#build()}, so an invalid level or service name is
 * reported before any destination is touched.
 */
public final class LogConfig {
    private final LogLevel level;
    private final String serviceName;
    private final List<DestinationBinding> destinations;

    private LogConfig(LogLevel level, String serviceName, List<DestinationBinding> destinations) {
        this.level = level;
        this.serviceName = serviceName;
        this.destinations = destinations;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Threshold level, or {@code null} to keep the current one. */
    public LogLevel level() {
        return level;
    }

    /** Service name, or {@code null} to keep the current one. */
    public String serviceName() {
        return serviceName;
    }

    /** Replacement destinations, or {@code null} to keep the current slots. */
    public List<DestinationBinding> destinations() {
        return destinations;
    }

    /** Builder for {@link LogConfig}. */
    public static final class Builder {
        private String levelName;
        private LogLevel level;
        private String serviceName;
        private List<DestinationBinding> destinations;

        private Builder() {
        }

        public Builder level(LogLevel level) {
            this.level = level;
            this.levelName = null;
            return this;
        }

        /**
         * Sets the level by name, e.g. from an environment variable. Parsed in {@link #build()}.
         */
        public Builder level(String levelName) {
            this.levelName = levelName;
            this.level = null;
            return this;
        }

        public Builder serviceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        /**
         * Replaces all destinations. An empty list removes every destination.
         */
        public Builder destinations(List<DestinationBinding> destinations) {
            this.destinations = new ArrayList<>(Objects.requireNonNull(destinations, "destinations"));
            return this;
        }

        /**
         * @return the validated config
         * @throws IllegalArgumentException if the level name is unknown or the service name is blank
         */
        public LogConfig build() {
            LogLevel resolved = levelName != null ? LogLevel.parse(levelName) : level;
            if (serviceName != null && serviceName.trim().isEmpty()) {
                throw new IllegalArgumentException("serviceName cannot be empty");
            }
            if (destinations != null && destinations.contains(null)) {
                throw new NullPointerException("destinations must not contain null elements");
            }
            return new LogConfig(resolved, serviceName,
                    destinations == null ? null : List.copyOf(destinations));
        }
    }
}
