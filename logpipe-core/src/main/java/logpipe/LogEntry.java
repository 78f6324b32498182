package logpipe;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable log record carried through the delivery pipeline.
 *
 * <p>Each entry is assigned a ULID-based {@code id} at creation so sinks can recognise
 * a batch redelivered after a retry. Metadata is kept as its own field and never merged
 * into the record's top level; one instance may be shared by every destination.
 *
 * @see LogBatch
 * @see StructuredLogger
 */
public final class LogEntry {
    private final String id;
    private final LogLevel level;
    private final String message;
    private final Instant timestamp;
    private final String service;
    private final String scope;
    private final Map<String, Object> metadata;

    private LogEntry(Builder builder) {
        this.id = builder.id == null ? UlidCreator.getMonotonicUlid().toString() : builder.id;
        this.level = Objects.requireNonNull(builder.level, "level");
        this.message = Objects.requireNonNull(builder.message, "message");
        this.timestamp = builder.timestamp == null ? Instant.now() : builder.timestamp;
        this.service = Objects.requireNonNull(builder.service, "service");
        this.scope = builder.scope;
        this.metadata = builder.metadata == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    }

    /**
     * Creates a builder for an entry at the given level.
     *
     * @param level   severity
     * @param message log message
     * @return a new builder
     */
    public static Builder builder(LogLevel level, String message) {
        return new Builder(level, message);
    }

    /**
     * Creates an entry with no scope or metadata, timestamped now.
     *
     * @param level   severity
     * @param message log message
     * @param service emitting service name
     * @return a new entry
     */
    public static LogEntry of(LogLevel level, String message, String service) {
        return builder(level, message).service(service).build();
    }

    public String id() {
        return id;
    }

    public LogLevel level() {
        return level;
    }

    public String message() {
        return message;
    }

    public Instant timestamp() {
        return timestamp;
    }

    public String service() {
        return service;
    }

    /**
     * Returns the sub-component tag, or {@code null} if the entry is unscoped.
     *
     * @return the scope, or {@code null}
     */
    public String scope() {
        return scope;
    }

    /** Unmodifiable caller-supplied metadata; empty, never {@code null}. */
    public Map<String, Object> metadata() {
        return metadata;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("LogEntry{id=").append(id)
                .append(", level=").append(level.label())
                .append(", service=").append(service);
        if (scope != null) {
            sb.append(", scope=").append(scope);
        }
        return sb.append(", message=").append(message).append('}').toString();
    }

    /** Builder for {@link LogEntry}. */
    public static final class Builder {
        private String id;
        private final LogLevel level;
        private final String message;
        private Instant timestamp;
        private String service;
        private String scope;
        private Map<String, Object> metadata;

        private Builder(LogLevel level, String message) {
            this.level = level;
            this.message = message;
        }

        /** Overrides the generated id; intended for replay and tests. */
        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder service(String service) {
            this.service = service;
            return this;
        }

        public Builder scope(String scope) {
            this.scope = scope;
            return this;
        }

        public Builder metadata(Map<String, ?> metadata) {
            this.metadata = metadata == null ? null : new LinkedHashMap<>(metadata);
            return this;
        }

        /**
         * @return a new immutable entry
         * @throws NullPointerException if level, message or service is null
         */
        public LogEntry build() {
            return new LogEntry(this);
        }
    }
}
