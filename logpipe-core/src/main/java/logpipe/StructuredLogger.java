package logpipe;

import logpipe.dispatch.DestinationSlot;
import logpipe.dispatch.LogDispatcher;
import logpipe.dispatch.SlotConfig;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point that turns log calls into {@link LogEntry} values and hands them to a
 * {@link LogDispatcher}.
 *
 * <p>Calls below the logger's threshold level build nothing. Everything else is dispatched
 * to every configured destination; log calls never block on a destination and never throw.
 * Instances are owned by the application's composition root and passed around explicitly.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (StructuredLogger log = StructuredLogger.builder()
 *     .serviceName("checkout")
 *     .level(LogLevel.DEBUG)
 *     .build()) {
 *   log.addDestination(httpSink, SlotConfig.builder()
 *       .minLevel(LogLevel.WARN)
 *       .batchSize(50)
 *       .flushInterval(Duration.ofSeconds(2))
 *       .maxRetries(3)
 *       .retryDelay(Duration.ofMillis(500))
 *       .build());
 *
 *   log.scope("payments").info("charge accepted", Map.of("orderId", "o-42"));
 * }
 * }</pre>
 *
 * @see LogDispatcher
 * @see LogConfig
 */
public final class StructuredLogger implements ScopedLogger, AutoCloseable {
    private final LogDispatcher dispatcher;
    private final Clock clock;
    private volatile LogLevel level;
    private volatile String serviceName;

    private StructuredLogger(Builder builder) {
        this.level = Objects.requireNonNull(builder.level, "level");
        this.serviceName = requireServiceName(builder.serviceName);
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.dispatcher = builder.dispatcher != null ? builder.dispatcher : LogDispatcher.builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static String requireServiceName(String serviceName) {
        Objects.requireNonNull(serviceName, "serviceName");
        if (serviceName.trim().isEmpty()) {
            throw new IllegalArgumentException("serviceName cannot be empty");
        }
        return serviceName;
    }

    @Override
    public void log(LogLevel level, String message, Map<String, ?> metadata) {
        write(level, message, metadata, null, null);
    }

    private void write(LogLevel entryLevel, String message, Map<String, ?> metadata,
            String scope, Map<String, ?> context) {
        if (!entryLevel.isAtLeast(level)) {
            return;
        }
        dispatcher.dispatch(LogEntry.builder(entryLevel, String.valueOf(message))
                .timestamp(clock.instant())
                .service(serviceName)
                .scope(scope)
                .metadata(merge(context, metadata))
                .build());
    }

    // call metadata wins over child context on key collision
    private static Map<String, Object> merge(Map<String, ?> context, Map<String, ?> metadata) {
        if (context == null && metadata == null) {
            return null;
        }
        Map<String, Object> merged = new LinkedHashMap<>();
        if (context != null) {
            merged.putAll(context);
        }
        if (metadata != null) {
            merged.putAll(metadata);
        }
        return merged;
    }

    /**
     * Returns a logger that tags every entry with {@code scope}.
     *
     * @param scope sub-component tag
     * @return the scoped logger
     */
    public ScopedLogger scope(String scope) {
        Objects.requireNonNull(scope, "scope");
        return (entryLevel, message, metadata) -> write(entryLevel, message, metadata, scope, null);
    }

    /**
     * Returns a logger that merges {@code context} into every entry's metadata.
     *
     * @param context fixed metadata
     * @return the child logger
     */
    public ChildLogger child(Map<String, ?> context) {
        Map<String, Object> fixed = new LinkedHashMap<>(Objects.requireNonNull(context, "context"));
        return new ChildLogger() {
            @Override
            public void log(LogLevel entryLevel, String message, Map<String, ?> metadata) {
                write(entryLevel, message, metadata, null, fixed);
            }

            @Override
            public ScopedLogger scope(String scope) {
                Objects.requireNonNull(scope, "scope");
                return (entryLevel, message, metadata) -> write(entryLevel, message, metadata, scope, fixed);
            }
        };
    }

    public TimerHandle time(String label) {
        return time(label, null);
    }

    /**
     * Starts measuring elapsed time. {@link TimerHandle#end} logs at debug level.
     *
     * @param label what is being measured
     * @param scope optional scope for the resulting entry
     * @return the running timer
     */
    public TimerHandle time(String label, String scope) {
        long start = System.nanoTime();
        return metadata -> {
            long elapsedMs = Math.round((System.nanoTime() - start) / 1_000_000.0);
            write(LogLevel.DEBUG, label + " completed in " + elapsedMs + "ms", metadata, scope, null);
        };
    }

    /**
     * Applies {@code config}. A config carrying destinations replaces every slot; entries still
     * queued in the replaced slots are discarded.
     *
     * @param config validated settings
     */
    public void configure(LogConfig config) {
        Objects.requireNonNull(config, "config");
        if (config.destinations() != null) {
            dispatcher.reconfigure(config.destinations());
        }
        if (config.level() != null) {
            this.level = config.level();
        }
        if (config.serviceName() != null) {
            this.serviceName = config.serviceName();
        }
    }

    public DestinationSlot addDestination(Destination destination) {
        return dispatcher.add(destination);
    }

    public DestinationSlot addDestination(Destination destination, SlotConfig config) {
        return dispatcher.add(destination, config);
    }

    /**
     * Flushes every destination.
     *
     * @return a future completing once everything logged before this call is delivered or dropped
     */
    public CompletableFuture<Void> flush() {
        return dispatcher.flushAll();
    }

    public LogLevel getLevel() {
        return level;
    }

    public String getServiceName() {
        return serviceName;
    }

    public LogDispatcher dispatcher() {
        return dispatcher;
    }

    /**
     * Drains and closes the underlying dispatcher.
     */
    @Override
    public void close() {
        dispatcher.close();
    }

    /** Builder for {@link StructuredLogger}. */
    public static final class Builder {
        private LogDispatcher dispatcher;
        private Clock clock;
        private LogLevel level = LogLevel.INFO;
        private String serviceName = "app";

        private Builder() {
        }

        /**
         * Sets the dispatcher entries are handed to. The logger closes it on {@link #close()}.
         *
         * <p>Optional. Defaults to a new dispatcher with no destinations.
         *
         * @param dispatcher the dispatcher
         * @return this builder
         */
        public Builder dispatcher(LogDispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        /**
         * Sets the time source for entry timestamps.
         *
         * <p>Optional. Defaults to {@link Clock#systemUTC()}.
         *
         * @param clock the clock
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Sets the threshold below which log calls are ignored.
         *
         * <p>Optional. Defaults to {@link LogLevel#INFO}.
         *
         * @param level the threshold
         * @return this builder
         */
        public Builder level(LogLevel level) {
            this.level = level;
            return this;
        }

        /**
         * Sets the service name stamped on every entry.
         *
         * <p>Optional. Defaults to {@code "app"}. Must not be blank.
         *
         * @param serviceName the service name
         * @return this builder
         */
        public Builder serviceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        /**
         * @return a new logger
         * @throws IllegalArgumentException if the service name is blank
         */
        public StructuredLogger build() {
            return new StructuredLogger(this);
        }
    }
}
