package logpipe.dispatch;

import logpipe.LogEntry;
import logpipe.LogLevel;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Resolved, immutable delivery settings for one destination: filtering, batching,
 * rate limiting and retry.
 *
 * <p>{@link #defaults()} is immediate, unbuffered, unfiltered, unlimited delivery with no
 * retry. Create customised instances via {@link #builder()}.
 *
 * @see DestinationSlot
 */
public final class SlotConfig {
  private static final SlotConfig DEFAULTS = builder().build();

  private final String name;
  private final LogLevel minLevel;
  private final Predicate<LogEntry> filter;
  private final int batchSize;
  private final Duration flushInterval;
  private final int maxQueueSize;
  private final int rateLimit;
  private final int maxRetries;
  private final RetryPolicy retryPolicy;

  private SlotConfig(Builder builder) {
    if (builder.batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be >= 1, got: " + builder.batchSize);
    }
    requireNonNegative(builder.flushInterval, "flushInterval");
    if (builder.maxQueueSize < 0) {
      throw new IllegalArgumentException("maxQueueSize must be >= 0, got: " + builder.maxQueueSize);
    }
    if (builder.rateLimit < 0) {
      throw new IllegalArgumentException("rateLimit must be >= 0, got: " + builder.rateLimit);
    }
    if (builder.maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0, got: " + builder.maxRetries);
    }
    if (builder.name != null && builder.name.isBlank()) {
      throw new IllegalArgumentException("name cannot be blank");
    }
    this.name = builder.name;
    this.minLevel = builder.minLevel;
    this.filter = builder.filter;
    this.batchSize = builder.batchSize;
    this.flushInterval = builder.flushInterval;
    this.maxQueueSize = builder.maxQueueSize;
    this.rateLimit = builder.rateLimit;
    this.maxRetries = builder.maxRetries;
    if (builder.retryPolicy != null) {
      this.retryPolicy = builder.retryPolicy;
    } else {
      requireNonNegative(builder.retryDelay, "retryDelay");
      this.retryPolicy = RetryPolicy.fixed(builder.retryDelay);
    }
  }

  private static void requireNonNegative(Duration value, String field) {
    Objects.requireNonNull(value, field);
    if (value.isNegative()) {
      throw new IllegalArgumentException(field + " must be >= 0, got: " + value);
    }
  }

  public static SlotConfig defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Slot name for diagnostics and metric tags, or {@code null} to let the dispatcher assign one. */
  public String name() {
    return name;
  }

  /** Minimum level admitted, or {@code null} for no level filtering. */
  public LogLevel minLevel() {
    return minLevel;
  }

  /** Admission predicate, or {@code null} to admit everything. */
  public Predicate<LogEntry> filter() {
    return filter;
  }

  public int batchSize() {
    return batchSize;
  }

  public Duration flushInterval() {
    return flushInterval;
  }

  public int maxQueueSize() {
    return maxQueueSize;
  }

  public int rateLimit() {
    return rateLimit;
  }

  public int maxRetries() {
    return maxRetries;
  }

  public RetryPolicy retryPolicy() {
    return retryPolicy;
  }

  @Override
  public String toString() {
    return "SlotConfig{name=" + name
        + ", minLevel=" + minLevel
        + ", batchSize=" + batchSize
        + ", flushInterval=" + flushInterval
        + ", maxQueueSize=" + maxQueueSize
        + ", rateLimit=" + rateLimit
        + ", maxRetries=" + maxRetries + '}';
  }

  /** Builder for {@link SlotConfig}. */
  public static final class Builder {
    private String name;
    private LogLevel minLevel;
    private Predicate<LogEntry> filter;
    private int batchSize = 1;
    private Duration flushInterval = Duration.ZERO;
    private int maxQueueSize;
    private int rateLimit;
    private int maxRetries;
    private Duration retryDelay = Duration.ZERO;
    private RetryPolicy retryPolicy;

    private Builder() {
    }

    /**
     * Sets the slot name used in diagnostics and metric tags.
     *
     * <p>Optional. Defaults to {@code destination-<n>}, assigned by the dispatcher.
     *
     * @param name the slot name
     * @return this builder
     */
    public Builder name(String name) {
      this.name = name;
      return this;
    }

    /**
     * Drops entries ranked below {@code minLevel}.
     *
     * <p>Optional. Defaults to no level filtering.
     *
     * @param minLevel the threshold
     * @return this builder
     */
    public Builder minLevel(LogLevel minLevel) {
      this.minLevel = minLevel;
      return this;
    }

    /**
     * Drops entries for which {@code filter} returns {@code false}. A predicate that throws
     * counts as a rejection.
     *
     * <p>Optional. Defaults to admitting everything.
     *
     * @param filter the admission predicate
     * @return this builder
     */
    public Builder filter(Predicate<LogEntry> filter) {
      this.filter = filter;
      return this;
    }

    /**
     * Sets how many queued entries trigger a write.
     *
     * <p>Optional. Defaults to {@code 1} (write every entry immediately). Must be &ge; 1.
     *
     * @param batchSize entries per batch
     * @return this builder
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets how long a partial batch may wait before it is written anyway.
     *
     * <p>Optional. Defaults to {@link Duration#ZERO}: partial batches wait for more entries
     * or an explicit flush.
     *
     * @param flushInterval maximum wait for a partial batch
     * @return this builder
     */
    public Builder flushInterval(Duration flushInterval) {
      this.flushInterval = flushInterval;
      return this;
    }

    /**
     * Caps the number of queued entries; the oldest are evicted first.
     *
     * <p>Optional. Defaults to {@code 0} (unbounded). Must be &ge; 0.
     *
     * @param maxQueueSize queue capacity
     * @return this builder
     */
    public Builder maxQueueSize(int maxQueueSize) {
      this.maxQueueSize = maxQueueSize;
      return this;
    }

    /**
     * Caps admissions per one-second window.
     *
     * <p>Optional. Defaults to {@code 0} (unlimited). Must be &ge; 0.
     *
     * @param rateLimit entries per second
     * @return this builder
     */
    public Builder rateLimit(int rateLimit) {
      this.rateLimit = rateLimit;
      return this;
    }

    /**
     * Sets how many times a failed write is attempted again before the batch is dropped.
     *
     * <p>Optional. Defaults to {@code 0}. Must be &ge; 0.
     *
     * @param maxRetries retries per batch
     * @return this builder
     */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    /**
     * Sets a fixed wait between write attempts. Ignored when a {@link #retryPolicy} is set.
     *
     * <p>Optional. Defaults to {@link Duration#ZERO}.
     *
     * @param retryDelay delay between attempts
     * @return this builder
     */
    public Builder retryDelay(Duration retryDelay) {
      this.retryDelay = retryDelay;
      return this;
    }

    /**
     * Sets a custom policy for the wait between attempts, e.g.
     * {@link ExponentialBackoffRetryPolicy}.
     *
     * <p>Optional. Defaults to {@link RetryPolicy#fixed} with the {@link #retryDelay}.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * @return a new immutable config
     * @throws IllegalArgumentException if any numeric setting is out of range or the name is blank
     * @throws NullPointerException     if a duration is null
     */
    public SlotConfig build() {
      return new SlotConfig(this);
    }
  }
}
