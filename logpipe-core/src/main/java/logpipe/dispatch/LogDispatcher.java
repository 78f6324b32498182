package logpipe.dispatch;

import logpipe.Destination;
import logpipe.LogEntry;
import logpipe.spi.PipelineMetrics;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fans log entries out to an ordered set of {@link DestinationSlot}s and coordinates their
 * flush and teardown.
 *
 * <p>{@link #dispatch} never blocks and never throws. Writes run on a cached pool of daemon
 * threads, so a slow or hung destination only holds up its own slot; flush timers and retry
 * delays share one daemon scheduler. Slots are independent: there is no ordering between
 * destinations.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe and implements
 * {@link AutoCloseable} for graceful shutdown with a configurable drain timeout.
 *
 * @see LogDispatcher.Builder
 * @see DestinationSlot
 */
public final class LogDispatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(LogDispatcher.class.getName());

  private final ExecutorService writers;
  private final ScheduledExecutorService scheduler;
  private final Clock clock;
  private final PipelineMetrics metrics;
  private final long drainTimeoutMs;
  private final AtomicBoolean accepting = new AtomicBoolean(true);

  private volatile List<DestinationSlot> slots = List.of();
  private boolean closed;

  private LogDispatcher(Builder builder) {
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.metrics = builder.metrics != null ? builder.metrics : PipelineMetrics.NOOP;
    this.drainTimeoutMs = builder.drainTimeoutMs;
    List<PendingSlot> initial = buildSlots(builder.bindings);

    this.writers = Executors.newCachedThreadPool(new PipelineThreadFactory(builder.threadNamePrefix + "writer-"));
    this.scheduler = Executors.newSingleThreadScheduledExecutor(
        new PipelineThreadFactory(builder.threadNamePrefix + "timer-"));
    this.slots = Collections.unmodifiableList(attach(initial, 0));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Hands an entry to every active slot, in slot order. Entries dispatched after
   * {@link #close()} are ignored.
   *
   * @param entry the entry to deliver
   */
  public void dispatch(LogEntry entry) {
    if (entry == null || !accepting.get()) {
      return;
    }
    for (DestinationSlot slot : slots) {
      try {
        slot.enqueue(entry);
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Enqueue failed for destination " + slot.name(), e);
      }
    }
  }

  /**
   * Replaces every slot. The current slots are destroyed first: their timers are cancelled
   * and anything still queued in them is discarded, not flushed. Writes already in flight
   * finish in the background.
   *
   * @param bindings destinations and their settings, in dispatch order
   * @throws IllegalStateException if the dispatcher has been closed
   */
  public synchronized void reconfigure(List<DestinationBinding> bindings) {
    List<PendingSlot> pending = buildSlots(bindings);
    ensureOpen();
    for (DestinationSlot slot : slots) {
      slot.destroy();
    }
    slots = Collections.unmodifiableList(attach(pending, 0));
  }

  /**
   * Appends a slot without disturbing the existing ones.
   *
   * @param destination the destination
   * @param config      its settings; {@code null} for {@link SlotConfig#defaults()}
   * @return the new slot
   * @throws IllegalStateException if the dispatcher has been closed
   */
  public synchronized DestinationSlot add(Destination destination, SlotConfig config) {
    List<PendingSlot> pending = buildSlots(List.of(new DestinationBinding(destination, config)));
    ensureOpen();
    List<DestinationSlot> attached = attach(pending, slots.size());
    List<DestinationSlot> next = new ArrayList<>(slots);
    next.addAll(attached);
    slots = Collections.unmodifiableList(next);
    return attached.get(0);
  }

  /**
   * Appends a slot with the default (immediate, unfiltered) settings.
   *
   * @param destination the destination
   * @return the new slot
   */
  public DestinationSlot add(Destination destination) {
    return add(destination, SlotConfig.defaults());
  }

  /**
   * Flushes every active slot concurrently.
   *
   * @return a future completing once every slot has drained what it held at call time;
   *     never completes exceptionally
   */
  public CompletableFuture<Void> flushAll() {
    List<DestinationSlot> snapshot = slots;
    CompletableFuture<?>[] flushes = new CompletableFuture<?>[snapshot.size()];
    for (int i = 0; i < flushes.length; i++) {
      flushes[i] = snapshot.get(i).flush();
    }
    return CompletableFuture.allOf(flushes);
  }

  /** The active slots, in dispatch order. */
  public List<DestinationSlot> slots() {
    return slots;
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("LogDispatcher has been closed");
    }
  }

  private List<PendingSlot> buildSlots(List<DestinationBinding> bindings) {
    Objects.requireNonNull(bindings, "bindings");
    List<PendingSlot> pending = new ArrayList<>(bindings.size());
    for (DestinationBinding binding : bindings) {
      Objects.requireNonNull(binding, "bindings must not contain null elements");
      pending.add(new PendingSlot(binding.destination(), binding.config()));
    }
    return pending;
  }

  // Unnamed slots are named after their 1-based position, so a reconfigure reuses names
  private List<DestinationSlot> attach(List<PendingSlot> pending, int offset) {
    List<DestinationSlot> attached = new ArrayList<>(pending.size());
    for (int i = 0; i < pending.size(); i++) {
      PendingSlot p = pending.get(i);
      String name = p.config().name() != null ? p.config().name() : "destination-" + (offset + i + 1);
      attached.add(new DestinationSlot(name, p.destination(), p.config(), writers, scheduler, clock, metrics));
    }
    return attached;
  }

  private record PendingSlot(Destination destination, SlotConfig config) {
  }

  /**
   * Stops accepting entries, flushes every slot within the configured drain timeout,
   * then destroys the slots and releases the dispatcher threads. Idempotent.
   */
  @Override
  public void close() {
    synchronized (this) {
      if (closed) {
        return;
      }
      closed = true;
    }
    accepting.set(false);
    try {
      flushAll().get(drainTimeoutMs, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      logger.log(Level.WARNING, "Drain timeout exceeded; abandoning pending writes on "
          + slots.size() + " destinations");
    } catch (ExecutionException e) {
      logger.log(Level.SEVERE, "Flush failed during shutdown", e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    RuntimeException first = null;
    synchronized (this) {
      for (DestinationSlot slot : slots) {
        try {
          slot.destroy();
        } catch (RuntimeException e) {
          if (first == null) first = e; else first.addSuppressed(e);
        }
      }
      slots = List.of();
    }
    scheduler.shutdownNow();
    writers.shutdown();
    if (first != null) throw first;
  }

  /** Builder for {@link LogDispatcher}. */
  public static final class Builder {
    private final List<DestinationBinding> bindings = new ArrayList<>();
    private Clock clock;
    private PipelineMetrics metrics;
    private long drainTimeoutMs = 5000;
    private String threadNamePrefix = "logpipe-";

    private Builder() {
    }

    /**
     * Adds a destination with the default settings to the initial slot set.
     *
     * @param destination the destination
     * @return this builder
     */
    public Builder destination(Destination destination) {
      return destination(destination, SlotConfig.defaults());
    }

    /**
     * Adds a destination to the initial slot set. Slots receive entries in the order
     * they were added.
     *
     * @param destination the destination
     * @param config      its settings
     * @return this builder
     */
    public Builder destination(Destination destination, SlotConfig config) {
      this.bindings.add(new DestinationBinding(destination, config));
      return this;
    }

    /**
     * Sets the time source for rate-limit windows.
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
     * Sets the metrics exporter for per-destination counters.
     *
     * <p>Optional. Defaults to {@link PipelineMetrics#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(PipelineMetrics metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the maximum time in milliseconds {@link #close()} waits for pending writes.
     *
     * <p>Optional. Defaults to {@code 5000} ms. Must be &ge; 0.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Sets the prefix for writer and timer thread names.
     *
     * <p>Optional. Defaults to {@code "logpipe-"}.
     *
     * @param threadNamePrefix thread name prefix
     * @return this builder
     */
    public Builder threadNamePrefix(String threadNamePrefix) {
      this.threadNamePrefix = Objects.requireNonNull(threadNamePrefix, "threadNamePrefix");
      return this;
    }

    /**
     * Builds the dispatcher and its initial slots.
     *
     * @return a new {@link LogDispatcher}
     * @throws IllegalArgumentException if {@code drainTimeoutMs < 0}
     */
    public LogDispatcher build() {
      return new LogDispatcher(this);
    }
  }
}
