package logpipe.dispatch;

import logpipe.Destination;
import logpipe.LogBatch;
import logpipe.LogEntry;
import logpipe.spi.PipelineMetrics;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Delivery state for one {@link Destination}: its pending queue, lazy flush timer,
 * rate-limit window and single in-flight write.
 *
 * <p>{@link #enqueue} runs on the logging thread and only filters, counts and queues; writes
 * always run on the dispatcher's writer pool. At most one write per slot is outstanding at
 * any time and batches reach the destination in admission order. Failed writes are retried
 * per {@link SlotConfig} and then dropped; nothing is ever thrown back to the caller.
 *
 * <p>Slots are created by {@link LogDispatcher}. This class is thread-safe: all state is
 * guarded by a per-slot monitor, and destination code never runs while it is held.
 */
public final class DestinationSlot {
  private static final Logger logger = Logger.getLogger(DestinationSlot.class.getName());

  private final String name;
  private final Destination destination;
  private final SlotConfig config;
  private final Executor writers;
  private final ScheduledExecutorService scheduler;
  private final PipelineMetrics metrics;

  private final Object lock = new Object();
  private final EvictingQueue queue;
  private final RateLimiter rateLimiter;
  private ScheduledFuture<?> pendingTimer;
  private long timerGeneration;
  private CompletableFuture<Void> inFlight;
  private boolean flushRequested;
  private boolean destroyed;

  DestinationSlot(String name, Destination destination, SlotConfig config,
      Executor writers, ScheduledExecutorService scheduler, Clock clock, PipelineMetrics metrics) {
    this.name = Objects.requireNonNull(name, "name");
    this.destination = Objects.requireNonNull(destination, "destination");
    this.config = Objects.requireNonNull(config, "config");
    this.writers = Objects.requireNonNull(writers, "writers");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.queue = new EvictingQueue(config.maxQueueSize());
    this.rateLimiter = new RateLimiter(config.rateLimit(), clock);
  }

  public String name() {
    return name;
  }

  public SlotConfig config() {
    return config;
  }

  /** Number of admitted entries waiting for a write. */
  public int queued() {
    synchronized (lock) {
      return queue.size();
    }
  }

  public boolean isDestroyed() {
    synchronized (lock) {
      return destroyed;
    }
  }

  /**
   * Runs an entry through level filter, predicate and rate limit, queues it, and either
   * starts a write or arms the flush timer. Never blocks on the destination and never throws.
   *
   * @param entry the entry to deliver
   */
  public void enqueue(LogEntry entry) {
    if (entry == null) {
      return;
    }
    if (!passesFilters(entry)) {
      metrics.incrementFiltered(name);
      return;
    }
    synchronized (lock) {
      if (destroyed) {
        return;
      }
      if (rateLimiter.isLimited()) {
        metrics.incrementRateLimited(name);
        if (logger.isLoggable(Level.FINE)) {
          logger.fine("Rate limit reached for destination " + name + "; entry dropped");
        }
        return;
      }
      int evicted = queue.add(entry);
      metrics.incrementAdmitted(name);
      for (int i = 0; i < evicted; i++) {
        metrics.incrementEvicted(name);
      }
      if (evicted > 0 && logger.isLoggable(Level.FINE)) {
        logger.fine("Queue full for destination " + name + "; evicted " + evicted + " oldest entries");
      }

      if (config.batchSize() <= 1 || queue.size() >= config.batchSize()) {
        if (inFlight == null) {
          startWrite();
        } else {
          // picked up when the in-flight write completes
          flushRequested = true;
        }
      } else {
        armTimer();
      }
    }
  }

  private boolean passesFilters(LogEntry entry) {
    if (config.minLevel() != null && !entry.level().isAtLeast(config.minLevel())) {
      return false;
    }
    if (config.filter() == null) {
      return true;
    }
    try {
      return config.filter().test(entry);
    } catch (RuntimeException e) {
      logger.log(Level.FINE, "Filter for destination " + name + " threw; entry dropped", e);
      return false;
    }
  }

  /**
   * Writes everything queued so far. If a write is in flight, waits for it and re-evaluates,
   * so the returned future completes only once every entry queued before this call has been
   * accepted by the destination or dropped after its retries. Never completes exceptionally.
   *
   * @return a future completing when the queue has been drained
   */
  public CompletableFuture<Void> flush() {
    synchronized (lock) {
      if (inFlight != null) {
        return inFlight.thenCompose(ignored -> flush());
      }
      if (queue.isEmpty()) {
        return CompletableFuture.completedFuture(null);
      }
      return startWrite();
    }
  }

  /**
   * Cancels the flush timer and discards queued entries. A write already in flight runs to
   * completion; nothing is queued or scheduled afterwards. Idempotent.
   */
  public void destroy() {
    synchronized (lock) {
      if (destroyed) {
        return;
      }
      destroyed = true;
      cancelTimer();
      flushRequested = false;
      int discarded = queue.drain().size();
      if (discarded > 0) {
        logger.fine("Destination " + name + " destroyed with " + discarded + " queued entries discarded");
      }
    }
  }

  // Caller holds lock and has checked inFlight == null
  private CompletableFuture<Void> startWrite() {
    cancelTimer();
    LogBatch batch = LogBatch.of(queue.drain());
    CompletableFuture<Void> done = new CompletableFuture<>();
    inFlight = done;
    submitAttempt(batch, 0, done);
    return done;
  }

  private void armTimer() {
    Duration interval = config.flushInterval();
    if (pendingTimer != null || interval.isZero()) {
      return;
    }
    long generation = ++timerGeneration;
    try {
      pendingTimer = scheduler.schedule(() -> onTimer(generation),
          interval.toMillis(), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      logger.log(Level.FINE, "Flush timer rejected for destination " + name, e);
    }
  }

  private void onTimer(long generation) {
    try {
      synchronized (lock) {
        if (generation != timerGeneration || pendingTimer == null) {
          return;
        }
        pendingTimer = null;
      }
      flush();
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Flush timer failed for destination " + name, e);
    }
  }

  private void cancelTimer() {
    if (pendingTimer != null) {
      pendingTimer.cancel(false);
      pendingTimer = null;
      timerGeneration++;
    }
  }

  private void submitAttempt(LogBatch batch, int attempt, CompletableFuture<Void> done) {
    try {
      writers.execute(() -> attempt(batch, attempt, done));
    } catch (RejectedExecutionException e) {
      logger.log(Level.FINE, "Write rejected for destination " + name + "; dispatcher is shut down", e);
      finish(done);
      metrics.recordDropped(name, batch.size());
    }
  }

  private void attempt(LogBatch batch, int attempt, CompletableFuture<Void> done) {
    CompletionStage<Void> stage;
    try {
      stage = destination.write(batch);
    } catch (Throwable t) {
      stage = CompletableFuture.failedFuture(t);
    }
    if (stage == null) {
      stage = CompletableFuture.completedFuture(null);
    }
    stage.whenComplete((ignored, error) -> onAttemptComplete(batch, attempt, done, error));
  }

  private void onAttemptComplete(LogBatch batch, int attempt, CompletableFuture<Void> done, Throwable error) {
    try {
      handleOutcome(batch, attempt, done, error);
    } catch (Throwable t) {
      // the in-flight guard must be released whatever happens above
      logger.log(Level.SEVERE, "Delivery bookkeeping failed for destination " + name
          + "; dropping batch of " + batch.size() + " entries", t);
      finish(done);
    }
  }

  private void handleOutcome(LogBatch batch, int attempt, CompletableFuture<Void> done, Throwable error) {
    if (error == null) {
      finish(done);
      metrics.recordDelivered(name, batch.size());
      return;
    }
    if (attempt >= config.maxRetries()) {
      logger.log(Level.WARNING, "Dropping batch of " + batch.size() + " entries for destination "
          + name + " after " + (attempt + 1) + " attempts", unwrap(error));
      finish(done);
      metrics.recordDropped(name, batch.size());
      return;
    }

    int retry = attempt + 1;
    Duration delay = config.retryPolicy().delayBefore(retry);
    metrics.incrementRetried(name);
    if (delay == null || delay.isZero() || delay.isNegative()) {
      submitAttempt(batch, retry, done);
      return;
    }
    try {
      scheduler.schedule(() -> submitAttempt(batch, retry, done), delay.toMillis(), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      logger.log(Level.FINE, "Retry rejected for destination " + name + "; dispatcher is shut down", e);
      finish(done);
      metrics.recordDropped(name, batch.size());
    }
  }

  // Idempotent per write
  private void finish(CompletableFuture<Void> done) {
    if (done.isDone()) {
      return;
    }
    synchronized (lock) {
      if (inFlight == done) {
        inFlight = null;
      }
      if (flushRequested && inFlight == null) {
        flushRequested = false;
        if (!destroyed && !queue.isEmpty()) {
          startWrite();
        }
      }
    }
    done.complete(null);
  }

  private static Throwable unwrap(Throwable error) {
    return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
  }

  @Override
  public String toString() {
    return "DestinationSlot{name=" + name + ", config=" + config + '}';
  }
}
