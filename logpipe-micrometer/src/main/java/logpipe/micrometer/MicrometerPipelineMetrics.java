package logpipe.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import logpipe.spi.PipelineMetrics;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link PipelineMetrics}.
 *
 * <p>Registers one set of counters per destination, tagged {@code destination=<slot name>},
 * the first time that destination reports anything.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code logpipe.admitted}: entries queued for delivery</li>
 *   <li>{@code logpipe.filtered}: entries rejected by level threshold or filter</li>
 *   <li>{@code logpipe.rate_limited}: entries rejected by the per-second limit</li>
 *   <li>{@code logpipe.evicted}: queued entries dropped to respect the queue cap</li>
 *   <li>{@code logpipe.delivered.batches} / {@code logpipe.delivered.entries}: accepted writes</li>
 *   <li>{@code logpipe.write.retries}: failed writes that will be attempted again</li>
 *   <li>{@code logpipe.dropped.batches} / {@code logpipe.dropped.entries}: writes given up on</li>
 * </ul>
 *
 * @see PipelineMetrics
 */
public final class MicrometerPipelineMetrics implements PipelineMetrics, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Map<String, DestinationCounters> counters = new ConcurrentHashMap<>();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "logpipe"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerPipelineMetrics(MeterRegistry registry) {
    this(registry, "logpipe");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "checkout.logpipe"})
   */
  public MicrometerPipelineMetrics(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }
    this.registry = registry;
    this.namePrefix = namePrefix;
  }

  private DestinationCounters countersFor(String destination) {
    return counters.computeIfAbsent(destination, DestinationCounters::new);
  }

  @Override
  public void incrementAdmitted(String destination) {
    if (closed) return;
    countersFor(destination).admitted.increment();
  }

  @Override
  public void incrementFiltered(String destination) {
    if (closed) return;
    countersFor(destination).filtered.increment();
  }

  @Override
  public void incrementRateLimited(String destination) {
    if (closed) return;
    countersFor(destination).rateLimited.increment();
  }

  @Override
  public void incrementEvicted(String destination) {
    if (closed) return;
    countersFor(destination).evicted.increment();
  }

  @Override
  public void recordDelivered(String destination, int entries) {
    if (closed) return;
    DestinationCounters c = countersFor(destination);
    c.deliveredBatches.increment();
    c.deliveredEntries.increment(entries);
  }

  @Override
  public void incrementRetried(String destination) {
    if (closed) return;
    countersFor(destination).retries.increment();
  }

  @Override
  public void recordDropped(String destination, int entries) {
    if (closed) return;
    DestinationCounters c = countersFor(destination);
    c.droppedBatches.increment();
    c.droppedEntries.increment(entries);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the {@link logpipe.dispatch.LogDispatcher} it reports for is closed,
   * so stale per-destination series disappear.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (DestinationCounters c : counters.values()) {
      for (Meter meter : c.meters()) {
        try {
          registry.remove(meter);
        } catch (RuntimeException e) {
          if (first == null) first = e; else first.addSuppressed(e);
        }
      }
    }
    counters.clear();
    if (first != null) throw first;
  }

  private final class DestinationCounters {
    final Counter admitted;
    final Counter filtered;
    final Counter rateLimited;
    final Counter evicted;
    final Counter deliveredBatches;
    final Counter deliveredEntries;
    final Counter retries;
    final Counter droppedBatches;
    final Counter droppedEntries;

    DestinationCounters(String destination) {
      admitted = counter(destination, "admitted", "Entries queued for delivery");
      filtered = counter(destination, "filtered", "Entries rejected by level threshold or filter");
      rateLimited = counter(destination, "rate_limited", "Entries rejected by the rate limit");
      evicted = counter(destination, "evicted", "Queued entries evicted (queue full)");
      deliveredBatches = counter(destination, "delivered.batches", "Batches accepted by the destination");
      deliveredEntries = counter(destination, "delivered.entries", "Entries accepted by the destination");
      retries = counter(destination, "write.retries", "Failed writes scheduled for retry");
      droppedBatches = counter(destination, "dropped.batches", "Batches dropped after retries");
      droppedEntries = counter(destination, "dropped.entries", "Entries dropped after retries");
    }

    private Counter counter(String destination, String name, String description) {
      return Counter.builder(namePrefix + "." + name)
          .description(description)
          .tag("destination", destination)
          .register(registry);
    }

    List<Meter> meters() {
      List<Meter> meters = new ArrayList<>();
      meters.add(admitted);
      meters.add(filtered);
      meters.add(rateLimited);
      meters.add(evicted);
      meters.add(deliveredBatches);
      meters.add(deliveredEntries);
      meters.add(retries);
      meters.add(droppedBatches);
      meters.add(droppedEntries);
      return meters;
    }
  }
}
