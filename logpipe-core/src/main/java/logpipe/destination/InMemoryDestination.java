package logpipe.destination;

import logpipe.Destination;
import logpipe.LogBatch;
import logpipe.LogEntry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Destination that keeps received batches in memory, for tests and in-process inspection.
 *
 * <p>With a positive {@code capacity}, the oldest batches are discarded once more than
 * {@code capacity} entries are retained. This class is thread-safe.
 */
public final class InMemoryDestination implements Destination {
    private final int capacity;
    private final ArrayDeque<LogBatch> batches = new ArrayDeque<>();
    private int retainedEntries;

    /** Creates an unbounded buffer. */
    public InMemoryDestination() {
        this(0);
    }

    /**
     * @param capacity maximum retained entries; {@code 0} for unbounded
     */
    public InMemoryDestination(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be >= 0, got: " + capacity);
        }
        this.capacity = capacity;
    }

    @Override
    public synchronized CompletionStage<Void> write(LogBatch batch) {
        batches.addLast(batch);
        retainedEntries += batch.size();
        while (capacity > 0 && retainedEntries > capacity && batches.size() > 1) {
            retainedEntries -= batches.removeFirst().size();
        }
        return CompletableFuture.completedFuture(null);
    }

    /** Retained batches, oldest first. */
    public synchronized List<LogBatch> batches() {
        return new ArrayList<>(batches);
    }

    /** Retained entries across all batches, in delivery order. */
    public synchronized List<LogEntry> entries() {
        List<LogEntry> all = new ArrayList<>(retainedEntries);
        for (LogBatch batch : batches) {
            all.addAll(batch.entries());
        }
        return all;
    }

    public synchronized void clear() {
        batches.clear();
        retainedEntries = 0;
    }
}
