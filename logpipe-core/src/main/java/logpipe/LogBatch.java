package logpipe;

import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * One or more {@link LogEntry} values handed to a {@link Destination} in a single write,
 * in the order they were admitted.
 *
 * <p>Destinations that do not care about batching can call {@link #single()} whenever
 * {@link #isSingle()} is true, which is always the case for slots with {@code batchSize = 1}.
 */
public final class LogBatch implements Iterable<LogEntry> {
    private final List<LogEntry> entries;

    private LogBatch(List<LogEntry> entries) {
        this.entries = entries;
    }

    /**
     * Creates a batch holding a copy of {@code entries}.
     *
     * @param entries the entries, in delivery order
     * @return a new batch
     * @throws IllegalArgumentException if {@code entries} is empty
     */
    public static LogBatch of(Collection<LogEntry> entries) {
        Objects.requireNonNull(entries, "entries");
        if (entries.isEmpty()) {
            throw new IllegalArgumentException("A batch holds at least one entry");
        }
        return new LogBatch(List.copyOf(entries));
    }

    public static LogBatch of(LogEntry entry) {
        return new LogBatch(List.of(Objects.requireNonNull(entry, "entry")));
    }

    public List<LogEntry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isSingle() {
        return entries.size() == 1;
    }

    /**
     * Returns the only entry of a single-entry batch.
     *
     * @return the entry
     * @throws IllegalStateException if the batch holds more than one entry
     */
    public LogEntry single() {
        if (!isSingle()) {
            throw new IllegalStateException("Batch holds " + entries.size() + " entries");
        }
        return entries.get(0);
    }

    @Override
    public Iterator<LogEntry> iterator() {
        return entries.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LogBatch)) return false;
        return entries.equals(((LogBatch) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "LogBatch{size=" + entries.size() + "}";
    }
}
