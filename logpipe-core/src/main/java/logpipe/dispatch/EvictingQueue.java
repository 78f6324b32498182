package logpipe.dispatch;

import logpipe.LogEntry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * FIFO of pending entries that silently drops its oldest elements once it grows past
 * {@code maxSize}. Not thread-safe; the owning slot serialises access.
 */
final class EvictingQueue {
  private final int maxSize;
  private ArrayDeque<LogEntry> entries = new ArrayDeque<>();

  /**
   * @param maxSize capacity; {@code 0} means unbounded
   */
  EvictingQueue(int maxSize) {
    if (maxSize < 0) {
      throw new IllegalArgumentException("maxSize must be >= 0, got: " + maxSize);
    }
    this.maxSize = maxSize;
  }

  /**
   * Appends an entry, evicting from the head until the capacity holds again.
   *
   * @return number of entries evicted
   */
  int add(LogEntry entry) {
    entries.addLast(entry);
    int evicted = 0;
    if (maxSize > 0) {
      while (entries.size() > maxSize) {
        entries.pollFirst();
        evicted++;
      }
    }
    return evicted;
  }

  /**
   * Removes and returns everything queued, leaving a fresh empty queue behind.
   */
  List<LogEntry> drain() {
    ArrayDeque<LogEntry> drained = entries;
    entries = new ArrayDeque<>();
    return new ArrayList<>(drained);
  }

  int size() {
    return entries.size();
  }

  boolean isEmpty() {
    return entries.isEmpty();
  }
}
