package logpipe.dispatch;

import java.time.Clock;
import java.util.Objects;

/**
 * Self-resetting one-second admission window, evaluated lazily on each call.
 *
 * <p>No timer runs between calls: the window restarts on the first check made at least
 * one second after it opened. Not thread-safe; the owning slot serialises access.
 */
final class RateLimiter {
  static final long WINDOW_MS = 1000L;

  private final int limit;
  private final Clock clock;

  private long windowStart;
  private int windowCount;

  /**
   * @param limit entries admitted per window; {@code <= 0} disables limiting
   * @param clock time source
   */
  RateLimiter(int limit, Clock clock) {
    this.limit = limit;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Admits or rejects one entry. An admitted entry counts against the current window.
   *
   * @return {@code true} if the entry is over the limit and must be dropped
   */
  boolean isLimited() {
    if (limit <= 0) {
      return false;
    }
    long now = clock.millis();
    if (now - windowStart >= WINDOW_MS) {
      windowStart = now;
      windowCount = 0;
    }
    if (windowCount >= limit) {
      return true;
    }
    windowCount++;
    return false;
  }
}
