package logpipe.dispatch;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry policy using exponential backoff with jitter.
 *
 * <p>Delay formula: {@code baseDelay * 2^(retry-1)}, capped at {@code maxDelay},
 * multiplied by a random jitter in [0.5, 1.5) and capped again.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;

  /**
   * @param baseDelay delay before the first retry
   * @param maxDelay  upper bound for any delay
   */
  public ExponentialBackoffRetryPolicy(Duration baseDelay, Duration maxDelay) {
    if (baseDelay == null || baseDelay.isNegative() || baseDelay.isZero()) {
      throw new IllegalArgumentException("baseDelay must be > 0, got: " + baseDelay);
    }
    if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
      throw new IllegalArgumentException("maxDelay must be >= baseDelay, got: " + maxDelay);
    }
    this.baseDelayMs = baseDelay.toMillis();
    this.maxDelayMs = maxDelay.toMillis();
  }

  @Override
  public Duration delayBefore(int retry) {
    if (retry <= 0) {
      return Duration.ZERO;
    }
    long expDelay;
    if (retry >= 63) {
      expDelay = Long.MAX_VALUE;
    } else {
      long factor = 1L << (retry - 1);
      // factor * base would overflow past the cap anyway
      expDelay = factor > maxDelayMs / Math.max(1L, baseDelayMs) ? Long.MAX_VALUE : baseDelayMs * factor;
    }
    long capped = Math.min(maxDelayMs, expDelay);
    double jitter = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
    return Duration.ofMillis(Math.min(maxDelayMs, (long) (capped * jitter)));
  }
}
