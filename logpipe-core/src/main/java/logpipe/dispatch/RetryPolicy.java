package logpipe.dispatch;

import java.time.Duration;
import java.util.Objects;

/**
 * Strategy for computing the delay before retrying a failed destination write.
 *
 * @see ExponentialBackoffRetryPolicy
 */
@FunctionalInterface
public interface RetryPolicy {

    /**
     * Computes the delay before the next attempt.
     *
     * @param retry the retry about to be made (1-based)
     * @return non-negative delay
     */
    Duration delayBefore(int retry);

    /**
     * Returns a policy that waits the same {@code delay} before every retry.
     *
     * @param delay fixed delay; must be non-negative
     * @return the policy
     */
    static RetryPolicy fixed(Duration delay) {
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0, got: " + delay);
        }
        return retry -> delay;
    }
}
