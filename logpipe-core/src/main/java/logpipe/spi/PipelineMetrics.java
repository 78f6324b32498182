package logpipe.spi;

/**
 * Observability hook for exporting per-destination delivery counters to a metrics backend.
 *
 * <p>Every method receives the name of the slot it concerns. The {@link #NOOP} instance
 * discards everything. Implementations are called from caller threads and writer threads
 * concurrently and must be thread-safe and non-blocking.
 */
public interface PipelineMetrics {

    /**
     * No-op instance that discards all metrics.
     */
    PipelineMetrics NOOP = new Noop();

    /**
     * Increments the count of entries that passed filtering and rate limiting.
     */
    void incrementAdmitted(String destination);

    /**
     * Increments the count of entries rejected by the level threshold or the filter predicate.
     */
    void incrementFiltered(String destination);

    /**
     * Increments the count of entries rejected by the per-second rate limit.
     */
    void incrementRateLimited(String destination);

    /**
     * Increments the count of queued entries dropped to respect {@code maxQueueSize}.
     */
    void incrementEvicted(String destination);

    /**
     * Records a batch accepted by the destination.
     *
     * @param destination slot name
     * @param entries     number of entries in the batch
     */
    void recordDelivered(String destination, int entries);

    /**
     * Increments the count of failed writes that will be attempted again.
     */
    void incrementRetried(String destination);

    /**
     * Records a batch discarded after its retries were exhausted.
     *
     * @param destination slot name
     * @param entries     number of entries in the batch
     */
    void recordDropped(String destination, int entries);

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements PipelineMetrics {
        @Override
        public void incrementAdmitted(String destination) {
        }

        @Override
        public void incrementFiltered(String destination) {
        }

        @Override
        public void incrementRateLimited(String destination) {
        }

        @Override
        public void incrementEvicted(String destination) {
        }

        @Override
        public void recordDelivered(String destination, int entries) {
        }

        @Override
        public void incrementRetried(String destination) {
        }

        @Override
        public void recordDropped(String destination, int entries) {
        }
    }
}
