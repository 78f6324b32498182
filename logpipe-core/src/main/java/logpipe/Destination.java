package logpipe;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Sink that accepts batches of log entries: a file, an HTTP collector, an in-memory buffer.
 *
 * <p>The dispatcher never calls {@link #write} concurrently for the same slot, and never on
 * the thread that produced the entry. A thrown exception and an exceptionally completed stage
 * are both treated as a failed write and retried according to the slot's configuration.
 * A {@code null} return is treated as success.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * Destination stdout = Destination.of(batch -> {
 *     for (LogEntry entry : batch) {
 *         System.out.println(entry.level().label() + " " + entry.message());
 *     }
 * });
 * }</pre>
 */
@FunctionalInterface
public interface Destination {

    /**
     * Writes a batch.
     *
     * @param batch one or more entries, in admission order
     * @return a stage completing when the destination has accepted the batch
     */
    CompletionStage<Void> write(LogBatch batch);

    /**
     * Adapts a blocking writer. The returned stage is already complete when
     * {@code write} returns.
     *
     * @param sync the blocking writer
     * @return a destination delegating to {@code sync}
     */
    static Destination of(Sync sync) {
        Objects.requireNonNull(sync, "sync");
        return batch -> {
            try {
                sync.write(batch);
                return CompletableFuture.completedFuture(null);
            } catch (Exception e) {
                return CompletableFuture.failedFuture(e);
            }
        };
    }

    /** Blocking form of {@link Destination}. */
    @FunctionalInterface
    interface Sync {
        void write(LogBatch batch) throws Exception;
    }
}
