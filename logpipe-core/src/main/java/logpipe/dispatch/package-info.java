/**
 * Per-destination delivery pipeline.
 *
 * <p>{@link logpipe.dispatch.LogDispatcher} fans every entry out to one
 * {@link logpipe.dispatch.DestinationSlot} per destination. Each slot filters by level and
 * predicate, applies a one-second rate-limit window, queues with oldest-first eviction, and
 * writes batches one at a time with bounded retry. Failures never reach the caller.
 *
 * @see logpipe.dispatch.LogDispatcher
 * @see logpipe.dispatch.SlotConfig
 * @see logpipe.dispatch.RetryPolicy
 */
package logpipe.dispatch;
