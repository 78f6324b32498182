/**
 * Root API for logpipe: structured log entries fanned out to pluggable destinations with
 * per-destination filtering, batching, rate limiting and retry.
 *
 * <h2>Core Design</h2>
 * <p>{@link logpipe.StructuredLogger} builds an immutable {@link logpipe.LogEntry} for each
 * log call above its threshold and hands it to a
 * {@linkplain logpipe.dispatch.LogDispatcher dispatcher}. The dispatcher owns one
 * {@linkplain logpipe.dispatch.DestinationSlot slot} per {@link logpipe.Destination};
 * each slot admits, queues and writes independently, with at most one write in flight and
 * batches delivered in admission order. Delivery failures are retried and then dropped;
 * they never reach the code that logged.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>logpipe-core</b>: entries, destinations, dispatcher, logger (depends only on ulid-creator)</li>
 *   <li><b>logpipe-micrometer</b>: Micrometer bridge for {@link logpipe.spi.PipelineMetrics}</li>
 *   <li><b>logpipe-spring-boot-starter</b>: auto-configuration from {@code logpipe.*} properties</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var dispatcher = LogDispatcher.builder()
 *     .destination(new JsonLinesFileDestination(Path.of("logs/app.jsonl")),
 *         SlotConfig.builder().batchSize(100).flushInterval(Duration.ofSeconds(1)).build())
 *     .build();
 *
 * try (StructuredLogger log = StructuredLogger.builder()
 *     .serviceName("orders")
 *     .dispatcher(dispatcher)
 *     .build()) {
 *   log.info("order placed", Map.of("orderId", "order-123"));
 * }
 * }</pre>
 *
 * @see logpipe.StructuredLogger
 * @see logpipe.Destination
 * @see logpipe.dispatch.LogDispatcher
 * @see logpipe.dispatch.SlotConfig
 */
package logpipe;
