/**
 * Micrometer bridge for exporting per-destination delivery counters to Prometheus, Grafana,
 * and other backends.
 *
 * <p>{@link logpipe.micrometer.MicrometerPipelineMetrics} implements the
 * {@link logpipe.spi.PipelineMetrics} SPI using tagged Micrometer counters.
 *
 * @see logpipe.micrometer.MicrometerPipelineMetrics
 */
package logpipe.micrometer;
