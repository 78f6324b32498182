/**
 * Service provider interfaces for plugging observability into the pipeline.
 *
 * @see logpipe.spi.PipelineMetrics
 */
package logpipe.spi;
