/**
 * Spring Boot auto-configuration for the logging pipeline.
 *
 * <p>{@link logpipe.spring.boot.LogPipeAutoConfiguration} wires a
 * {@link logpipe.StructuredLogger} from {@code logpipe.*} application properties and every
 * {@link logpipe.Destination} bean in the context, and reports slot activity to Micrometer
 * when a {@code MeterRegistry} bean is present.
 *
 * @see logpipe.spring.boot.LogPipeAutoConfiguration
 * @see logpipe.spring.boot.LogPipeProperties
 */
package logpipe.spring.boot;
