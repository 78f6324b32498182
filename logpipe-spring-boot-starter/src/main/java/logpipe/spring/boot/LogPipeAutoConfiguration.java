package logpipe.spring.boot;

import logpipe.Destination;
import logpipe.LogLevel;
import logpipe.StructuredLogger;
import logpipe.dispatch.LogDispatcher;
import logpipe.dispatch.SlotConfig;
import logpipe.micrometer.MicrometerPipelineMetrics;
import logpipe.spi.PipelineMetrics;

import io.micrometer.core.instrument.MeterRegistry;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * Auto-configuration for the logging pipeline.
 *
 * <p>Wires a {@link LogDispatcher} with one slot per {@link Destination} bean, in bean
 * registration order, and a {@link StructuredLogger} on top of it. Slot settings come from
 * {@code logpipe.destinations.<beanName>.*}; beans without an entry get
 * {@link SlotConfig#defaults()}. The slot is named after the bean.
 *
 * <p>When Micrometer and the {@code logpipe-micrometer} module are on the classpath and a
 * {@link MeterRegistry} bean exists, slot activity is reported through a
 * {@link MicrometerPipelineMetrics} unless {@code logpipe.metrics.enabled} is false or the
 * application defines its own {@link PipelineMetrics}.
 *
 * @see LogPipeProperties
 */
@AutoConfiguration(afterName =
    "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass(StructuredLogger.class)
@EnableConfigurationProperties(LogPipeProperties.class)
public class LogPipeAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public LogDispatcher logDispatcher(LogPipeProperties props,
      ListableBeanFactory beanFactory,
      ObjectProvider<PipelineMetrics> metricsProvider) {
    Map<String, Destination> destinations = beanFactory.getBeansOfType(Destination.class);
    for (String configured : props.getDestinations().keySet()) {
      if (!destinations.containsKey(configured)) {
        throw new IllegalStateException("logpipe.destinations." + configured
            + " does not match any Destination bean");
      }
    }

    var builder = LogDispatcher.builder()
        .drainTimeoutMs(props.getDispatcher().getDrainTimeoutMs());
    PipelineMetrics metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    destinations.forEach((beanName, destination) ->
        builder.destination(destination, slotConfig(beanName, props.getDestinations().get(beanName))));
    return builder.build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public StructuredLogger structuredLogger(LogPipeProperties props, LogDispatcher logDispatcher) {
    return StructuredLogger.builder()
        .dispatcher(logDispatcher)
        .level(LogLevel.parse(props.getLevel()))
        .serviceName(props.getServiceName())
        .build();
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(name = {
      "io.micrometer.core.instrument.MeterRegistry",
      "logpipe.micrometer.MicrometerPipelineMetrics"})
  @ConditionalOnProperty(prefix = "logpipe.metrics", name = "enabled", matchIfMissing = true)
  @ConditionalOnBean(type = "io.micrometer.core.instrument.MeterRegistry")
  static class MicrometerMetricsConfiguration {

    @Bean
    @ConditionalOnMissingBean(PipelineMetrics.class)
    MicrometerPipelineMetrics micrometerPipelineMetrics(MeterRegistry meterRegistry, LogPipeProperties props) {
      return new MicrometerPipelineMetrics(meterRegistry, props.getMetrics().getNamePrefix());
    }
  }

  static SlotConfig slotConfig(String beanName, LogPipeProperties.DestinationProperties dp) {
    var builder = SlotConfig.builder().name(beanName);
    if (dp == null) {
      return builder.build();
    }
    if (dp.getMinLevel() != null && !dp.getMinLevel().isBlank()) {
      builder.minLevel(LogLevel.parse(dp.getMinLevel()));
    }
    return builder
        .batchSize(dp.getBatchSize())
        .flushInterval(dp.getFlushInterval())
        .maxQueueSize(dp.getMaxQueueSize())
        .rateLimit(dp.getRateLimit())
        .maxRetries(dp.getMaxRetries())
        .retryDelay(dp.getRetryDelay())
        .build();
  }
}
