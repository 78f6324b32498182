package logpipe.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the logging pipeline.
 *
 * @see LogPipeAutoConfiguration
 */
@ConfigurationProperties(prefix = "logpipe")
public class LogPipeProperties {

    /**
     * Service name stamped on every entry.
     */
    private String serviceName = "app";

    /**
     * Threshold level: debug, info, warn or error.
     */
    private String level = "info";

    private final Dispatcher dispatcher = new Dispatcher();
    private final Metrics metrics = new Metrics();

    /**
     * Per-destination delivery settings, keyed by {@code Destination} bean name.
     */
    private final Map<String, DestinationProperties> destinations = new LinkedHashMap<>();

    public String getServiceName() {
        return serviceName;
    }

    public void setServiceName(String serviceName) {
        this.serviceName = serviceName;
    }

    public String getLevel() {
        return level;
    }

    public void setLevel(String level) {
        this.level = level;
    }

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public Map<String, DestinationProperties> getDestinations() {
        return destinations;
    }

    public static class Dispatcher {
        private long drainTimeoutMs = 5000;

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "logpipe";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }

    public static class DestinationProperties {
        private String minLevel;
        private int batchSize = 1;
        private Duration flushInterval = Duration.ZERO;
        private int maxQueueSize;
        private int rateLimit;
        private int maxRetries;
        private Duration retryDelay = Duration.ZERO;

        public String getMinLevel() {
            return minLevel;
        }

        public void setMinLevel(String minLevel) {
            this.minLevel = minLevel;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getFlushInterval() {
            return flushInterval;
        }

        public void setFlushInterval(Duration flushInterval) {
            this.flushInterval = flushInterval;
        }

        public int getMaxQueueSize() {
            return maxQueueSize;
        }

        public void setMaxQueueSize(int maxQueueSize) {
            this.maxQueueSize = maxQueueSize;
        }

        public int getRateLimit() {
            return rateLimit;
        }

        public void setRateLimit(int rateLimit) {
            this.rateLimit = rateLimit;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getRetryDelay() {
            return retryDelay;
        }

        public void setRetryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
        }
    }
}
