package io.framerelay.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the frame relay.
 *
 * @see FrameRelayAutoConfiguration
 */
@ConfigurationProperties(prefix = "framerelay")
public class FrameRelayProperties {

    /**
     * Broker backing the channels: in-memory (single process) or Kafka.
     */
    private Broker broker = Broker.IN_MEMORY;

    private final Kafka kafka = new Kafka();
    private final Channels channels = new Channels();
    private final Producer producer = new Producer();
    private final Consumer consumer = new Consumer();
    private final Retry retry = new Retry();
    private final Reconnect reconnect = new Reconnect();
    private final Supervisor supervisor = new Supervisor();
    private final Metrics metrics = new Metrics();

    public Broker getBroker() {
        return broker;
    }

    public void setBroker(Broker broker) {
        this.broker = broker;
    }

    public Kafka getKafka() {
        return kafka;
    }

    public Channels getChannels() {
        return channels;
    }

    public Producer getProducer() {
        return producer;
    }

    public Consumer getConsumer() {
        return consumer;
    }

    public Retry getRetry() {
        return retry;
    }

    public Reconnect getReconnect() {
        return reconnect;
    }

    public Supervisor getSupervisor() {
        return supervisor;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public enum Broker {
        IN_MEMORY,
        KAFKA
    }

    public static class Kafka {
        private String bootstrapServers = "localhost:9092";
        private String groupId = "framerelay";
        private String clientId;
        private Duration sendTimeout = Duration.ofSeconds(30);

        /**
         * How long a connect waits for the cluster to answer; also the idle time after
         * which a subscription checks the cluster again.
         */
        private Duration connectTimeout = Duration.ofSeconds(10);

        /**
         * Raw Kafka client properties (credentials, TLS), applied to producer and consumer.
         */
        private final Map<String, String> properties = new LinkedHashMap<>();

        public String getBootstrapServers() {
            return bootstrapServers;
        }

        public void setBootstrapServers(String bootstrapServers) {
            this.bootstrapServers = bootstrapServers;
        }

        public String getGroupId() {
            return groupId;
        }

        public void setGroupId(String groupId) {
            this.groupId = groupId;
        }

        public String getClientId() {
            return clientId;
        }

        public void setClientId(String clientId) {
            this.clientId = clientId;
        }

        public Duration getSendTimeout() {
            return sendTimeout;
        }

        public void setSendTimeout(Duration sendTimeout) {
            this.sendTimeout = sendTimeout;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Map<String, String> getProperties() {
            return properties;
        }
    }

    public static class Channels {
        private String frames = "frames";
        private String detections = "detections";

        public String getFrames() {
            return frames;
        }

        public void setFrames(String frames) {
            this.frames = frames;
        }

        public String getDetections() {
            return detections;
        }

        public void setDetections(String detections) {
            this.detections = detections;
        }
    }

    public static class Producer {
        /**
         * Runs a producer pipeline. Requires a {@code FrameSource} bean.
         */
        private boolean enabled;
        private String sourceId = "cam0";
        private int queueCapacity = 64;
        private int maxPublishAttempts = 5;
        private Duration drainTimeout = Duration.ofSeconds(5);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getSourceId() {
            return sourceId;
        }

        public void setSourceId(String sourceId) {
            this.sourceId = sourceId;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getMaxPublishAttempts() {
            return maxPublishAttempts;
        }

        public void setMaxPublishAttempts(int maxPublishAttempts) {
            this.maxPublishAttempts = maxPublishAttempts;
        }

        public Duration getDrainTimeout() {
            return drainTimeout;
        }

        public void setDrainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
        }
    }

    public static class Consumer {
        /**
         * Runs a consumer pipeline. Requires a {@code Detector} bean.
         */
        private boolean enabled;
        private int prefetchLimit = 4;
        private int maxAttempts = 3;
        private Duration shutdownDeadline = Duration.ofSeconds(10);

        /**
         * Detection keys remembered for duplicate suppression; 0 disables it.
         */
        private int dedupeWindow = 10_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getPrefetchLimit() {
            return prefetchLimit;
        }

        public void setPrefetchLimit(int prefetchLimit) {
            this.prefetchLimit = prefetchLimit;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getShutdownDeadline() {
            return shutdownDeadline;
        }

        public void setShutdownDeadline(Duration shutdownDeadline) {
            this.shutdownDeadline = shutdownDeadline;
        }

        public int getDedupeWindow() {
            return dedupeWindow;
        }

        public void setDedupeWindow(int dedupeWindow) {
            this.dedupeWindow = dedupeWindow;
        }
    }

    public static class Retry {
        private long baseDelayMs = 100;
        private long maxDelayMs = 5000;

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
    }

    public static class Reconnect {
        private long baseDelayMs = 500;
        private long maxDelayMs = 30_000;

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
    }

    public static class Supervisor {
        private int recentFailures = 100;

        public int getRecentFailures() {
            return recentFailures;
        }

        public void setRecentFailures(int recentFailures) {
            this.recentFailures = recentFailures;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "framerelay";

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
}
