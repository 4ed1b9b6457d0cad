package io.framerelay.spring.boot;

import io.framerelay.Detector;
import io.framerelay.FrameSource;
import io.framerelay.channel.ChannelClient;
import io.framerelay.channel.memory.InMemoryBroker;
import io.framerelay.channel.memory.InMemoryChannelClient;
import io.framerelay.consumer.ConsumerPipeline;
import io.framerelay.kafka.KafkaChannelClient;
import io.framerelay.producer.ProducerPipeline;
import io.framerelay.retry.ExponentialBackoffRetryPolicy;
import io.framerelay.retry.RetryPolicy;
import io.framerelay.sink.ChannelResultSink;
import io.framerelay.sink.DeduplicatingResultSink;
import io.framerelay.sink.ResultSink;
import io.framerelay.spi.MetricsExporter;
import io.framerelay.supervisor.Supervisor;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Auto-configuration for the frame relay.
 *
 * <p>Always provides a {@link ChannelClient} for the configured broker. When
 * {@code framerelay.producer.enabled} or {@code framerelay.consumer.enabled} is set, wires
 * a {@link Supervisor} around the corresponding pipelines and starts it with the
 * context. The producer needs a {@link FrameSource} bean and the consumer a
 * {@link Detector} bean; detections go to the detections channel unless a
 * {@link ResultSink} bean is present.
 *
 * @see FrameRelayProperties
 * @see FrameRelayMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(Supervisor.class)
@EnableConfigurationProperties(FrameRelayProperties.class)
public class FrameRelayAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "framerelay.consumer", name = "enabled", havingValue = "true")
  public ResultSink frameRelayResultSink(ChannelClient channelClient, FrameRelayProperties props) {
    ResultSink sink = new ChannelResultSink(channelClient, props.getChannels().getDetections());
    int window = props.getConsumer().getDedupeWindow();
    return window > 0 ? new DeduplicatingResultSink(sink, window) : sink;
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnExpression("${framerelay.producer.enabled:false} or ${framerelay.consumer.enabled:false}")
  public Supervisor frameRelaySupervisor(FrameRelayProperties props,
      ChannelClient channelClient,
      ObjectProvider<FrameSource> frameSourceProvider,
      ObjectProvider<Detector> detectorProvider,
      ObjectProvider<ResultSink> sinkProvider,
      ObjectProvider<MetricsExporter> metricsProvider) {

    MetricsExporter metrics = metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP);
    RetryPolicy reconnectPolicy = new ExponentialBackoffRetryPolicy(
        props.getReconnect().getBaseDelayMs(), props.getReconnect().getMaxDelayMs());
    var builder = Supervisor.builder()
        .producerDrainTimeout(props.getProducer().getDrainTimeout())
        .consumerShutdownDeadline(props.getConsumer().getShutdownDeadline())
        .recentFailureCapacity(props.getSupervisor().getRecentFailures());

    if (props.getProducer().isEnabled()) {
      FrameSource frameSource = frameSourceProvider.getIfAvailable();
      if (frameSource == null) {
        throw new IllegalStateException(
            "framerelay.producer.enabled=true requires a FrameSource bean");
      }
      builder.producer(ProducerPipeline.builder()
          .channelClient(channelClient)
          .frameSource(frameSource)
          .sourceId(props.getProducer().getSourceId())
          .channel(props.getChannels().getFrames())
          .queueCapacity(props.getProducer().getQueueCapacity())
          .maxPublishAttempts(props.getProducer().getMaxPublishAttempts())
          .publishRetryPolicy(new ExponentialBackoffRetryPolicy(
              props.getRetry().getBaseDelayMs(), props.getRetry().getMaxDelayMs()))
          .reconnectPolicy(reconnectPolicy)
          .drainTimeout(props.getProducer().getDrainTimeout())
          .metrics(metrics));
    }

    if (props.getConsumer().isEnabled()) {
      Detector detector = detectorProvider.getIfAvailable();
      if (detector == null) {
        throw new IllegalStateException(
            "framerelay.consumer.enabled=true requires a Detector bean");
      }
      builder.consumer(ConsumerPipeline.builder()
          .channelClient(channelClient)
          .detector(detector)
          .sink(sinkProvider.getObject())
          .channel(props.getChannels().getFrames())
          .prefetchLimit(props.getConsumer().getPrefetchLimit())
          .maxAttempts(props.getConsumer().getMaxAttempts())
          .reconnectPolicy(reconnectPolicy)
          .shutdownDeadline(props.getConsumer().getShutdownDeadline())
          .metrics(metrics));
    }
    return builder.build();
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnProperty(prefix = "framerelay", name = "broker", havingValue = "IN_MEMORY", matchIfMissing = true)
  static class InMemoryChannelConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public InMemoryBroker frameRelayBroker() {
      return new InMemoryBroker();
    }

    @Bean
    @ConditionalOnMissingBean(ChannelClient.class)
    public InMemoryChannelClient frameRelayChannelClient(InMemoryBroker broker) {
      return new InMemoryChannelClient(broker);
    }
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(KafkaChannelClient.class)
  @ConditionalOnProperty(prefix = "framerelay", name = "broker", havingValue = "KAFKA")
  static class KafkaChannelConfiguration {

    @Bean
    @ConditionalOnMissingBean(ChannelClient.class)
    public KafkaChannelClient frameRelayChannelClient(FrameRelayProperties props) {
      FrameRelayProperties.Kafka kafka = props.getKafka();
      KafkaChannelClient.Builder builder = KafkaChannelClient.builder()
          .bootstrapServers(kafka.getBootstrapServers())
          .groupId(kafka.getGroupId())
          .sendTimeout(kafka.getSendTimeout())
          .connectTimeout(kafka.getConnectTimeout())
          .properties(kafka.getProperties());
      if (kafka.getClientId() != null && !kafka.getClientId().isEmpty()) {
        builder.clientId(kafka.getClientId());
      }
      return builder.build();
    }
  }
}
