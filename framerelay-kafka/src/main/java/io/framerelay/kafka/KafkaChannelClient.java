package io.framerelay.kafka;

import io.framerelay.channel.ChannelClient;
import io.framerelay.channel.ChannelConnectException;
import io.framerelay.channel.ChannelConnection;
import org.apache.kafka.clients.CommonClientConfigs;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.DescribeClusterOptions;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.Node;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * {@link ChannelClient} backed by Apache Kafka. Each channel is a topic.
 *
 * <p>Publishing uses an idempotent producer with {@code acks=all} and waits for the send
 * future, so a returned {@link io.framerelay.channel.PublishAck} means the record is
 * replicated. Consuming uses manual offset commits: an offset is committed only once it
 * and every earlier offset of its partition are settled, so anything unsettled when a
 * connection dies is redelivered.
 *
 * <p>Kafka clients connect lazily, so {@link #connect()} first asks the cluster for its
 * brokers and fails when none answers within the connect timeout. An open connection
 * repeats that check when a publish times out or a subscription stays idle for the connect
 * timeout, and closes itself when the cluster is gone.
 *
 * <p>Kafka has no per-message negative acknowledgement. A requeue republishes the record
 * to the same topic with the {@value #ATTEMPT_HEADER} header incremented; a dead-letter
 * republishes it to {@code <channel>}{@value #DEAD_LETTER_SUFFIX}. Both then settle the
 * original offset. The attempt of every handed-out record that is not committed yet is
 * stored in the metadata of the partition's committed offset, so a record redelivered
 * after a lost connection or a crashed consumer arrives with its attempt incremented.
 *
 * <pre>{@code
 * ChannelClient client = KafkaChannelClient.builder()
 *     .bootstrapServers("localhost:9092")
 *     .groupId("detector")
 *     .property("security.protocol", "SASL_SSL")
 *     .build();
 * }</pre>
 */
public final class KafkaChannelClient implements ChannelClient {

  /** Record header carrying the delivery attempt as a decimal string. */
  public static final String ATTEMPT_HEADER = "framerelay-attempt";

  /** Topic suffix for dead letters. */
  public static final String DEAD_LETTER_SUFFIX = ".dlq";

  private static final Duration ADMIN_CLOSE_TIMEOUT = Duration.ofSeconds(1);

  private final String bootstrapServers;
  private final String groupId;
  private final String clientId;
  private final Map<String, String> properties;
  private final Duration sendTimeout;
  private final Duration connectTimeout;
  private final ClusterCheck clusterCheck;
  private final Function<Properties, Producer<String, byte[]>> producerFactory;
  private final Function<Properties, Consumer<String, byte[]>> consumerFactory;

  private KafkaChannelClient(Builder builder) {
    this.bootstrapServers = requireNonBlank(builder.bootstrapServers, "bootstrapServers");
    this.groupId = requireNonBlank(builder.groupId, "groupId");
    this.clientId = builder.clientId;
    this.properties = Map.copyOf(builder.properties);
    this.sendTimeout = Objects.requireNonNull(builder.sendTimeout, "sendTimeout");
    if (sendTimeout.isNegative() || sendTimeout.isZero()) {
      throw new IllegalArgumentException("sendTimeout must be positive");
    }
    this.connectTimeout = Objects.requireNonNull(builder.connectTimeout, "connectTimeout");
    if (connectTimeout.isNegative() || connectTimeout.isZero()) {
      throw new IllegalArgumentException("connectTimeout must be positive");
    }
    this.clusterCheck = builder.clusterCheck != null ? builder.clusterCheck : KafkaChannelClient::describeCluster;
    this.producerFactory = builder.producerFactory != null ? builder.producerFactory : KafkaProducer::new;
    this.consumerFactory = builder.consumerFactory != null ? builder.consumerFactory : KafkaConsumer::new;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Checks that the cluster answers, then creates the producer for a new connection.
   *
   * @throws ChannelConnectException if no broker answers within the connect timeout or
   *     the client configuration is rejected
   */
  @Override
  public ChannelConnection connect() throws ChannelConnectException {
    verifyCluster();
    Producer<String, byte[]> producer;
    try {
      producer = producerFactory.apply(producerProperties());
    } catch (KafkaException e) {
      throw new ChannelConnectException("Cannot create Kafka producer for " + bootstrapServers, e);
    }
    return new KafkaConnection(this, producer);
  }

  @Override
  public String describe() {
    return "kafka[" + bootstrapServers + "]";
  }

  /**
   * Asks the cluster for its brokers.
   *
   * @throws ChannelConnectException if no broker answered within the connect timeout
   */
  void verifyCluster() throws ChannelConnectException {
    try {
      clusterCheck.verify(adminProperties(), connectTimeout);
    } catch (ChannelConnectException e) {
      throw e;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ChannelConnectException("Interrupted while contacting Kafka cluster " + bootstrapServers, e);
    } catch (ExecutionException e) {
      throw new ChannelConnectException("Kafka cluster " + bootstrapServers + " is unreachable", e.getCause());
    } catch (Exception e) {
      throw new ChannelConnectException("Kafka cluster " + bootstrapServers + " is unreachable", e);
    }
  }

  private static void describeCluster(Properties props, Duration timeout) throws Exception {
    Admin admin = Admin.create(props);
    try {
      Collection<Node> nodes = admin.describeCluster(new DescribeClusterOptions()
          .timeoutMs((int) Math.min(Integer.MAX_VALUE, timeout.toMillis())))
          .nodes()
          .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (nodes.isEmpty()) {
        throw new ChannelConnectException("Kafka cluster reported no brokers");
      }
    } finally {
      admin.close(ADMIN_CLOSE_TIMEOUT);
    }
  }

  Consumer<String, byte[]> newConsumer(int prefetchLimit) throws ChannelConnectException {
    try {
      return consumerFactory.apply(consumerProperties(prefetchLimit));
    } catch (KafkaException e) {
      throw new ChannelConnectException("Cannot create Kafka consumer for " + bootstrapServers, e);
    }
  }

  Duration sendTimeout() {
    return sendTimeout;
  }

  Duration connectTimeout() {
    return connectTimeout;
  }

  Properties adminProperties() {
    Properties props = new Properties();
    props.put(CommonClientConfigs.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
    props.put(CommonClientConfigs.REQUEST_TIMEOUT_MS_CONFIG, String.valueOf(connectTimeout.toMillis()));
    props.put(CommonClientConfigs.DEFAULT_API_TIMEOUT_MS_CONFIG, String.valueOf(connectTimeout.toMillis()));
    if (clientId != null) {
      props.put(CommonClientConfigs.CLIENT_ID_CONFIG, clientId + "-admin");
    }
    props.putAll(properties);
    return props;
  }

  Properties producerProperties() {
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "true");
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
    props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, String.valueOf(sendTimeout.toMillis()));
    if (clientId != null) {
      props.put(ProducerConfig.CLIENT_ID_CONFIG, clientId + "-producer");
    }
    props.putAll(properties);
    return props;
  }

  Properties consumerProperties(int prefetchLimit) {
    Properties props = new Properties();
    props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
    props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
    props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
    props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
    props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
    props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
    props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, String.valueOf(prefetchLimit));
    if (clientId != null) {
      props.put(ConsumerConfig.CLIENT_ID_CONFIG, clientId + "-consumer");
    }
    props.putAll(properties);
    return props;
  }

  private static String requireNonBlank(String value, String name) {
    Objects.requireNonNull(value, name);
    String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
    return trimmed;
  }

  /** Confirms that at least one broker of the cluster answers. */
  @FunctionalInterface
  interface ClusterCheck {
    void verify(Properties adminProperties, Duration timeout) throws Exception;
  }

  /** Builder for {@link KafkaChannelClient}. */
  public static final class Builder {
    private String bootstrapServers;
    private String groupId = "framerelay";
    private String clientId;
    private final Map<String, String> properties = new LinkedHashMap<>();
    private Duration sendTimeout = Duration.ofSeconds(30);
    private Duration connectTimeout = Duration.ofSeconds(10);
    private ClusterCheck clusterCheck;
    private Function<Properties, Producer<String, byte[]>> producerFactory;
    private Function<Properties, Consumer<String, byte[]>> consumerFactory;

    private Builder() {}

    /**
     * Sets the comma-separated bootstrap servers.
     *
     * <p><b>Required.</b>
     *
     * @param bootstrapServers bootstrap servers
     * @return this builder
     */
    public Builder bootstrapServers(String bootstrapServers) {
      this.bootstrapServers = bootstrapServers;
      return this;
    }

    /**
     * Sets the consumer group. Every consumer pipeline sharing a group splits the
     * channel's partitions. Defaults to {@code "framerelay"}.
     *
     * @param groupId consumer group id
     * @return this builder
     */
    public Builder groupId(String groupId) {
      this.groupId = groupId;
      return this;
    }

    public Builder clientId(String clientId) {
      this.clientId = clientId;
      return this;
    }

    /**
     * Adds a raw Kafka client property, applied to both producer and consumer after the
     * defaults (for example credentials or TLS settings).
     *
     * @param name  Kafka property name
     * @param value property value
     * @return this builder
     */
    public Builder property(String name, String value) {
      this.properties.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
      return this;
    }

    public Builder properties(Map<String, String> properties) {
      properties.forEach(this::property);
      return this;
    }

    /**
     * Sets how long a publish waits for broker confirmation. Defaults to 30 seconds.
     *
     * @param sendTimeout confirmation timeout
     * @return this builder
     */
    public Builder sendTimeout(Duration sendTimeout) {
      this.sendTimeout = sendTimeout;
      return this;
    }

    /**
     * Sets how long {@link #connect()} waits for the cluster to answer, and how long a
     * subscription may stay idle before the cluster is checked again. Defaults to 10 seconds.
     *
     * @param connectTimeout cluster check timeout
     * @return this builder
     */
    public Builder connectTimeout(Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
      return this;
    }

    Builder clusterCheck(ClusterCheck clusterCheck) {
      this.clusterCheck = clusterCheck;
      return this;
    }

    Builder producerFactory(Function<Properties, Producer<String, byte[]>> producerFactory) {
      this.producerFactory = producerFactory;
      return this;
    }

    Builder consumerFactory(Function<Properties, Consumer<String, byte[]>> consumerFactory) {
      this.consumerFactory = consumerFactory;
      return this;
    }

    public KafkaChannelClient build() {
      return new KafkaChannelClient(this);
    }
  }
}
