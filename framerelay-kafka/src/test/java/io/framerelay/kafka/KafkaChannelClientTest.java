package io.framerelay.kafka;

import io.framerelay.channel.ChannelClosedException;
import io.framerelay.channel.ChannelConnectException;
import io.framerelay.channel.ChannelConnection;
import io.framerelay.channel.Delivery;
import io.framerelay.channel.PublishAck;
import io.framerelay.channel.PublishException;
import io.framerelay.channel.Subscription;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.TimeoutException;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class KafkaChannelClientTest {

  private static final String TOPIC = "frames";
  private static final Duration POLL = Duration.ofMillis(10);

  private final TopicPartition partition = new TopicPartition(TOPIC, 0);
  private final AtomicBoolean clusterUp = new AtomicBoolean(true);
  private final AtomicInteger producersCreated = new AtomicInteger();
  private MockProducer<String, byte[]> producer;
  private MockConsumer<String, byte[]> consumer;
  private KafkaChannelClient client;
  private ChannelConnection connection;

  @BeforeEach
  void setUp() throws Exception {
    producer = new MockProducer<>(true, new StringSerializer(), new ByteArraySerializer());
    consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
    client = clientBuilder()
        .consumerFactory(props -> consumer)
        .build();
    connection = client.connect();
  }

  private KafkaChannelClient.Builder clientBuilder() {
    return KafkaChannelClient.builder()
        .bootstrapServers("localhost:9092")
        .groupId("detector")
        .clientId("cam-site")
        .property("compression.type", "lz4")
        .clusterCheck((props, timeout) -> {
          if (!clusterUp.get()) {
            throw new TimeoutException("Timed out waiting for a node assignment");
          }
        })
        .producerFactory(props -> {
          producersCreated.incrementAndGet();
          return producer;
        });
  }

  @AfterEach
  void tearDown() {
    connection.close();
  }

  // ── Configuration ─────────────────────────────────────────────

  @Test
  void producerIsIdempotentWithAllAcks() {
    Properties props = client.producerProperties();
    assertEquals("all", props.get(ProducerConfig.ACKS_CONFIG));
    assertEquals("true", props.get(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG));
    assertEquals("localhost:9092", props.get(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG));
    assertEquals("cam-site-producer", props.get(ProducerConfig.CLIENT_ID_CONFIG));
    assertEquals("lz4", props.get("compression.type"));
  }

  @Test
  void consumerCommitsManuallyAndFetchesPrefetchLimit() {
    Properties props = client.consumerProperties(4);
    assertEquals("false", props.get(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG));
    assertEquals("4", props.get(ConsumerConfig.MAX_POLL_RECORDS_CONFIG));
    assertEquals("detector", props.get(ConsumerConfig.GROUP_ID_CONFIG));
    assertEquals("earliest", props.get(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG));
  }

  @Test
  void blankBootstrapServersRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> KafkaChannelClient.builder().bootstrapServers("  ").build());
    assertThrows(NullPointerException.class, () -> KafkaChannelClient.builder().build());
  }

  @Test
  void adminUsesConnectTimeout() {
    Properties props = client.adminProperties();
    assertEquals("localhost:9092", props.get("bootstrap.servers"));
    assertEquals("10000", props.get("request.timeout.ms"));
    assertEquals("cam-site-admin", props.get("client.id"));
  }

  @Test
  void describeNamesCluster() {
    assertEquals("kafka[localhost:9092]", client.describe());
  }

  // ── Connect ───────────────────────────────────────────────────

  @Test
  void connectFailsWhenClusterDoesNotAnswer() {
    clusterUp.set(false);
    int before = producersCreated.get();

    ChannelConnectException e = assertThrows(ChannelConnectException.class, client::connect);
    assertInstanceOf(TimeoutException.class, e.getCause());
    assertEquals(before, producersCreated.get());
  }

  @Test
  void connectFailsFastAgainstUnreachableBroker() {
    KafkaChannelClient unreachable = KafkaChannelClient.builder()
        .bootstrapServers("127.0.0.1:1")
        .connectTimeout(Duration.ofMillis(500))
        .build();

    long start = System.nanoTime();
    assertThrows(ChannelConnectException.class, unreachable::connect);
    assertTrue(Duration.ofNanos(System.nanoTime() - start).compareTo(Duration.ofSeconds(10)) < 0);
  }

  @Test
  void connectTimeoutMustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> KafkaChannelClient.builder()
        .bootstrapServers("localhost:9092")
        .connectTimeout(Duration.ZERO)
        .build());
  }

  // ── Publish ───────────────────────────────────────────────────

  @Test
  void publishReturnsAfterBrokerAcknowledges() throws Exception {
    PublishAck ack = connection.publish(TOPIC, "cam0", bytes("frame-1"));

    assertEquals(TOPIC, ack.channel());
    assertEquals(1, producer.history().size());
    ProducerRecord<String, byte[]> sent = producer.history().get(0);
    assertEquals(TOPIC, sent.topic());
    assertEquals("cam0", sent.key());
    assertArrayEquals(bytes("frame-1"), sent.value());
    assertNull(sent.headers().lastHeader(KafkaChannelClient.ATTEMPT_HEADER));
  }

  @Test
  void nonRetriablePublishFailureClosesConnection() {
    producer.sendException = new KafkaException("producer fenced");

    assertThrows(PublishException.class, () -> connection.publish(TOPIC, "cam0", bytes("x")));
    assertFalse(connection.isOpen());
    assertThrows(PublishException.class, () -> connection.publish(TOPIC, "cam0", bytes("x")));
  }

  @Test
  void publishTimeoutClosesConnectionWhenClusterIsGone() {
    clusterUp.set(false);
    producer.sendException = new TimeoutException("Expiring 1 record(s)");

    assertThrows(PublishException.class, () -> connection.publish(TOPIC, "cam0", bytes("x")));
    assertFalse(connection.isOpen());
  }

  @Test
  void retriablePublishFailureKeepsConnectionWhileClusterAnswers() {
    producer.sendException = new TimeoutException("Expiring 1 record(s)");

    assertThrows(PublishException.class, () -> connection.publish(TOPIC, "cam0", bytes("x")));
    assertTrue(connection.isOpen());
  }

  // ── Consume ───────────────────────────────────────────────────

  @Test
  void ackCommitsOffsetOnNextPoll() throws Exception {
    Subscription subscription = subscribe(2);
    addRecord(0, "cam0", bytes("a"), null);

    Delivery delivery = subscription.poll(POLL);
    assertNotNull(delivery);
    assertEquals(1, delivery.attemptCount());
    assertEquals("cam0", delivery.key());
    assertArrayEquals(bytes("a"), delivery.body());
    assertEquals(1, subscription.inFlight());

    delivery.ack();
    assertEquals(0, subscription.inFlight());
    assertNull(subscription.poll(POLL));
    assertEquals(1L, committedOffset());
  }

  @Test
  void commitsOnlyContiguousSettledPrefix() throws Exception {
    Subscription subscription = subscribe(3);
    addRecord(0, "cam0", bytes("a"), null);
    addRecord(1, "cam0", bytes("b"), null);
    addRecord(2, "cam0", bytes("c"), null);

    Delivery first = subscription.poll(POLL);
    Delivery second = subscription.poll(POLL);
    Delivery third = subscription.poll(POLL);
    assertNotNull(first);
    assertNotNull(second);
    assertNotNull(third);

    second.ack();
    third.ack();
    subscription.poll(POLL);
    assertEquals(0L, committedOffset());

    first.ack();
    subscription.poll(POLL);
    assertEquals(3L, committedOffset());
  }

  @Test
  void prefetchLimitBoundsUnsettledDeliveries() throws Exception {
    Subscription subscription = subscribe(1);
    addRecord(0, "cam0", bytes("a"), null);
    addRecord(1, "cam0", bytes("b"), null);

    Delivery first = subscription.poll(POLL);
    assertNotNull(first);
    assertNull(subscription.poll(POLL));
    assertEquals(1, subscription.inFlight());

    first.ack();
    Delivery second = subscription.poll(POLL);
    assertNotNull(second);
    assertArrayEquals(bytes("b"), second.body());
  }

  @Test
  void requeueRepublishesWithIncrementedAttempt() throws Exception {
    Subscription subscription = subscribe(1);
    addRecord(0, "cam0", bytes("a"), "2");

    Delivery delivery = subscription.poll(POLL);
    assertEquals(2, delivery.attemptCount());
    delivery.nack(true);

    ProducerRecord<String, byte[]> republished = producer.history().get(producer.history().size() - 1);
    assertEquals(TOPIC, republished.topic());
    assertEquals("cam0", republished.key());
    assertEquals("3", headerValue(republished.headers().lastHeader(KafkaChannelClient.ATTEMPT_HEADER)));

    subscription.poll(POLL);
    assertEquals(1L, committedOffset());
  }

  @Test
  void deadLetterGoesToDlqTopic() throws Exception {
    Subscription subscription = subscribe(1);
    addRecord(0, "cam0", bytes("garbage"), null);

    Delivery delivery = subscription.poll(POLL);
    delivery.nack(false);

    ProducerRecord<String, byte[]> dead = producer.history().get(producer.history().size() - 1);
    assertEquals("frames.dlq", dead.topic());
    assertArrayEquals(bytes("garbage"), dead.value());
    assertEquals("1", headerValue(dead.headers().lastHeader(KafkaChannelClient.ATTEMPT_HEADER)));
  }

  @Test
  void malformedAttemptHeaderCountsAsFirstAttempt() throws Exception {
    Subscription subscription = subscribe(1);
    addRecord(0, "cam0", bytes("a"), "not-a-number");

    assertEquals(1, subscription.poll(POLL).attemptCount());
  }

  @Test
  void consumerFailureClosesConnection() throws Exception {
    Subscription subscription = subscribe(1);
    consumer.setPollException(new KafkaException("broker gone"));

    assertThrows(ChannelClosedException.class, () -> subscription.poll(POLL));
    assertFalse(connection.isOpen());
  }

  @Test
  void settlingAfterCloseLeavesRecordForRedelivery() throws Exception {
    Subscription subscription = subscribe(1);
    addRecord(0, "cam0", bytes("a"), null);
    Delivery delivery = subscription.poll(POLL);

    subscription.close();

    assertThrows(ChannelClosedException.class, delivery::ack);
    assertThrows(ChannelClosedException.class, () -> subscription.poll(POLL));
  }

  @Test
  void idleSubscriptionClosesWhenClusterIsGone() throws Exception {
    KafkaChannelClient quickCheck = clientBuilder()
        .consumerFactory(props -> consumer)
        .connectTimeout(Duration.ofMillis(1))
        .build();
    ChannelConnection quick = quickCheck.connect();
    Subscription subscription = subscribe(quick, consumer, 1);
    assertNull(subscription.poll(POLL));
    assertTrue(quick.isOpen());

    clusterUp.set(false);
    Thread.sleep(5);

    assertThrows(ChannelClosedException.class, () -> subscription.poll(POLL));
    assertFalse(quick.isOpen());
  }

  @Test
  void handedOutAttemptIsRecordedInCommitMetadata() throws Exception {
    Subscription subscription = subscribe(2);
    addRecord(0, "cam0", bytes("a"), null);
    addRecord(1, "cam0", bytes("b"), "3");

    Delivery first = subscription.poll(POLL);
    subscription.poll(POLL);

    OffsetAndMetadata committed = consumer.committed(Set.of(partition)).get(partition);
    assertEquals(0L, committed.offset());
    assertEquals("a1:0=1,1=3", committed.metadata());

    first.ack();
    subscription.poll(POLL);
    committed = consumer.committed(Set.of(partition)).get(partition);
    assertEquals(1L, committed.offset());
    assertEquals("a1:1=3", committed.metadata());
  }

  @Test
  void redeliveryAfterConnectionLossIncrementsAttempt() throws Exception {
    Map<TopicPartition, OffsetAndMetadata> groupOffsets = new ConcurrentHashMap<>();
    GroupConsumer firstOwner = new GroupConsumer(groupOffsets);
    GroupConsumer secondOwner = new GroupConsumer(groupOffsets);
    Iterator<GroupConsumer> owners = List.of(firstOwner, secondOwner).iterator();
    KafkaChannelClient group = clientBuilder()
        .consumerFactory(props -> owners.next())
        .build();

    ChannelConnection lost = group.connect();
    Subscription before = subscribe(lost, firstOwner, 1);
    addRecord(firstOwner, 0, "cam0", bytes("a"), null);
    Delivery delivery = before.poll(POLL);
    assertEquals(1, delivery.attemptCount());
    lost.close();
    assertThrows(ChannelClosedException.class, delivery::ack);

    ChannelConnection replacement = group.connect();
    try {
      Subscription after = subscribe(replacement, secondOwner, 1);
      addRecord(secondOwner, 0, "cam0", bytes("a"), null);
      Delivery redelivered = after.poll(POLL);
      assertNotNull(redelivered);
      assertEquals(2, redelivered.attemptCount());

      redelivered.ack();
      assertNull(after.poll(POLL));
      assertEquals(1L, groupOffsets.get(partition).offset());
      assertEquals("", groupOffsets.get(partition).metadata());
    } finally {
      replacement.close();
    }
  }

  // ── Helpers ───────────────────────────────────────────────────

  private Subscription subscribe(int prefetchLimit) throws Exception {
    return subscribe(connection, consumer, prefetchLimit);
  }

  private Subscription subscribe(ChannelConnection conn, MockConsumer<String, byte[]> owner, int prefetchLimit)
      throws Exception {
    Subscription subscription = conn.subscribe(TOPIC, prefetchLimit);
    owner.rebalance(List.of(partition));
    owner.updateBeginningOffsets(Map.of(partition, 0L));
    return subscription;
  }

  private void addRecord(long offset, String key, byte[] value, String attempt) {
    addRecord(consumer, offset, key, value, attempt);
  }

  private static void addRecord(MockConsumer<String, byte[]> owner, long offset, String key, byte[] value,
      String attempt) {
    ConsumerRecord<String, byte[]> record = new ConsumerRecord<>(TOPIC, 0, offset, key, value);
    if (attempt != null) {
      record.headers().add(KafkaChannelClient.ATTEMPT_HEADER, attempt.getBytes(StandardCharsets.US_ASCII));
    }
    owner.addRecord(record);
  }

  private Long committedOffset() {
    OffsetAndMetadata committed = consumer.committed(Set.of(partition)).get(partition);
    return committed == null ? null : committed.offset();
  }

  private static String headerValue(Header header) {
    assertNotNull(header);
    return new String(header.value(), StandardCharsets.US_ASCII);
  }

  private static byte[] bytes(String s) {
    return s.getBytes(StandardCharsets.UTF_8);
  }

  /** Mock consumer whose commits outlive it, like a group coordinator's offset store. */
  private static final class GroupConsumer extends MockConsumer<String, byte[]> {
    private final Map<TopicPartition, OffsetAndMetadata> groupOffsets;

    GroupConsumer(Map<TopicPartition, OffsetAndMetadata> groupOffsets) {
      super(OffsetResetStrategy.EARLIEST);
      this.groupOffsets = groupOffsets;
    }

    @Override
    public synchronized void commitSync(Map<TopicPartition, OffsetAndMetadata> offsets) {
      super.commitSync(offsets);
      groupOffsets.putAll(offsets);
    }

    @Override
    public synchronized Map<TopicPartition, OffsetAndMetadata> committed(Set<TopicPartition> partitions) {
      Map<TopicPartition, OffsetAndMetadata> result = new HashMap<>();
      for (TopicPartition tp : partitions) {
        OffsetAndMetadata offset = groupOffsets.get(tp);
        if (offset != null) {
          result.put(tp, offset);
        }
      }
      return result;
    }
  }
}
