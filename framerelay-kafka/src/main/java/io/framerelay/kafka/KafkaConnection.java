package io.framerelay.kafka;

import io.framerelay.channel.ChannelClosedException;
import io.framerelay.channel.ChannelConnectException;
import io.framerelay.channel.ChannelConnection;
import io.framerelay.channel.PublishAck;
import io.framerelay.channel.PublishException;
import io.framerelay.channel.Subscription;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.RetriableException;
import org.apache.kafka.common.header.internals.RecordHeader;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One producer shared by every publish, plus one consumer per subscription.
 *
 * <p>A non-retriable Kafka error from either side closes the whole connection, and so does
 * a retriable one when the cluster no longer answers. The owning pipeline then reconnects
 * and uncommitted offsets are redelivered.
 */
final class KafkaConnection implements ChannelConnection {
  private static final Logger logger = Logger.getLogger(KafkaConnection.class.getName());

  private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

  private final KafkaChannelClient client;
  private final Producer<String, byte[]> producer;
  private final List<KafkaSubscription> subscriptions = new CopyOnWriteArrayList<>();
  private final AtomicBoolean open = new AtomicBoolean(true);

  KafkaConnection(KafkaChannelClient client, Producer<String, byte[]> producer) {
    this.client = Objects.requireNonNull(client, "client");
    this.producer = Objects.requireNonNull(producer, "producer");
  }

  @Override
  public PublishAck publish(String channel, String key, byte[] body) throws PublishException {
    return send(channel, key, body, 0);
  }

  /**
   * Sends a record and waits for the broker's acknowledgement.
   *
   * @param attempt value for the attempt header, or {@code 0} to omit it
   */
  PublishAck send(String channel, String key, byte[] body, int attempt) throws PublishException {
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(body, "body");
    if (!open.get()) {
      throw new PublishException("Kafka connection to " + client.describe() + " is closed");
    }
    ProducerRecord<String, byte[]> record = new ProducerRecord<>(channel, key, body);
    if (attempt > 0) {
      record.headers().add(new RecordHeader(KafkaChannelClient.ATTEMPT_HEADER,
          Integer.toString(attempt).getBytes(StandardCharsets.US_ASCII)));
    }
    try {
      RecordMetadata metadata = producer.send(record).get(client.sendTimeout().toMillis(), TimeUnit.MILLISECONDS);
      return new PublishAck(channel, metadata.topic() + "-" + metadata.partition() + "@" + metadata.offset());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PublishException("Interrupted while awaiting publish confirmation for " + channel, e);
    } catch (TimeoutException e) {
      verifyClusterOrFail();
      throw new PublishException("No publish confirmation for " + channel + " within " + client.sendTimeout(), e);
    } catch (ExecutionException e) {
      throw publishFailure(channel, e.getCause());
    } catch (KafkaException e) {
      throw publishFailure(channel, e);
    }
  }

  private PublishException publishFailure(String channel, Throwable cause) {
    if (cause instanceof RetriableException) {
      verifyClusterOrFail();
    } else {
      fail(cause);
    }
    return new PublishException("Publish to " + channel + " failed", cause);
  }

  @Override
  public Subscription subscribe(String channel, int prefetchLimit) throws ChannelClosedException {
    Objects.requireNonNull(channel, "channel");
    if (prefetchLimit < 1) {
      throw new IllegalArgumentException("prefetchLimit must be >= 1");
    }
    if (!open.get()) {
      throw new ChannelClosedException("Kafka connection to " + client.describe() + " is closed");
    }
    Consumer<String, byte[]> consumer;
    try {
      consumer = client.newConsumer(prefetchLimit);
    } catch (ChannelConnectException e) {
      throw new ChannelClosedException("Cannot subscribe to " + channel, e);
    }
    KafkaSubscription subscription = new KafkaSubscription(this, consumer, channel, prefetchLimit,
        client.connectTimeout());
    subscriptions.add(subscription);
    return subscription;
  }

  @Override
  public boolean isOpen() {
    return open.get();
  }

  /**
   * Checks that the cluster still answers and closes the connection if it does not.
   *
   * @return {@code true} if the cluster answered
   */
  boolean verifyClusterOrFail() {
    if (!open.get()) {
      return false;
    }
    try {
      client.verifyCluster();
      return true;
    } catch (ChannelConnectException e) {
      fail(e);
      return false;
    }
  }

  /** Closes the connection after an unrecoverable Kafka error. */
  void fail(Throwable cause) {
    if (open.get()) {
      logger.log(Level.WARNING, "Closing Kafka connection to " + client.describe() + " after failure", cause);
      close();
    }
  }

  void removed(KafkaSubscription subscription) {
    subscriptions.remove(subscription);
  }

  @Override
  public void close() {
    if (!open.compareAndSet(true, false)) {
      return;
    }
    for (KafkaSubscription subscription : new ArrayList<>(subscriptions)) {
      subscription.close();
    }
    try {
      producer.close(CLOSE_TIMEOUT);
    } catch (KafkaException e) {
      logger.log(Level.FINE, "Error closing Kafka producer", e);
    }
  }
}
