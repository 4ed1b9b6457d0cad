package io.framerelay.kafka;

import io.framerelay.channel.ChannelClosedException;
import io.framerelay.channel.Delivery;
import io.framerelay.channel.PublishException;
import io.framerelay.channel.Subscription;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.header.Header;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Kafka consumer adapted to the prefetch-bounded {@link Subscription} contract.
 *
 * <p>The consumer itself is only touched under {@code consumerLock} from
 * {@link #poll(Duration)} and {@link #close()}. Settling a delivery only updates the
 * pending-offset table; the next poll commits, per partition, the offset after the
 * longest settled prefix. While records are buffered or the prefetch window is full the
 * assignment is paused, so the consumer keeps its group membership without fetching.
 *
 * <p>Each commit also records, in {@link OffsetAttempts} metadata, the attempt of every
 * handed-out offset it does not cover. A record fetched again at such an offset is a
 * redelivery and is handed out with the next attempt.
 */
final class KafkaSubscription implements Subscription {
  private static final Logger logger = Logger.getLogger(KafkaSubscription.class.getName());

  private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

  private final KafkaConnection connection;
  private final Consumer<String, byte[]> consumer;
  private final String channel;
  private final int prefetchLimit;
  private final long idleCheckNanos;
  private final ReentrantLock consumerLock = new ReentrantLock();
  private final Object stateLock = new Object();
  private final ArrayDeque<ConsumerRecord<String, byte[]>> buffered = new ArrayDeque<>();
  private final Map<TopicPartition, TreeMap<Long, PendingOffset>> pending = new HashMap<>();
  private final Set<TopicPartition> handedOutSinceCommit = new HashSet<>();
  // guarded by consumerLock
  private final Map<TopicPartition, Map<Long, Integer>> previousAttempts = new HashMap<>();
  private int unsettled;
  private boolean open = true;
  private long idleSince = System.nanoTime();

  KafkaSubscription(KafkaConnection connection, Consumer<String, byte[]> consumer, String channel,
      int prefetchLimit, Duration idleCheck) {
    this.connection = Objects.requireNonNull(connection, "connection");
    this.consumer = Objects.requireNonNull(consumer, "consumer");
    this.channel = Objects.requireNonNull(channel, "channel");
    this.prefetchLimit = prefetchLimit;
    this.idleCheckNanos = idleCheck.toNanos();
    consumer.subscribe(List.of(channel), new RevocationListener());
  }

  @Override
  public Delivery poll(Duration timeout) throws ChannelClosedException {
    consumerLock.lock();
    try {
      ensureOpen();
      if (buffered.isEmpty() && inFlight() < prefetchLimit) {
        consumer.resume(consumer.assignment());
        ConsumerRecords<String, byte[]> records = consumer.poll(timeout);
        for (ConsumerRecord<String, byte[]> record : records) {
          buffered.addLast(record);
        }
        if (records.isEmpty()) {
          checkClusterWhenIdle();
        } else {
          idleSince = System.nanoTime();
        }
      } else {
        consumer.pause(consumer.assignment());
        consumer.poll(Duration.ZERO);
        idleSince = System.nanoTime();
      }
      Delivery delivery = null;
      if (!buffered.isEmpty() && inFlight() < prefetchLimit) {
        delivery = handOut(buffered.pollFirst());
      }
      commitSettled();
      return delivery;
    } catch (KafkaException e) {
      connection.fail(e);
      throw new ChannelClosedException("Kafka consumer for " + channel + " failed", e);
    } finally {
      consumerLock.unlock();
    }
  }

  /** An empty poll does not tell a quiet channel from a dead cluster. */
  private void checkClusterWhenIdle() throws ChannelClosedException {
    long now = System.nanoTime();
    if (now - idleSince < idleCheckNanos) {
      return;
    }
    if (!connection.verifyClusterOrFail()) {
      throw new ChannelClosedException("Kafka cluster for " + channel + " stopped answering");
    }
    idleSince = System.nanoTime();
  }

  private void ensureOpen() throws ChannelClosedException {
    synchronized (stateLock) {
      if (!open) {
        throw new ChannelClosedException("Subscription to " + channel + " is closed");
      }
    }
  }

  /** Caller holds {@code consumerLock}. */
  private Delivery handOut(ConsumerRecord<String, byte[]> record) {
    TopicPartition partition = new TopicPartition(record.topic(), record.partition());
    int attempt = attemptOf(record);
    Integer previous = previousAttempts(partition).remove(record.offset());
    if (previous != null && previous + 1 > attempt) {
      attempt = previous + 1;
    }
    synchronized (stateLock) {
      pending.computeIfAbsent(partition, p -> new TreeMap<>()).put(record.offset(), new PendingOffset(attempt));
      handedOutSinceCommit.add(partition);
      unsettled++;
    }
    byte[] body = record.value() != null ? record.value() : new byte[0];
    return new KafkaDelivery(this, partition, record.offset(), attempt, record.key(), body);
  }

  /** Attempts recorded by an earlier owner of the partition. Caller holds {@code consumerLock}. */
  private Map<Long, Integer> previousAttempts(TopicPartition partition) {
    Map<Long, Integer> attempts = previousAttempts.get(partition);
    if (attempts == null) {
      OffsetAndMetadata committed = consumer.committed(Set.of(partition)).get(partition);
      attempts = new HashMap<>(OffsetAttempts.decode(committed != null ? committed.metadata() : null));
      previousAttempts.put(partition, attempts);
    }
    return attempts;
  }

  /** Caller holds {@code consumerLock}. */
  private void commitSettled() {
    Map<TopicPartition, OffsetAndMetadata> commits = new HashMap<>();
    synchronized (stateLock) {
      for (Map.Entry<TopicPartition, TreeMap<Long, PendingOffset>> entry : pending.entrySet()) {
        TreeMap<Long, PendingOffset> offsets = entry.getValue();
        long next = -1;
        Iterator<Map.Entry<Long, PendingOffset>> it = offsets.entrySet().iterator();
        while (it.hasNext()) {
          Map.Entry<Long, PendingOffset> offset = it.next();
          if (!offset.getValue().settled) {
            break;
          }
          next = offset.getKey() + 1;
          it.remove();
        }
        boolean handedOut = handedOutSinceCommit.remove(entry.getKey());
        if (next < 0 && !handedOut) {
          continue;
        }
        long position = offsets.isEmpty() ? next : offsets.firstKey();
        Map<Long, Integer> attempts = new TreeMap<>();
        offsets.forEach((offset, state) -> attempts.put(offset, state.attempt));
        commits.put(entry.getKey(), new OffsetAndMetadata(position, OffsetAttempts.encode(attempts)));
      }
    }
    if (!commits.isEmpty()) {
      consumer.commitSync(commits);
      logger.fine("Committed " + commits + " on " + channel);
    }
  }

  void settle(KafkaDelivery delivery, Settlement settlement) throws ChannelClosedException {
    synchronized (stateLock) {
      if (!open) {
        throw new ChannelClosedException("Subscription to " + channel + " closed before "
            + delivery.deliveryId() + " was settled; it will be redelivered");
      }
      TreeMap<Long, PendingOffset> offsets = pending.get(delivery.partition());
      if (offsets == null || !offsets.containsKey(delivery.offset())) {
        logger.fine("Partition " + delivery.partition() + " was revoked; " + delivery.deliveryId()
            + " will be redelivered to its new owner");
        return;
      }
    }
    try {
      switch (settlement) {
        case REQUEUE -> connection.send(channel, delivery.key(), delivery.body(), delivery.attemptCount() + 1);
        case DEAD_LETTER -> connection.send(channel + KafkaChannelClient.DEAD_LETTER_SUFFIX, delivery.key(),
            delivery.body(), delivery.attemptCount());
        case ACK -> {
        }
      }
    } catch (PublishException e) {
      connection.fail(e);
      throw new ChannelClosedException("Could not " + settlement + " " + delivery.deliveryId(), e);
    }
    synchronized (stateLock) {
      TreeMap<Long, PendingOffset> offsets = pending.get(delivery.partition());
      PendingOffset state = offsets != null ? offsets.get(delivery.offset()) : null;
      if (state != null && !state.settled) {
        state.settled = true;
        unsettled--;
      }
    }
  }

  static int attemptOf(ConsumerRecord<String, byte[]> record) {
    Header header = record.headers().lastHeader(KafkaChannelClient.ATTEMPT_HEADER);
    if (header == null || header.value() == null) {
      return 1;
    }
    try {
      int attempt = Integer.parseInt(new String(header.value(), StandardCharsets.US_ASCII).trim());
      return Math.max(1, attempt);
    } catch (NumberFormatException e) {
      logger.log(Level.FINE, "Ignoring malformed attempt header on " + record.topic() + "-"
          + record.partition() + "@" + record.offset(), e);
      return 1;
    }
  }

  @Override
  public String channel() {
    return channel;
  }

  @Override
  public int prefetchLimit() {
    return prefetchLimit;
  }

  @Override
  public int inFlight() {
    synchronized (stateLock) {
      return unsettled;
    }
  }

  /**
   * Commits what is settled and closes the consumer. Records that were handed out but
   * not settled stay uncommitted and are redelivered to the group.
   */
  @Override
  public void close() {
    consumerLock.lock();
    try {
      synchronized (stateLock) {
        if (!open) {
          return;
        }
      }
      try {
        commitSettled();
      } catch (KafkaException e) {
        logger.log(Level.FINE, "Final commit on " + channel + " failed", e);
      }
      synchronized (stateLock) {
        open = false;
        pending.clear();
        handedOutSinceCommit.clear();
        buffered.clear();
        unsettled = 0;
      }
      try {
        consumer.close(CLOSE_TIMEOUT);
      } catch (KafkaException e) {
        logger.log(Level.FINE, "Error closing Kafka consumer", e);
      }
    } finally {
      consumerLock.unlock();
      connection.removed(this);
    }
  }

  private static final class PendingOffset {
    final int attempt;
    boolean settled;

    PendingOffset(int attempt) {
      this.attempt = attempt;
    }
  }

  enum Settlement {
    ACK,
    REQUEUE,
    DEAD_LETTER
  }

  private final class RevocationListener implements ConsumerRebalanceListener {

    @Override
    public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
      try {
        commitSettled();
      } catch (KafkaException e) {
        logger.log(Level.FINE, "Commit on revocation failed for " + channel, e);
      }
      synchronized (stateLock) {
        for (TopicPartition partition : partitions) {
          previousAttempts.remove(partition);
          handedOutSinceCommit.remove(partition);
          TreeMap<Long, PendingOffset> offsets = pending.remove(partition);
          if (offsets != null) {
            for (PendingOffset offset : offsets.values()) {
              if (!offset.settled) {
                unsettled--;
              }
            }
          }
        }
        buffered.removeIf(r -> partitions.contains(new TopicPartition(r.topic(), r.partition())));
      }
    }

    @Override
    public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
      logger.fine("Assigned " + partitions + " on " + channel);
    }
  }
}
