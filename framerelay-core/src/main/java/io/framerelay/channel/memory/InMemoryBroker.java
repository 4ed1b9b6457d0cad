package io.framerelay.channel.memory;

import io.framerelay.channel.AbstractDelivery;
import io.framerelay.channel.ChannelClosedException;
import io.framerelay.channel.ChannelConnectException;
import io.framerelay.channel.ChannelConnection;
import io.framerelay.channel.Delivery;
import io.framerelay.channel.PublishAck;
import io.framerelay.channel.PublishException;
import io.framerelay.channel.Subscription;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Process-local broker with the delivery contract of a durable queueing broker.
 *
 * <p>Messages live in per-channel FIFO queues for the lifetime of this object. A
 * subscription never holds more than its prefetch limit of unsettled deliveries. Requeued
 * messages go to the tail of the queue; messages returned by a dropped connection go back
 * to the head. Every redelivery increments the attempt count. Dead-lettered messages are
 * kept per channel for inspection.
 *
 * <p>Outages can be simulated with {@link #setAvailable(boolean)} and
 * {@link #disconnectAll()}, slow brokers with {@link #setPublishLatencyMs(long)} and
 * unconfirmed publishes with {@link #rejectNextPublishes(int)}.
 *
 * <p>This class is thread-safe. All state is guarded by one lock.
 */
public final class InMemoryBroker {
  private static final Logger logger = Logger.getLogger(InMemoryBroker.class.getName());

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = lock.newCondition();
  private final Map<String, ChannelState> channels = new HashMap<>();
  private final Set<Connection> connections = new LinkedHashSet<>();
  private final AtomicLong messageSeq = new AtomicLong();
  private final AtomicLong deliverySeq = new AtomicLong();
  private final AtomicLong connectionSeq = new AtomicLong();

  private volatile boolean available = true;
  private volatile long publishLatencyMs;
  private int publishRejections;

  /**
   * Dead-lettered message.
   *
   * @param channel      channel it was consumed from
   * @param messageId    broker message id
   * @param key          message key
   * @param body         message body
   * @param attemptCount delivery attempt on which it was dead-lettered
   */
  public record DeadLetter(String channel, String messageId, String key, byte[] body, int attemptCount) {
  }

  /**
   * Makes the broker reachable or unreachable. Going unavailable drops every open
   * connection; new connects fail with {@link ChannelConnectException}.
   *
   * @param available whether connects should succeed
   */
  public void setAvailable(boolean available) {
    this.available = available;
    if (!available) {
      disconnectAll();
    }
  }

  public boolean isAvailable() {
    return available;
  }

  /**
   * Delays every publish confirmation by the given time.
   *
   * @param latencyMs added latency in milliseconds, {@code 0} to disable
   */
  public void setPublishLatencyMs(long latencyMs) {
    if (latencyMs < 0) {
      throw new IllegalArgumentException("latencyMs must be >= 0");
    }
    this.publishLatencyMs = latencyMs;
  }

  /**
   * Makes the next {@code count} publishes fail without storing the message.
   *
   * @param count number of publishes to reject
   */
  public void rejectNextPublishes(int count) {
    lock.lock();
    try {
      publishRejections = count;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Drops every open connection as if the network failed. Unsettled deliveries return
   * to the head of their queues.
   */
  public void disconnectAll() {
    List<Connection> open;
    lock.lock();
    try {
      open = new ArrayList<>(connections);
    } finally {
      lock.unlock();
    }
    for (Connection connection : open) {
      connection.close();
    }
    if (!open.isEmpty()) {
      logger.info("Dropped " + open.size() + " in-memory broker connection(s)");
    }
  }

  /**
   * Number of messages ready for delivery on a channel.
   *
   * @param channel channel name
   * @return queued message count
   */
  public int depth(String channel) {
    lock.lock();
    try {
      ChannelState state = channels.get(channel);
      return state == null ? 0 : state.ready.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Number of messages handed out and not yet settled on a channel.
   *
   * @param channel channel name
   * @return in-flight count across all subscriptions
   */
  public int inFlight(String channel) {
    lock.lock();
    try {
      int total = 0;
      for (Connection connection : connections) {
        for (Sub sub : connection.subscriptions) {
          if (sub.channel.equals(channel)) {
            total += sub.unsettled.size();
          }
        }
      }
      return total;
    } finally {
      lock.unlock();
    }
  }

  public long publishedCount(String channel) {
    lock.lock();
    try {
      ChannelState state = channels.get(channel);
      return state == null ? 0 : state.published;
    } finally {
      lock.unlock();
    }
  }

  public long acknowledgedCount(String channel) {
    lock.lock();
    try {
      ChannelState state = channels.get(channel);
      return state == null ? 0 : state.acknowledged;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns how many times each message id was acknowledged. A correct consumer never
   * acknowledges the same message twice.
   *
   * @param channel channel name
   * @return message id to ack count
   */
  public Map<String, Integer> acknowledgementsByMessage(String channel) {
    lock.lock();
    try {
      ChannelState state = channels.get(channel);
      return state == null ? Map.of() : Map.copyOf(state.acksByMessage);
    } finally {
      lock.unlock();
    }
  }

  public List<DeadLetter> deadLetters(String channel) {
    lock.lock();
    try {
      ChannelState state = channels.get(channel);
      return state == null ? List.of() : List.copyOf(state.dead);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Snapshot of the bodies queued on a channel, oldest first, without consuming them.
   *
   * @param channel channel name
   * @return queued message bodies
   */
  public List<byte[]> peek(String channel) {
    lock.lock();
    try {
      ChannelState state = channels.get(channel);
      if (state == null) {
        return List.of();
      }
      List<byte[]> bodies = new ArrayList<>(state.ready.size());
      for (StoredMessage message : state.ready) {
        bodies.add(message.body.clone());
      }
      return bodies;
    } finally {
      lock.unlock();
    }
  }

  public int openConnections() {
    lock.lock();
    try {
      return connections.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Waits until a channel has no queued and no in-flight messages.
   *
   * @param channel channel name
   * @param timeout maximum wait
   * @return {@code true} if the channel drained in time
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitIdle(String channel, Duration timeout) throws InterruptedException {
    long remaining = timeout.toNanos();
    lock.lock();
    try {
      while (true) {
        ChannelState state = channels.get(channel);
        boolean idle = state == null || state.ready.isEmpty();
        if (idle && inFlight(channel) == 0) {
          return true;
        }
        if (remaining <= 0) {
          return false;
        }
        remaining = changed.awaitNanos(remaining);
      }
    } finally {
      lock.unlock();
    }
  }

  ChannelConnection connect() throws ChannelConnectException {
    lock.lock();
    try {
      if (!available) {
        throw new ChannelConnectException("In-memory broker is unavailable");
      }
      Connection connection = new Connection("conn-" + connectionSeq.incrementAndGet());
      connections.add(connection);
      return connection;
    } finally {
      lock.unlock();
    }
  }

  private ChannelState channelState(String name) {
    return channels.computeIfAbsent(name, n -> new ChannelState());
  }

  private enum Settlement {
    ACK,
    REQUEUE,
    DEAD_LETTER
  }

  private static final class ChannelState {
    private final Deque<StoredMessage> ready = new ArrayDeque<>();
    private final List<DeadLetter> dead = new ArrayList<>();
    private final Map<String, Integer> acksByMessage = new LinkedHashMap<>();
    private long published;
    private long acknowledged;
  }

  private static final class StoredMessage {
    private final String messageId;
    private final String key;
    private final byte[] body;
    private int deliveries;

    private StoredMessage(String messageId, String key, byte[] body) {
      this.messageId = messageId;
      this.key = key;
      this.body = body;
    }
  }

  private final class Connection implements ChannelConnection {
    private final String id;
    private final List<Sub> subscriptions = new ArrayList<>();
    private boolean open = true;

    private Connection(String id) {
      this.id = id;
    }

    @Override
    public PublishAck publish(String channel, String key, byte[] body) throws PublishException {
      Objects.requireNonNull(channel, "channel");
      Objects.requireNonNull(body, "body");
      long latency = publishLatencyMs;
      if (latency > 0) {
        try {
          Thread.sleep(latency);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new PublishException("Interrupted while awaiting publish confirmation", e);
        }
      }
      lock.lock();
      try {
        if (!open) {
          throw new PublishException("Connection " + id + " is closed");
        }
        if (publishRejections > 0) {
          publishRejections--;
          throw new PublishException("Broker did not confirm publish to " + channel);
        }
        ChannelState state = channelState(channel);
        StoredMessage message = new StoredMessage("m-" + messageSeq.incrementAndGet(), key, body.clone());
        state.ready.addLast(message);
        state.published++;
        changed.signalAll();
        return new PublishAck(channel, message.messageId);
      } finally {
        lock.unlock();
      }
    }

    @Override
    public Subscription subscribe(String channel, int prefetchLimit) throws ChannelClosedException {
      Objects.requireNonNull(channel, "channel");
      if (prefetchLimit < 1) {
        throw new IllegalArgumentException("prefetchLimit must be >= 1");
      }
      lock.lock();
      try {
        if (!open) {
          throw new ChannelClosedException("Connection " + id + " is closed");
        }
        channelState(channel);
        Sub sub = new Sub(this, channel, prefetchLimit);
        subscriptions.add(sub);
        return sub;
      } finally {
        lock.unlock();
      }
    }

    @Override
    public boolean isOpen() {
      lock.lock();
      try {
        return open;
      } finally {
        lock.unlock();
      }
    }

    @Override
    public void close() {
      lock.lock();
      try {
        if (!open) {
          return;
        }
        open = false;
        for (Sub sub : subscriptions) {
          sub.returnUnsettled();
        }
        subscriptions.clear();
        connections.remove(this);
        changed.signalAll();
      } finally {
        lock.unlock();
      }
    }

    @Override
    public String toString() {
      return "InMemoryConnection{" + id + "}";
    }
  }

  private final class Sub implements Subscription {
    private final Connection connection;
    private final String channel;
    private final int prefetchLimit;
    private final Map<String, StoredMessage> unsettled = new LinkedHashMap<>();
    private boolean open = true;

    private Sub(Connection connection, String channel, int prefetchLimit) {
      this.connection = connection;
      this.channel = channel;
      this.prefetchLimit = prefetchLimit;
    }

    @Override
    public Delivery poll(Duration timeout) throws ChannelClosedException {
      long remaining = timeout.toNanos();
      lock.lock();
      try {
        while (true) {
          if (!open || !connection.open) {
            throw new ChannelClosedException("Subscription to " + channel + " is closed");
          }
          ChannelState state = channelState(channel);
          if (unsettled.size() < prefetchLimit && !state.ready.isEmpty()) {
            StoredMessage message = state.ready.pollFirst();
            message.deliveries++;
            String deliveryId = "d-" + deliverySeq.incrementAndGet();
            unsettled.put(deliveryId, message);
            return new MemoryDelivery(this, deliveryId, message);
          }
          if (remaining <= 0) {
            return null;
          }
          try {
            remaining = changed.awaitNanos(remaining);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
          }
        }
      } finally {
        lock.unlock();
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
      lock.lock();
      try {
        return unsettled.size();
      } finally {
        lock.unlock();
      }
    }

    @Override
    public void close() {
      lock.lock();
      try {
        if (!open) {
          return;
        }
        returnUnsettled();
        connection.subscriptions.remove(this);
        changed.signalAll();
      } finally {
        lock.unlock();
      }
    }

    /** Caller holds the lock. */
    private void returnUnsettled() {
      open = false;
      if (unsettled.isEmpty()) {
        return;
      }
      ChannelState state = channelState(channel);
      List<StoredMessage> pending = new ArrayList<>(unsettled.values());
      for (int i = pending.size() - 1; i >= 0; i--) {
        state.ready.addFirst(pending.get(i));
      }
      unsettled.clear();
    }

    private void settle(String deliveryId, Settlement settlement) throws ChannelClosedException {
      lock.lock();
      try {
        StoredMessage message = unsettled.remove(deliveryId);
        if (message == null) {
          throw new ChannelClosedException("Delivery " + deliveryId + " was returned to the broker");
        }
        ChannelState state = channelState(channel);
        switch (settlement) {
          case ACK -> {
            state.acknowledged++;
            state.acksByMessage.merge(message.messageId, 1, Integer::sum);
          }
          case REQUEUE -> state.ready.addLast(message);
          case DEAD_LETTER -> state.dead.add(new DeadLetter(channel, message.messageId, message.key,
              message.body.clone(), message.deliveries));
        }
        changed.signalAll();
      } finally {
        lock.unlock();
      }
    }
  }

  private static final class MemoryDelivery extends AbstractDelivery {
    private final Sub sub;

    private MemoryDelivery(Sub sub, String deliveryId, StoredMessage message) {
      super(deliveryId, message.deliveries, message.key, message.body);
      this.sub = sub;
    }

    @Override
    protected void doAck() throws ChannelClosedException {
      sub.settle(deliveryId(), Settlement.ACK);
    }

    @Override
    protected void doNack(boolean requeue) throws ChannelClosedException {
      sub.settle(deliveryId(), requeue ? Settlement.REQUEUE : Settlement.DEAD_LETTER);
    }
  }
}
