package io.framerelay.channel;

/**
 * One session with the broker.
 *
 * <p>Implementations serialize their own internal access: publishing, subscribing and
 * settling deliveries may happen from any number of threads without external locking.
 *
 * <p>When the session is lost, {@link #isOpen()} turns {@code false}, every later call
 * fails with {@link ChannelClosedException} or {@link PublishException}, and all
 * unsettled deliveries go back to the broker for redelivery. A lost connection is never
 * revived; open a new one.
 */
public interface ChannelConnection extends AutoCloseable {

  /**
   * Publishes one message and waits for the broker to confirm it is durably stored.
   *
   * <p>The channel is declared durable on first use.
   *
   * @param channel target channel name
   * @param key     routing or partitioning key, typically the frame source id
   * @param body    message body
   * @return the broker confirmation
   * @throws PublishException if the broker did not confirm; the message may be lost
   */
  PublishAck publish(String channel, String key, byte[] body) throws PublishException;

  /**
   * Subscribes to a channel.
   *
   * @param channel       channel name
   * @param prefetchLimit maximum number of unsettled deliveries handed out at once, &ge; 1
   * @return a subscription that can be polled from several threads
   * @throws ChannelClosedException if the connection is no longer open
   */
  Subscription subscribe(String channel, int prefetchLimit) throws ChannelClosedException;

  boolean isOpen();

  /**
   * Closes the session. Unsettled deliveries are returned to the broker. Idempotent.
   */
  @Override
  void close();
}
