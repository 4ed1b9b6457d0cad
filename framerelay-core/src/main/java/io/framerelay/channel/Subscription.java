package io.framerelay.channel;

import java.time.Duration;

/**
 * A lazy stream of deliveries from one channel.
 *
 * <p>The broker never hands out more than the subscription's prefetch limit of unsettled
 * deliveries; {@link #poll(Duration)} waits while the limit is reached. This is the
 * consumer-side backpressure valve. Thread-safe: worker slots poll concurrently.
 */
public interface Subscription extends AutoCloseable {

  /**
   * Waits up to {@code timeout} for the next delivery.
   *
   * @param timeout maximum wait
   * @return the next delivery, or {@code null} if none arrived in time
   * @throws ChannelClosedException if the underlying connection is gone
   */
  Delivery poll(Duration timeout) throws ChannelClosedException;

  String channel();

  int prefetchLimit();

  /**
   * Number of deliveries handed out and not yet settled.
   *
   * @return unsettled delivery count
   */
  int inFlight();

  /**
   * Cancels the subscription. Unsettled deliveries are returned to the broker.
   */
  @Override
  void close();
}
