package io.framerelay.channel;

/**
 * One message handed out by a {@link Subscription}, with the handle that settles it.
 *
 * <p>Exactly one of {@link #ack()} or {@link #nack(boolean)} must be called. A delivery
 * that is never settled stays in flight until its connection drops, after which the
 * broker redelivers it. Settling twice raises {@link IllegalStateException}.
 *
 * @see AbstractDelivery
 */
public interface Delivery {

  /**
   * Broker-assigned identifier of this delivery attempt.
   *
   * @return delivery id
   */
  String deliveryId();

  /**
   * Delivery attempts of the underlying message, including this one (starts at 1).
   *
   * @return attempt count
   */
  int attemptCount();

  String key();

  byte[] body();

  /**
   * Confirms processing; the broker discards the message.
   *
   * @throws ChannelClosedException if the connection is gone; the message will be redelivered
   */
  void ack() throws ChannelClosedException;

  /**
   * Rejects the delivery.
   *
   * @param requeue {@code true} to redeliver with an incremented attempt count,
   *     {@code false} to dead-letter it
   * @throws ChannelClosedException if the connection is gone; the message will be redelivered
   */
  void nack(boolean requeue) throws ChannelClosedException;

  boolean isSettled();
}
