package io.framerelay.channel;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Base {@link Delivery} that enforces the settle-exactly-once contract.
 *
 * <p>Subclasses implement {@link #doAck()} and {@link #doNack(boolean)}; each runs at
 * most once per delivery. If the broker call fails the delivery still counts as settled
 * locally, because the broker will redeliver it on its own.
 */
public abstract class AbstractDelivery implements Delivery {
  private final String deliveryId;
  private final int attemptCount;
  private final String key;
  private final byte[] body;
  private final AtomicBoolean settled = new AtomicBoolean(false);

  protected AbstractDelivery(String deliveryId, int attemptCount, String key, byte[] body) {
    this.deliveryId = Objects.requireNonNull(deliveryId, "deliveryId");
    this.body = Objects.requireNonNull(body, "body");
    this.key = key;
    if (attemptCount < 1) {
      throw new IllegalArgumentException("attemptCount must be >= 1, got: " + attemptCount);
    }
    this.attemptCount = attemptCount;
  }

  @Override
  public final String deliveryId() {
    return deliveryId;
  }

  @Override
  public final int attemptCount() {
    return attemptCount;
  }

  @Override
  public final String key() {
    return key;
  }

  @Override
  public final byte[] body() {
    return body.clone();
  }

  @Override
  public final void ack() throws ChannelClosedException {
    markSettled("ack");
    doAck();
  }

  @Override
  public final void nack(boolean requeue) throws ChannelClosedException {
    markSettled("nack");
    doNack(requeue);
  }

  @Override
  public final boolean isSettled() {
    return settled.get();
  }

  protected abstract void doAck() throws ChannelClosedException;

  protected abstract void doNack(boolean requeue) throws ChannelClosedException;

  private void markSettled(String operation) {
    if (!settled.compareAndSet(false, true)) {
      throw new IllegalStateException("Delivery " + deliveryId + " already settled; cannot " + operation);
    }
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{deliveryId=" + deliveryId + ", attemptCount=" + attemptCount + "}";
  }
}
