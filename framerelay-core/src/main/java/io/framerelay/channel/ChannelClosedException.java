package io.framerelay.channel;

/**
 * The connection backing a subscription or delivery is gone.
 *
 * <p>Every unsettled delivery of that connection has already been returned to the broker
 * and will be redelivered after a reconnect.
 */
public class ChannelClosedException extends ChannelException {

  public ChannelClosedException(String message) {
    super(message);
  }

  public ChannelClosedException(String message, Throwable cause) {
    super(message, cause);
  }
}
