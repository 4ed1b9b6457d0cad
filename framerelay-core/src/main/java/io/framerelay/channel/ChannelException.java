package io.framerelay.channel;

/**
 * Base type for broker failures surfaced by a {@link ChannelClient}.
 */
public class ChannelException extends Exception {

  public ChannelException(String message) {
    super(message);
  }

  public ChannelException(String message, Throwable cause) {
    super(message, cause);
  }
}
