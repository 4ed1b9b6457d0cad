package io.framerelay.channel;

/**
 * The broker did not confirm a publish.
 *
 * <p>The message may or may not have been stored; callers must not assume it was.
 */
public class PublishException extends ChannelException {

  public PublishException(String message) {
    super(message);
  }

  public PublishException(String message, Throwable cause) {
    super(message, cause);
  }
}
