package io.framerelay.channel;

/**
 * The broker could not be reached or refused the session.
 *
 * <p>Raised without internal retry; callers decide the retry policy, usually through
 * {@link Reconnector}.
 */
public class ChannelConnectException extends ChannelException {

  public ChannelConnectException(String message) {
    super(message);
  }

  public ChannelConnectException(String message, Throwable cause) {
    super(message, cause);
  }
}
