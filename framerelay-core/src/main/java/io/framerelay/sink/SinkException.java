package io.framerelay.sink;

/**
 * Thrown when a {@link ResultSink} could not store a detection. Treated as a transient
 * failure of the delivery.
 */
public class SinkException extends Exception {

  public SinkException(String message) {
    super(message);
  }

  public SinkException(String message, Throwable cause) {
    super(message, cause);
  }
}
