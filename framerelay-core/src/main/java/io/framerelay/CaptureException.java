package io.framerelay;

/**
 * Raised by a {@link FrameSource} when the capture device fails.
 *
 * <p>Reported to the supervisor; the capture flow restarts with backoff.
 */
public class CaptureException extends Exception {

  public CaptureException(String message) {
    super(message);
  }

  public CaptureException(String message, Throwable cause) {
    super(message, cause);
  }
}
