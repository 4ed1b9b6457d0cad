package io.framerelay.codec;

import java.util.Objects;

/**
 * A payload that can never be decoded, whatever the number of attempts.
 *
 * <p>Consumers dead-letter the delivery instead of requeueing it.
 */
public class FrameDecodeException extends Exception {

  private final String reason;

  public FrameDecodeException(String reason) {
    super("Cannot decode frame: " + Objects.requireNonNull(reason, "reason"));
    this.reason = reason;
  }

  /**
   * Returns the specific defect, e.g. {@code "truncated payload"}.
   *
   * @return the decode failure reason
   */
  public String reason() {
    return reason;
  }
}
