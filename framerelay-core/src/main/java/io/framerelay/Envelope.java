package io.framerelay;

import java.util.Objects;

/**
 * A decoded {@link Frame} together with the broker's delivery metadata.
 *
 * <p>Redelivery never mutates an envelope; the broker hands out a new one wrapping the
 * same logical frame with a higher {@code attemptCount}.
 *
 * @param frame        the decoded frame
 * @param deliveryId   broker-assigned delivery identifier (not persisted by the application)
 * @param attemptCount delivery attempts seen for this frame, starting at 1
 */
public record Envelope(Frame frame, String deliveryId, int attemptCount) {

  public Envelope {
    Objects.requireNonNull(frame, "frame");
    Objects.requireNonNull(deliveryId, "deliveryId");
    if (attemptCount < 1) {
      throw new IllegalArgumentException("attemptCount must be >= 1, got: " + attemptCount);
    }
  }

  public boolean redelivered() {
    return attemptCount > 1;
  }
}
