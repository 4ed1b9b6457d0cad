package io.framerelay;

import java.time.Instant;
import java.util.Objects;

/**
 * Frame as handed over by a {@link FrameSource}, before the producer numbers it.
 *
 * @param payload    encoded image bytes
 * @param capturedAt acquisition timestamp, or {@code null} to let the producer stamp it
 */
public record RawFrame(byte[] payload, Instant capturedAt) {

  public RawFrame {
    Objects.requireNonNull(payload, "payload");
  }

  public static RawFrame of(byte[] payload) {
    return new RawFrame(payload, null);
  }
}
