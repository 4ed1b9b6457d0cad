package io.framerelay;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * One captured video frame plus the metadata that identifies it on the wire.
 *
 * <p>{@code sequenceNumber} is assigned by the producer at capture time and strictly
 * increases per {@code sourceId}. A gap between two observed numbers means frames were
 * dropped upstream; a decrease on a first delivery is a protocol violation.
 *
 * <p>The payload is opaque encoded image bytes. The record copies it on the way in and
 * on the way out, so instances are immutable and compare by content.
 *
 * @param sourceId       identifier of the originating capture stream
 * @param sequenceNumber per-source monotonically increasing number, never reused
 * @param capturedAt     acquisition timestamp on the producer clock
 * @param payload        encoded image bytes
 */
public record Frame(String sourceId, long sequenceNumber, Instant capturedAt, byte[] payload) {

  public Frame {
    Objects.requireNonNull(sourceId, "sourceId");
    Objects.requireNonNull(capturedAt, "capturedAt");
    Objects.requireNonNull(payload, "payload");
    if (sourceId.isEmpty()) {
      throw new IllegalArgumentException("sourceId must not be empty");
    }
    if (sequenceNumber < 0) {
      throw new IllegalArgumentException("sequenceNumber must be >= 0, got: " + sequenceNumber);
    }
    payload = payload.clone();
  }

  @Override
  public byte[] payload() {
    return payload.clone();
  }

  /**
   * Returns the payload length without copying it.
   *
   * @return number of payload bytes
   */
  public int payloadSize() {
    return payload.length;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Frame other)) return false;
    return sequenceNumber == other.sequenceNumber
        && sourceId.equals(other.sourceId)
        && capturedAt.equals(other.capturedAt)
        && Arrays.equals(payload, other.payload);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(sourceId, sequenceNumber, capturedAt);
    return 31 * result + Arrays.hashCode(payload);
  }

  @Override
  public String toString() {
    return "Frame{sourceId=" + sourceId
        + ", sequenceNumber=" + sequenceNumber
        + ", capturedAt=" + capturedAt
        + ", payloadSize=" + payload.length + "}";
  }
}
