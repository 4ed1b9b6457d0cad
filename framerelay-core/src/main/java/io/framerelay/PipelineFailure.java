package io.framerelay;

import java.time.Instant;
import java.util.Objects;

/**
 * A failure observed by a pipeline, reported to the supervisor rather than raised.
 *
 * @param type           what failed
 * @param sourceId       frame source involved, or {@code null} when not frame-specific
 * @param sequenceNumber frame sequence number, or {@code -1} when unknown
 * @param message        human-readable description
 * @param cause          underlying exception, may be {@code null}
 * @param occurredAt     when the failure was observed
 */
public record PipelineFailure(Type type, String sourceId, long sequenceNumber, String message,
    Throwable cause, Instant occurredAt) {

  public enum Type {
    /** Capture device failed; capture restarts with backoff. */
    CAPTURE,
    /** Publish retries exhausted; the frame was dropped. */
    PUBLISH,
    /** Broker refused or lost the connection. */
    CONNECT,
    /** Payload could not be decoded; dead-lettered. */
    DECODE,
    /** Detector failed permanently or ran out of attempts; dead-lettered. */
    DETECTION,
    /** Result sink rejected a detection. */
    SINK
  }

  public PipelineFailure {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(occurredAt, "occurredAt");
  }

  public static PipelineFailure of(Type type, String message, Throwable cause) {
    return new PipelineFailure(type, null, -1, message, cause, Instant.now());
  }

  public static PipelineFailure forFrame(Type type, String sourceId, long sequenceNumber,
      String message, Throwable cause) {
    return new PipelineFailure(type, sourceId, sequenceNumber, message, cause, Instant.now());
  }
}
