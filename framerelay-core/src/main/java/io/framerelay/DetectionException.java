package io.framerelay;

import java.util.Objects;

/**
 * Raised by a {@link Detector} when inference fails.
 *
 * <p>A {@link Kind#TRANSIENT} failure (for example resource exhaustion) requeues the
 * delivery until {@code maxAttempts} is reached. A {@link Kind#PERMANENT} failure
 * dead-letters it on the spot.
 */
public class DetectionException extends Exception {

  public enum Kind {
    TRANSIENT,
    PERMANENT
  }

  private final Kind kind;

  public DetectionException(Kind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public DetectionException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public static DetectionException transientFailure(String message) {
    return new DetectionException(Kind.TRANSIENT, message);
  }

  public static DetectionException permanentFailure(String message) {
    return new DetectionException(Kind.PERMANENT, message);
  }

  public Kind kind() {
    return kind;
  }

  public boolean isTransient() {
    return kind == Kind.TRANSIENT;
  }
}
