package io.framerelay.consumer;

/** How the consumer settled one delivery. */
public enum DeliveryOutcome {
  /** Detection handed to the sink, then acknowledged. */
  ACKED,
  /** Transient failure below the attempt limit; returned to the channel. */
  REQUEUED,
  /** Decode failure, permanent detection failure, or attempts exhausted. */
  DEAD_LETTERED,
  /** Left to the broker at shutdown or after a lost connection; will be redelivered. */
  ABANDONED
}
