package io.framerelay.producer;

/**
 * Lifecycle of a {@link ProducerPipeline}:
 * {@code IDLE -> CAPTURING <-> PUBLISHING -> DRAINING -> STOPPED}.
 */
public enum ProducerState {
  IDLE,
  CAPTURING,
  PUBLISHING,
  DRAINING,
  STOPPED
}
