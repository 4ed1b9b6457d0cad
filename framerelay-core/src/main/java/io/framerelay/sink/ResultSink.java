package io.framerelay.sink;

import io.framerelay.Detection;

/**
 * Receives detections from the consumer pipeline.
 *
 * <p>{@link #emit(Detection)} returning normally means the detection was durably handed
 * over; only then is the originating delivery acknowledged. Because deliveries are
 * at-least-once, implementations must tolerate the same {@link Detection#dedupeKey()}
 * arriving more than once (see {@link DeduplicatingResultSink}).
 *
 * <p>Called concurrently from every consumer worker slot.
 */
@FunctionalInterface
public interface ResultSink extends AutoCloseable {

  /**
   * Hands over one detection.
   *
   * @param detection the detection
   * @throws SinkException if the detection was not stored; the delivery is requeued
   */
  void emit(Detection detection) throws SinkException;

  @Override
  default void close() {
  }
}
