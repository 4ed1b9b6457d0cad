package io.framerelay.spi;

/**
 * Observability hook for exporting pipeline counters and gauges to a metrics backend.
 *
 * <p>Every dropped or dead-lettered frame passes through one of these counters, so no
 * frame disappears without a signal. The {@link #NOOP} instance discards everything.
 * Implement this interface to bridge into Micrometer, Prometheus or similar.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of frames pulled from the capture source.
     */
    void incrementFramesCaptured();

    /**
     * Increments the count of buffered frames evicted by the drop-oldest policy.
     */
    void incrementFramesDropped();

    /**
     * Increments the count of capture failures.
     */
    void incrementCaptureErrors();

    /**
     * Increments the count of frames whose publish was confirmed by the broker.
     */
    void incrementPublishSuccess();

    /**
     * Increments the count of failed publish attempts that will be retried.
     */
    void incrementPublishRetries();

    /**
     * Increments the count of frames dropped after exhausting publish retries.
     */
    void incrementPublishFailed();

    /**
     * Increments the count of deliveries acknowledged after a successful detection.
     */
    void incrementDeliveriesAcked();

    /**
     * Increments the count of deliveries returned to the broker for another attempt.
     */
    void incrementDeliveriesRequeued();

    /**
     * Increments the count of deliveries removed from normal processing (dead-letter).
     */
    void incrementDeliveriesDead();

    /**
     * Increments the count of detections handed to the result sink.
     */
    void incrementDetectionsEmitted();

    /**
     * Increments the count of sequence gaps observed by the consumer.
     */
    default void incrementSequenceGaps() {
    }

    /**
     * Increments the count of first-attempt deliveries whose sequence number went backwards.
     */
    default void incrementSequenceRegressions() {
    }

    /**
     * Increments the count of successful reconnects after a lost or refused connection.
     */
    default void incrementReconnects() {
    }

    /**
     * Records the number of frames buffered in the producer and not yet published.
     *
     * @param depth buffered frame count, never above the configured capacity
     */
    void recordBufferDepth(int depth);

    /**
     * Records the number of deliveries currently held by consumer worker slots.
     *
     * @param inFlight in-flight delivery count, never above the prefetch limit
     */
    void recordConsumerInFlight(int inFlight);

    /**
     * Records the duration of one detector invocation.
     *
     * @param durationMs detector execution time in milliseconds (always non-negative)
     */
    default void recordDetectDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementFramesCaptured() {
        }

        @Override
        public void incrementFramesDropped() {
        }

        @Override
        public void incrementCaptureErrors() {
        }

        @Override
        public void incrementPublishSuccess() {
        }

        @Override
        public void incrementPublishRetries() {
        }

        @Override
        public void incrementPublishFailed() {
        }

        @Override
        public void incrementDeliveriesAcked() {
        }

        @Override
        public void incrementDeliveriesRequeued() {
        }

        @Override
        public void incrementDeliveriesDead() {
        }

        @Override
        public void incrementDetectionsEmitted() {
        }

        @Override
        public void recordBufferDepth(int depth) {
        }

        @Override
        public void recordConsumerInFlight(int inFlight) {
        }
    }
}
