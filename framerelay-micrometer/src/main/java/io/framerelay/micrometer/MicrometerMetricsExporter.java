package io.framerelay.micrometer;

import io.framerelay.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code framerelay.frames.captured}: frames taken from the capture source</li>
 *   <li>{@code framerelay.frames.dropped}: frames evicted by drop-oldest or abandoned at shutdown</li>
 *   <li>{@code framerelay.capture.errors}: capture failures (capture restarts with backoff)</li>
 *   <li>{@code framerelay.publish.success}: frames confirmed by the broker</li>
 *   <li>{@code framerelay.publish.retries}: publish attempts retried</li>
 *   <li>{@code framerelay.publish.failed}: frames dropped after exhausting publish attempts</li>
 *   <li>{@code framerelay.deliveries.acked}: deliveries acknowledged</li>
 *   <li>{@code framerelay.deliveries.requeued}: deliveries returned for another attempt</li>
 *   <li>{@code framerelay.deliveries.dead}: deliveries dead-lettered</li>
 *   <li>{@code framerelay.detections.emitted}: detections handed to the result sink</li>
 *   <li>{@code framerelay.sequence.gaps}: sequence gaps seen by the consumer</li>
 *   <li>{@code framerelay.sequence.regressions}: first deliveries arriving out of order</li>
 *   <li>{@code framerelay.reconnects}: connections re-established</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code framerelay.buffer.depth}: frames buffered in the producer</li>
 *   <li>{@code framerelay.consumer.inflight}: deliveries being processed</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code framerelay.detect.duration.ms}: detector execution time</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final List<Meter> meters = new ArrayList<>();
    private final Counter framesCaptured;
    private final Counter framesDropped;
    private final Counter captureErrors;
    private final Counter publishSuccess;
    private final Counter publishRetries;
    private final Counter publishFailed;
    private final Counter deliveriesAcked;
    private final Counter deliveriesRequeued;
    private final Counter deliveriesDead;
    private final Counter detectionsEmitted;
    private final Counter sequenceGaps;
    private final Counter sequenceRegressions;
    private final Counter reconnects;
    private final DistributionSummary detectDuration;

    private final AtomicInteger bufferDepth = new AtomicInteger();
    private final AtomicInteger consumerInFlight = new AtomicInteger();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "framerelay"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "framerelay");
    }

    /**
     * Creates an exporter with a custom metric name prefix, e.g. one per camera site.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "lobby.framerelay"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.framesCaptured = counter(namePrefix + ".frames.captured", "Frames taken from the capture source");
        this.framesDropped = counter(namePrefix + ".frames.dropped",
                "Frames evicted by drop-oldest or abandoned at shutdown");
        this.captureErrors = counter(namePrefix + ".capture.errors", "Capture failures");
        this.publishSuccess = counter(namePrefix + ".publish.success", "Frames confirmed by the broker");
        this.publishRetries = counter(namePrefix + ".publish.retries", "Publish attempts retried");
        this.publishFailed = counter(namePrefix + ".publish.failed",
                "Frames dropped after exhausting publish attempts");
        this.deliveriesAcked = counter(namePrefix + ".deliveries.acked", "Deliveries acknowledged");
        this.deliveriesRequeued = counter(namePrefix + ".deliveries.requeued",
                "Deliveries returned for another attempt");
        this.deliveriesDead = counter(namePrefix + ".deliveries.dead", "Deliveries dead-lettered");
        this.detectionsEmitted = counter(namePrefix + ".detections.emitted",
                "Detections handed to the result sink");
        this.sequenceGaps = counter(namePrefix + ".sequence.gaps", "Sequence gaps seen by the consumer");
        this.sequenceRegressions = counter(namePrefix + ".sequence.regressions",
                "First deliveries arriving below the highest sequence seen");
        this.reconnects = counter(namePrefix + ".reconnects", "Connections re-established");

        meters.add(Gauge.builder(namePrefix + ".buffer.depth", bufferDepth, AtomicInteger::get)
                .description("Frames buffered in the producer")
                .register(registry));
        meters.add(Gauge.builder(namePrefix + ".consumer.inflight", consumerInFlight, AtomicInteger::get)
                .description("Deliveries being processed")
                .register(registry));

        this.detectDuration = DistributionSummary.builder(namePrefix + ".detect.duration.ms")
                .description("Detector execution time in milliseconds")
                .register(registry);
        meters.add(detectDuration);
    }

    private Counter counter(String name, String description) {
        Counter counter = Counter.builder(name)
                .description(description)
                .register(registry);
        meters.add(counter);
        return counter;
    }

    @Override
    public void incrementFramesCaptured() {
        if (closed) return;
        framesCaptured.increment();
    }

    @Override
    public void incrementFramesDropped() {
        if (closed) return;
        framesDropped.increment();
    }

    @Override
    public void incrementCaptureErrors() {
        if (closed) return;
        captureErrors.increment();
    }

    @Override
    public void incrementPublishSuccess() {
        if (closed) return;
        publishSuccess.increment();
    }

    @Override
    public void incrementPublishRetries() {
        if (closed) return;
        publishRetries.increment();
    }

    @Override
    public void incrementPublishFailed() {
        if (closed) return;
        publishFailed.increment();
    }

    @Override
    public void incrementDeliveriesAcked() {
        if (closed) return;
        deliveriesAcked.increment();
    }

    @Override
    public void incrementDeliveriesRequeued() {
        if (closed) return;
        deliveriesRequeued.increment();
    }

    @Override
    public void incrementDeliveriesDead() {
        if (closed) return;
        deliveriesDead.increment();
    }

    @Override
    public void incrementDetectionsEmitted() {
        if (closed) return;
        detectionsEmitted.increment();
    }

    @Override
    public void incrementSequenceGaps() {
        if (closed) return;
        sequenceGaps.increment();
    }

    @Override
    public void incrementSequenceRegressions() {
        if (closed) return;
        sequenceRegressions.increment();
    }

    @Override
    public void incrementReconnects() {
        if (closed) return;
        reconnects.increment();
    }

    @Override
    public void recordBufferDepth(int depth) {
        if (closed) return;
        bufferDepth.set(depth);
    }

    @Override
    public void recordConsumerInFlight(int inFlight) {
        if (closed) return;
        consumerInFlight.set(inFlight);
    }

    @Override
    public void recordDetectDurationMs(long durationMs) {
        if (closed) return;
        detectDuration.record(durationMs);
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     *
     * <p>Call this when the pipelines reporting to this exporter are closed to prevent
     * stale gauges.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : meters) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
