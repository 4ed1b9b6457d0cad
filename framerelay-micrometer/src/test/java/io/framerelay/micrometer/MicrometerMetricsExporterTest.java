package io.framerelay.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void producerCounters() {
    exporter.incrementFramesCaptured();
    exporter.incrementFramesCaptured();
    exporter.incrementFramesCaptured();
    exporter.incrementFramesDropped();
    exporter.incrementCaptureErrors();
    exporter.incrementPublishSuccess();
    exporter.incrementPublishSuccess();
    exporter.incrementPublishRetries();
    exporter.incrementPublishFailed();

    assertEquals(3.0, counter("framerelay.frames.captured").count());
    assertEquals(1.0, counter("framerelay.frames.dropped").count());
    assertEquals(1.0, counter("framerelay.capture.errors").count());
    assertEquals(2.0, counter("framerelay.publish.success").count());
    assertEquals(1.0, counter("framerelay.publish.retries").count());
    assertEquals(1.0, counter("framerelay.publish.failed").count());
  }

  @Test
  void consumerCounters() {
    exporter.incrementDeliveriesAcked();
    exporter.incrementDeliveriesAcked();
    exporter.incrementDeliveriesRequeued();
    exporter.incrementDeliveriesDead();
    exporter.incrementDetectionsEmitted();
    exporter.incrementSequenceGaps();
    exporter.incrementSequenceRegressions();
    exporter.incrementReconnects();

    assertEquals(2.0, counter("framerelay.deliveries.acked").count());
    assertEquals(1.0, counter("framerelay.deliveries.requeued").count());
    assertEquals(1.0, counter("framerelay.deliveries.dead").count());
    assertEquals(1.0, counter("framerelay.detections.emitted").count());
    assertEquals(1.0, counter("framerelay.sequence.gaps").count());
    assertEquals(1.0, counter("framerelay.sequence.regressions").count());
    assertEquals(1.0, counter("framerelay.reconnects").count());
  }

  @Test
  void gaugesFollowLatestValue() {
    exporter.recordBufferDepth(2);
    exporter.recordConsumerInFlight(4);
    assertEquals(2.0, gauge("framerelay.buffer.depth").value());
    assertEquals(4.0, gauge("framerelay.consumer.inflight").value());

    exporter.recordBufferDepth(0);
    exporter.recordConsumerInFlight(0);
    assertEquals(0.0, gauge("framerelay.buffer.depth").value());
    assertEquals(0.0, gauge("framerelay.consumer.inflight").value());
  }

  @Test
  void recordDetectDuration() {
    exporter.recordDetectDurationMs(12);
    exporter.recordDetectDurationMs(30);

    DistributionSummary summary = registry.find("framerelay.detect.duration.ms").summary();
    assertNotNull(summary);
    assertEquals(2, summary.count());
    assertEquals(42.0, summary.totalAmount());
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "lobby.framerelay");
    custom.incrementFramesCaptured();
    custom.recordBufferDepth(7);

    assertEquals(1.0, counter("lobby.framerelay.frames.captured").count());
    assertEquals(7.0, gauge("lobby.framerelay.buffer.depth").value());
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.incrementFramesCaptured();
    exporter.close();

    assertNull(registry.find("framerelay.frames.captured").counter());
    assertNull(registry.find("framerelay.buffer.depth").gauge());
    assertNull(registry.find("framerelay.detect.duration.ms").summary());
    assertDoesNotThrow(() -> exporter.incrementFramesCaptured());
  }

  @Test
  void nullRegistryThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  @Test
  void nullPrefixThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
  }

  @Test
  void prefixEndingWithDotThrows() {
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "cams."));
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }
}
