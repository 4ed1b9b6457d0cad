package io.framerelay.supervisor;

import io.framerelay.BoundingBox;
import io.framerelay.Detection;
import io.framerelay.FrameSource;
import io.framerelay.PipelineFailure;
import io.framerelay.RawFrame;
import io.framerelay.channel.memory.InMemoryBroker;
import io.framerelay.channel.memory.InMemoryChannelClient;
import io.framerelay.consumer.ConsumerPipeline;
import io.framerelay.producer.ProducerPipeline;
import io.framerelay.producer.ProducerState;
import io.framerelay.retry.RetryPolicy;
import io.framerelay.sink.DeduplicatingResultSink;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class SupervisorTest {

  private static final RetryPolicy FAST = attempts -> 10L;

  private final InMemoryBroker broker = new InMemoryBroker();
  private final InMemoryChannelClient client = new InMemoryChannelClient(broker);
  private final List<Detection> detections = new CopyOnWriteArrayList<>();
  private Supervisor supervisor;

  @AfterEach
  void tearDown() {
    if (supervisor != null) {
      supervisor.close();
    }
  }

  private ProducerPipeline.Builder producer(FrameSource source) {
    return ProducerPipeline.builder()
        .channelClient(client)
        .frameSource(source)
        .sourceId("cam0")
        .reconnectPolicy(FAST)
        .publishRetryPolicy(FAST);
  }

  private ConsumerPipeline.Builder consumer() {
    return ConsumerPipeline.builder()
        .channelClient(client)
        .detector(frame -> List.of(new BoundingBox("person", 0.7, 1, 1, 2, 2)))
        .sink(new DeduplicatingResultSink(detections::add, 100))
        .reconnectPolicy(FAST);
  }

  @Test
  void relaysFramesFromProducerToConsumer() {
    supervisor = Supervisor.builder()
        .producer(producer(finiteSource(5)))
        .consumer(consumer())
        .build();
    supervisor.start();

    assertTrue(waitFor(() -> detections.size() == 5
        && supervisor.health().framesPublished() == 5
        && supervisor.health().deliveriesAcked() == 5));

    HealthStatus health = supervisor.health();
    assertEquals(0, health.framesDropped());
    assertEquals(0, health.deliveriesDead());
    assertEquals(0, health.failuresReported());
    assertNull(health.lastFailure());
  }

  @Test
  void notLiveWhileBrokerIsUnavailable() {
    broker.setAvailable(false);
    supervisor = Supervisor.builder()
        .producer(producer(endlessSource()))
        .consumer(consumer())
        .build();
    supervisor.start();

    assertTrue(waitFor(() -> supervisor.failureCount(PipelineFailure.Type.CONNECT) >= 2));
    assertFalse(supervisor.isLive());
    assertFalse(supervisor.health().live());

    broker.setAvailable(true);
    assertTrue(waitFor(supervisor::isLive));
    assertTrue(supervisor.health().producerConnected());
    assertTrue(supervisor.health().consumerConnected());
  }

  @Test
  void closeStopsBothPipelines() {
    supervisor = Supervisor.builder()
        .producer(producer(endlessSource()))
        .consumer(consumer())
        .producerDrainTimeout(Duration.ofSeconds(2))
        .consumerShutdownDeadline(Duration.ofSeconds(2))
        .build();
    supervisor.start();
    assertTrue(waitFor(supervisor::isLive));
    assertTrue(waitFor(() -> !detections.isEmpty()));

    supervisor.close();

    assertFalse(supervisor.isLive());
    assertEquals(ProducerState.STOPPED, supervisor.producer().orElseThrow().state());
    assertFalse(supervisor.consumer().orElseThrow().isRunning());
    assertEquals(0, broker.openConnections());
    assertThrows(IllegalStateException.class, supervisor::start);
    supervisor.close();
  }

  @Test
  void consumerOnlySupervisor() {
    supervisor = Supervisor.builder().consumer(consumer()).build();

    assertTrue(supervisor.producer().isEmpty());
    assertThrows(IllegalStateException.class, supervisor::startProducer);
    supervisor.start();
    assertTrue(waitFor(supervisor::isLive));
    assertNull(supervisor.health().producerState());
  }

  @Test
  void producerOnlySupervisorStarts() {
    supervisor = Supervisor.builder().producer(producer(endlessSource())).build();

    assertTrue(supervisor.consumer().isEmpty());
    assertThrows(IllegalStateException.class, supervisor::startConsumer);
    supervisor.start();
    assertTrue(waitFor(supervisor::isLive));
    assertTrue(waitFor(() -> supervisor.health().framesPublished() > 0));
    assertFalse(supervisor.health().consumerConnected());
  }

  @Test
  void staysLiveAfterSourceReachesEndOfStream() {
    supervisor = Supervisor.builder()
        .producer(producer(finiteSource(3)))
        .consumer(consumer())
        .build();
    supervisor.start();

    ProducerPipeline producer = supervisor.producer().orElseThrow();
    assertTrue(waitFor(producer::isCompleted));
    assertEquals(ProducerState.STOPPED, producer.state());
    assertFalse(producer.isConnected());
    assertTrue(waitFor(supervisor::isLive));
    assertTrue(waitFor(() -> detections.size() == 3));
  }

  @Test
  void retainsBoundedRecentFailures() {
    supervisor = Supervisor.builder()
        .consumer(consumer())
        .recentFailureCapacity(2)
        .build();

    for (int i = 0; i < 3; i++) {
      supervisor.onFailure(PipelineFailure.forFrame(PipelineFailure.Type.SINK, "cam0", i, "sink " + i, null));
    }
    supervisor.onFailure(PipelineFailure.of(PipelineFailure.Type.CONNECT, "refused", null));

    List<PipelineFailure> recent = supervisor.recentFailures();
    assertEquals(2, recent.size());
    assertEquals("sink 2", recent.get(0).message());
    assertEquals("refused", recent.get(1).message());
    assertEquals(3, supervisor.failureCount(PipelineFailure.Type.SINK));
    assertEquals(4, supervisor.health().failuresReported());
    assertEquals("refused", supervisor.health().lastFailure().message());
  }

  @Test
  void pipelineFailuresReachSupervisor() {
    broker.rejectNextPublishes(2);
    supervisor = Supervisor.builder()
        .producer(producer(finiteSource(1)).maxPublishAttempts(2))
        .build();
    supervisor.start();

    assertTrue(waitFor(() -> supervisor.failureCount(PipelineFailure.Type.PUBLISH) == 1));
    assertEquals(1, supervisor.health().framesFailed());
  }

  @Test
  void requiresAtLeastOnePipeline() {
    assertThrows(IllegalStateException.class, () -> Supervisor.builder().build());
    assertThrows(IllegalArgumentException.class,
        () -> Supervisor.builder().consumer(consumer()).recentFailureCapacity(0).build());
  }

  // ── Helpers ──────────────────────────────────────────────────

  private static FrameSource finiteSource(int count) {
    AtomicInteger next = new AtomicInteger();
    return () -> next.incrementAndGet() > count
        ? Optional.empty()
        : Optional.of(RawFrame.of(new byte[] {(byte) next.get()}));
  }

  private static FrameSource endlessSource() {
    return () -> {
      sleep(5);
      return Optional.of(new RawFrame(new byte[] {7}, Instant.now()));
    };
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private static boolean waitFor(BooleanSupplier condition) {
    long deadline = System.currentTimeMillis() + 5000;
    while (System.currentTimeMillis() < deadline) {
      if (condition.getAsBoolean()) {
        return true;
      }
      sleep(10);
    }
    return condition.getAsBoolean();
  }
}
