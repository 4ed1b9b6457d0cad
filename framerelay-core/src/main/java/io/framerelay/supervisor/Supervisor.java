package io.framerelay.supervisor;

import io.framerelay.PipelineFailure;
import io.framerelay.consumer.ConsumerPipeline;
import io.framerelay.consumer.DeliveryOutcome;
import io.framerelay.producer.ProducerPipeline;
import io.framerelay.producer.ProducerState;
import io.framerelay.spi.FailureListener;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the lifecycle of an optional {@link ProducerPipeline} and an optional
 * {@link ConsumerPipeline}.
 *
 * <p>The pipelines start independently and in any order; the broker buffers between
 * them. The supervisor registers itself as a failure listener on both and keeps the most
 * recent failures. {@link #isLive()} is {@code false} until every configured pipeline
 * holds an open connection.
 *
 * <p>Shutdown order: the producer stops capturing and drains its buffer within the drain
 * timeout, then the consumer finishes in-flight deliveries within the shutdown deadline.
 * Deliveries still unsettled at the deadline go back to the broker.
 *
 * <pre>{@code
 * try (Supervisor supervisor = Supervisor.builder()
 *     .producer(ProducerPipeline.builder()
 *         .channelClient(client)
 *         .frameSource(camera)
 *         .sourceId("cam0"))
 *     .consumer(ConsumerPipeline.builder()
 *         .channelClient(client)
 *         .detector(detector)
 *         .sink(sink))
 *     .build()) {
 *   supervisor.start();
 *   ...
 * }
 * }</pre>
 */
public final class Supervisor implements FailureListener, AutoCloseable {
  private static final Logger logger = Logger.getLogger(Supervisor.class.getName());

  private final ProducerPipeline producer;
  private final ConsumerPipeline consumer;
  private final Duration producerDrainTimeout;
  private final Duration consumerShutdownDeadline;
  private final int recentFailureCapacity;
  private final Deque<PipelineFailure> recentFailures = new ArrayDeque<>();
  private final Map<PipelineFailure.Type, AtomicLong> failureCounts = new EnumMap<>(PipelineFailure.Type.class);
  private final AtomicLong failuresReported = new AtomicLong();
  private final AtomicBoolean producerStarted = new AtomicBoolean();
  private final AtomicBoolean consumerStarted = new AtomicBoolean();
  private final AtomicBoolean closed = new AtomicBoolean();
  private final Thread shutdownHook;

  private Supervisor(Builder builder) {
    if (builder.producer == null && builder.consumer == null) {
      throw new IllegalStateException("At least one of producer or consumer must be configured");
    }
    if (builder.recentFailureCapacity <= 0) {
      throw new IllegalArgumentException("recentFailureCapacity must be > 0");
    }
    this.producerDrainTimeout = Objects.requireNonNull(builder.producerDrainTimeout, "producerDrainTimeout");
    this.consumerShutdownDeadline = Objects.requireNonNull(builder.consumerShutdownDeadline,
        "consumerShutdownDeadline");
    this.recentFailureCapacity = builder.recentFailureCapacity;
    for (PipelineFailure.Type type : PipelineFailure.Type.values()) {
      failureCounts.put(type, new AtomicLong());
    }
    this.producer = builder.producer != null
        ? builder.producer.failureListener(this).build() : null;
    this.consumer = builder.consumer != null
        ? builder.consumer.failureListener(this).build() : null;
    if (builder.registerShutdownHook) {
      this.shutdownHook = new Thread(this::close, "framerelay-shutdown");
      Runtime.getRuntime().addShutdownHook(shutdownHook);
    } else {
      this.shutdownHook = null;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts every configured pipeline that is not running yet. A supervisor holding only
   * a producer or only a consumer starts just that one.
   *
   * @throws IllegalStateException if the supervisor is closed
   */
  public void start() {
    ensureOpen();
    if (consumer != null) {
      startConsumer();
    }
    if (producer != null) {
      startProducer();
    }
  }

  /**
   * Starts the producer.
   *
   * @throws IllegalStateException if no producer is configured or the supervisor is closed
   */
  public void startProducer() {
    if (producer == null) {
      throw new IllegalStateException("No producer configured");
    }
    ensureOpen();
    if (producerStarted.compareAndSet(false, true)) {
      producer.start();
    }
  }

  /**
   * Starts the consumer.
   *
   * @throws IllegalStateException if no consumer is configured or the supervisor is closed
   */
  public void startConsumer() {
    if (consumer == null) {
      throw new IllegalStateException("No consumer configured");
    }
    ensureOpen();
    if (consumerStarted.compareAndSet(false, true)) {
      consumer.start();
    }
  }

  private void ensureOpen() {
    if (closed.get()) {
      throw new IllegalStateException("Supervisor is closed");
    }
  }

  /**
   * Liveness signal.
   *
   * <p>A producer whose source reached end of stream and whose buffer was fully drained
   * released its connection on purpose and no longer counts against liveness.
   *
   * @return {@code true} once every configured pipeline is started and connected,
   *     {@code false} while any of them is disconnected or after shutdown
   */
  public boolean isLive() {
    if (closed.get()) {
      return false;
    }
    if (producer != null && !(producerStarted.get() && (producer.isConnected() || producer.isCompleted()))) {
      return false;
    }
    return consumer == null || (consumerStarted.get() && consumer.isConnected());
  }

  public HealthStatus health() {
    ProducerState producerState = producer != null ? producer.state() : null;
    return new HealthStatus(
        isLive(),
        producerState,
        producer != null && producer.isConnected(),
        consumer != null && consumer.isConnected(),
        producer != null ? producer.publishedFrames() : 0,
        producer != null ? producer.droppedFrames() : 0,
        producer != null ? producer.failedFrames() : 0,
        consumer != null ? consumer.outcomeCount(DeliveryOutcome.ACKED) : 0,
        consumer != null ? consumer.outcomeCount(DeliveryOutcome.DEAD_LETTERED) : 0,
        failuresReported.get(),
        lastFailure());
  }

  @Override
  public void onFailure(PipelineFailure failure) {
    failuresReported.incrementAndGet();
    failureCounts.get(failure.type()).incrementAndGet();
    synchronized (recentFailures) {
      if (recentFailures.size() == recentFailureCapacity) {
        recentFailures.removeFirst();
      }
      recentFailures.addLast(failure);
    }
  }

  /** @return retained failures, oldest first */
  public List<PipelineFailure> recentFailures() {
    synchronized (recentFailures) {
      return new ArrayList<>(recentFailures);
    }
  }

  public long failureCount(PipelineFailure.Type type) {
    return failureCounts.get(type).get();
  }

  private PipelineFailure lastFailure() {
    synchronized (recentFailures) {
      return recentFailures.peekLast();
    }
  }

  public Optional<ProducerPipeline> producer() {
    return Optional.ofNullable(producer);
  }

  public Optional<ConsumerPipeline> consumer() {
    return Optional.ofNullable(consumer);
  }

  /**
   * Stops the producer first, then the consumer. Safe to call more than once; the first
   * exception thrown by a pipeline is rethrown after both were stopped.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    logger.info("Shutting down");
    RuntimeException first = null;
    if (producer != null) {
      try {
        producer.stop(producerDrainTimeout);
      } catch (RuntimeException e) {
        first = e;
      }
    }
    if (consumer != null) {
      try {
        consumer.stop(consumerShutdownDeadline);
      } catch (RuntimeException e) {
        if (first == null) {
          first = e;
        } else {
          first.addSuppressed(e);
        }
      }
    }
    removeShutdownHook();
    if (first != null) {
      throw first;
    }
    logger.info("Shutdown complete");
  }

  private void removeShutdownHook() {
    if (shutdownHook == null || Thread.currentThread() == shutdownHook) {
      return;
    }
    try {
      Runtime.getRuntime().removeShutdownHook(shutdownHook);
    } catch (IllegalStateException e) {
      logger.log(Level.FINE, "JVM already shutting down", e);
    }
  }

  /** Builder for {@link Supervisor}. */
  public static final class Builder {
    private ProducerPipeline.Builder producer;
    private ConsumerPipeline.Builder consumer;
    private Duration producerDrainTimeout = Duration.ofSeconds(5);
    private Duration consumerShutdownDeadline = Duration.ofSeconds(10);
    private int recentFailureCapacity = 100;
    private boolean registerShutdownHook;

    private Builder() {}

    /**
     * Configures the producer. The supervisor adds itself as a failure listener and
     * builds the pipeline.
     *
     * @param producer producer builder
     * @return this builder
     */
    public Builder producer(ProducerPipeline.Builder producer) {
      this.producer = producer;
      return this;
    }

    /**
     * Configures the consumer. The supervisor adds itself as a failure listener and
     * builds the pipeline.
     *
     * @param consumer consumer builder
     * @return this builder
     */
    public Builder consumer(ConsumerPipeline.Builder consumer) {
      this.consumer = consumer;
      return this;
    }

    public Builder producerDrainTimeout(Duration producerDrainTimeout) {
      this.producerDrainTimeout = producerDrainTimeout;
      return this;
    }

    public Builder consumerShutdownDeadline(Duration consumerShutdownDeadline) {
      this.consumerShutdownDeadline = consumerShutdownDeadline;
      return this;
    }

    /**
     * Sets how many recent failures are retained. Defaults to {@code 100}.
     *
     * @param recentFailureCapacity retained failures, &gt; 0
     * @return this builder
     */
    public Builder recentFailureCapacity(int recentFailureCapacity) {
      this.recentFailureCapacity = recentFailureCapacity;
      return this;
    }

    /**
     * Registers a JVM shutdown hook that closes the supervisor. Defaults to {@code false}.
     *
     * @param registerShutdownHook whether to register the hook
     * @return this builder
     */
    public Builder registerShutdownHook(boolean registerShutdownHook) {
      this.registerShutdownHook = registerShutdownHook;
      return this;
    }

    public Supervisor build() {
      return new Supervisor(this);
    }
  }
}
