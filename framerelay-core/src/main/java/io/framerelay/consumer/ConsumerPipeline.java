package io.framerelay.consumer;

import io.framerelay.BoundingBox;
import io.framerelay.Detection;
import io.framerelay.DetectionException;
import io.framerelay.Detector;
import io.framerelay.Envelope;
import io.framerelay.Frame;
import io.framerelay.PipelineFailure;
import io.framerelay.channel.ChannelClient;
import io.framerelay.channel.ChannelClosedException;
import io.framerelay.channel.ChannelConnection;
import io.framerelay.channel.Delivery;
import io.framerelay.channel.Reconnector;
import io.framerelay.channel.Subscription;
import io.framerelay.codec.FrameCodec;
import io.framerelay.codec.FrameDecodeException;
import io.framerelay.retry.ExponentialBackoffRetryPolicy;
import io.framerelay.retry.RetryPolicy;
import io.framerelay.sink.ResultSink;
import io.framerelay.sink.SinkException;
import io.framerelay.spi.FailureListener;
import io.framerelay.spi.MetricsExporter;
import io.framerelay.util.CancellationToken;
import io.framerelay.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Consumes frames from a channel, runs the {@link Detector} and hands results to a
 * {@link ResultSink}.
 *
 * <p>{@code prefetchLimit} worker slots share one {@link Subscription}. Each slot takes
 * one delivery at a time through decode, detect, emit and settle, so the prefetch limit
 * bounds both the broker's in-flight count and local concurrency. Settlement rules:
 * <ul>
 *   <li>undecodable body: dead-lettered, never retried</li>
 *   <li>transient detection or sink failure: requeued while
 *       {@code attemptCount < maxAttempts}, dead-lettered and reported after that</li>
 *   <li>permanent detection failure: dead-lettered and reported</li>
 *   <li>success: emitted to the sink, then acknowledged</li>
 * </ul>
 *
 * <p>A lost connection is replaced through the reconnect policy; deliveries held on it
 * return to the broker. Create instances via {@link #builder()}. This class is
 * thread-safe.
 */
public final class ConsumerPipeline implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ConsumerPipeline.class.getName());

  private static final Duration POLL_TIMEOUT = Duration.ofMillis(100);

  private final ChannelClient channelClient;
  private final Detector detector;
  private final ResultSink sink;
  private final String channel;
  private final FrameCodec codec;
  private final int prefetchLimit;
  private final int maxAttempts;
  private final Reconnector reconnector;
  private final MetricsExporter metrics;
  private final List<FailureListener> failureListeners;
  private final Clock clock;
  private final Duration shutdownDeadline;
  private final SequenceTracker sequenceTracker;

  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean stopped = new AtomicBoolean();
  private final CancellationToken pollToken = new CancellationToken();
  private final CancellationToken abortToken = new CancellationToken();
  private final AtomicInteger inFlight = new AtomicInteger();
  private final Set<Received> active = ConcurrentHashMap.newKeySet();
  private final Map<DeliveryOutcome, AtomicLong> outcomes = new EnumMap<>(DeliveryOutcome.class);
  private final Object sessionLock = new Object();
  private final Object pollLock = new Object();
  private ExecutorService workers;
  private volatile Session session;
  private boolean connectedBefore;

  private ConsumerPipeline(Builder builder) {
    this.channelClient = Objects.requireNonNull(builder.channelClient, "channelClient");
    this.detector = Objects.requireNonNull(builder.detector, "detector");
    this.sink = Objects.requireNonNull(builder.sink, "sink");
    this.channel = Objects.requireNonNull(builder.channel, "channel");
    if (channel.isEmpty()) {
      throw new IllegalArgumentException("channel must not be empty");
    }
    if (builder.prefetchLimit < 1) {
      throw new IllegalArgumentException("prefetchLimit must be >= 1");
    }
    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    Objects.requireNonNull(builder.shutdownDeadline, "shutdownDeadline");
    if (builder.shutdownDeadline.isNegative()) {
      throw new IllegalArgumentException("shutdownDeadline must not be negative");
    }
    this.codec = builder.codec != null ? builder.codec : FrameCodec.getDefault();
    this.prefetchLimit = builder.prefetchLimit;
    this.maxAttempts = builder.maxAttempts;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.failureListeners = Collections.unmodifiableList(new ArrayList<>(builder.failureListeners));
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.shutdownDeadline = builder.shutdownDeadline;
    RetryPolicy reconnectPolicy = builder.reconnectPolicy != null
        ? builder.reconnectPolicy : new ExponentialBackoffRetryPolicy(500, 30_000);
    this.reconnector = new Reconnector(channelClient, reconnectPolicy, metrics, this::report);
    this.sequenceTracker = new SequenceTracker(metrics);
    for (DeliveryOutcome outcome : DeliveryOutcome.values()) {
      outcomes.put(outcome, new AtomicLong());
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the worker slots. The first slot to run opens the connection and
   * subscription; the others wait for it.
   *
   * @throws IllegalStateException if the pipeline was already started
   */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Consumer for " + channel + " already started");
    }
    logger.info("Starting consumer on channel " + channel + " via " + channelClient.describe()
        + " with prefetchLimit=" + prefetchLimit + ", maxAttempts=" + maxAttempts);
    workers = Executors.newFixedThreadPool(prefetchLimit,
        new DaemonThreadFactory("framerelay-consumer-" + channel + "-"));
    for (int i = 0; i < prefetchLimit; i++) {
      workers.submit(this::workerLoop);
    }
  }

  private void workerLoop() {
    while (!pollToken.isCancelled()) {
      try {
        Session current = currentSession();
        if (current == null) {
          break;
        }
        Received received;
        try {
          received = receive(current);
        } catch (ChannelClosedException e) {
          sessionLost(current, e);
          continue;
        }
        if (received == null) {
          continue;
        }
        active.add(received);
        metrics.recordConsumerInFlight(inFlight.incrementAndGet());
        try {
          DeliveryOutcome outcome = process(received);
          if (received.finish()) {
            outcomes.get(outcome).incrementAndGet();
          }
        } finally {
          active.remove(received);
          metrics.recordConsumerInFlight(inFlight.decrementAndGet());
        }
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Consumer worker error on channel " + channel, t);
      }
    }
  }

  private Received receive(Session current) throws ChannelClosedException {
    synchronized (pollLock) {
      Delivery delivery = current.subscription.poll(POLL_TIMEOUT);
      if (delivery == null) {
        return null;
      }
      try {
        Frame frame = codec.decode(delivery.body());
        Envelope envelope = new Envelope(frame, delivery.deliveryId(), delivery.attemptCount());
        sequenceTracker.observe(frame.sourceId(), frame.sequenceNumber(), envelope.attemptCount());
        return new Received(current, delivery, envelope, null);
      } catch (FrameDecodeException e) {
        return new Received(current, delivery, null, e);
      }
    }
  }

  private DeliveryOutcome process(Received received) {
    Delivery delivery = received.delivery;
    if (received.decodeError != null) {
      logger.log(Level.WARNING, "Dead-lettering undecodable delivery " + delivery.deliveryId()
          + " on " + channel, received.decodeError);
      report(PipelineFailure.of(PipelineFailure.Type.DECODE,
          received.decodeError.getMessage(), received.decodeError));
      return settle(received, Settlement.DEAD);
    }
    Envelope envelope = received.envelope;
    Frame frame = envelope.frame();
    if (abortToken.isCancelled()) {
      return settle(received, Settlement.RELEASE);
    }

    List<BoundingBox> boxes;
    long startNanos = System.nanoTime();
    try {
      boxes = detector.detect(frame);
    } catch (DetectionException e) {
      if (e.isTransient()) {
        return retryOrDeadLetter(received, PipelineFailure.Type.DETECTION, e);
      }
      logger.log(Level.SEVERE, "Permanent detection failure for " + describe(envelope)
          + "; dead-lettering", e);
      report(PipelineFailure.forFrame(PipelineFailure.Type.DETECTION, frame.sourceId(),
          frame.sequenceNumber(), "Permanent detection failure: " + e.getMessage(), e));
      return settle(received, Settlement.DEAD);
    } catch (RuntimeException e) {
      return retryOrDeadLetter(received, PipelineFailure.Type.DETECTION, e);
    } finally {
      metrics.recordDetectDurationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
    }
    if (abortToken.isCancelled()) {
      return settle(received, Settlement.RELEASE);
    }

    Detection detection = new Detection(frame.sourceId(), frame.sequenceNumber(),
        envelope.attemptCount(), boxes == null ? List.of() : boxes, clock.instant());
    try {
      sink.emit(detection);
    } catch (SinkException | RuntimeException e) {
      return retryOrDeadLetter(received, PipelineFailure.Type.SINK, e);
    }
    metrics.incrementDetectionsEmitted();
    return settle(received, Settlement.ACK);
  }

  private DeliveryOutcome retryOrDeadLetter(Received received, PipelineFailure.Type type, Exception failure) {
    Envelope envelope = received.envelope;
    if (envelope.attemptCount() < maxAttempts) {
      logger.log(Level.FINE, "Transient " + type + " failure for " + describe(envelope)
          + " on attempt " + envelope.attemptCount() + "; requeueing", failure);
      return settle(received, Settlement.REQUEUE);
    }
    Frame frame = envelope.frame();
    logger.log(Level.SEVERE, describe(envelope) + " failed after " + envelope.attemptCount()
        + " attempt(s); dead-lettering", failure);
    report(PipelineFailure.forFrame(type, frame.sourceId(), frame.sequenceNumber(),
        "Failed after " + envelope.attemptCount() + " attempt(s): " + failure.getMessage(), failure));
    return settle(received, Settlement.DEAD);
  }

  private DeliveryOutcome settle(Received received, Settlement settlement) {
    Delivery delivery = received.delivery;
    try {
      switch (settlement) {
        case ACK -> {
          delivery.ack();
          metrics.incrementDeliveriesAcked();
          return DeliveryOutcome.ACKED;
        }
        case REQUEUE -> {
          delivery.nack(true);
          metrics.incrementDeliveriesRequeued();
          return DeliveryOutcome.REQUEUED;
        }
        case DEAD -> {
          delivery.nack(false);
          metrics.incrementDeliveriesDead();
          return DeliveryOutcome.DEAD_LETTERED;
        }
        default -> {
          delivery.nack(true);
          return DeliveryOutcome.ABANDONED;
        }
      }
    } catch (ChannelClosedException e) {
      logger.log(Level.WARNING, "Could not settle delivery " + delivery.deliveryId()
          + "; the broker will redeliver it", e);
      sessionLost(received.session, e);
      return DeliveryOutcome.ABANDONED;
    }
  }

  private Session currentSession() {
    synchronized (sessionLock) {
      while (!pollToken.isCancelled()) {
        Session current = session;
        if (current != null && current.connection.isOpen()) {
          return current;
        }
        if (current != null) {
          current.close();
          session = null;
        }
        ChannelConnection connection = reconnector.connect(pollToken, connectedBefore);
        if (connection == null) {
          return null;
        }
        try {
          Subscription subscription = connection.subscribe(channel, prefetchLimit);
          connectedBefore = true;
          sequenceTracker.reset();
          session = new Session(connection, subscription);
          logger.info("Subscribed to " + channel + " via " + channelClient.describe());
        } catch (ChannelClosedException e) {
          logger.log(Level.WARNING, "Subscribe to " + channel + " failed; reconnecting", e);
          connection.close();
        }
      }
      return null;
    }
  }

  private void sessionLost(Session lost, Exception cause) {
    synchronized (sessionLock) {
      if (session != lost) {
        return;
      }
      session = null;
    }
    if (!pollToken.isCancelled()) {
      logger.log(Level.WARNING, "Lost connection to " + channelClient.describe()
          + " while consuming " + channel + "; reconnecting", cause);
      report(PipelineFailure.of(PipelineFailure.Type.CONNECT,
          "Connection lost while consuming " + channel, cause));
    }
    lost.close();
  }

  private void report(PipelineFailure failure) {
    for (FailureListener listener : failureListeners) {
      try {
        listener.onFailure(failure);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Failure listener threw", e);
      }
    }
  }

  private static String describe(Envelope envelope) {
    return "frame " + envelope.frame().sourceId() + "#" + envelope.frame().sequenceNumber();
  }

  /**
   * Stops polling and lets in-flight deliveries finish for up to {@code deadline}. Past
   * the deadline the deliveries still held are counted as abandoned and the connection is
   * closed, which returns them to the broker. Workers still inside the detector are not
   * interrupted; they observe the abort when the call returns and settle nothing.
   * Idempotent.
   *
   * @param deadline how long in-flight deliveries may keep running
   */
  public void stop(Duration deadline) {
    Objects.requireNonNull(deadline, "deadline");
    if (!stopped.compareAndSet(false, true)) {
      return;
    }
    pollToken.cancel();
    if (workers != null) {
      workers.shutdown();
      try {
        if (!workers.awaitTermination(deadline.toMillis(), TimeUnit.MILLISECONDS)) {
          abandonInFlight();
        }
      } catch (InterruptedException e) {
        abandonInFlight();
        Thread.currentThread().interrupt();
      }
    }
    Session last;
    synchronized (sessionLock) {
      last = session;
      session = null;
    }
    if (last != null) {
      last.close();
    }
    try {
      sink.close();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to close result sink", e);
    }
    metrics.recordConsumerInFlight(0);
    logger.info("Consumer on " + channel + " stopped: acked=" + outcomeCount(DeliveryOutcome.ACKED)
        + ", requeued=" + outcomeCount(DeliveryOutcome.REQUEUED)
        + ", deadLettered=" + outcomeCount(DeliveryOutcome.DEAD_LETTERED)
        + ", abandoned=" + outcomeCount(DeliveryOutcome.ABANDONED));
  }

  private void abandonInFlight() {
    abortToken.cancel();
    int abandoned = 0;
    for (Received held : active) {
      if (held.finish()) {
        abandoned++;
      }
    }
    outcomes.get(DeliveryOutcome.ABANDONED).addAndGet(abandoned);
    logger.warning("Shutdown deadline exceeded on " + channel + "; abandoning " + abandoned
        + " in-flight delivery(ies) to the broker");
  }

  /** Stops with the configured shutdown deadline. */
  @Override
  public void close() {
    stop(shutdownDeadline);
  }

  public String channel() {
    return channel;
  }

  public int prefetchLimit() {
    return prefetchLimit;
  }

  /** @return {@code true} while the pipeline holds an open subscription */
  public boolean isConnected() {
    Session current = session;
    return current != null && current.connection.isOpen();
  }

  public boolean isRunning() {
    return started.get() && !stopped.get();
  }

  /** @return deliveries currently between receipt and settlement */
  public int inFlight() {
    return inFlight.get();
  }

  public long outcomeCount(DeliveryOutcome outcome) {
    return outcomes.get(outcome).get();
  }

  public SequenceTracker sequenceTracker() {
    return sequenceTracker;
  }

  private enum Settlement {
    ACK,
    REQUEUE,
    DEAD,
    RELEASE
  }

  private static final class Session {
    private final ChannelConnection connection;
    private final Subscription subscription;

    private Session(ChannelConnection connection, Subscription subscription) {
      this.connection = connection;
      this.subscription = subscription;
    }

    private void close() {
      try {
        subscription.close();
      } catch (RuntimeException e) {
        logger.log(Level.FINE, "Error closing subscription", e);
      }
      try {
        connection.close();
      } catch (RuntimeException e) {
        logger.log(Level.FINE, "Error closing connection", e);
      }
    }
  }

  private static final class Received {
    private final Session session;
    private final Delivery delivery;
    private final Envelope envelope;
    private final FrameDecodeException decodeError;
    private final AtomicBoolean finished = new AtomicBoolean();

    private Received(Session session, Delivery delivery, Envelope envelope, FrameDecodeException decodeError) {
      this.session = session;
      this.delivery = delivery;
      this.envelope = envelope;
      this.decodeError = decodeError;
    }

    /** @return {@code true} for the one caller that gets to count this delivery's outcome */
    private boolean finish() {
      return finished.compareAndSet(false, true);
    }
  }

  /** Builder for {@link ConsumerPipeline}. */
  public static final class Builder {
    private ChannelClient channelClient;
    private Detector detector;
    private ResultSink sink;
    private String channel = "frames";
    private FrameCodec codec;
    private int prefetchLimit = 4;
    private int maxAttempts = 3;
    private RetryPolicy reconnectPolicy;
    private MetricsExporter metrics;
    private final List<FailureListener> failureListeners = new ArrayList<>();
    private Clock clock;
    private Duration shutdownDeadline = Duration.ofSeconds(10);

    private Builder() {}

    /**
     * Sets the client used to open the consuming connection.
     *
     * <p><b>Required.</b>
     *
     * @param channelClient the channel client
     * @return this builder
     */
    public Builder channelClient(ChannelClient channelClient) {
      this.channelClient = channelClient;
      return this;
    }

    /**
     * Sets the detection collaborator. Called concurrently from every worker slot.
     *
     * <p><b>Required.</b>
     *
     * @param detector the detector
     * @return this builder
     */
    public Builder detector(Detector detector) {
      this.detector = detector;
      return this;
    }

    /**
     * Sets where detections go. The pipeline closes it on stop.
     *
     * <p><b>Required.</b>
     *
     * @param sink the result sink
     * @return this builder
     */
    public Builder sink(ResultSink sink) {
      this.sink = sink;
      return this;
    }

    public Builder channel(String channel) {
      this.channel = channel;
      return this;
    }

    public Builder codec(FrameCodec codec) {
      this.codec = codec;
      return this;
    }

    /**
     * Sets the number of worker slots, which is also the number of unsettled deliveries
     * the broker may hand out. Defaults to {@code 4}. Must be &ge; 1.
     *
     * @param prefetchLimit prefetch limit
     * @return this builder
     */
    public Builder prefetchLimit(int prefetchLimit) {
      this.prefetchLimit = prefetchLimit;
      return this;
    }

    /**
     * Sets the delivery attempts allowed before a transient failure dead-letters the
     * message. Defaults to {@code 3}. Must be &ge; 1.
     *
     * @param maxAttempts maximum attempts per message
     * @return this builder
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    public Builder reconnectPolicy(RetryPolicy reconnectPolicy) {
      this.reconnectPolicy = reconnectPolicy;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Adds a listener for decode, detection, sink and connection failures. May be called
     * more than once.
     *
     * @param failureListener listener to add
     * @return this builder
     */
    public Builder failureListener(FailureListener failureListener) {
      this.failureListeners.add(Objects.requireNonNull(failureListener, "failureListener"));
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the deadline used by {@link ConsumerPipeline#close()}. Defaults to 10 seconds.
     *
     * @param shutdownDeadline shutdown deadline
     * @return this builder
     */
    public Builder shutdownDeadline(Duration shutdownDeadline) {
      this.shutdownDeadline = shutdownDeadline;
      return this;
    }

    public ConsumerPipeline build() {
      return new ConsumerPipeline(this);
    }
  }
}
