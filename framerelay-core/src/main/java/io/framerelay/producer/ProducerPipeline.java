package io.framerelay.producer;

import io.framerelay.CaptureException;
import io.framerelay.Frame;
import io.framerelay.FrameSource;
import io.framerelay.PipelineFailure;
import io.framerelay.RawFrame;
import io.framerelay.channel.ChannelClient;
import io.framerelay.channel.ChannelConnection;
import io.framerelay.channel.PublishException;
import io.framerelay.channel.Reconnector;
import io.framerelay.codec.FrameCodec;
import io.framerelay.retry.ExponentialBackoffRetryPolicy;
import io.framerelay.retry.RetryPolicy;
import io.framerelay.spi.FailureListener;
import io.framerelay.spi.MetricsExporter;
import io.framerelay.util.CancellationToken;
import io.framerelay.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Captures frames from one {@link FrameSource} and publishes them to a channel.
 *
 * <p>Capture and publish run on separate daemon threads joined by a
 * {@link DropOldestBuffer}. Capture never waits on the broker: when the buffer is full the
 * oldest unpublished frame is discarded and counted. Sequence numbers are assigned at
 * capture time from a per-source counter and are never reused, so consumers see drops
 * as gaps.
 *
 * <p>A frame whose publish fails {@code maxPublishAttempts} times is dropped, counted in
 * {@link #failedFrames()} and reported to the failure listeners. A connection found
 * closed is replaced through the reconnect policy before the next attempt.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 *
 * @see ProducerState
 */
public final class ProducerPipeline implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ProducerPipeline.class.getName());

  private static final long BUFFER_POLL_TIMEOUT_MS = 50;
  private static final long FORCED_STOP_WAIT_MS = 5000;

  private final ChannelClient channelClient;
  private final FrameSource frameSource;
  private final String sourceId;
  private final String channel;
  private final FrameCodec codec;
  private final DropOldestBuffer<Frame> buffer;
  private final int maxPublishAttempts;
  private final RetryPolicy publishRetryPolicy;
  private final RetryPolicy captureRetryPolicy;
  private final Reconnector reconnector;
  private final MetricsExporter metrics;
  private final List<FailureListener> failureListeners;
  private final Clock clock;
  private final Duration drainTimeout;

  private final AtomicReference<ProducerState> state = new AtomicReference<>(ProducerState.IDLE);
  private final AtomicLong nextSequence;
  private final AtomicLong captured = new AtomicLong();
  private final AtomicLong published = new AtomicLong();
  private final AtomicLong dropped = new AtomicLong();
  private final AtomicLong failed = new AtomicLong();
  private final CancellationToken captureToken = new CancellationToken();
  private final CancellationToken publishToken = new CancellationToken();
  private final CountDownLatch captureDone = new CountDownLatch(1);
  private final CountDownLatch publishDone = new CountDownLatch(1);
  private final DaemonThreadFactory threadFactory;

  private volatile boolean started;
  private volatile boolean captureFinished;
  private volatile boolean endOfStream;
  private volatile boolean draining;
  private volatile ChannelConnection connection;

  private ProducerPipeline(Builder builder) {
    this.channelClient = Objects.requireNonNull(builder.channelClient, "channelClient");
    this.frameSource = Objects.requireNonNull(builder.frameSource, "frameSource");
    this.sourceId = Objects.requireNonNull(builder.sourceId, "sourceId");
    this.channel = Objects.requireNonNull(builder.channel, "channel");
    if (sourceId.isEmpty()) {
      throw new IllegalArgumentException("sourceId must not be empty");
    }
    if (channel.isEmpty()) {
      throw new IllegalArgumentException("channel must not be empty");
    }
    if (builder.queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be > 0");
    }
    if (builder.maxPublishAttempts < 1) {
      throw new IllegalArgumentException("maxPublishAttempts must be >= 1");
    }
    if (builder.firstSequenceNumber < 0) {
      throw new IllegalArgumentException("firstSequenceNumber must be >= 0");
    }
    Objects.requireNonNull(builder.drainTimeout, "drainTimeout");
    if (builder.drainTimeout.isNegative()) {
      throw new IllegalArgumentException("drainTimeout must not be negative");
    }
    this.codec = builder.codec != null ? builder.codec : FrameCodec.getDefault();
    this.buffer = new DropOldestBuffer<>(builder.queueCapacity);
    this.maxPublishAttempts = builder.maxPublishAttempts;
    this.publishRetryPolicy = builder.publishRetryPolicy != null
        ? builder.publishRetryPolicy : new ExponentialBackoffRetryPolicy(100, 5_000);
    this.captureRetryPolicy = builder.captureRetryPolicy != null
        ? builder.captureRetryPolicy : new ExponentialBackoffRetryPolicy(200, 10_000);
    RetryPolicy reconnectPolicy = builder.reconnectPolicy != null
        ? builder.reconnectPolicy : new ExponentialBackoffRetryPolicy(500, 30_000);
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.failureListeners = Collections.unmodifiableList(new ArrayList<>(builder.failureListeners));
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.drainTimeout = builder.drainTimeout;
    this.nextSequence = new AtomicLong(builder.firstSequenceNumber);
    this.reconnector = new Reconnector(channelClient, reconnectPolicy, metrics, this::report);
    this.threadFactory = new DaemonThreadFactory("framerelay-producer-" + sourceId + "-");
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the capture and publish threads. The publish thread connects eagerly, so
   * {@link #isConnected()} turns {@code true} before the first frame is captured if the
   * broker is reachable.
   *
   * @throws IllegalStateException if the pipeline was already started
   */
  public void start() {
    if (!state.compareAndSet(ProducerState.IDLE, ProducerState.CAPTURING)) {
      throw new IllegalStateException("Producer for " + sourceId + " already started: " + state.get());
    }
    logger.info("Starting producer for source " + sourceId + " on channel " + channel
        + " via " + channelClient.describe());
    started = true;
    threadFactory.newThread(this::publishLoop).start();
    threadFactory.newThread(this::captureLoop).start();
  }

  private void captureLoop() {
    int consecutiveErrors = 0;
    try {
      while (!captureToken.isCancelled()) {
        Optional<RawFrame> next;
        try {
          next = frameSource.nextFrame();
          consecutiveErrors = 0;
        } catch (CaptureException | RuntimeException e) {
          consecutiveErrors++;
          metrics.incrementCaptureErrors();
          logger.log(Level.WARNING, "Capture failed for source " + sourceId
              + " (consecutive errors: " + consecutiveErrors + "); restarting with backoff", e);
          report(PipelineFailure.forFrame(PipelineFailure.Type.CAPTURE, sourceId, -1,
              "Capture failed: " + e.getMessage(), e));
          if (!captureToken.sleep(captureRetryPolicy.computeDelayMs(consecutiveErrors))) {
            break;
          }
          continue;
        }
        if (next.isEmpty()) {
          endOfStream = true;
          logger.info("End of stream for source " + sourceId + " after " + captured.get() + " frame(s)");
          break;
        }
        enqueue(next.get());
      }
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Capture loop error for source " + sourceId, t);
    } finally {
      captureFinished = true;
      transitionToDraining();
      captureDone.countDown();
    }
  }

  private void enqueue(RawFrame raw) {
    Instant capturedAt = raw.capturedAt() != null ? raw.capturedAt() : clock.instant();
    Frame frame = new Frame(sourceId, nextSequence.getAndIncrement(), capturedAt, raw.payload());
    captured.incrementAndGet();
    metrics.incrementFramesCaptured();
    Frame evicted = buffer.offer(frame);
    if (evicted != null) {
      dropped.incrementAndGet();
      metrics.incrementFramesDropped();
      logger.fine("Buffer full; dropped frame " + sourceId + "#" + evicted.sequenceNumber());
    }
    metrics.recordBufferDepth(buffer.size());
  }

  private void publishLoop() {
    try {
      connection = reconnector.connect(publishToken, false);
      while (!publishToken.isCancelled()) {
        Frame frame = buffer.poll(BUFFER_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        if (frame == null) {
          if ((captureFinished || draining) && buffer.isEmpty()) {
            break;
          }
          continue;
        }
        metrics.recordBufferDepth(buffer.size());
        state.compareAndSet(ProducerState.CAPTURING, ProducerState.PUBLISHING);
        try {
          publish(frame);
        } finally {
          state.compareAndSet(ProducerState.PUBLISHING, ProducerState.CAPTURING);
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Publish loop error for source " + sourceId, t);
    } finally {
      closeConnection();
      if (captureFinished) {
        state.set(ProducerState.STOPPED);
      }
      publishDone.countDown();
    }
  }

  private void publish(Frame frame) {
    byte[] body = codec.encode(frame);
    PublishException lastError = null;
    for (int attempt = 1; attempt <= maxPublishAttempts; attempt++) {
      ChannelConnection conn = currentConnection();
      if (conn == null) {
        abandon(frame);
        return;
      }
      try {
        conn.publish(channel, sourceId, body);
        published.incrementAndGet();
        metrics.incrementPublishSuccess();
        return;
      } catch (PublishException e) {
        lastError = e;
        if (!conn.isOpen()) {
          logger.log(Level.WARNING, "Connection lost while publishing " + sourceId + "#"
              + frame.sequenceNumber() + "; reconnecting", e);
          dropConnection(conn);
        }
        if (attempt == maxPublishAttempts) {
          break;
        }
        metrics.incrementPublishRetries();
        logger.log(Level.FINE, "Publish attempt " + attempt + " failed for " + sourceId + "#"
            + frame.sequenceNumber(), e);
        if (!publishToken.sleep(publishRetryPolicy.computeDelayMs(attempt))) {
          abandon(frame);
          return;
        }
      }
    }
    failed.incrementAndGet();
    metrics.incrementPublishFailed();
    logger.log(Level.SEVERE, "Dropping frame " + sourceId + "#" + frame.sequenceNumber()
        + " after " + maxPublishAttempts + " publish attempt(s)", lastError);
    report(PipelineFailure.forFrame(PipelineFailure.Type.PUBLISH, sourceId, frame.sequenceNumber(),
        "Publish failed after " + maxPublishAttempts + " attempt(s)", lastError));
  }

  private ChannelConnection currentConnection() {
    ChannelConnection conn = connection;
    if (conn != null && conn.isOpen()) {
      return conn;
    }
    if (conn != null) {
      dropConnection(conn);
    }
    conn = reconnector.connect(publishToken, true);
    connection = conn;
    return conn;
  }

  private void dropConnection(ChannelConnection conn) {
    connection = null;
    try {
      conn.close();
    } catch (RuntimeException e) {
      logger.log(Level.FINE, "Error closing lost connection", e);
    }
  }

  private void closeConnection() {
    ChannelConnection conn = connection;
    if (conn != null) {
      dropConnection(conn);
    }
  }

  private void abandon(Frame frame) {
    dropped.incrementAndGet();
    metrics.incrementFramesDropped();
    logger.warning("Abandoned unpublished frame " + sourceId + "#" + frame.sequenceNumber() + " at shutdown");
  }

  private void transitionToDraining() {
    ProducerState current;
    do {
      current = state.get();
      if (current == ProducerState.DRAINING || current == ProducerState.STOPPED) {
        return;
      }
    } while (!state.compareAndSet(current, ProducerState.DRAINING));
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

  /**
   * Stops capture, then lets the publish thread drain the buffer for up to
   * {@code drainTimeout}. Frames still buffered or mid-publish when the timeout elapses
   * are counted as dropped. Closes the frame source. Idempotent.
   *
   * @param drainTimeout how long buffered frames may keep publishing
   */
  public void stop(Duration drainTimeout) {
    Objects.requireNonNull(drainTimeout, "drainTimeout");
    if (state.compareAndSet(ProducerState.IDLE, ProducerState.STOPPED)) {
      closeSource();
      return;
    }
    if (state.get() == ProducerState.STOPPED
        && (!started || (publishDone.getCount() == 0 && captureDone.getCount() == 0))) {
      closeSource();
      return;
    }
    long deadline = System.nanoTime() + drainTimeout.toNanos();
    captureToken.cancel();
    draining = true;
    transitionToDraining();
    try {
      captureDone.await(remainingNanos(deadline), TimeUnit.NANOSECONDS);
      closeSource();
      if (!publishDone.await(remainingNanos(deadline), TimeUnit.NANOSECONDS)) {
        logger.warning("Drain timeout exceeded for source " + sourceId + "; forcing stop. Buffered: "
            + buffer.size());
        publishToken.cancel();
        publishDone.await(FORCED_STOP_WAIT_MS, TimeUnit.MILLISECONDS);
      }
    } catch (InterruptedException e) {
      publishToken.cancel();
      Thread.currentThread().interrupt();
    } finally {
      for (Frame frame : buffer.drain()) {
        abandon(frame);
      }
      metrics.recordBufferDepth(0);
      state.set(ProducerState.STOPPED);
      logger.info("Producer for source " + sourceId + " stopped: captured=" + captured.get()
          + ", published=" + published.get() + ", dropped=" + dropped.get() + ", failed=" + failed.get());
    }
  }

  private static long remainingNanos(long deadline) {
    return Math.max(0, deadline - System.nanoTime());
  }

  private void closeSource() {
    try {
      frameSource.close();
    } catch (Exception e) {
      logger.log(Level.WARNING, "Failed to close frame source " + sourceId, e);
    }
  }

  /** Stops with the configured drain timeout. */
  @Override
  public void close() {
    stop(drainTimeout);
  }

  /**
   * Waits until the publish thread has exited, which happens on its own once the source
   * reaches end of stream and the buffer is drained.
   *
   * @param timeout maximum wait
   * @return {@code true} if the publish thread finished
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitCompletion(Duration timeout) throws InterruptedException {
    return publishDone.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  public ProducerState state() {
    return state.get();
  }

  public String sourceId() {
    return sourceId;
  }

  public String channel() {
    return channel;
  }

  /** @return {@code true} while the publish thread holds an open connection */
  public boolean isConnected() {
    ChannelConnection conn = connection;
    return conn != null && conn.isOpen();
  }

  /**
   * @return {@code true} once the source reached end of stream and the publish thread
   *     drained the buffer and exited on its own
   */
  public boolean isCompleted() {
    return endOfStream && publishDone.getCount() == 0;
  }

  public long capturedFrames() {
    return captured.get();
  }

  public long publishedFrames() {
    return published.get();
  }

  /** @return frames discarded by drop-oldest eviction or abandoned at shutdown */
  public long droppedFrames() {
    return dropped.get();
  }

  /** @return frames discarded after exhausting publish attempts */
  public long failedFrames() {
    return failed.get();
  }

  public int bufferedFrames() {
    return buffer.size();
  }

  public int bufferHighWaterMark() {
    return buffer.highWaterMark();
  }

  /** Builder for {@link ProducerPipeline}. */
  public static final class Builder {
    private ChannelClient channelClient;
    private FrameSource frameSource;
    private String sourceId;
    private String channel = "frames";
    private FrameCodec codec;
    private int queueCapacity = 64;
    private int maxPublishAttempts = 5;
    private RetryPolicy publishRetryPolicy;
    private RetryPolicy reconnectPolicy;
    private RetryPolicy captureRetryPolicy;
    private MetricsExporter metrics;
    private final List<FailureListener> failureListeners = new ArrayList<>();
    private Clock clock;
    private long firstSequenceNumber = 1;
    private Duration drainTimeout = Duration.ofSeconds(5);

    private Builder() {}

    /**
     * Sets the client used to open the publish connection.
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
     * Sets the capture device. The pipeline closes it on stop.
     *
     * <p><b>Required.</b>
     *
     * @param frameSource the capture collaborator
     * @return this builder
     */
    public Builder frameSource(FrameSource frameSource) {
      this.frameSource = frameSource;
      return this;
    }

    /**
     * Sets the source identifier stamped on every frame and used as the message key.
     *
     * <p><b>Required.</b>
     *
     * @param sourceId non-empty source identifier
     * @return this builder
     */
    public Builder sourceId(String sourceId) {
      this.sourceId = sourceId;
      return this;
    }

    /**
     * Sets the channel frames are published to. Defaults to {@code "frames"}.
     *
     * @param channel channel name
     * @return this builder
     */
    public Builder channel(String channel) {
      this.channel = channel;
      return this;
    }

    public Builder codec(FrameCodec codec) {
      this.codec = codec;
      return this;
    }

    /**
     * Sets how many captured, unpublished frames may be buffered before the oldest is
     * dropped. Defaults to {@code 64}. Must be &gt; 0.
     *
     * @param queueCapacity buffer capacity
     * @return this builder
     */
    public Builder queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    /**
     * Sets the publish attempts per frame before it is dropped as failed. Defaults to
     * {@code 5}. Must be &ge; 1.
     *
     * @param maxPublishAttempts attempts per frame
     * @return this builder
     */
    public Builder maxPublishAttempts(int maxPublishAttempts) {
      this.maxPublishAttempts = maxPublishAttempts;
      return this;
    }

    /**
     * Sets the delay between publish attempts. Defaults to
     * {@link ExponentialBackoffRetryPolicy} with {@code 100..5000} ms.
     *
     * @param publishRetryPolicy publish retry policy
     * @return this builder
     */
    public Builder publishRetryPolicy(RetryPolicy publishRetryPolicy) {
      this.publishRetryPolicy = publishRetryPolicy;
      return this;
    }

    /**
     * Sets the delay between connection attempts. Defaults to
     * {@link ExponentialBackoffRetryPolicy} with {@code 500..30000} ms.
     *
     * @param reconnectPolicy reconnect policy
     * @return this builder
     */
    public Builder reconnectPolicy(RetryPolicy reconnectPolicy) {
      this.reconnectPolicy = reconnectPolicy;
      return this;
    }

    /**
     * Sets the delay before capture is retried after a {@link CaptureException}. Defaults
     * to {@link ExponentialBackoffRetryPolicy} with {@code 200..10000} ms.
     *
     * @param captureRetryPolicy capture restart policy
     * @return this builder
     */
    public Builder captureRetryPolicy(RetryPolicy captureRetryPolicy) {
      this.captureRetryPolicy = captureRetryPolicy;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Adds a listener for capture, connect and publish failures. May be called more than
     * once.
     *
     * @param failureListener listener to add
     * @return this builder
     */
    public Builder failureListener(FailureListener failureListener) {
      this.failureListeners.add(Objects.requireNonNull(failureListener, "failureListener"));
      return this;
    }

    /**
     * Sets the clock used to stamp frames whose source supplied no capture time.
     *
     * @param clock clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the first sequence number assigned. Defaults to {@code 1}.
     *
     * @param firstSequenceNumber first sequence number, &ge; 0
     * @return this builder
     */
    public Builder firstSequenceNumber(long firstSequenceNumber) {
      this.firstSequenceNumber = firstSequenceNumber;
      return this;
    }

    /**
     * Sets the drain timeout used by {@link ProducerPipeline#close()}. Defaults to 5 seconds.
     *
     * @param drainTimeout drain timeout
     * @return this builder
     */
    public Builder drainTimeout(Duration drainTimeout) {
      this.drainTimeout = drainTimeout;
      return this;
    }

    public ProducerPipeline build() {
      return new ProducerPipeline(this);
    }
  }
}
