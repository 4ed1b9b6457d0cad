package io.framerelay.consumer;

import io.framerelay.spi.MetricsExporter;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Follows per-source sequence numbers of first-attempt deliveries.
 *
 * <p>A jump forward is a gap: frames the producer dropped under backpressure. Gaps are
 * counted, never treated as errors. A first-attempt frame at or below the highest number
 * already seen on the same connection is a regression, which the producer contract rules
 * out; it is logged and counted. Redeliveries are ignored because the broker does not
 * order them.
 *
 * <p>This class is thread-safe.
 */
public final class SequenceTracker {
  private static final Logger logger = Logger.getLogger(SequenceTracker.class.getName());

  /** Classification of one observed sequence number. */
  public enum Observation {
    FIRST,
    IN_ORDER,
    GAP,
    REGRESSION,
    REDELIVERY
  }

  private final MetricsExporter metrics;
  private final Map<String, Long> highest = new HashMap<>();
  private final AtomicLong missingFrames = new AtomicLong();
  private final AtomicLong regressions = new AtomicLong();

  public SequenceTracker(MetricsExporter metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Records a delivered frame.
   *
   * @param sourceId       frame source
   * @param sequenceNumber frame sequence number
   * @param attemptCount   delivery attempt, {@code 1} for a first delivery
   * @return how the number relates to those seen before
   */
  public synchronized Observation observe(String sourceId, long sequenceNumber, int attemptCount) {
    if (attemptCount > 1) {
      return Observation.REDELIVERY;
    }
    Long last = highest.get(sourceId);
    if (last == null) {
      highest.put(sourceId, sequenceNumber);
      return Observation.FIRST;
    }
    if (sequenceNumber <= last) {
      regressions.incrementAndGet();
      metrics.incrementSequenceRegressions();
      logger.warning("Sequence regression for source " + sourceId + ": " + sequenceNumber
          + " after " + last);
      return Observation.REGRESSION;
    }
    highest.put(sourceId, sequenceNumber);
    if (sequenceNumber > last + 1) {
      missingFrames.addAndGet(sequenceNumber - last - 1);
      metrics.incrementSequenceGaps();
      logger.fine("Sequence gap for source " + sourceId + ": " + (last + 1) + ".." + (sequenceNumber - 1));
      return Observation.GAP;
    }
    return Observation.IN_ORDER;
  }

  /** Forgets every source. Called when a new connection starts. */
  public synchronized void reset() {
    highest.clear();
  }

  /** @return sequence numbers skipped across all gaps */
  public long missingFrames() {
    return missingFrames.get();
  }

  public long regressions() {
    return regressions.get();
  }
}
