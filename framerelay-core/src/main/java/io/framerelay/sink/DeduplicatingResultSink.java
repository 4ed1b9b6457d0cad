package io.framerelay.sink;

import io.framerelay.Detection;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Suppresses detections whose {@link Detection#dedupeKey()} was already emitted.
 *
 * <p>Remembers the most recent {@code window} keys in an access-ordered LRU map. A key is
 * recorded only after the delegate accepted the detection, so a failed emit can be
 * retried by a redelivery.
 *
 * <p>This class is thread-safe.
 */
public final class DeduplicatingResultSink implements ResultSink {
  private static final Logger logger = Logger.getLogger(DeduplicatingResultSink.class.getName());

  private final ResultSink delegate;
  private final int window;
  private final Map<String, Boolean> seen;
  private final AtomicLong suppressed = new AtomicLong();

  public DeduplicatingResultSink(ResultSink delegate, int window) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    if (window <= 0) {
      throw new IllegalArgumentException("window must be > 0, got: " + window);
    }
    this.window = window;
    this.seen = new LinkedHashMap<>(16, 0.75f, true) {
      @Override
      protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
        return size() > DeduplicatingResultSink.this.window;
      }
    };
  }

  @Override
  public void emit(Detection detection) throws SinkException {
    String key = detection.dedupeKey();
    synchronized (seen) {
      if (seen.get(key) != null) {
        suppressed.incrementAndGet();
        logger.fine("Suppressed duplicate detection " + key);
        return;
      }
    }
    delegate.emit(detection);
    synchronized (seen) {
      seen.put(key, Boolean.TRUE);
    }
  }

  /** @return number of detections dropped as duplicates */
  public long suppressedCount() {
    return suppressed.get();
  }

  public int window() {
    return window;
  }

  @Override
  public void close() {
    delegate.close();
  }
}
