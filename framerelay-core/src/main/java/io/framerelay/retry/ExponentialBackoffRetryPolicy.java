package io.framerelay.retry;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with a capped maximum and symmetric jitter.
 *
 * <p>Delay formula: {@code min(maxDelay, baseDelay * 2^(attempt-1))} scaled by a random
 * factor in {@code [1 - jitter, 1 + jitter)}, then capped at {@code maxDelay} again. With the
 * default jitter of {@code 0.5} the factor is {@code [0.5, 1.5)}.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  public static final double DEFAULT_JITTER = 0.5;

  private final long baseDelayMs;
  private final long maxDelayMs;
  private final double jitter;

  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    this(baseDelayMs, maxDelayMs, DEFAULT_JITTER);
  }

  /**
   * @param baseDelayMs delay before the first retry (milliseconds)
   * @param maxDelayMs  cap for any single delay (milliseconds)
   * @param jitter      relative jitter in {@code [0, 1)}; {@code 0} disables it
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs, double jitter) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    if (jitter < 0.0 || jitter >= 1.0) {
      throw new IllegalArgumentException("jitter must be within [0, 1), got: " + jitter);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.jitter = jitter;
  }

  public long baseDelayMs() {
    return baseDelayMs;
  }

  public long maxDelayMs() {
    return maxDelayMs;
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    long expDelay;
    if (attempts >= 63) {
      expDelay = maxDelayMs;
    } else {
      long shift = 1L << (attempts - 1);
      // shift * base would overflow or exceed the cap
      expDelay = shift > maxDelayMs / baseDelayMs ? maxDelayMs : baseDelayMs * shift;
    }
    long capped = Math.min(maxDelayMs, expDelay);
    if (jitter == 0.0) {
      return capped;
    }
    double factor = ThreadLocalRandom.current().nextDouble(1.0 - jitter, 1.0 + jitter);
    return Math.min(maxDelayMs, Math.max(0L, (long) (capped * factor)));
  }
}
