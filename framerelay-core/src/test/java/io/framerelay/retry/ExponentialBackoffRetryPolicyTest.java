package io.framerelay.retry;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryPolicyTest {

  @Test
  void firstAttemptReturnsBaseDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 10000);

    long delay = policy.computeDelayMs(1);

    // jitter 0.5 gives a factor in [0.5, 1.5)
    assertTrue(delay >= 50 && delay < 150, "Expected delay between 50-150, got: " + delay);
  }

  @Test
  void delayDoublesWithoutJitter() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 100000, 0.0);

    assertEquals(100, policy.computeDelayMs(1));
    assertEquals(200, policy.computeDelayMs(2));
    assertEquals(400, policy.computeDelayMs(3));
    assertEquals(800, policy.computeDelayMs(4));
  }

  @Test
  void delayIsCappedAtMaxDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 500);

    for (int attempt = 1; attempt <= 20; attempt++) {
      long delay = policy.computeDelayMs(attempt);
      assertTrue(delay <= 500, "Delay should be capped at maxDelay, got: " + delay);
    }
  }

  @Test
  void handlesAttemptCountAtOverflowBoundary() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 60000, 0.0);

    assertEquals(60000, policy.computeDelayMs(31));
    assertEquals(60000, policy.computeDelayMs(62));
    assertEquals(60000, policy.computeDelayMs(63));
    assertEquals(60000, policy.computeDelayMs(Integer.MAX_VALUE));
  }

  @Test
  void zeroAttemptsReturnsZero() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 10000);

    assertEquals(0L, policy.computeDelayMs(0));
    assertEquals(0L, policy.computeDelayMs(-1));
  }

  @Test
  void rejectsInvalidArguments() {
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(0, 1000));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(500, 100));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(100, 1000, 1.0));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(100, 1000, -0.1));
  }

  @Test
  void immediatePolicyNeverWaits() {
    RetryPolicy policy = RetryPolicy.immediate();

    assertEquals(0L, policy.computeDelayMs(1));
    assertEquals(0L, policy.computeDelayMs(50));
  }
}
