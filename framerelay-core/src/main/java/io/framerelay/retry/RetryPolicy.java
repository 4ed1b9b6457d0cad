package io.framerelay.retry;

/**
 * Strategy for the delay before the next attempt of a failed broker operation
 * (connect, publish) or a failed capture.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

    /**
     * Computes the delay in milliseconds before the next attempt.
     *
     * @param attempts the number of failed attempts so far (1-based)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int attempts);

    /**
     * Policy that retries without waiting. Intended for tests.
     *
     * @return a zero-delay policy
     */
    static RetryPolicy immediate() {
        return attempts -> 0L;
    }
}
