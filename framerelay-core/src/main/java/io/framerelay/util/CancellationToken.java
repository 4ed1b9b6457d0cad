package io.framerelay.util;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation signal passed explicitly through every suspension point of a
 * pipeline flow (broker I/O, backoff sleeps, collaborator calls).
 *
 * <p>Flows check {@link #isCancelled()} between steps and use {@link #sleep(long)} for
 * backoff so a cancel wakes them immediately. Thread interruption is not used for
 * shutdown. Once cancelled a token stays cancelled.
 *
 * <p>This class is thread-safe.
 */
public final class CancellationToken {
  private final CountDownLatch cancelled = new CountDownLatch(1);

  public void cancel() {
    cancelled.countDown();
  }

  public boolean isCancelled() {
    return cancelled.getCount() == 0;
  }

  /**
   * Sleeps for the given delay or until the token is cancelled, whichever comes first.
   *
   * @param delayMs delay in milliseconds; non-positive values return immediately
   * @return {@code true} if the full delay elapsed, {@code false} if cancelled
   */
  public boolean sleep(long delayMs) {
    if (isCancelled()) {
      return false;
    }
    if (delayMs <= 0) {
      return true;
    }
    try {
      return !cancelled.await(delayMs, TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  /**
   * Blocks until cancelled or the timeout elapses.
   *
   * @param timeoutMs maximum wait in milliseconds
   * @return {@code true} if the token was cancelled
   */
  public boolean awaitCancellation(long timeoutMs) {
    return !sleep(timeoutMs) && isCancelled();
  }
}
