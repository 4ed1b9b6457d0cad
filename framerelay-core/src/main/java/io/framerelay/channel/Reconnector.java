package io.framerelay.channel;

import io.framerelay.PipelineFailure;
import io.framerelay.retry.RetryPolicy;
import io.framerelay.spi.FailureListener;
import io.framerelay.spi.MetricsExporter;
import io.framerelay.util.CancellationToken;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Opens a {@link ChannelConnection}, retrying with backoff until it succeeds or the
 * caller's token is cancelled.
 *
 * <p>Each refused attempt is reported to the {@link FailureListener} once per outage
 * (the first refusal) and logged; later refusals of the same outage are logged at
 * {@code FINE}.
 */
public final class Reconnector {
  private static final Logger logger = Logger.getLogger(Reconnector.class.getName());

  private final ChannelClient client;
  private final RetryPolicy retryPolicy;
  private final MetricsExporter metrics;
  private final FailureListener failureListener;

  public Reconnector(ChannelClient client, RetryPolicy retryPolicy,
      MetricsExporter metrics, FailureListener failureListener) {
    this.client = Objects.requireNonNull(client, "client");
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
    this.failureListener = failureListener != null ? failureListener : FailureListener.NOOP;
  }

  /**
   * Connects, backing off between refused attempts.
   *
   * @param token cancels the wait between attempts
   * @param reconnect {@code true} when replacing a lost connection (counted as a reconnect)
   * @return an open connection, or {@code null} if the token was cancelled first
   */
  public ChannelConnection connect(CancellationToken token, boolean reconnect) {
    int failures = 0;
    while (!token.isCancelled()) {
      try {
        ChannelConnection connection = client.connect();
        if (failures > 0 || reconnect) {
          metrics.incrementReconnects();
          logger.info("Connected to " + client.describe() + " after " + failures + " refused attempt(s)");
        }
        return connection;
      } catch (ChannelConnectException e) {
        failures++;
        if (failures == 1) {
          logger.log(Level.WARNING, "Cannot connect to " + client.describe() + "; retrying with backoff", e);
          failureListener.onFailure(PipelineFailure.of(PipelineFailure.Type.CONNECT, e.getMessage(), e));
        } else {
          logger.log(Level.FINE, "Connect attempt " + failures + " to " + client.describe() + " refused", e);
        }
        if (!token.sleep(retryPolicy.computeDelayMs(failures))) {
          break;
        }
      }
    }
    return null;
  }
}
