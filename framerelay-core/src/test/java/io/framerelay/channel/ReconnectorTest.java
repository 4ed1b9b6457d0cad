package io.framerelay.channel;

import io.framerelay.PipelineFailure;
import io.framerelay.retry.RetryPolicy;
import io.framerelay.spi.MetricsExporter;
import io.framerelay.util.CancellationToken;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ReconnectorTest {

  private final List<PipelineFailure> failures = new CopyOnWriteArrayList<>();

  @Test
  void retriesUntilConnectSucceedsAndReportsOnce() {
    AtomicInteger attempts = new AtomicInteger();
    ChannelConnection connection = new StubConnection();
    ChannelClient client = () -> {
      if (attempts.incrementAndGet() < 4) {
        throw new ChannelConnectException("refused");
      }
      return connection;
    };
    CountingMetrics metrics = new CountingMetrics();
    Reconnector reconnector = new Reconnector(client, RetryPolicy.immediate(), metrics, failures::add);

    assertSame(connection, reconnector.connect(new CancellationToken(), false));
    assertEquals(4, attempts.get());
    assertEquals(1, failures.size());
    assertEquals(PipelineFailure.Type.CONNECT, failures.get(0).type());
    assertEquals(1, metrics.reconnects.get());
  }

  @Test
  void firstConnectIsNotAReconnect() {
    CountingMetrics metrics = new CountingMetrics();
    Reconnector reconnector = new Reconnector(StubConnection::new, RetryPolicy.immediate(), metrics, null);

    assertNotNull(reconnector.connect(new CancellationToken(), false));
    assertEquals(0, metrics.reconnects.get());
    assertNotNull(reconnector.connect(new CancellationToken(), true));
    assertEquals(1, metrics.reconnects.get());
  }

  @Test
  void cancellationStopsRetrying() {
    CancellationToken token = new CancellationToken();
    ChannelClient client = () -> {
      token.cancel();
      throw new ChannelConnectException("refused");
    };
    Reconnector reconnector = new Reconnector(client, attempts -> 60_000L, null, failures::add);

    assertNull(reconnector.connect(token, false));
    assertEquals(1, failures.size());
  }

  private static final class CountingMetrics implements MetricsExporter {
    private final AtomicInteger reconnects = new AtomicInteger();

    @Override
    public void incrementReconnects() {
      reconnects.incrementAndGet();
    }

    @Override
    public void incrementFramesCaptured() {
    }

    @Override
    public void incrementFramesDropped() {
    }

    @Override
    public void incrementCaptureErrors() {
    }

    @Override
    public void incrementPublishSuccess() {
    }

    @Override
    public void incrementPublishRetries() {
    }

    @Override
    public void incrementPublishFailed() {
    }

    @Override
    public void incrementDeliveriesAcked() {
    }

    @Override
    public void incrementDeliveriesRequeued() {
    }

    @Override
    public void incrementDeliveriesDead() {
    }

    @Override
    public void incrementDetectionsEmitted() {
    }

    @Override
    public void recordBufferDepth(int depth) {
    }

    @Override
    public void recordConsumerInFlight(int inFlight) {
    }
  }

  private static final class StubConnection implements ChannelConnection {
    @Override
    public PublishAck publish(String channel, String key, byte[] body) {
      return new PublishAck(channel, "m-1");
    }

    @Override
    public Subscription subscribe(String channel, int prefetchLimit) {
      throw new UnsupportedOperationException();
    }

    @Override
    public boolean isOpen() {
      return true;
    }

    @Override
    public void close() {
    }
  }
}
