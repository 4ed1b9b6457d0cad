package io.framerelay.sink;

import io.framerelay.Detection;
import io.framerelay.channel.ChannelClient;
import io.framerelay.channel.ChannelConnectException;
import io.framerelay.channel.ChannelConnection;
import io.framerelay.channel.PublishException;
import io.framerelay.codec.DetectionCodec;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Publishes detections as JSON to a results channel, keyed by source id.
 *
 * <p>A publish is confirmed before {@link #emit(Detection)} returns. The connection is
 * opened lazily and replaced on the next emit after it is lost; a refused connect or a
 * failed publish surfaces as a {@link SinkException}, which makes the consumer requeue
 * the originating delivery.
 */
public final class ChannelResultSink implements ResultSink {
  private static final Logger logger = Logger.getLogger(ChannelResultSink.class.getName());

  private final ChannelClient client;
  private final String channel;
  private final DetectionCodec codec;
  private final Object connectionLock = new Object();
  private ChannelConnection connection;
  private boolean closed;

  public ChannelResultSink(ChannelClient client, String channel) {
    this(client, channel, DetectionCodec.getDefault());
  }

  public ChannelResultSink(ChannelClient client, String channel, DetectionCodec codec) {
    this.client = Objects.requireNonNull(client, "client");
    this.channel = Objects.requireNonNull(channel, "channel");
    this.codec = Objects.requireNonNull(codec, "codec");
    if (channel.isEmpty()) {
      throw new IllegalArgumentException("channel must not be empty");
    }
  }

  @Override
  public void emit(Detection detection) throws SinkException {
    ChannelConnection conn = connection();
    try {
      conn.publish(channel, detection.sourceId(), codec.encode(detection));
    } catch (PublishException e) {
      if (!conn.isOpen()) {
        discard(conn);
      }
      throw new SinkException("Failed to publish detection " + detection.dedupeKey() + " to " + channel, e);
    }
  }

  private ChannelConnection connection() throws SinkException {
    synchronized (connectionLock) {
      if (closed) {
        throw new SinkException("Result sink for " + channel + " is closed");
      }
      if (connection != null && connection.isOpen()) {
        return connection;
      }
      try {
        connection = client.connect();
        logger.fine("Opened result connection to " + client.describe() + " for " + channel);
        return connection;
      } catch (ChannelConnectException e) {
        connection = null;
        throw new SinkException("Cannot connect result sink to " + client.describe(), e);
      }
    }
  }

  private void discard(ChannelConnection conn) {
    synchronized (connectionLock) {
      if (connection == conn) {
        connection = null;
      }
    }
    closeQuietly(conn);
  }

  public String channel() {
    return channel;
  }

  @Override
  public void close() {
    ChannelConnection conn;
    synchronized (connectionLock) {
      closed = true;
      conn = connection;
      connection = null;
    }
    if (conn != null) {
      closeQuietly(conn);
    }
  }

  private static void closeQuietly(ChannelConnection conn) {
    try {
      conn.close();
    } catch (RuntimeException e) {
      logger.log(Level.FINE, "Error closing result connection", e);
    }
  }
}
