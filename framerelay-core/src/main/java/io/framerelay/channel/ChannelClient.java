package io.framerelay.channel;

/**
 * Entry point to a durable publish/subscribe broker.
 *
 * <p>A client holds the broker address and credentials and opens sessions on demand.
 * Each pipeline gets its client injected and owns the connections it opens.
 *
 * @see io.framerelay.channel.memory.InMemoryChannelClient
 */
public interface ChannelClient {

  /**
   * Opens a session with the broker.
   *
   * @return an open connection
   * @throws ChannelConnectException if the broker is unreachable; fails fast, no retry
   */
  ChannelConnection connect() throws ChannelConnectException;

  /**
   * Returns a short description of the broker endpoint for log messages.
   *
   * @return endpoint description
   */
  default String describe() {
    return getClass().getSimpleName();
  }
}
