package io.framerelay.channel.memory;

import io.framerelay.channel.ChannelClient;
import io.framerelay.channel.ChannelConnectException;
import io.framerelay.channel.ChannelConnection;

import java.util.Objects;

/**
 * {@link ChannelClient} that connects to an {@link InMemoryBroker} in the same JVM.
 *
 * <p>Used for tests, the demo and single-process deployments where streamer and detector
 * are colocated. Durability lasts as long as the broker object.
 */
public final class InMemoryChannelClient implements ChannelClient {
  private final InMemoryBroker broker;

  public InMemoryChannelClient(InMemoryBroker broker) {
    this.broker = Objects.requireNonNull(broker, "broker");
  }

  public InMemoryBroker broker() {
    return broker;
  }

  @Override
  public ChannelConnection connect() throws ChannelConnectException {
    return broker.connect();
  }

  @Override
  public String describe() {
    return "in-memory broker";
  }
}
