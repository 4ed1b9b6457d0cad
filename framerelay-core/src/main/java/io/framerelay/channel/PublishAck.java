package io.framerelay.channel;

import java.util.Objects;

/**
 * Broker confirmation that a message reached its durable store.
 *
 * @param channel   channel the message was stored in
 * @param messageId broker-side identifier of the stored message
 */
public record PublishAck(String channel, String messageId) {

  public PublishAck {
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(messageId, "messageId");
  }
}
