package io.framerelay.kafka;

import io.framerelay.channel.AbstractDelivery;
import io.framerelay.channel.ChannelClosedException;
import org.apache.kafka.common.TopicPartition;

/** One consumed record; settling goes through its {@link KafkaSubscription}. */
final class KafkaDelivery extends AbstractDelivery {
  private final KafkaSubscription subscription;
  private final TopicPartition partition;
  private final long offset;

  KafkaDelivery(KafkaSubscription subscription, TopicPartition partition, long offset, int attemptCount,
      String key, byte[] body) {
    super(partition + "@" + offset, attemptCount, key, body);
    this.subscription = subscription;
    this.partition = partition;
    this.offset = offset;
  }

  TopicPartition partition() {
    return partition;
  }

  long offset() {
    return offset;
  }

  @Override
  protected void doAck() throws ChannelClosedException {
    subscription.settle(this, KafkaSubscription.Settlement.ACK);
  }

  @Override
  protected void doNack(boolean requeue) throws ChannelClosedException {
    subscription.settle(this, requeue
        ? KafkaSubscription.Settlement.REQUEUE : KafkaSubscription.Settlement.DEAD_LETTER);
  }
}
