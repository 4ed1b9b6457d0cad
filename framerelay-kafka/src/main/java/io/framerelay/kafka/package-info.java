/**
 * Apache Kafka implementation of the channel client.
 *
 * @see io.framerelay.kafka.KafkaChannelClient
 */
package io.framerelay.kafka;
