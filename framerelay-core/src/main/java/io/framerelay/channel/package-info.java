/**
 * Channel Client: a thin abstraction over a durable publish/subscribe broker with
 * confirmed publishes, per-delivery acknowledgment and prefetch-bounded subscriptions.
 *
 * <p>Delivery is at-least-once. A connection drop returns every unsettled delivery to the
 * broker, which redelivers it after reconnection, so consumers must tolerate duplicates
 * and out-of-order arrival.
 *
 * @see io.framerelay.channel.ChannelClient
 * @see io.framerelay.channel.ChannelConnection
 * @see io.framerelay.channel.Subscription
 * @see io.framerelay.channel.Delivery
 * @see io.framerelay.channel.Reconnector
 */
package io.framerelay.channel;
