/**
 * Core model of the frame relay: {@link io.framerelay.Frame} and
 * {@link io.framerelay.Detection} records and the capture and detection collaborators.
 *
 * <p>Frames flow from a {@link io.framerelay.FrameSource} through
 * {@link io.framerelay.producer.ProducerPipeline} onto a durable channel, and from there
 * through {@link io.framerelay.consumer.ConsumerPipeline} into a
 * {@link io.framerelay.sink.ResultSink}. {@link io.framerelay.supervisor.Supervisor} owns
 * both lifecycles.
 *
 * @see io.framerelay.channel.ChannelClient
 * @see io.framerelay.codec.FrameCodec
 */
package io.framerelay;
