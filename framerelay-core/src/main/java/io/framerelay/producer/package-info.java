/**
 * Frame capture and publishing: {@link io.framerelay.producer.ProducerPipeline} and the
 * drop-oldest buffer between its capture and publish threads.
 */
package io.framerelay.producer;
