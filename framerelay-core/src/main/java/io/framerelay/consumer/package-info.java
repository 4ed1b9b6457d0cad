/**
 * Frame consumption: {@link io.framerelay.consumer.ConsumerPipeline} decodes, detects and
 * settles deliveries under a bounded prefetch window.
 */
package io.framerelay.consumer;
