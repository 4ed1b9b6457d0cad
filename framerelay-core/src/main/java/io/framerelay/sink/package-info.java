/**
 * Destinations for detections produced by the consumer pipeline.
 */
package io.framerelay.sink;
