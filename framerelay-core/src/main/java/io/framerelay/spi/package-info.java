/**
 * Extension points that integrators implement to observe the pipelines.
 *
 * @see io.framerelay.spi.MetricsExporter
 * @see io.framerelay.spi.FailureListener
 */
package io.framerelay.spi;
