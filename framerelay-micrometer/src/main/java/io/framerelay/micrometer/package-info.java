/**
 * Micrometer bridge for exporting frame relay metrics to Prometheus, Grafana, and other
 * backends.
 *
 * <p>{@link io.framerelay.micrometer.MicrometerMetricsExporter} implements the
 * {@link io.framerelay.spi.MetricsExporter} SPI using Micrometer counters, gauges and a
 * distribution summary.
 *
 * @see io.framerelay.micrometer.MicrometerMetricsExporter
 */
package io.framerelay.micrometer;
