/**
 * Micrometer bridge for exporting job queue metrics to Prometheus, Grafana and other backends.
 *
 * <p>{@link io.jobqueue.micrometer.MicrometerMetricsExporter} implements the
 * {@link io.jobqueue.spi.MetricsExporter} SPI using Micrometer counters and gauges.
 */
package io.jobqueue.micrometer;
