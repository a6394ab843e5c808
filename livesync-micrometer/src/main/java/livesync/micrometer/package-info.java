/**
 * Micrometer bridge for exporting engine metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link livesync.micrometer.MicrometerMetricsExporter} implements the
 * {@link livesync.spi.MetricsExporter} SPI using Micrometer counters and gauges.
 *
 * @see livesync.micrometer.MicrometerMetricsExporter
 */
package livesync.micrometer;
