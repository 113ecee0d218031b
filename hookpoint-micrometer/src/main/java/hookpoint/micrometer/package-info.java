/**
 * Micrometer bridge for exporting hook dispatch metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link hookpoint.micrometer.MicrometerMetricsExporter} implements the
 * {@link hookpoint.spi.MetricsExporter} SPI using Micrometer counters and a timer.
 *
 * @see hookpoint.micrometer.MicrometerMetricsExporter
 */
package hookpoint.micrometer;
