/**
 * Service-provider interfaces for plugging backends into the dispatcher.
 *
 * @see hookpoint.spi.MetricsExporter
 */
package hookpoint.spi;
