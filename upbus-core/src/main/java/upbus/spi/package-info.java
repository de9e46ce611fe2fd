/**
 * Service provider interfaces implemented by optional modules.
 *
 * @see upbus.spi.MetricsExporter
 */
package upbus.spi;
