/**
 * Micrometer binding for {@link upbus.spi.MetricsExporter}.
 */
package upbus.micrometer;
