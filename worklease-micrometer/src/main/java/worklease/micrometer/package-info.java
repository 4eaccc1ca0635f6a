/**
 * Micrometer bridge for {@link worklease.spi.MetricsExporter}.
 */
package worklease.micrometer;
