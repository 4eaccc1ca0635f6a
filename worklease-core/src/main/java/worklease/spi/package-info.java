/**
 * Service Provider Interfaces (SPI) for plugging worklease into a database and a
 * metrics backend.
 *
 * @see worklease.spi.ConnectionProvider
 * @see worklease.spi.WorkStore
 * @see worklease.spi.MetricsExporter
 */
package worklease.spi;
