/**
 * Service Provider Interfaces (SPI) for plugging the cleanup engine into a database
 * and an operational environment.
 *
 * @see dbcleaner.spi.MetadataDatabase
 * @see dbcleaner.spi.Dialect
 * @see dbcleaner.spi.CleanupListener
 * @see dbcleaner.spi.MetricsExporter
 * @see dbcleaner.spi.Sleeper
 */
package dbcleaner.spi;
