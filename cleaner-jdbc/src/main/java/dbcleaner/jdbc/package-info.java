/**
 * JDBC implementation of the {@link dbcleaner.spi.MetadataDatabase} SPI.
 *
 * @see dbcleaner.jdbc.JdbcMetadataDatabase
 * @see dbcleaner.jdbc.dialect.Dialects
 */
package dbcleaner.jdbc;
