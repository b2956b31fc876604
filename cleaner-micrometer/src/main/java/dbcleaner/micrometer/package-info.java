/**
 * Micrometer bridge for the cleanup metrics SPI.
 *
 * @see dbcleaner.micrometer.MicrometerMetricsExporter
 */
package dbcleaner.micrometer;
