/**
 * In-memory {@link dbcleaner.spi.MetadataDatabase} for mock runs.
 */
package dbcleaner.mock;
