package dbcleaner.spi;

import dbcleaner.DatabaseAccessException;
import dbcleaner.model.Row;

import java.util.List;

/**
 * Query/execute handle the cleanup engine issues its statements through.
 *
 * <p>Parameters are bound positionally. {@link java.time.Instant} parameters are
 * bound as SQL timestamps. Every statement is independently committed; no
 * transaction spans a batch or a table.
 *
 * <p>All methods report failures as {@link DatabaseAccessException}.
 *
 * @see dbcleaner.jdbc.JdbcMetadataDatabase
 * @see dbcleaner.mock.CannedMetadataDatabase
 */
public interface MetadataDatabase {

  /**
   * Executes a query returning a single numeric value (e.g. {@code COUNT(*)}).
   *
   * @param sql    the query
   * @param params positional parameters
   * @return the value of the first column of the first row, or 0 if no row
   */
  long queryForLong(String sql, Object... params);

  /**
   * Executes a mutating statement.
   *
   * @param sql    the statement
   * @param params positional parameters
   * @return the number of rows the database reports as affected
   */
  int update(String sql, Object... params);

  /**
   * Executes a query and returns every row, readable by position or by column name.
   *
   * @param sql    the query
   * @param params positional parameters
   * @return the rows in result-set order; never null
   */
  List<Row> queryRows(String sql, Object... params);
}
