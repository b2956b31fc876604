package dbcleaner.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Supplies JDBC connections to {@link JdbcMetadataDatabase}.
 *
 * <p>Each call must return a connection the caller owns and closes.
 */
@FunctionalInterface
public interface ConnectionProvider {

  Connection getConnection() throws SQLException;
}
