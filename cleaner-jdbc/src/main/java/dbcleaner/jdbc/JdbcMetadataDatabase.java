package dbcleaner.jdbc;

import dbcleaner.DatabaseAccessException;
import dbcleaner.model.Row;
import dbcleaner.spi.MetadataDatabase;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;

/**
 * {@link MetadataDatabase} over JDBC.
 *
 * <p>Every statement borrows its own connection, runs in auto-commit mode and
 * returns the connection immediately, so locks are held for a single batch at most.
 */
public final class JdbcMetadataDatabase implements MetadataDatabase {
  private final ConnectionProvider connectionProvider;

  /**
   * Borrows connections from {@code dataSource}, typically a pool.
   */
  public JdbcMetadataDatabase(DataSource dataSource) {
    this(Objects.requireNonNull(dataSource, "dataSource")::getConnection);
  }

  public JdbcMetadataDatabase(ConnectionProvider connectionProvider) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
  }

  @Override
  public long queryForLong(String sql, Object... params) {
    try (Connection conn = open()) {
      return JdbcTemplate.queryForLong(conn, sql, params);
    } catch (SQLException e) {
      throw new DatabaseAccessException("Failed to close connection", e);
    }
  }

  @Override
  public int update(String sql, Object... params) {
    try (Connection conn = open()) {
      return JdbcTemplate.update(conn, sql, params);
    } catch (SQLException e) {
      throw new DatabaseAccessException("Failed to close connection", e);
    }
  }

  @Override
  public List<Row> queryRows(String sql, Object... params) {
    try (Connection conn = open()) {
      return JdbcTemplate.query(conn, sql, JdbcTemplate.ROW_MAPPER, params);
    } catch (SQLException e) {
      throw new DatabaseAccessException("Failed to close connection", e);
    }
  }

  private Connection open() {
    Connection conn = null;
    try {
      conn = connectionProvider.getConnection();
      conn.setAutoCommit(true);
      return conn;
    } catch (SQLException e) {
      if (conn != null) {
        try {
          conn.close();
        } catch (SQLException suppressed) {
          e.addSuppressed(suppressed);
        }
      }
      throw new DatabaseAccessException("Failed to obtain connection", e);
    }
  }
}
