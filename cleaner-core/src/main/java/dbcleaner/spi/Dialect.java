package dbcleaner.spi;

import java.util.List;

/**
 * SPI for database-specific SQL fragments used by the cleanup engine.
 *
 * <p>Identifiers handed to a dialect have already passed the allow-list check, so
 * implementations only quote them. Register custom dialects via
 * {@code META-INF/services/dbcleaner.spi.Dialect}.
 *
 * <p>Built-in dialects: MySQL (+ TiDB), PostgreSQL, H2.
 *
 * @see dbcleaner.jdbc.dialect.Dialects
 */
public interface Dialect {

  /**
   * Unique identifier for this dialect (e.g., "mysql", "postgresql", "h2").
   */
  String name();

  /**
   * JDBC URL prefixes this dialect handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  List<String> jdbcUrlPrefixes();

  /**
   * Quotes a validated identifier.
   */
  String quote(String identifier);

  /**
   * Query counting the catalog entries for a column of a table in the current
   * database/schema.
   *
   * <p>Parameters: table name (String), column name (String)
   */
  String columnExistsSql();

  /**
   * Clause appended to a {@code SELECT} to return at most {@code limit} rows.
   */
  String limitClause(int limit);

  /**
   * Statement deleting at most {@code limit} rows whose date column is before the cutoff.
   *
   * <p>Parameters: cutoff (Instant)
   *
   * @param quotedTable      quoted table name
   * @param quotedDateColumn quoted date column
   * @param limit            maximum number of rows to delete
   */
  String rangeDeleteSql(String quotedTable, String quotedDateColumn, int limit);
}
