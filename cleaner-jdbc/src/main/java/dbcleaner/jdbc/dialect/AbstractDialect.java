package dbcleaner.jdbc.dialect;

import dbcleaner.spi.Dialect;

/**
 * Base dialect with standard SQL implementations.
 *
 * <p>Subclasses can override methods to provide database-specific SQL.
 */
public abstract class AbstractDialect implements Dialect {

  @Override
  public String quote(String identifier) {
    return "\"" + identifier + "\"";
  }

  @Override
  public String columnExistsSql() {
    return "SELECT COUNT(*) FROM information_schema.columns" +
        " WHERE table_schema = CURRENT_SCHEMA AND table_name = ? AND column_name = ?";
  }

  @Override
  public String limitClause(int limit) {
    return "LIMIT " + limit;
  }

  /**
   * Default uses the standard {@code FETCH FIRST} clause on the {@code DELETE}.
   */
  @Override
  public String rangeDeleteSql(String quotedTable, String quotedDateColumn, int limit) {
    return "DELETE FROM " + quotedTable +
        " WHERE " + quotedDateColumn + " < ?" +
        " FETCH FIRST " + limit + " ROWS ONLY";
  }
}
