package dbcleaner.jdbc.dialect;

import java.util.List;

/**
 * PostgreSQL dialect.
 *
 * <p>PostgreSQL has no row limit on {@code DELETE}; the batch is bounded by a
 * {@code ctid} subquery instead.
 */
public final class PostgresDialect extends AbstractDialect {

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public String rangeDeleteSql(String quotedTable, String quotedDateColumn, int limit) {
    return "DELETE FROM " + quotedTable + " WHERE ctid IN (" +
        "SELECT ctid FROM " + quotedTable +
        " WHERE " + quotedDateColumn + " < ?" +
        " LIMIT " + limit + ")";
  }
}
