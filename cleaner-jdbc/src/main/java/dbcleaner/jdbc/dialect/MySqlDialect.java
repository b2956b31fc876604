package dbcleaner.jdbc.dialect;

import java.util.List;

/**
 * MySQL dialect. Also compatible with TiDB.
 *
 * <p>Uses {@code DELETE ... LIMIT}, which MySQL supports natively, and looks up
 * columns in the schema of the connection's current database.
 */
public final class MySqlDialect extends AbstractDialect {

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:", "jdbc:mariadb:");
  }

  @Override
  public String quote(String identifier) {
    return "`" + identifier + "`";
  }

  @Override
  public String columnExistsSql() {
    return "SELECT COUNT(*) FROM information_schema.columns" +
        " WHERE table_schema = DATABASE() AND table_name = ? AND column_name = ?";
  }

  @Override
  public String rangeDeleteSql(String quotedTable, String quotedDateColumn, int limit) {
    return "DELETE FROM " + quotedTable +
        " WHERE " + quotedDateColumn + " < ?" +
        " LIMIT " + limit;
  }
}
