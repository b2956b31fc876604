package dbcleaner.jdbc.dialect;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DialectSqlTest {

  @Test
  void mySqlUsesBackticksAndDeleteLimit() {
    MySqlDialect dialect = new MySqlDialect();

    assertEquals("`xcom`", dialect.quote("xcom"));
    assertEquals("DELETE FROM `log` WHERE `dttm` < ? LIMIT 1000",
        dialect.rangeDeleteSql("`log`", "`dttm`", 1000));
    assertEquals("LIMIT 5", dialect.limitClause(5));
    assertTrue(dialect.columnExistsSql().contains("table_schema = DATABASE()"));
  }

  @Test
  void postgresBoundsDeleteWithCtidSubquery() {
    PostgresDialect dialect = new PostgresDialect();

    assertEquals("\"xcom\"", dialect.quote("xcom"));
    assertEquals("DELETE FROM \"log\" WHERE ctid IN (SELECT ctid FROM \"log\" WHERE \"dttm\" < ? LIMIT 500)",
        dialect.rangeDeleteSql("\"log\"", "\"dttm\"", 500));
    assertTrue(dialect.columnExistsSql().contains("CURRENT_SCHEMA"));
  }

  @Test
  void h2UsesFetchFirst() {
    H2Dialect dialect = new H2Dialect();

    assertEquals("FETCH FIRST 5 ROWS ONLY", dialect.limitClause(5));
    assertEquals("DELETE FROM \"job\" WHERE \"end_date\" < ? FETCH FIRST 7 ROWS ONLY",
        dialect.rangeDeleteSql("\"job\"", "\"end_date\"", 7));
  }

  @Test
  void columnCheckBindsTableThenColumn() {
    for (var dialect : Dialects.all()) {
      String sql = dialect.columnExistsSql();
      assertTrue(sql.indexOf("table_name = ?") < sql.indexOf("column_name = ?"), dialect.name());
    }
  }
}
