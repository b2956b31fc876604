package dbcleaner.jdbc.dialect;

import java.util.List;

/**
 * H2 dialect, used for tests and local runs. Uses the standard
 * {@code FETCH FIRST} row limit on both {@code SELECT} and {@code DELETE}.
 */
public final class H2Dialect extends AbstractDialect {

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public String limitClause(int limit) {
    return "FETCH FIRST " + limit + " ROWS ONLY";
  }
}
