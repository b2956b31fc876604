package dbcleaner.sql;

import dbcleaner.TableJob;
import dbcleaner.spi.Dialect;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds the statements of a table job.
 *
 * <p>Identifiers come from a {@link TableJob}, whose constructor has already
 * validated them, and are quoted by the {@link Dialect}. Values are always bound
 * as parameters.
 */
public final class CleanupSql {
  private final Dialect dialect;

  public CleanupSql(Dialect dialect) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  /** Parameters: table name, column name. */
  public String columnExists() {
    return dialect.columnExistsSql();
  }

  /** Parameters: cutoff. */
  public String countExpired(TableJob job) {
    return "SELECT COUNT(*) FROM " + table(job) + " WHERE " + dateColumn(job) + " < ?";
  }

  /** Parameters: cutoff. */
  public String rangeDelete(TableJob job, int limit) {
    return dialect.rangeDeleteSql(table(job), dateColumn(job), limit);
  }

  /**
   * Selects the key columns of up to {@code limit} expired rows, ordered by the first
   * key column. Parameters: cutoff.
   */
  public String selectKeys(TableJob job, int limit) {
    List<String> key = job.primaryKey();
    String columns = key.stream().map(dialect::quote).collect(Collectors.joining(", "));
    return "SELECT " + columns + " FROM " + table(job) +
        " WHERE " + dateColumn(job) + " < ?" +
        " ORDER BY " + dialect.quote(key.get(0)) +
        " " + dialect.limitClause(limit);
  }

  /** Parameters: {@code keyCount} values of the single key column. */
  public String deleteByKeys(TableJob job, int keyCount) {
    String placeholders = String.join(",", Collections.nCopies(keyCount, "?"));
    return "DELETE FROM " + table(job) +
        " WHERE " + dialect.quote(job.primaryKey().get(0)) + " IN (" + placeholders + ")";
  }

  /**
   * {@code (k1 = ? AND k2 = ?) OR (k1 = ? AND k2 = ?) ...} for {@code rowCount} rows.
   * Parameters: the key values row by row, in key-column order.
   */
  public String deleteByCompositeKeys(TableJob job, int rowCount) {
    String conjunction = job.primaryKey().stream()
        .map(column -> dialect.quote(column) + " = ?")
        .collect(Collectors.joining(" AND ", "(", ")"));
    String where = String.join(" OR ", Collections.nCopies(rowCount, conjunction));
    return "DELETE FROM " + table(job) + " WHERE " + where;
  }

  private String table(TableJob job) {
    return dialect.quote(job.tableName());
  }

  private String dateColumn(TableJob job) {
    return dialect.quote(job.dateColumn());
  }
}
