package dbcleaner.mock;

import dbcleaner.model.Row;
import dbcleaner.spi.MetadataDatabase;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link MetadataDatabase} returning fixed values without touching a database.
 *
 * <p>Every scalar query answers {@link Builder#scalarResult(long)} (so the column
 * check passes and the count is that value), every update reports
 * {@link Builder#affectedRows(int)}, and every row query returns the configured key
 * rows. All statements are recorded in order. Used for mock runs and tests.
 *
 * <p>Thread-safe for recording; the engine itself is single-threaded.
 */
public final class CannedMetadataDatabase implements MetadataDatabase {
  private static final Logger logger = Logger.getLogger(CannedMetadataDatabase.class.getName());

  public static final long DEFAULT_SCALAR_RESULT = 1000;
  public static final int DEFAULT_AFFECTED_ROWS = 1000;

  private final long scalarResult;
  private final int affectedRows;
  private final List<Row> keyRows;
  private final List<Statement> statements = Collections.synchronizedList(new ArrayList<>());

  private CannedMetadataDatabase(Builder builder) {
    if (builder.scalarResult < 0) {
      throw new IllegalArgumentException("scalarResult must be >= 0");
    }
    if (builder.affectedRows < 0) {
      throw new IllegalArgumentException("affectedRows must be >= 0");
    }
    this.scalarResult = builder.scalarResult;
    this.affectedRows = builder.affectedRows;
    this.keyRows = List.copyOf(builder.keyRows);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Instance with the default canned values and no key rows. */
  public static CannedMetadataDatabase withDefaults() {
    return builder().build();
  }

  @Override
  public long queryForLong(String sql, Object... params) {
    capture(Statement.Kind.QUERY_FOR_LONG, sql, params);
    return scalarResult;
  }

  @Override
  public int update(String sql, Object... params) {
    capture(Statement.Kind.UPDATE, sql, params);
    return affectedRows;
  }

  @Override
  public List<Row> queryRows(String sql, Object... params) {
    capture(Statement.Kind.QUERY_ROWS, sql, params);
    return keyRows;
  }

  /** Statements received so far, oldest first. */
  public List<Statement> statements() {
    synchronized (statements) {
      return List.copyOf(statements);
    }
  }

  public List<Statement> statements(Statement.Kind kind) {
    return statements().stream().filter(s -> s.kind() == kind).toList();
  }

  public void reset() {
    statements.clear();
  }

  private void capture(Statement.Kind kind, String sql, Object[] params) {
    logger.log(Level.FINE, "[Mock] {0}: {1} {2}", new Object[]{kind, sql, Arrays.toString(params)});
    statements.add(new Statement(kind, sql, params == null ? List.of() : Arrays.asList(params.clone())));
  }

  /**
   * A recorded call.
   *
   * @param kind   which method received it
   * @param sql    the statement text
   * @param params bound parameters in order
   */
  public record Statement(Kind kind, String sql, List<Object> params) {

    public enum Kind { QUERY_FOR_LONG, UPDATE, QUERY_ROWS }
  }

  /** Builder for {@link CannedMetadataDatabase}. */
  public static final class Builder {
    private long scalarResult = DEFAULT_SCALAR_RESULT;
    private int affectedRows = DEFAULT_AFFECTED_ROWS;
    private List<Row> keyRows = List.of();

    private Builder() {}

    /**
     * Value returned by every scalar query, including the column check.
     *
     * <p>Optional. Defaults to {@code 1000}. Must be &ge; 0.
     */
    public Builder scalarResult(long scalarResult) {
      this.scalarResult = scalarResult;
      return this;
    }

    /**
     * Affected-row count reported by every update.
     *
     * <p>Optional. Defaults to {@code 1000}. Must be &ge; 0.
     */
    public Builder affectedRows(int affectedRows) {
      this.affectedRows = affectedRows;
      return this;
    }

    /**
     * Rows returned by every row query.
     *
     * <p>Optional. Defaults to none.
     */
    public Builder keyRows(List<Row> keyRows) {
      this.keyRows = keyRows;
      return this;
    }

    public CannedMetadataDatabase build() {
      return new CannedMetadataDatabase(this);
    }
  }
}
