package dbcleaner;

import java.util.Objects;

/**
 * Fatal error of a table job. A run stops at the first one; batches already
 * deleted stay deleted.
 */
public final class CleanupException extends RuntimeException {

  /**
   * What went wrong.
   */
  public enum Kind {
    /** The schema catalog query failed. */
    SCHEMA_CHECK_FAILED,
    /** The expired-row count query failed. */
    COUNT_QUERY_FAILED,
    /** A key select or delete statement failed; the table may be partially cleaned. */
    DELETE_FAILED,
    /** Key enumeration was requested for a job without key columns. */
    MISSING_PRIMARY_KEY,
    /** A table or column is not on the allow-list. */
    INVALID_IDENTIFIER,
    /** The thread was interrupted while pausing between batches. */
    INTERRUPTED
  }

  private final Kind kind;
  private final String tableName;

  public CleanupException(Kind kind, String tableName, String detail, Throwable cause) {
    super("Failed to clean table " + tableName + ": " + detail, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.tableName = Objects.requireNonNull(tableName, "tableName");
  }

  public CleanupException(Kind kind, String tableName, String detail) {
    this(kind, tableName, detail, null);
  }

  public Kind kind() {
    return kind;
  }

  public String tableName() {
    return tableName;
  }
}
