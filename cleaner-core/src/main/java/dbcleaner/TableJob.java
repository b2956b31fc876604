package dbcleaner;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Cleanup unit for one table.
 *
 * <p>A job is planned fresh for every run and holds no state; the engine derives the
 * cutoff once when the job starts.
 *
 * @param tableName     the table to clean
 * @param retentionDays rows older than this many days are expired; 0 means older than now
 * @param dateColumn    column compared against the cutoff
 * @param primaryKey    key columns in order; may be empty only for range deletion
 */
public record TableJob(
    String tableName,
    int retentionDays,
    String dateColumn,
    List<String> primaryKey
) {
  public TableJob {
    Identifiers.validate(tableName);
    Identifiers.validate(dateColumn);
    if (retentionDays < 0) {
      throw new IllegalArgumentException("retentionDays must be >= 0");
    }
    primaryKey = List.copyOf(Objects.requireNonNull(primaryKey, "primaryKey"));
    primaryKey.forEach(Identifiers::validate);
  }

  public boolean hasPrimaryKey() {
    return !primaryKey.isEmpty();
  }

  public boolean hasCompositeKey() {
    return primaryKey.size() > 1;
  }

  /** {@code now} minus the retention window. */
  public Instant cutoff(Instant now) {
    return now.minus(Duration.ofDays(retentionDays));
  }
}
