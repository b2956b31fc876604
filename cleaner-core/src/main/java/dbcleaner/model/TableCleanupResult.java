package dbcleaner.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of one table job.
 *
 * @param tableName    the table
 * @param status       how the job ended
 * @param cutoff       the cutoff the job counted and deleted against
 * @param expiredCount rows counted as expired at job start (0 when skipped)
 * @param deleted      rows actually deleted
 * @param batches      delete batches executed
 */
public record TableCleanupResult(
    String tableName,
    CleanupStatus status,
    Instant cutoff,
    long expiredCount,
    long deleted,
    int batches
) {
  public TableCleanupResult {
    Objects.requireNonNull(tableName, "tableName");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(cutoff, "cutoff");
  }

  public static TableCleanupResult skipped(String tableName, Instant cutoff) {
    return new TableCleanupResult(tableName, CleanupStatus.SKIPPED_MISSING_COLUMN, cutoff, 0, 0, 0);
  }

  public static TableCleanupResult dryRun(String tableName, Instant cutoff, long expiredCount) {
    return new TableCleanupResult(tableName, CleanupStatus.DRY_RUN, cutoff, expiredCount, 0, 0);
  }

  public static TableCleanupResult nothingToDelete(String tableName, Instant cutoff) {
    return new TableCleanupResult(tableName, CleanupStatus.NOTHING_TO_DELETE, cutoff, 0, 0, 0);
  }

  public static TableCleanupResult cleaned(String tableName, Instant cutoff, long expiredCount,
      long deleted, int batches) {
    return new TableCleanupResult(tableName, CleanupStatus.CLEANED, cutoff, expiredCount, deleted, batches);
  }
}
