package dbcleaner.spi;

import dbcleaner.CleanupException;
import dbcleaner.TableJob;
import dbcleaner.model.BatchProgress;
import dbcleaner.model.TableCleanupResult;

import java.time.Duration;
import java.time.Instant;

/**
 * Receives progress notifications from the planner and the cleanup engine.
 *
 * <p>The engine does not log on its own; everything an operator sees comes through
 * this interface. All callbacks run on the cleaning thread and default to no-ops.
 *
 * @see dbcleaner.LoggingCleanupListener
 */
public interface CleanupListener {

  /**
   * No-op instance.
   */
  CleanupListener NOOP = new CleanupListener() {};

  /**
   * A managed table had no retention entry and fell back to the default.
   */
  default void onDefaultRetention(String tableName, int defaultDays) {
  }

  /**
   * A job started; {@code cutoff} stays fixed until the job ends.
   */
  default void onJobStart(TableJob job, Instant cutoff, String strategy) {
  }

  /**
   * The date column does not exist; the table is skipped.
   */
  default void onColumnMissing(TableJob job) {
  }

  default void onExpiredCount(TableJob job, long expiredCount) {
  }

  default void onDryRun(TableJob job, long expiredCount) {
  }

  default void onNothingToDelete(TableJob job) {
  }

  /**
   * Called after every delete batch.
   */
  default void onBatch(TableJob job, BatchProgress progress) {
  }

  /**
   * Called before pausing between two batches.
   */
  default void onSleep(TableJob job, Duration sleep) {
  }

  default void onJobComplete(TableCleanupResult result) {
  }

  default void onJobFailed(TableJob job, CleanupException error) {
  }
}
