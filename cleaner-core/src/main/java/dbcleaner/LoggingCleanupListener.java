package dbcleaner;

import dbcleaner.model.BatchProgress;
import dbcleaner.model.TableCleanupResult;
import dbcleaner.spi.CleanupListener;

import java.time.Duration;
import java.time.Instant;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link CleanupListener} writing to {@code java.util.logging}.
 *
 * <p>Per-batch progress is always logged at {@code INFO}. Pauses between batches are
 * logged at {@code INFO} when verbose and at {@code FINE} otherwise.
 */
public final class LoggingCleanupListener implements CleanupListener {
  private static final Logger logger = Logger.getLogger(LoggingCleanupListener.class.getName());

  private final Level sleepLevel;

  public LoggingCleanupListener(boolean verbose) {
    this.sleepLevel = verbose ? Level.INFO : Level.FINE;
  }

  @Override
  public void onDefaultRetention(String tableName, int defaultDays) {
    logger.log(Level.WARNING, "No retention configured for table {0}, using default of {1} days",
        new Object[]{tableName, defaultDays});
  }

  @Override
  public void onJobStart(TableJob job, Instant cutoff, String strategy) {
    logger.log(Level.INFO, "Cleaning table {0}, deleting records older than {1} ({2} days, {3})",
        new Object[]{job.tableName(), cutoff, job.retentionDays(), strategy});
  }

  @Override
  public void onColumnMissing(TableJob job) {
    logger.log(Level.WARNING, "Column {0} does not exist in table {1}, skipping",
        new Object[]{job.dateColumn(), job.tableName()});
  }

  @Override
  public void onExpiredCount(TableJob job, long expiredCount) {
    logger.log(Level.INFO, "Found {0} expired records in table {1}",
        new Object[]{expiredCount, job.tableName()});
  }

  @Override
  public void onDryRun(TableJob job, long expiredCount) {
    logger.log(Level.INFO, "[Dry Run] Would delete {0} records from table {1}",
        new Object[]{expiredCount, job.tableName()});
  }

  @Override
  public void onNothingToDelete(TableJob job) {
    logger.log(Level.INFO, "No expired records in table {0}", job.tableName());
  }

  @Override
  public void onBatch(TableJob job, BatchProgress progress) {
    if (!logger.isLoggable(Level.INFO)) {
      return;
    }
    long percent = progress.expiredCount() > 0
        ? progress.deleted() * 100 / progress.expiredCount()
        : 100;
    logger.log(Level.INFO, "Table {0} batch {1}: deleted {2} records, {3}/{4} ({5}%) in {6} ms",
        new Object[]{progress.tableName(), progress.batchNumber(), progress.batchDeleted(),
            progress.deleted(), progress.expiredCount(), percent, progress.elapsed().toMillis()});
  }

  @Override
  public void onSleep(TableJob job, Duration sleep) {
    logger.log(sleepLevel, "Sleeping {0} ms before next batch of table {1}",
        new Object[]{sleep.toMillis(), job.tableName()});
  }

  @Override
  public void onJobComplete(TableCleanupResult result) {
    logger.log(Level.INFO, "Table {0} finished: {1}, deleted {2} of {3} records in {4} batches",
        new Object[]{result.tableName(), result.status(), result.deleted(),
            result.expiredCount(), result.batches()});
  }

  @Override
  public void onJobFailed(TableJob job, CleanupException error) {
    logger.log(Level.SEVERE, error.getMessage(), error);
  }
}
