package dbcleaner.delete;

import dbcleaner.CleanupException;
import dbcleaner.DatabaseAccessException;
import dbcleaner.TableJob;
import dbcleaner.model.BatchProgress;
import dbcleaner.model.Row;
import dbcleaner.spi.CleanupListener;
import dbcleaner.spi.MetadataDatabase;
import dbcleaner.spi.MetricsExporter;
import dbcleaner.spi.Sleeper;
import dbcleaner.sql.CleanupSql;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Everything a {@link DeletionStrategy} needs for one job: the fixed cutoff and
 * target count, pacing, and the collaborators statements and progress go to.
 */
public final class DeletionContext {
  private final MetadataDatabase database;
  private final CleanupSql sql;
  private final TableJob job;
  private final Instant cutoff;
  private final long expiredCount;
  private final int batchSize;
  private final Duration sleep;
  private final Sleeper sleeper;
  private final CleanupListener listener;
  private final MetricsExporter metrics;

  public DeletionContext(MetadataDatabase database, CleanupSql sql, TableJob job, Instant cutoff,
      long expiredCount, int batchSize, Duration sleep, Sleeper sleeper,
      CleanupListener listener, MetricsExporter metrics) {
    this.database = Objects.requireNonNull(database, "database");
    this.sql = Objects.requireNonNull(sql, "sql");
    this.job = Objects.requireNonNull(job, "job");
    this.cutoff = Objects.requireNonNull(cutoff, "cutoff");
    this.sleep = Objects.requireNonNull(sleep, "sleep");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.listener = Objects.requireNonNull(listener, "listener");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    this.expiredCount = expiredCount;
    this.batchSize = batchSize;
  }

  public CleanupSql sql() {
    return sql;
  }

  public TableJob job() {
    return job;
  }

  public Instant cutoff() {
    return cutoff;
  }

  public long expiredCount() {
    return expiredCount;
  }

  public int batchSize() {
    return batchSize;
  }

  /** {@code min(batchSize, expiredCount - deleted)}. */
  public int nextBatchSize(long deleted) {
    return (int) Math.min(batchSize, expiredCount - deleted);
  }

  /**
   * Issues one {@code DELETE}.
   *
   * @return affected rows reported by the database
   * @throws CleanupException of kind {@code DELETE_FAILED}
   */
  public int delete(String statement, Object... params) {
    int affected;
    try {
      affected = database.update(statement, params);
    } catch (DatabaseAccessException e) {
      throw new CleanupException(CleanupException.Kind.DELETE_FAILED, job.tableName(),
          "failed to delete records", e);
    }
    metrics.incrementDeleteStatements(job.tableName());
    return affected;
  }

  /**
   * Runs a key select.
   *
   * @throws CleanupException of kind {@code DELETE_FAILED}
   */
  public List<Row> selectKeys(String statement, Object... params) {
    try {
      return database.queryRows(statement, params);
    } catch (DatabaseAccessException e) {
      throw new CleanupException(CleanupException.Kind.DELETE_FAILED, job.tableName(),
          "failed to query primary keys", e);
    }
  }

  /** Publishes the progress of a finished batch to the listener and the metrics. */
  public void batchDone(int batchNumber, int batchDeleted, long deleted, int statements,
      long startNanos) {
    Duration elapsed = Duration.ofNanos(Math.max(0, System.nanoTime() - startNanos));
    metrics.incrementBatches(job.tableName());
    metrics.incrementRowsDeleted(job.tableName(), batchDeleted);
    metrics.recordBatchDurationMs(job.tableName(), elapsed.toMillis());
    listener.onBatch(job, new BatchProgress(job.tableName(), batchNumber, batchDeleted, deleted,
        expiredCount, statements, elapsed));
  }

  /**
   * Pauses before the next batch.
   *
   * @throws CleanupException of kind {@code INTERRUPTED}; the interrupt flag is restored
   */
  public void pause() {
    listener.onSleep(job, sleep);
    try {
      sleeper.sleep(sleep);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CleanupException(CleanupException.Kind.INTERRUPTED, job.tableName(),
          "interrupted between batches", e);
    }
  }
}
