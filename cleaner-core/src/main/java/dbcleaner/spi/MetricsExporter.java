package dbcleaner.spi;

/**
 * Observability hook for exporting cleanup counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Records the number of expired rows counted at the start of a job.
   *
   * @param tableName the table
   * @param count     rows with the date column before the cutoff
   */
  void recordExpiredRows(String tableName, long count);

  /**
   * Increments the number of rows deleted from a table.
   *
   * @param tableName the table
   * @param rows      affected rows reported by the database
   */
  void incrementRowsDeleted(String tableName, long rows);

  /**
   * Increments the count of completed delete batches.
   */
  void incrementBatches(String tableName);

  /**
   * Increments the count of physical {@code DELETE} statements issued.
   */
  void incrementDeleteStatements(String tableName);

  /**
   * Records the wall-clock time of one batch, excluding the pause after it.
   *
   * @param durationMs batch duration in milliseconds (always non-negative)
   */
  default void recordBatchDurationMs(String tableName, long durationMs) {
  }

  /**
   * Increments the count of tables skipped because the date column is missing.
   */
  void incrementTablesSkipped(String tableName);

  /**
   * Increments the count of tables whose cleanup failed.
   */
  void incrementTablesFailed(String tableName);

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void recordExpiredRows(String tableName, long count) {
    }

    @Override
    public void incrementRowsDeleted(String tableName, long rows) {
    }

    @Override
    public void incrementBatches(String tableName) {
    }

    @Override
    public void incrementDeleteStatements(String tableName) {
    }

    @Override
    public void incrementTablesSkipped(String tableName) {
    }

    @Override
    public void incrementTablesFailed(String tableName) {
    }
  }
}
