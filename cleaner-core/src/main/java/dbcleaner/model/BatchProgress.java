package dbcleaner.model;

import java.time.Duration;

/**
 * Progress snapshot reported after each delete batch.
 *
 * @param tableName    the table being cleaned
 * @param batchNumber  1-based batch index within the job
 * @param batchDeleted rows deleted by this batch
 * @param deleted      rows deleted so far in the job
 * @param expiredCount rows counted as expired at job start
 * @param statements   physical {@code DELETE} statements issued by this batch
 * @param elapsed      wall-clock time of this batch
 */
public record BatchProgress(
    String tableName,
    int batchNumber,
    int batchDeleted,
    long deleted,
    long expiredCount,
    int statements,
    Duration elapsed
) {}
