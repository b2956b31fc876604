package dbcleaner.delete;

/**
 * Deletes directly by the date predicate, relying on the database's row-limited
 * {@code DELETE} to bound each statement.
 *
 * <p>Each batch asks for {@code min(batchSize, remaining)} rows and accumulates the
 * affected-row count the database reports. A batch that deletes nothing means the
 * matching set is exhausted and ends the job.
 */
public final class RangeDeletionStrategy implements DeletionStrategy {

  @Override
  public String name() {
    return "range";
  }

  @Override
  public DeletionOutcome delete(DeletionContext context) {
    long deleted = 0;
    int batches = 0;
    while (deleted < context.expiredCount()) {
      int limit = context.nextBatchSize(deleted);
      long start = System.nanoTime();

      int affected = context.delete(context.sql().rangeDelete(context.job(), limit), context.cutoff());
      deleted += affected;
      batches++;
      context.batchDone(batches, affected, deleted, 1, start);

      if (affected == 0) {
        break;
      }
      if (deleted < context.expiredCount()) {
        context.pause();
      }
    }
    return new DeletionOutcome(deleted, batches);
  }
}
