package dbcleaner.delete;

import dbcleaner.TableJob;
import dbcleaner.model.Row;

import java.util.ArrayList;
import java.util.List;

/**
 * Selects the keys of expired rows first, then deletes by key.
 *
 * <p>Keys are selected in order of the first key column so consecutive batches move
 * forward through the table. Single-column keys are deleted with one {@code IN}
 * list per batch. Composite keys are deleted with a disjunction of per-row
 * equality conjunctions, flushed every {@value #COMPOSITE_FLUSH_ROWS} rows to bound
 * statement size and parameter count.
 *
 * <p>An empty key select, or a batch whose deletes affect no rows, ends the job even
 * when fewer rows were deleted than counted.
 */
public final class KeyEnumerationDeletionStrategy implements DeletionStrategy {
  public static final int COMPOSITE_FLUSH_ROWS = 100;

  @Override
  public String name() {
    return "key-enumeration";
  }

  @Override
  public DeletionOutcome delete(DeletionContext context) {
    TableJob job = context.job();
    long deleted = 0;
    int batches = 0;
    while (deleted < context.expiredCount()) {
      int limit = context.nextBatchSize(deleted);
      long start = System.nanoTime();

      List<Row> keys = context.selectKeys(context.sql().selectKeys(job, limit), context.cutoff());
      if (keys.isEmpty()) {
        break;
      }

      int[] result = job.hasCompositeKey()
          ? deleteComposite(context, keys)
          : deleteSingle(context, keys);
      int batchDeleted = result[0];
      deleted += batchDeleted;
      batches++;
      context.batchDone(batches, batchDeleted, deleted, result[1], start);
      if (batchDeleted == 0) {
        break;
      }

      if (deleted < context.expiredCount()) {
        context.pause();
      }
    }
    return new DeletionOutcome(deleted, batches);
  }

  /** Returns {deleted, statements}. */
  private static int[] deleteSingle(DeletionContext context, List<Row> keys) {
    Object[] ids = new Object[keys.size()];
    for (int i = 0; i < ids.length; i++) {
      ids[i] = keys.get(i).get(0);
    }
    int affected = context.delete(context.sql().deleteByKeys(context.job(), ids.length), ids);
    return new int[] {affected, 1};
  }

  /** Returns {deleted, statements}. */
  private static int[] deleteComposite(DeletionContext context, List<Row> keys) {
    List<String> keyColumns = context.job().primaryKey();
    int deleted = 0;
    int statements = 0;
    List<Object> params = new ArrayList<>();
    int pendingRows = 0;
    for (int i = 0; i < keys.size(); i++) {
      Row row = keys.get(i);
      for (String column : keyColumns) {
        params.add(row.get(column));
      }
      pendingRows++;

      if (pendingRows >= COMPOSITE_FLUSH_ROWS || i == keys.size() - 1) {
        String statement = context.sql().deleteByCompositeKeys(context.job(), pendingRows);
        deleted += context.delete(statement, params.toArray());
        statements++;
        params.clear();
        pendingRows = 0;
      }
    }
    return new int[] {deleted, statements};
  }
}
