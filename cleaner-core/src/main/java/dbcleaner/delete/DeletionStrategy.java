package dbcleaner.delete;

/**
 * One way of deleting the expired rows of a table in bounded batches.
 *
 * <p>Implementations stop once the counted rows are gone or the table has no more
 * matching rows, pause between batches but never after the last one, and report
 * every batch to the context's listener.
 *
 * @see RangeDeletionStrategy
 * @see KeyEnumerationDeletionStrategy
 */
public interface DeletionStrategy {

  /** Short name for logs, e.g. {@code "range"}. */
  String name();

  /**
   * Deletes the expired rows described by {@code context}.
   *
   * @throws dbcleaner.CleanupException if a statement fails or the pause is interrupted
   */
  DeletionOutcome delete(DeletionContext context);
}
