package dbcleaner.delete;

/**
 * @param deleted rows deleted, as reported by the database
 * @param batches batches executed
 */
public record DeletionOutcome(long deleted, int batches) {}
