package dbcleaner.model;

/**
 * How a table job ended.
 */
public enum CleanupStatus {
  /** The date column does not exist on the table. Nothing was counted or deleted. */
  SKIPPED_MISSING_COLUMN,
  /** Expired rows were counted but dry-run mode suppressed deletion. */
  DRY_RUN,
  /** No row was older than the cutoff. */
  NOTHING_TO_DELETE,
  /** Expired rows were deleted in batches. */
  CLEANED
}
