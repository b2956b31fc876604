/**
 * Batch deletion strategies.
 *
 * <ul>
 *   <li><b>Range</b> : {@link dbcleaner.delete.RangeDeletionStrategy} deletes by the date
 *       predicate with a row-limited {@code DELETE}.</li>
 *   <li><b>Key enumeration</b> : {@link dbcleaner.delete.KeyEnumerationDeletionStrategy}
 *       selects key values first and deletes by key, supporting composite keys.</li>
 * </ul>
 */
package dbcleaner.delete;
