/**
 * Retention cleanup of scheduler metadata tables.
 *
 * <p>{@link dbcleaner.RetentionPlanner} turns a {@link dbcleaner.RunConfig} into one
 * {@link dbcleaner.TableJob} per {@link dbcleaner.ManagedTable};
 * {@link dbcleaner.TableCleaner} runs them against a
 * {@link dbcleaner.spi.MetadataDatabase}.
 */
package dbcleaner;
