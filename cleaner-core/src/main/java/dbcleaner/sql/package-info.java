/**
 * SQL text generation for table jobs.
 */
package dbcleaner.sql;
