/**
 * Command-line process surface of the metadata cleaner.
 */
package dbcleaner.app;
