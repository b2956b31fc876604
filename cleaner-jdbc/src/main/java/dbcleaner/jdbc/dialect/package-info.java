/**
 * Built-in SQL dialects and the {@link dbcleaner.jdbc.dialect.Dialects} registry.
 */
package dbcleaner.jdbc.dialect;
