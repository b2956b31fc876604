/**
 * Spring Boot auto-configuration for the metadata cleaner.
 *
 * <p>Binds {@code cleaner.*} properties and exposes a ready-to-run
 * {@link dbcleaner.TableCleaner} backed by the application's DataSource or the canned
 * mock database.
 */
package dbcleaner.spring.boot;
