package dbcleaner.jdbc.dialect;

import dbcleaner.spi.Dialect;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of the SQL dialects on the classpath.
 *
 * <p>Dialects are loaded once via {@link ServiceLoader} from
 * {@code META-INF/services/dbcleaner.spi.Dialect}; the first dialect whose JDBC URL
 * prefix matches wins.
 *
 * <pre>{@code
 * Dialect dialect = Dialects.detect(dataSource);
 * Dialect dialect = Dialects.detect("jdbc:mysql://localhost/airflow");
 * Dialect dialect = Dialects.get("postgresql");
 * }</pre>
 */
public final class Dialects {

  private static final List<Dialect> DIALECTS;
  private static final Map<String, Dialect> BY_NAME = new ConcurrentHashMap<>();

  static {
    DIALECTS = ServiceLoader.load(Dialect.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (Dialect dialect : DIALECTS) {
      BY_NAME.put(dialect.name().toLowerCase(Locale.ROOT), dialect);
    }
  }

  private Dialects() {
  }

  /**
   * Returns all registered dialects in discovery order.
   */
  public static List<Dialect> all() {
    return DIALECTS;
  }

  /**
   * Looks a dialect up by name, ignoring case.
   *
   * @throws IllegalArgumentException if no dialect has that name
   */
  public static Dialect get(String name) {
    Dialect dialect = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (dialect == null) {
      throw new IllegalArgumentException("Unknown dialect: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return dialect;
  }

  /**
   * Returns the dialect handling {@code jdbcUrl}, if any.
   */
  public static Optional<Dialect> find(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      return Optional.empty();
    }
    for (Dialect dialect : DIALECTS) {
      for (String prefix : dialect.jdbcUrlPrefixes()) {
        if (jdbcUrl.startsWith(prefix)) {
          return Optional.of(dialect);
        }
      }
    }
    return Optional.empty();
  }

  /**
   * Detects the dialect from a JDBC URL.
   *
   * @throws IllegalArgumentException if the URL is empty or no dialect matches
   */
  public static Dialect detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    return find(jdbcUrl).orElseThrow(() -> new IllegalArgumentException(
        "No dialect found for JDBC URL: " + jdbcUrl + ". Supported prefixes: " + allPrefixes()));
  }

  /**
   * Detects the dialect from the URL reported by a connection of {@code dataSource}.
   *
   * @throws IllegalStateException if no connection can be obtained
   */
  public static Dialect detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      return detect(conn.getMetaData().getURL());
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect dialect from DataSource", e);
    }
  }

  private static List<String> allPrefixes() {
    return DIALECTS.stream()
        .flatMap(d -> d.jdbcUrlPrefixes().stream())
        .toList();
  }
}
