package dbcleaner.spring.boot;

import dbcleaner.LoggingCleanupListener;
import dbcleaner.RunConfig;
import dbcleaner.TableCleaner;
import dbcleaner.jdbc.JdbcMetadataDatabase;
import dbcleaner.jdbc.dialect.Dialects;
import dbcleaner.mock.CannedMetadataDatabase;
import dbcleaner.spi.CleanupListener;
import dbcleaner.spi.Dialect;
import dbcleaner.spi.MetadataDatabase;
import dbcleaner.spi.MetricsExporter;
import dbcleaner.spi.Sleeper;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Auto-configuration for the metadata cleaner.
 *
 * <p>Wires a {@link TableCleaner} from {@link CleanerProperties} and either the
 * application's {@link DataSource} or, with {@code cleaner.database.mock=true}, a
 * {@link CannedMetadataDatabase}.
 *
 * @see CleanerProperties
 * @see CleanerMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(TableCleaner.class)
@EnableConfigurationProperties(CleanerProperties.class)
public class CleanerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public RunConfig cleanerRunConfig(CleanerProperties props) {
    return props.toRunConfig();
  }

  @Bean
  @ConditionalOnMissingBean
  public CleanupListener cleanupListener(RunConfig config) {
    return new LoggingCleanupListener(config.verbose());
  }

  @Bean
  @ConditionalOnMissingBean
  public TableCleaner tableCleaner(RunConfig config,
      CleanupListener listener,
      ObjectProvider<MetadataDatabase> databaseProvider,
      ObjectProvider<Dialect> dialectProvider,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<Sleeper> sleeperProvider) {
    MetadataDatabase database = databaseProvider.getIfAvailable();
    if (database == null) {
      throw new IllegalStateException(
          "No MetadataDatabase available: configure spring.datasource.* or set cleaner.database.mock=true");
    }
    TableCleaner.Builder builder = TableCleaner.builder()
        .database(database)
        .dialect(dialectProvider.getObject())
        .config(config)
        .listener(listener);
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    Sleeper sleeper = sleeperProvider.getIfAvailable();
    if (sleeper != null) {
      builder.sleeper(sleeper);
    }
    return builder.build();
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnBean(DataSource.class)
  @ConditionalOnProperty(prefix = "cleaner.database", name = "mock", havingValue = "false", matchIfMissing = true)
  static class JdbcDatabaseConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Dialect cleanerDialect(DataSource dataSource, CleanerProperties props) {
      String name = props.getDialect();
      if (name != null && !name.isBlank()) {
        return Dialects.get(name);
      }
      return Dialects.detect(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean
    public MetadataDatabase metadataDatabase(DataSource dataSource) {
      return new JdbcMetadataDatabase(dataSource);
    }
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnProperty(prefix = "cleaner.database", name = "mock", havingValue = "true")
  static class MockDatabaseConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Dialect cleanerDialect(CleanerProperties props) {
      String name = props.getDialect();
      return Dialects.get(name != null && !name.isBlank() ? name : "mysql");
    }

    @Bean
    @ConditionalOnMissingBean
    public MetadataDatabase metadataDatabase() {
      return CannedMetadataDatabase.withDefaults();
    }
  }
}
