package dbcleaner.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import dbcleaner.ManagedTable;
import dbcleaner.RunConfig;
import dbcleaner.TableCleaner;
import dbcleaner.jdbc.dialect.Dialects;
import dbcleaner.model.CleanupReport;
import dbcleaner.spi.Dialect;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class HikariCPIntegrationTest {
  private HikariDataSource hikariDs;
  private MetadataSchema schema;
  private Dialect dialect;

  @BeforeEach
  void setup() throws Exception {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:hikari_" + UUID.randomUUID() + ";DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1");
    config.setMaximumPoolSize(2);
    config.setMinimumIdle(1);
    config.setPoolName("cleaner-test-pool");

    hikariDs = new HikariDataSource(config);
    dialect = Dialects.detect(hikariDs);
    schema = new MetadataSchema(hikariDs, dialect);
    schema.create();
  }

  @AfterEach
  void tearDown() {
    if (hikariDs != null && !hikariDs.isClosed()) {
      hikariDs.close();
    }
  }

  @Test
  void fullRunThroughPoolLeaksNoConnections() {
    for (boolean keys : new boolean[] {false, true}) {
      schema.seedAll(30, Duration.ofDays(60));
      TableCleaner cleaner = TableCleaner.builder()
          .database(new JdbcMetadataDatabase(hikariDs))
          .dialect(dialect)
          .config(RunConfig.builder().batchSize(7).useKeyEnumeration(keys).build())
          .sleeper(d -> { })
          .build();

      CleanupReport report = cleaner.cleanAll();

      assertEquals(150, report.totalDeleted());
      assertEquals(0, hikariDs.getHikariPoolMXBean().getActiveConnections());
    }
    for (ManagedTable table : ManagedTable.values()) {
      assertEquals(0, schema.count(table));
    }
  }

  @Test
  void detectsH2DialectFromPool() {
    assertEquals("h2", dialect.name());
  }
}
