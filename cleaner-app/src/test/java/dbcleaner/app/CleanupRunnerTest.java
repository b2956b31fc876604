package dbcleaner.app;

import dbcleaner.DatabaseAccessException;
import dbcleaner.RunConfig;
import dbcleaner.TableCleaner;
import dbcleaner.jdbc.dialect.MySqlDialect;
import dbcleaner.mock.CannedMetadataDatabase;
import dbcleaner.model.CleanupStatus;
import dbcleaner.model.Row;
import dbcleaner.spi.MetadataDatabase;
import dbcleaner.spring.boot.CleanerProperties;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CleanupRunnerTest {

  private static TableCleaner cleaner(MetadataDatabase database, RunConfig config) {
    return TableCleaner.builder()
        .database(database)
        .dialect(new MySqlDialect())
        .config(config)
        .sleeper(duration -> { })
        .build();
  }

  @Test
  void successfulRunExitsWithZero() throws Exception {
    CannedMetadataDatabase database = CannedMetadataDatabase.withDefaults();
    CleanupRunner runner = new CleanupRunner(cleaner(database, RunConfig.builder().build()),
        new CleanerProperties());

    runner.run(null);

    assertEquals(0, runner.getExitCode());
    assertEquals(5, runner.report().results().size());
    assertEquals(CleanupStatus.CLEANED, runner.report().results().get(0).status());
  }

  @Test
  void dryRunIssuesNoDeletes() throws Exception {
    CannedMetadataDatabase database = CannedMetadataDatabase.withDefaults();
    CleanupRunner runner = new CleanupRunner(
        cleaner(database, RunConfig.builder().dryRun(true).build()), new CleanerProperties());

    runner.run(null);

    assertEquals(0, runner.getExitCode());
    assertTrue(database.statements(CannedMetadataDatabase.Statement.Kind.UPDATE).isEmpty());
    assertEquals(5000, runner.report().totalExpired());
  }

  @Test
  void failedJobExitsWithOne() throws Exception {
    MetadataDatabase failing = new MetadataDatabase() {
      @Override
      public long queryForLong(String sql, Object... params) {
        return 10;
      }

      @Override
      public int update(String sql, Object... params) {
        throw new DatabaseAccessException("Lock wait timeout exceeded");
      }

      @Override
      public List<Row> queryRows(String sql, Object... params) {
        return List.of();
      }
    };
    CleanupRunner runner = new CleanupRunner(cleaner(failing, RunConfig.builder().build()),
        new CleanerProperties());

    runner.run(null);

    assertEquals(1, runner.getExitCode());
    assertNull(runner.report());
  }

  // ── banners ──

  @Test
  void dryRunAndRangeBanners() {
    List<String> lines = CleanupRunner.banners(RunConfig.builder().dryRun(true).build());

    assertEquals("=== Running in Dry Run mode ===", lines.get(0));
    assertEquals("=== Using Direct DELETE method ===", lines.get(2));
  }

  @Test
  void executionAndKeyEnumerationBanners() {
    List<String> lines = CleanupRunner.banners(
        RunConfig.builder().useKeyEnumeration(true).build());

    assertEquals("=== Running in Execution mode ===", lines.get(0));
    assertEquals("=== Using Primary Key-based deletion method ===", lines.get(2));
    assertEquals(4, lines.size());
  }
}
