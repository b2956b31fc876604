package dbcleaner.app;

import dbcleaner.CleanupException;
import dbcleaner.RunConfig;
import dbcleaner.TableCleaner;
import dbcleaner.model.CleanupReport;
import dbcleaner.model.TableCleanupResult;
import dbcleaner.spring.boot.CleanerProperties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs one cleanup pass over every managed table and records the process exit code.
 *
 * <p>Exit code 0 on success, 1 when a table job fails. Already-deleted batches are kept.
 */
@Component
public class CleanupRunner implements ApplicationRunner, ExitCodeGenerator {

  private static final Logger log = LoggerFactory.getLogger(CleanupRunner.class);

  private final TableCleaner cleaner;
  private final CleanerProperties props;
  private volatile int exitCode;
  private volatile CleanupReport report;

  public CleanupRunner(TableCleaner cleaner, CleanerProperties props) {
    this.cleaner = cleaner;
    this.props = props;
  }

  @Override
  public void run(ApplicationArguments args) {
    if (props.getDatabase().isMock()) {
      log.info("Using mock mode, not actually connecting to the database");
    }
    for (String line : banners(cleaner.config())) {
      log.info(line);
    }

    log.info("=== Starting to clean expired data ===");
    try {
      report = cleaner.cleanAll();
    } catch (CleanupException e) {
      log.error("Cleanup aborted: {}", e.getMessage(), e);
      exitCode = 1;
      return;
    }
    for (TableCleanupResult result : report.results()) {
      log.info("{}: {} (expired={}, deleted={}, batches={})", result.tableName(), result.status(),
          result.expiredCount(), result.deleted(), result.batches());
    }
    log.info("Total deleted: {}", report.totalDeleted());
    log.info("=== Data cleaning completed ===");
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }

  CleanupReport report() {
    return report;
  }

  static List<String> banners(RunConfig config) {
    List<String> lines = new ArrayList<>();
    if (config.dryRun()) {
      lines.add("=== Running in Dry Run mode ===");
      lines.add("No actual deletion operations will be executed, only showing the number of records to be deleted");
    } else {
      lines.add("=== Running in Execution mode ===");
      lines.add("Actual deletion operations will be executed, please ensure important data has been backed up");
    }
    if (config.useKeyEnumeration()) {
      lines.add("=== Using Primary Key-based deletion method ===");
      lines.add("This method can be faster for large tables but may involve more queries");
    } else {
      lines.add("=== Using Direct DELETE method ===");
      lines.add("This method is simpler but may be slower for large tables");
    }
    return lines;
  }
}
