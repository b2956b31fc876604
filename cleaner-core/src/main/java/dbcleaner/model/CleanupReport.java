package dbcleaner.model;

import java.util.List;
import java.util.Optional;

/**
 * Results of a full run, one entry per table in processing order.
 */
public record CleanupReport(List<TableCleanupResult> results) {

  public CleanupReport {
    results = List.copyOf(results);
  }

  public long totalDeleted() {
    return results.stream().mapToLong(TableCleanupResult::deleted).sum();
  }

  public long totalExpired() {
    return results.stream().mapToLong(TableCleanupResult::expiredCount).sum();
  }

  public Optional<TableCleanupResult> result(String tableName) {
    return results.stream().filter(r -> r.tableName().equals(tableName)).findFirst();
  }
}
