package dbcleaner;

import dbcleaner.spi.CleanupListener;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns a {@link RunConfig} into one {@link TableJob} per {@link ManagedTable}, in
 * declaration order.
 */
public final class RetentionPlanner {
  private final CleanupListener listener;

  public RetentionPlanner() {
    this(CleanupListener.NOOP);
  }

  public RetentionPlanner(CleanupListener listener) {
    this.listener = Objects.requireNonNull(listener, "listener");
  }

  /**
   * Plans the jobs of a run. Never fails: a table without a retention entry gets
   * {@link RunConfig#defaultRetentionDays()} and the listener is told about it.
   */
  public List<TableJob> plan(RunConfig config) {
    Objects.requireNonNull(config, "config");
    List<TableJob> jobs = new ArrayList<>();
    for (ManagedTable table : ManagedTable.values()) {
      Integer days = config.retentionDays().get(table.tableName());
      if (days == null) {
        days = config.defaultRetentionDays();
        listener.onDefaultRetention(table.tableName(), days);
      }
      jobs.add(table.toJob(days));
    }
    return List.copyOf(jobs);
  }
}
