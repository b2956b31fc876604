package dbcleaner;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The metadata tables this tool cleans, in processing order.
 *
 * <p>This enum is also the identifier allow-list: the engine only interpolates table
 * and column names declared here.
 */
public enum ManagedTable {
  DAG_RUN("dag_run", "execution_date", List.of("id")),
  TASK_INSTANCE("task_instance", "start_date", List.of("dag_id", "task_id", "run_id", "map_index")),
  XCOM("xcom", "timestamp", List.of("dag_id", "task_id", "run_id", "map_index", "key")),
  LOG("log", "dttm", List.of("id")),
  JOB("job", "end_date", List.of("id"));

  private final String tableName;
  private final String dateColumn;
  private final List<String> primaryKey;

  ManagedTable(String tableName, String dateColumn, List<String> primaryKey) {
    this.tableName = tableName;
    this.dateColumn = dateColumn;
    this.primaryKey = primaryKey;
  }

  public String tableName() {
    return tableName;
  }

  public String dateColumn() {
    return dateColumn;
  }

  public List<String> primaryKey() {
    return primaryKey;
  }

  /** Columns of this table that may appear in generated SQL. */
  public Set<String> allowedColumns() {
    Set<String> columns = new HashSet<>(primaryKey);
    columns.add(dateColumn);
    return columns;
  }

  public TableJob toJob(int retentionDays) {
    return new TableJob(tableName, retentionDays, dateColumn, primaryKey);
  }

  public static Optional<ManagedTable> forTableName(String tableName) {
    for (ManagedTable table : values()) {
      if (table.tableName.equals(tableName)) {
        return Optional.of(table);
      }
    }
    return Optional.empty();
  }
}
