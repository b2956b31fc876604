package dbcleaner.spring.boot;

import dbcleaner.RunConfig;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the metadata cleaner.
 *
 * <pre>
 * cleaner:
 *   retention-days:
 *     dag_run: 30
 *     xcom: 7
 *   batch-size: 1000
 *   sleep-seconds: 5.0
 *   dry-run: true
 * </pre>
 *
 * @see CleanerAutoConfiguration
 */
@ConfigurationProperties(prefix = "cleaner")
public class CleanerProperties {

  private final RetentionDays retentionDays = new RetentionDays();

  /**
   * Retention for tables without an entry under {@code retention-days}.
   */
  private int defaultRetentionDays = RunConfig.DEFAULT_RETENTION_DAYS;

  /**
   * Maximum rows per delete batch. Values &le; 0 fall back to 1000.
   */
  private int batchSize = RunConfig.DEFAULT_BATCH_SIZE;

  /**
   * Pause between batches in seconds. Values &le; 0 fall back to 5.0.
   */
  private double sleepSeconds = RunConfig.DEFAULT_SLEEP_SECONDS;

  /**
   * Count expired rows without deleting anything.
   */
  private boolean dryRun;

  /**
   * Log every batch and pause at INFO.
   */
  private boolean verbose;

  /**
   * Select key values first and delete by key instead of deleting by date range.
   */
  private boolean useKeyEnumeration;

  /**
   * Dialect name (mysql, postgresql, h2). Detected from the DataSource when empty.
   */
  private String dialect;

  private final Database database = new Database();
  private final Metrics metrics = new Metrics();

  public RetentionDays getRetentionDays() {
    return retentionDays;
  }

  public int getDefaultRetentionDays() {
    return defaultRetentionDays;
  }

  public void setDefaultRetentionDays(int defaultRetentionDays) {
    this.defaultRetentionDays = defaultRetentionDays;
  }

  public int getBatchSize() {
    return batchSize;
  }

  public void setBatchSize(int batchSize) {
    this.batchSize = batchSize;
  }

  public double getSleepSeconds() {
    return sleepSeconds;
  }

  public void setSleepSeconds(double sleepSeconds) {
    this.sleepSeconds = sleepSeconds;
  }

  public boolean isDryRun() {
    return dryRun;
  }

  public void setDryRun(boolean dryRun) {
    this.dryRun = dryRun;
  }

  public boolean isVerbose() {
    return verbose;
  }

  public void setVerbose(boolean verbose) {
    this.verbose = verbose;
  }

  public boolean isUseKeyEnumeration() {
    return useKeyEnumeration;
  }

  public void setUseKeyEnumeration(boolean useKeyEnumeration) {
    this.useKeyEnumeration = useKeyEnumeration;
  }

  public String getDialect() {
    return dialect;
  }

  public void setDialect(String dialect) {
    this.dialect = dialect;
  }

  public Database getDatabase() {
    return database;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  /**
   * Builds the immutable run configuration, applying the batch-size and sleep defaults.
   *
   * @throws IllegalArgumentException if a retention value is negative
   */
  public RunConfig toRunConfig() {
    RunConfig.Builder builder = RunConfig.builder()
        .defaultRetentionDays(defaultRetentionDays)
        .batchSize(batchSize)
        .sleepSeconds(sleepSeconds)
        .dryRun(dryRun)
        .verbose(verbose)
        .useKeyEnumeration(useKeyEnumeration);
    putIfSet(builder, "dag_run", retentionDays.getDagRun());
    putIfSet(builder, "task_instance", retentionDays.getTaskInstance());
    putIfSet(builder, "xcom", retentionDays.getXcom());
    putIfSet(builder, "log", retentionDays.getLog());
    putIfSet(builder, "job", retentionDays.getJob());
    return builder.build();
  }

  private static void putIfSet(RunConfig.Builder builder, String table, Integer days) {
    if (days != null) {
      builder.retentionDays(table, days);
    }
  }

  /**
   * Retention in days per managed table. Unset tables use {@code default-retention-days}.
   */
  public static class RetentionDays {
    private Integer dagRun;
    private Integer taskInstance;
    private Integer xcom;
    private Integer log;
    private Integer job;

    public Integer getDagRun() {
      return dagRun;
    }

    public void setDagRun(Integer dagRun) {
      this.dagRun = dagRun;
    }

    public Integer getTaskInstance() {
      return taskInstance;
    }

    public void setTaskInstance(Integer taskInstance) {
      this.taskInstance = taskInstance;
    }

    public Integer getXcom() {
      return xcom;
    }

    public void setXcom(Integer xcom) {
      this.xcom = xcom;
    }

    public Integer getLog() {
      return log;
    }

    public void setLog(Integer log) {
      this.log = log;
    }

    public Integer getJob() {
      return job;
    }

    public void setJob(Integer job) {
      this.job = job;
    }
  }

  public static class Database {
    /**
     * Use a canned in-memory database instead of the DataSource. Nothing is deleted.
     */
    private boolean mock;

    public boolean isMock() {
      return mock;
    }

    public void setMock(boolean mock) {
      this.mock = mock;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "dbcleaner";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
