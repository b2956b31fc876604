package dbcleaner;

import dbcleaner.delete.DeletionContext;
import dbcleaner.delete.DeletionOutcome;
import dbcleaner.delete.DeletionStrategy;
import dbcleaner.delete.KeyEnumerationDeletionStrategy;
import dbcleaner.delete.RangeDeletionStrategy;
import dbcleaner.model.CleanupReport;
import dbcleaner.model.TableCleanupResult;
import dbcleaner.spi.CleanupListener;
import dbcleaner.spi.Dialect;
import dbcleaner.spi.MetadataDatabase;
import dbcleaner.spi.MetricsExporter;
import dbcleaner.spi.Sleeper;
import dbcleaner.sql.CleanupSql;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Batch deletion engine: runs the planned table jobs one after another.
 *
 * <p>Per job the engine checks the date column in the schema catalog, counts the
 * expired rows, and then deletes them in batches of at most
 * {@link RunConfig#batchSize()} rows, pausing {@link RunConfig#sleep()} between
 * batches. The cutoff is taken from the clock once when the job starts. Each
 * statement auto-commits, so a failure leaves earlier batches deleted.
 *
 * <p>Only tables and columns declared by {@link ManagedTable} are interpolated
 * into SQL; anything else is rejected before a statement is issued.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see TableCleaner.Builder
 * @see RetentionPlanner
 */
public final class TableCleaner {
  private final MetadataDatabase database;
  private final CleanupSql sql;
  private final RunConfig config;
  private final CleanupListener listener;
  private final MetricsExporter metrics;
  private final Sleeper sleeper;
  private final Clock clock;
  private final RetentionPlanner planner;

  private TableCleaner(Builder builder) {
    this.database = Objects.requireNonNull(builder.database, "database");
    this.sql = new CleanupSql(Objects.requireNonNull(builder.dialect, "dialect"));
    this.config = Objects.requireNonNull(builder.config, "config");
    this.listener = builder.listener != null
        ? builder.listener
        : new LoggingCleanupListener(config.verbose());
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.SYSTEM;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.planner = new RetentionPlanner(listener);
  }

  public static Builder builder() {
    return new Builder();
  }

  public RunConfig config() {
    return config;
  }

  /**
   * Plans and runs every table job in order, stopping at the first failure.
   *
   * @return one result per table
   * @throws CleanupException from the first job that fails
   */
  public CleanupReport cleanAll() {
    List<TableCleanupResult> results = new ArrayList<>();
    for (TableJob job : planner.plan(config)) {
      results.add(clean(job));
    }
    return new CleanupReport(results);
  }

  /**
   * Runs a single table job.
   *
   * @throws CleanupException if the job is rejected or a statement fails
   */
  public TableCleanupResult clean(TableJob job) {
    Objects.requireNonNull(job, "job");
    try {
      TableCleanupResult result = doClean(job);
      listener.onJobComplete(result);
      return result;
    } catch (CleanupException e) {
      metrics.incrementTablesFailed(job.tableName());
      listener.onJobFailed(job, e);
      throw e;
    }
  }

  private TableCleanupResult doClean(TableJob job) {
    checkAllowed(job);
    DeletionStrategy strategy = selectStrategy(job);

    Instant cutoff = job.cutoff(clock.instant());
    listener.onJobStart(job, cutoff, strategy.name());

    if (!columnExists(job)) {
      metrics.incrementTablesSkipped(job.tableName());
      listener.onColumnMissing(job);
      return TableCleanupResult.skipped(job.tableName(), cutoff);
    }

    long expired = countExpired(job, cutoff);
    metrics.recordExpiredRows(job.tableName(), expired);
    listener.onExpiredCount(job, expired);

    if (config.dryRun()) {
      listener.onDryRun(job, expired);
      return TableCleanupResult.dryRun(job.tableName(), cutoff, expired);
    }
    if (expired == 0) {
      listener.onNothingToDelete(job);
      return TableCleanupResult.nothingToDelete(job.tableName(), cutoff);
    }

    DeletionContext context = new DeletionContext(database, sql, job, cutoff, expired,
        config.batchSize(), config.sleep(), sleeper, listener, metrics);
    DeletionOutcome outcome;
    try {
      outcome = strategy.delete(context);
    } catch (CleanupException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new CleanupException(CleanupException.Kind.DELETE_FAILED, job.tableName(),
          "unexpected error while deleting records", e);
    }
    return TableCleanupResult.cleaned(job.tableName(), cutoff, expired,
        outcome.deleted(), outcome.batches());
  }

  private static void checkAllowed(TableJob job) {
    Optional<ManagedTable> table = ManagedTable.forTableName(job.tableName());
    if (table.isEmpty()) {
      throw new CleanupException(CleanupException.Kind.INVALID_IDENTIFIER, job.tableName(),
          "not a managed table");
    }
    List<String> columns = new ArrayList<>(job.primaryKey());
    columns.add(job.dateColumn());
    for (String column : columns) {
      if (!table.get().allowedColumns().contains(column)) {
        throw new CleanupException(CleanupException.Kind.INVALID_IDENTIFIER, job.tableName(),
            "column " + column + " is not declared for this table");
      }
    }
  }

  private DeletionStrategy selectStrategy(TableJob job) {
    if (!config.useKeyEnumeration()) {
      return new RangeDeletionStrategy();
    }
    if (!job.hasPrimaryKey()) {
      throw new CleanupException(CleanupException.Kind.MISSING_PRIMARY_KEY, job.tableName(),
          "no primary key columns for key-based deletion");
    }
    return new KeyEnumerationDeletionStrategy();
  }

  private boolean columnExists(TableJob job) {
    try {
      return database.queryForLong(sql.columnExists(), job.tableName(), job.dateColumn()) > 0;
    } catch (DatabaseAccessException e) {
      throw new CleanupException(CleanupException.Kind.SCHEMA_CHECK_FAILED, job.tableName(),
          "failed to check column existence", e);
    }
  }

  private long countExpired(TableJob job, Instant cutoff) {
    try {
      return database.queryForLong(sql.countExpired(job), cutoff);
    } catch (DatabaseAccessException e) {
      throw new CleanupException(CleanupException.Kind.COUNT_QUERY_FAILED, job.tableName(),
          "failed to count records", e);
    }
  }

  /** Builder for {@link TableCleaner}. */
  public static final class Builder {
    private MetadataDatabase database;
    private Dialect dialect;
    private RunConfig config;
    private CleanupListener listener;
    private MetricsExporter metrics;
    private Sleeper sleeper;
    private Clock clock;

    private Builder() {}

    /**
     * Sets the database the statements run against.
     *
     * <p><b>Required.</b>
     *
     * @param database the metadata database
     * @return this builder
     */
    public Builder database(MetadataDatabase database) {
      this.database = database;
      return this;
    }

    /**
     * Sets the SQL dialect of the database.
     *
     * <p><b>Required.</b>
     *
     * @param dialect the dialect
     * @return this builder
     */
    public Builder dialect(Dialect dialect) {
      this.dialect = dialect;
      return this;
    }

    /**
     * Sets the run configuration.
     *
     * <p><b>Required.</b>
     *
     * @param config the run configuration
     * @return this builder
     */
    public Builder config(RunConfig config) {
      this.config = config;
      return this;
    }

    /**
     * Sets the progress listener.
     *
     * <p>Optional. Defaults to a {@link LoggingCleanupListener} honoring
     * {@link RunConfig#verbose()}.
     *
     * @param listener the listener
     * @return this builder
     */
    public Builder listener(CleanupListener listener) {
      this.listener = listener;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets how the engine pauses between batches.
     *
     * <p>Optional. Defaults to {@link Sleeper#SYSTEM}.
     *
     * @param sleeper the sleeper
     * @return this builder
     */
    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    /**
     * Sets the clock cutoffs are computed from.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * @return a new {@link TableCleaner}
     * @throws NullPointerException if {@code database}, {@code dialect} or {@code config} is null
     */
    public TableCleaner build() {
      return new TableCleaner(this);
    }
  }
}
