package dbcleaner;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Process-wide cleanup settings. Immutable once built.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see RunConfig.Builder
 */
public final class RunConfig {
  public static final int DEFAULT_BATCH_SIZE = 1000;
  public static final double DEFAULT_SLEEP_SECONDS = 5.0;
  public static final int DEFAULT_RETENTION_DAYS = 30;

  private final Map<String, Integer> retentionDays;
  private final int defaultRetentionDays;
  private final int batchSize;
  private final boolean dryRun;
  private final double sleepSeconds;
  private final boolean useKeyEnumeration;
  private final boolean verbose;

  private RunConfig(Builder builder) {
    for (Map.Entry<String, Integer> entry : builder.retentionDays.entrySet()) {
      if (entry.getValue() < 0) {
        throw new IllegalArgumentException("retention days for " + entry.getKey() + " must be >= 0");
      }
    }
    if (builder.defaultRetentionDays < 0) {
      throw new IllegalArgumentException("defaultRetentionDays must be >= 0");
    }

    this.retentionDays = Map.copyOf(builder.retentionDays);
    this.defaultRetentionDays = builder.defaultRetentionDays;
    this.batchSize = builder.batchSize > 0 ? builder.batchSize : DEFAULT_BATCH_SIZE;
    this.dryRun = builder.dryRun;
    this.sleepSeconds = builder.sleepSeconds > 0 ? builder.sleepSeconds : DEFAULT_SLEEP_SECONDS;
    this.useKeyEnumeration = builder.useKeyEnumeration;
    this.verbose = builder.verbose;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Configured retention per table name. Tables absent here use {@link #defaultRetentionDays()}. */
  public Map<String, Integer> retentionDays() {
    return retentionDays;
  }

  public int defaultRetentionDays() {
    return defaultRetentionDays;
  }

  public int batchSize() {
    return batchSize;
  }

  public boolean dryRun() {
    return dryRun;
  }

  public double sleepSeconds() {
    return sleepSeconds;
  }

  /** Pause between two batches of the same table. */
  public Duration sleep() {
    return Duration.ofNanos(Math.round(sleepSeconds * 1_000_000_000d));
  }

  public boolean useKeyEnumeration() {
    return useKeyEnumeration;
  }

  public boolean verbose() {
    return verbose;
  }

  @Override
  public String toString() {
    return "RunConfig{retentionDays=" + retentionDays +
        ", defaultRetentionDays=" + defaultRetentionDays +
        ", batchSize=" + batchSize +
        ", dryRun=" + dryRun +
        ", sleepSeconds=" + sleepSeconds +
        ", useKeyEnumeration=" + useKeyEnumeration +
        ", verbose=" + verbose + '}';
  }

  /** Builder for {@link RunConfig}. */
  public static final class Builder {
    private final Map<String, Integer> retentionDays = new LinkedHashMap<>();
    private int defaultRetentionDays = DEFAULT_RETENTION_DAYS;
    private int batchSize = DEFAULT_BATCH_SIZE;
    private boolean dryRun;
    private double sleepSeconds = DEFAULT_SLEEP_SECONDS;
    private boolean useKeyEnumeration;
    private boolean verbose;

    private Builder() {}

    /**
     * Sets the retention window of one table.
     *
     * @param tableName the table name, e.g. {@code "dag_run"}
     * @param days      retention in days; must be &ge; 0
     * @return this builder
     */
    public Builder retentionDays(String tableName, int days) {
      this.retentionDays.put(Objects.requireNonNull(tableName, "tableName"), days);
      return this;
    }

    /**
     * Adds every entry of {@code retentionDays}.
     *
     * @param retentionDays table name to retention in days
     * @return this builder
     */
    public Builder retentionDays(Map<String, Integer> retentionDays) {
      Objects.requireNonNull(retentionDays, "retentionDays");
      retentionDays.forEach(this::retentionDays);
      return this;
    }

    /**
     * Sets the retention applied to managed tables without an explicit entry.
     *
     * <p>Optional. Defaults to {@code 30}. Must be &ge; 0.
     *
     * @param days retention in days
     * @return this builder
     */
    public Builder defaultRetentionDays(int days) {
      this.defaultRetentionDays = days;
      return this;
    }

    /**
     * Sets the maximum number of rows per delete batch.
     *
     * <p>Optional. Values &le; 0 fall back to {@code 1000}.
     *
     * @param batchSize max rows per batch
     * @return this builder
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Counts expired rows without deleting them.
     *
     * @param dryRun whether to suppress all deletes
     * @return this builder
     */
    public Builder dryRun(boolean dryRun) {
      this.dryRun = dryRun;
      return this;
    }

    /**
     * Sets the pause between batches, in fractional seconds.
     *
     * <p>Optional. Values &le; 0 fall back to {@code 5.0}.
     *
     * @param sleepSeconds pause in seconds
     * @return this builder
     */
    public Builder sleepSeconds(double sleepSeconds) {
      this.sleepSeconds = sleepSeconds;
      return this;
    }

    /**
     * Selects key-enumeration deletion (select keys, then delete by key) instead of
     * range deletion.
     *
     * @param useKeyEnumeration whether to delete by key
     * @return this builder
     */
    public Builder useKeyEnumeration(boolean useKeyEnumeration) {
      this.useKeyEnumeration = useKeyEnumeration;
      return this;
    }

    /**
     * Logs per-batch progress at INFO instead of FINE. No effect on deletion.
     *
     * @param verbose whether to log every batch
     * @return this builder
     */
    public Builder verbose(boolean verbose) {
      this.verbose = verbose;
      return this;
    }

    /**
     * @throws IllegalArgumentException if a retention value is negative
     */
    public RunConfig build() {
      return new RunConfig(this);
    }
  }
}
