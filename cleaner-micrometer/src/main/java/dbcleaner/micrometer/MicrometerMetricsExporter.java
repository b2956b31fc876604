package dbcleaner.micrometer;

import dbcleaner.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Meters are tagged with {@code table} and registered on first use for each table.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code dbcleaner.rows.expired} : rows counted as expired at job start</li>
 *   <li>{@code dbcleaner.rows.deleted} : rows deleted</li>
 *   <li>{@code dbcleaner.batches} : delete batches executed</li>
 *   <li>{@code dbcleaner.statements.delete} : physical DELETE statements issued</li>
 *   <li>{@code dbcleaner.tables.skipped} : tables skipped for a missing date column</li>
 *   <li>{@code dbcleaner.tables.failed} : table jobs that failed</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code dbcleaner.batch.duration} : wall-clock time per batch, pause excluded</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {
  public static final String DEFAULT_PREFIX = "dbcleaner";
  static final String TABLE_TAG = "table";

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Map<String, Meter> meters = new ConcurrentHashMap<>();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "dbcleaner"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, DEFAULT_PREFIX);
  }

  /**
   * Creates an exporter with a custom metric name prefix.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "airflow.cleaner"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }
    this.registry = registry;
    this.namePrefix = namePrefix;
  }

  @Override
  public void recordExpiredRows(String tableName, long count) {
    if (closed) return;
    counter("rows.expired", "Rows counted as expired at job start", tableName).increment(count);
  }

  @Override
  public void incrementRowsDeleted(String tableName, long rows) {
    if (closed) return;
    counter("rows.deleted", "Rows deleted", tableName).increment(rows);
  }

  @Override
  public void incrementBatches(String tableName) {
    if (closed) return;
    counter("batches", "Delete batches executed", tableName).increment();
  }

  @Override
  public void incrementDeleteStatements(String tableName) {
    if (closed) return;
    counter("statements.delete", "DELETE statements issued", tableName).increment();
  }

  @Override
  public void recordBatchDurationMs(String tableName, long durationMs) {
    if (closed) return;
    Timer timer = (Timer) meters.computeIfAbsent(key("batch.duration", tableName),
        k -> Timer.builder(namePrefix + ".batch.duration")
            .description("Wall-clock time per delete batch")
            .tag(TABLE_TAG, tableName)
            .register(registry));
    timer.record(Duration.ofMillis(durationMs));
  }

  @Override
  public void incrementTablesSkipped(String tableName) {
    if (closed) return;
    counter("tables.skipped", "Tables skipped for a missing date column", tableName).increment();
  }

  @Override
  public void incrementTablesFailed(String tableName) {
    if (closed) return;
    counter("tables.failed", "Table jobs that failed", tableName).increment();
  }

  private Counter counter(String suffix, String description, String tableName) {
    return (Counter) meters.computeIfAbsent(key(suffix, tableName),
        k -> Counter.builder(namePrefix + "." + suffix)
            .description(description)
            .tag(TABLE_TAG, tableName)
            .register(registry));
  }

  private static String key(String suffix, String tableName) {
    return suffix + '|' + tableName;
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : new ArrayList<>(meters.values())) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    meters.clear();
    if (first != null) throw first;
  }
}
