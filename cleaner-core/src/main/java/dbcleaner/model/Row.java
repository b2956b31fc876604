package dbcleaner.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One materialized result row, readable by position or by column name.
 *
 * <p>Column-name lookups are case-insensitive because catalogs disagree on the case
 * they report labels in.
 */
public final class Row {
  private final List<String> columns;
  private final List<Object> values;

  private Row(List<String> columns, List<Object> values) {
    this.columns = columns;
    this.values = values;
  }

  /**
   * Creates a row from parallel column and value lists.
   *
   * @throws IllegalArgumentException if the lists differ in size
   */
  public static Row of(List<String> columns, List<?> values) {
    Objects.requireNonNull(columns, "columns");
    Objects.requireNonNull(values, "values");
    if (columns.size() != values.size()) {
      throw new IllegalArgumentException(
          "columns and values differ in size: " + columns.size() + " vs " + values.size());
    }
    return new Row(List.copyOf(columns), Collections.unmodifiableList(new ArrayList<>(values)));
  }

  /** Single-column row. */
  public static Row single(String column, Object value) {
    return of(List.of(column), Collections.singletonList(value));
  }

  public int size() {
    return values.size();
  }

  /** Value at a zero-based position. */
  public Object get(int index) {
    return values.get(index);
  }

  /**
   * Value of a named column.
   *
   * @throws IllegalArgumentException if the row has no such column
   */
  public Object get(String column) {
    for (int i = 0; i < columns.size(); i++) {
      if (columns.get(i).equalsIgnoreCase(column)) {
        return values.get(i);
      }
    }
    throw new IllegalArgumentException("No column " + column + " in row " + columns);
  }

  /** Column-to-value view in column order. */
  public Map<String, Object> asMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    for (int i = 0; i < columns.size(); i++) {
      map.put(columns.get(i), values.get(i));
    }
    return Collections.unmodifiableMap(map);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Row other)) return false;
    return columns.equals(other.columns) && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return Objects.hash(columns, values);
  }

  @Override
  public String toString() {
    return "Row" + asMap();
  }
}
