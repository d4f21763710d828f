package io.intellixity.jobly.persistence.sql;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Logical field name to physical column name table for one entity.
 *
 * <p>Not total: names without an entry resolve to themselves.</p>
 */
public final class ColumnNames {
  private static final ColumnNames IDENTITY = new ColumnNames(Map.of());

  private final Map<String, String> columns;

  private ColumnNames(Map<String, String> columns) {
    this.columns = Map.copyOf(columns);
  }

  public static ColumnNames identity() { return IDENTITY; }

  public static ColumnNames of(Map<String, String> columns) {
    Objects.requireNonNull(columns, "columns");
    for (var e : columns.entrySet()) {
      if (e.getKey() == null || e.getKey().isBlank()) throw new IllegalArgumentException("Blank logical name");
      if (e.getValue() == null || e.getValue().isBlank()) {
        throw new IllegalArgumentException("Blank column for logical name '" + e.getKey() + "'");
      }
    }
    return columns.isEmpty() ? IDENTITY : new ColumnNames(columns);
  }

  public static ColumnNames of(String logical, String column) {
    return of(Map.of(logical, column));
  }

  public static ColumnNames of(String logical1, String column1, String logical2, String column2) {
    Map<String, String> m = new LinkedHashMap<>();
    m.put(logical1, column1);
    m.put(logical2, column2);
    return of(m);
  }

  public String resolve(String logical) {
    String col = columns.get(logical);
    return col == null ? logical : col;
  }
}
