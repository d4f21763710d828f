package io.intellixity.jobly.persistence.sql;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Renders a partial update into a {@code SET} list.
 *
 * <pre>
 *   {firstName: "Aliya", age: 32} + {firstName -> first_name}
 *     => "first_name"=$1, "age"=$2   values ["Aliya", 32]
 * </pre>
 *
 * Placeholder order follows the iteration order of the update map, so callers should pass an ordered map
 * (e.g. {@link java.util.LinkedHashMap}). The result says nothing about table or row; callers append their
 * own {@code WHERE} starting at {@link SqlFragment#nextPosition()}.
 */
public final class UpdateClauseBuilder {
  private UpdateClauseBuilder() {}

  /**
   * @throws NoUpdateDataException if {@code updates} is empty
   */
  public static SqlFragment build(Map<String, SqlValue> updates, ColumnNames columns) {
    if (updates == null || updates.isEmpty()) throw new NoUpdateDataException();
    ColumnNames names = (columns == null) ? ColumnNames.identity() : columns;

    List<String> sets = new ArrayList<>(updates.size());
    List<SqlValue> values = new ArrayList<>(updates.size());
    int n = 1;
    for (var e : updates.entrySet()) {
      String field = Objects.requireNonNull(e.getKey(), "field name");
      sets.add(SqlIdents.quote(names.resolve(field)) + "=" + SqlIdents.placeholder(n++));
      values.add(e.getValue() == null ? SqlValue.nullValue() : e.getValue());
    }
    return new SqlFragment(String.join(", ", sets), values);
  }
}
