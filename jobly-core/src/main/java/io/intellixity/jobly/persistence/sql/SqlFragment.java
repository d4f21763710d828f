package io.intellixity.jobly.persistence.sql;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A piece of SQL plus the values for its placeholders.
 *
 * <p>{@code clause} references {@code $1..$n} with {@code n == values().size()}, each exactly once and in
 * increasing order. Callers that embed the fragment continue numbering at {@link #nextPosition()}.</p>
 */
public record SqlFragment(String clause, List<SqlValue> values) {
  private static final SqlFragment EMPTY = new SqlFragment("", List.of());

  public SqlFragment {
    Objects.requireNonNull(clause, "clause");
    values = values == null ? List.of() : List.copyOf(values);
  }

  public static SqlFragment empty() { return EMPTY; }

  public boolean isEmpty() { return clause.isEmpty(); }

  /** 1-based position of the next placeholder a caller may append. */
  public int nextPosition() { return values.size() + 1; }

  /** The fragment's values followed by {@code extra}, ready to hand to an executor. */
  public List<SqlValue> valuesWith(SqlValue... extra) {
    List<SqlValue> out = new ArrayList<>(values.size() + extra.length);
    out.addAll(values);
    out.addAll(Arrays.asList(extra));
    return List.copyOf(out);
  }
}
