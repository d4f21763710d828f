package io.intellixity.jobly.persistence.jdbc;

import io.intellixity.jobly.persistence.sql.SqlValue;

import java.util.List;

/**
 * Parameterized statement execution.
 *
 * <p>{@code sql} uses {@code $1..$n} positional placeholders matching {@code params} by position and count.</p>
 */
public interface QueryExecutor {
  /** Run a row-returning statement (SELECT, or DML with RETURNING). */
  <T> List<T> query(String sql, List<SqlValue> params, RowReader<T> reader);

  /** Run a statement without a result set; returns the affected row count. */
  long update(String sql, List<SqlValue> params);

  default <T> T queryOne(String sql, List<SqlValue> params, RowReader<T> reader) {
    List<T> rows = query(sql, params, reader);
    return rows.isEmpty() ? null : rows.get(0);
  }
}
