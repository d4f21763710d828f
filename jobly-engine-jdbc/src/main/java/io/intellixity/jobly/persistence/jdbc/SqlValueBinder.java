package io.intellixity.jobly.persistence.jdbc;

import io.intellixity.jobly.persistence.sql.SqlValue;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;

/** Binds a {@link SqlValue} into a JDBC parameter slot according to its tag. */
public final class SqlValueBinder {
  private SqlValueBinder() {}

  public static void bind(PreparedStatement ps, int index, SqlValue value) throws SQLException {
    if (value == null || value instanceof SqlValue.Null) {
      ps.setNull(index, Types.NULL);
    } else if (value instanceof SqlValue.Text t) {
      ps.setString(index, t.value());
    } else if (value instanceof SqlValue.Int i) {
      ps.setLong(index, i.value());
    } else if (value instanceof SqlValue.Real r) {
      ps.setDouble(index, r.value());
    } else if (value instanceof SqlValue.Bool b) {
      ps.setBoolean(index, b.value());
    } else {
      throw new IllegalArgumentException("Unsupported SqlValue: " + value.getClass().getName());
    }
  }
}
