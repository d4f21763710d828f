package io.intellixity.jobly.persistence.jdbc;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.Map;

public final class JdbcRowAdapter implements RowAdapter {
  private final ResultSet rs;
  private Map<String, Integer> colIndex;

  public JdbcRowAdapter(ResultSet rs) {
    this.rs = rs;
  }

  @Override
  public Object raw(String label) {
    try {
      return rs.getObject(indexOf(label));
    } catch (SQLException e) {
      throw new QueryExecutionException("Failed to read column '" + label + "'", e);
    }
  }

  private int indexOf(String label) throws SQLException {
    if (colIndex == null) {
      colIndex = new HashMap<>();
      ResultSetMetaData md = rs.getMetaData();
      for (int i = 1; i <= md.getColumnCount(); i++) {
        colIndex.put(md.getColumnLabel(i), i);
      }
    }
    Integer i = colIndex.get(label);
    if (i == null) throw new IllegalArgumentException("Unknown column label: " + label);
    return i;
  }
}
