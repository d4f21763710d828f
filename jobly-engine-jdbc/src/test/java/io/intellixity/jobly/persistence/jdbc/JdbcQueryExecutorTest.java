package io.intellixity.jobly.persistence.jdbc;

import io.intellixity.jobly.persistence.sql.SqlValue;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcQueryExecutorTest {

  /** Records what the executor does against a JDBC driver that never leaves the JVM. */
  private static final class FakeDriver {
    final List<String> prepared = new ArrayList<>();
    final List<String> bindCalls = new ArrayList<>();
    final List<String> columns;
    final List<Object[]> rows;
    int updateCount;
    int closedConnections;
    SQLException failOnExecute;

    FakeDriver(List<String> columns, List<Object[]> rows) {
      this.columns = columns;
      this.rows = rows;
    }

    DataSource dataSource() {
      return proxy(DataSource.class, (name, args) -> name.equals("getConnection") ? connection() : null);
    }

    private Connection connection() {
      return proxy(Connection.class, (name, args) -> switch (name) {
        case "prepareStatement" -> {
          prepared.add((String) args[0]);
          yield statement();
        }
        case "close" -> {
          closedConnections++;
          yield null;
        }
        default -> null;
      });
    }

    private PreparedStatement statement() {
      return proxy(PreparedStatement.class, (name, args) -> {
        if (name.startsWith("set")) {
          bindCalls.add(name + "(" + args[0] + "," + args[1] + ")");
          return null;
        }
        if (name.equals("executeQuery")) {
          if (failOnExecute != null) throw failOnExecute;
          return resultSet();
        }
        if (name.equals("executeUpdate")) {
          if (failOnExecute != null) throw failOnExecute;
          return updateCount;
        }
        return null;
      });
    }

    private ResultSet resultSet() {
      int[] cursor = {-1};
      ResultSetMetaData md = proxy(ResultSetMetaData.class, (name, args) -> switch (name) {
        case "getColumnCount" -> columns.size();
        case "getColumnLabel" -> columns.get((Integer) args[0] - 1);
        default -> null;
      });
      return proxy(ResultSet.class, (name, args) -> switch (name) {
        case "next" -> ++cursor[0] < rows.size();
        case "getMetaData" -> md;
        case "getObject" -> rows.get(cursor[0])[(Integer) args[0] - 1];
        default -> null;
      });
    }
  }

  private interface Handler {
    Object handle(String method, Object[] args) throws Throwable;
  }

  @SuppressWarnings("unchecked")
  private static <T> T proxy(Class<T> type, Handler h) {
    return (T) Proxy.newProxyInstance(type.getClassLoader(), new Class<?>[]{type}, (p, m, args) -> {
      Object out = h.handle(m.getName(), args);
      if (out == null && m.getReturnType() == boolean.class) return false;
      if (out == null && m.getReturnType() == int.class) return 0;
      if (out == null && m.getReturnType() == long.class) return 0L;
      return out;
    });
  }

  @Test
  void compilesBindsAndReadsRows() {
    FakeDriver driver = new FakeDriver(
        List.of("handle", "numEmployees"),
        List.of(new Object[]{"c1", 10}, new Object[]{"c2", null}));
    QueryExecutor exec = new JdbcQueryExecutor(driver.dataSource());

    List<Map<String, Object>> rows = exec.query(
        "SELECT handle, num_employees AS \"numEmployees\" FROM companies WHERE num_employees >= $1 AND name ILIKE '%' || $2 || '%'",
        List.of(SqlValue.integer(5), SqlValue.text("c")),
        row -> {
          Map<String, Object> m = new java.util.LinkedHashMap<>();
          m.put("handle", row.string("handle"));
          m.put("numEmployees", row.integer("numEmployees"));
          return m;
        });

    assertEquals(List.of(
        "SELECT handle, num_employees AS \"numEmployees\" FROM companies WHERE num_employees >= ? AND name ILIKE '%' || ? || '%'"),
        driver.prepared);
    assertEquals(List.of("setLong(1,5)", "setString(2,c)"), driver.bindCalls);
    assertEquals(2, rows.size());
    assertEquals("c1", rows.get(0).get("handle"));
    assertEquals(10, rows.get(0).get("numEmployees"));
    assertNull(rows.get(1).get("numEmployees"));
    assertEquals(1, driver.closedConnections);
  }

  @Test
  void bindsEveryTag() {
    FakeDriver driver = new FakeDriver(List.of(), List.of());
    driver.updateCount = 1;
    QueryExecutor exec = new JdbcQueryExecutor(driver.dataSource());

    long n = exec.update("UPDATE jobs SET \"title\"=$1, \"salary\"=$2, \"equity\"=$3, \"x\"=$4, \"y\"=$5 WHERE id = $6",
        List.of(SqlValue.text("t"), SqlValue.integer(1), SqlValue.real(0.5), SqlValue.bool(true),
            SqlValue.nullValue(), SqlValue.integer(7)));

    assertEquals(1, n);
    assertEquals(List.of(
        "setString(1,t)", "setLong(2,1)", "setDouble(3,0.5)", "setBoolean(4,true)",
        "setNull(5," + Types.NULL + ")", "setLong(6,7)"), driver.bindCalls);
  }

  @Test
  void queryOneReturnsNullWhenNoRows() {
    FakeDriver driver = new FakeDriver(List.of("id"), List.of());
    QueryExecutor exec = new JdbcQueryExecutor(driver.dataSource());

    assertNull(exec.queryOne("SELECT id FROM jobs WHERE id = $1", List.of(SqlValue.integer(1)), r -> r.integer("id")));
  }

  @Test
  void wrapsDriverErrors() {
    FakeDriver driver = new FakeDriver(List.of(), List.of());
    driver.failOnExecute = new SQLException("duplicate key", "23505");
    QueryExecutor exec = new JdbcQueryExecutor(driver.dataSource());

    QueryExecutionException ex = assertThrows(QueryExecutionException.class,
        () -> exec.update("DELETE FROM jobs WHERE id = $1", List.of(SqlValue.integer(1))));
    assertEquals("23505", ex.sqlState());
    assertEquals(1, driver.closedConnections);
  }
}
