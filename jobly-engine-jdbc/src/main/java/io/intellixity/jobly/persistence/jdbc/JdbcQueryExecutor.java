package io.intellixity.jobly.persistence.jdbc;

import io.intellixity.jobly.persistence.sql.SqlValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** {@link QueryExecutor} over a pooled {@link DataSource}; one connection per call, auto-commit. */
public final class JdbcQueryExecutor implements QueryExecutor {
  private static final Logger log = LoggerFactory.getLogger(JdbcQueryExecutor.class);

  private final DataSource ds;

  public JdbcQueryExecutor(DataSource ds) {
    this.ds = Objects.requireNonNull(ds, "ds");
  }

  @Override
  public <T> List<T> query(String sql, List<SqlValue> params, RowReader<T> reader) {
    Objects.requireNonNull(reader, "reader");
    PositionalSqlCompiler.Compiled compiled = PositionalSqlCompiler.compile(sql, params);
    long start = System.nanoTime();
    debugSql("QUERY", compiled);
    try (Connection c = ds.getConnection();
         PreparedStatement ps = c.prepareStatement(compiled.jdbcSql())) {
      bindAll(ps, compiled.binds());
      try (ResultSet rs = ps.executeQuery()) {
        List<T> out = new ArrayList<>();
        RowAdapter row = new JdbcRowAdapter(rs);
        while (rs.next()) out.add(reader.read(row));
        debugDone("QUERY", out.size(), System.nanoTime() - start);
        return out;
      }
    } catch (SQLException e) {
      throw new QueryExecutionException("Query failed: " + e.getMessage(), e);
    }
  }

  @Override
  public long update(String sql, List<SqlValue> params) {
    PositionalSqlCompiler.Compiled compiled = PositionalSqlCompiler.compile(sql, params);
    long start = System.nanoTime();
    debugSql("UPDATE", compiled);
    try (Connection c = ds.getConnection();
         PreparedStatement ps = c.prepareStatement(compiled.jdbcSql())) {
      bindAll(ps, compiled.binds());
      long n = ps.executeUpdate();
      debugDone("UPDATE", n, System.nanoTime() - start);
      return n;
    } catch (SQLException e) {
      throw new QueryExecutionException("Update failed: " + e.getMessage(), e);
    }
  }

  private static void bindAll(PreparedStatement ps, List<SqlValue> binds) throws SQLException {
    for (int i = 0; i < binds.size(); i++) {
      SqlValueBinder.bind(ps, i + 1, binds.get(i));
    }
  }

  private static void debugSql(String op, PositionalSqlCompiler.Compiled compiled) {
    if (!log.isDebugEnabled()) return;
    log.debug("jobly.jdbc op={} bindCount={} sql={}", op, compiled.binds().size(), compiled.jdbcSql());

    // TRACE: bind summary only (no raw values; avoids PII leaks)
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (SqlValue v : compiled.binds()) {
        Object raw = (v == null) ? null : v.raw();
        int len = (raw instanceof CharSequence cs) ? cs.length() : -1;
        log.trace("jobly.jdbc bind index={} tag={} valueLen={}",
            idx++, v == null ? "null" : v.getClass().getSimpleName(), len);
      }
    }
  }

  private static void debugDone(String op, long result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("jobly.jdbc_done op={} durationMs={} result={}", op, durationNanos / 1_000_000.0, result);
  }
}
