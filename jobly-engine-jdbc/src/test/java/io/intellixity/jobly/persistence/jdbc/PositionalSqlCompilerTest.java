package io.intellixity.jobly.persistence.jdbc;

import io.intellixity.jobly.persistence.sql.SqlValue;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class PositionalSqlCompilerTest {
  @Test
  void rewritesPlaceholdersInOrder() {
    var c = PositionalSqlCompiler.compile(
        "UPDATE companies SET \"name\"=$1, \"num_employees\"=$2 WHERE handle = $3",
        List.of(SqlValue.text("Acme"), SqlValue.integer(5), SqlValue.text("acme")));

    assertEquals("UPDATE companies SET \"name\"=?, \"num_employees\"=? WHERE handle = ?", c.jdbcSql());
    assertEquals(List.of(SqlValue.text("Acme"), SqlValue.integer(5), SqlValue.text("acme")), c.binds());
  }

  @Test
  void reordersAndRepeatsBindsByPosition() {
    var c = PositionalSqlCompiler.compile(
        "SELECT * FROM t WHERE a = $2 OR b = $1 OR c = $2",
        List.of(SqlValue.integer(1), SqlValue.integer(2)));

    assertEquals("SELECT * FROM t WHERE a = ? OR b = ? OR c = ?", c.jdbcSql());
    assertEquals(List.of(SqlValue.integer(2), SqlValue.integer(1), SqlValue.integer(2)), c.binds());
  }

  @Test
  void ignoresDollarInsideLiteralsAndIdentifiers() {
    var c = PositionalSqlCompiler.compile(
        "SELECT '$1' AS \"$2\" FROM t WHERE name ILIKE '%' || $1 || '%'",
        List.of(SqlValue.text("net")));

    assertEquals("SELECT '$1' AS \"$2\" FROM t WHERE name ILIKE '%' || ? || '%'", c.jdbcSql());
    assertEquals(1, c.binds().size());
  }

  @Test
  void rejectsPlaceholderWithoutParameter() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> PositionalSqlCompiler.compile("SELECT * FROM t WHERE id = $2", List.of(SqlValue.integer(1))));
    assertTrue(ex.getMessage().contains("$2"));
  }

  @Test
  void rejectsUnreferencedParameter() {
    assertThrows(IllegalArgumentException.class,
        () -> PositionalSqlCompiler.compile("SELECT 1", List.of(SqlValue.integer(1))));
  }

  @Test
  void sqlWithoutParamsPassesThrough() {
    var c = PositionalSqlCompiler.compile("SELECT handle FROM companies ORDER BY name", null);
    assertEquals("SELECT handle FROM companies ORDER BY name", c.jdbcSql());
    assertTrue(c.binds().isEmpty());
  }
}
