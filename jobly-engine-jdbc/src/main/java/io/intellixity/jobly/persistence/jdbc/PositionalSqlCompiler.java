package io.intellixity.jobly.persistence.jdbc;

import io.intellixity.jobly.persistence.sql.SqlValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiles SQL with Postgres-style positional placeholders ({@code $1..$n}) into JDBC SQL with '?' binds.
 *
 * Rules:
 * - A placeholder is '$' followed by one or more digits.
 * - Placeholders inside single-quoted literals or double-quoted identifiers are ignored.
 * - A position may appear more than once; the JDBC bind list repeats its value.
 * - Every position in 1..params.size() must be referenced and no position may exceed it.
 */
public final class PositionalSqlCompiler {
  private PositionalSqlCompiler() {}

  public record Compiled(String jdbcSql, List<SqlValue> binds) {
    public Compiled {
      binds = List.copyOf(binds);
    }
  }

  public static Compiled compile(String sql, List<SqlValue> params) {
    if (sql == null) throw new IllegalArgumentException("SQL is null");
    List<SqlValue> effective = (params == null) ? List.of() : params;

    StringBuilder out = new StringBuilder(sql.length());
    List<SqlValue> binds = new ArrayList<>();
    boolean[] seen = new boolean[effective.size()];
    boolean inSingleQuote = false;
    boolean inDoubleQuote = false;

    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (ch == '\'' && !inDoubleQuote) {
        inSingleQuote = !inSingleQuote;
        out.append(ch);
        continue;
      }
      if (ch == '"' && !inSingleQuote) {
        inDoubleQuote = !inDoubleQuote;
        out.append(ch);
        continue;
      }

      if (!inSingleQuote && !inDoubleQuote && ch == '$'
          && i + 1 < sql.length() && isDigit(sql.charAt(i + 1))) {
        int end = i + 1;
        while (end < sql.length() && isDigit(sql.charAt(end))) end++;
        int position = parsePosition(sql.substring(i + 1, end));
        if (position < 1 || position > effective.size()) {
          throw new IllegalArgumentException(
              "Placeholder $" + position + " has no parameter (" + effective.size() + " supplied)");
        }
        seen[position - 1] = true;
        binds.add(effective.get(position - 1));
        out.append('?');
        i = end - 1;
        continue;
      }

      out.append(ch);
    }

    for (int i = 0; i < seen.length; i++) {
      if (!seen[i]) throw new IllegalArgumentException("Parameter " + (i + 1) + " is never referenced");
    }
    return new Compiled(out.toString(), binds);
  }

  private static int parsePosition(String digits) {
    try {
      return Integer.parseInt(digits);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Placeholder out of range: $" + digits, e);
    }
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }
}
