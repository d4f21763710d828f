package io.intellixity.jobly.persistence.jdbc;

/** Wraps a driver failure raised while preparing, binding or running a statement. */
public final class QueryExecutionException extends RuntimeException {
  private final String sqlState;

  public QueryExecutionException(String message, Throwable cause) {
    super(message, cause);
    this.sqlState = (cause instanceof java.sql.SQLException se) ? se.getSQLState() : null;
  }

  /** SQLSTATE of the underlying driver error, or null. */
  public String sqlState() { return sqlState; }
}
