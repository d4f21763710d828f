package io.intellixity.jobly.persistence.sql;

/** Identifier quoting and placeholder rendering shared by the clause builders. */
public final class SqlIdents {
  public static final String PLACEHOLDER_PREFIX = "$";

  private SqlIdents() {}

  /**
   * Wrap an identifier in double quotes.
   *
   * <p>Embedded quotes are not escaped: identifiers come from static column tables, never from request
   * input.</p>
   */
  public static String quote(String ident) {
    if (ident == null || ident.isEmpty()) throw new IllegalArgumentException("Blank identifier");
    return "\"" + ident + "\"";
  }

  /** Render a 1-based positional placeholder, e.g. {@code $3}. */
  public static String placeholder(int position) {
    if (position < 1) throw new IllegalArgumentException("Placeholder position must be >= 1: " + position);
    return PLACEHOLDER_PREFIX + position;
  }
}
