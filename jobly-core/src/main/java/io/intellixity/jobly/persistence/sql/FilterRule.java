package io.intellixity.jobly.persistence.sql;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Maps one recognized filter key to a predicate template.
 *
 * <p>The template contains {@link #SLOT} exactly once; the builder replaces it with the current positional
 * placeholder. {@code valueTransform} is optional and, when present, decides the bound value.</p>
 */
public record FilterRule(String key, String predicateTemplate, UnaryOperator<SqlValue> valueTransform) {
  public static final String SLOT = "{}";

  public FilterRule {
    if (key == null || key.isBlank()) throw new IllegalArgumentException("Filter rule key is blank");
    Objects.requireNonNull(predicateTemplate, "predicateTemplate");
    int first = predicateTemplate.indexOf(SLOT);
    if (first < 0 || predicateTemplate.indexOf(SLOT, first + SLOT.length()) >= 0) {
      throw new IllegalArgumentException(
          "Predicate template for '" + key + "' must contain " + SLOT + " exactly once: " + predicateTemplate);
    }
  }

  public static FilterRule of(String key, String predicateTemplate) {
    return new FilterRule(key, predicateTemplate, null);
  }

  /** Case-insensitive partial match: {@code column ILIKE '%' || $n || '%'}. */
  public static FilterRule containsIgnoreCase(String key, String column) {
    return of(key, column + " ILIKE '%' || " + SLOT + " || '%'");
  }

  public static FilterRule atLeast(String key, String column) {
    return of(key, column + " >= " + SLOT);
  }

  public static FilterRule atMost(String key, String column) {
    return of(key, column + " <= " + SLOT);
  }

  /** {@code column > $n} bound to {@code literal}; the criteria value only switches the rule on. */
  public static FilterRule greaterThanConstant(String key, String column, SqlValue literal) {
    Objects.requireNonNull(literal, "literal");
    return new FilterRule(key, column + " > " + SLOT, ignored -> literal);
  }

  String render(int position) {
    return predicateTemplate.replace(SLOT, SqlIdents.placeholder(position));
  }

  SqlValue bind(SqlValue criteriaValue) {
    SqlValue v = (criteriaValue == null) ? SqlValue.nullValue() : criteriaValue;
    if (valueTransform == null) return v;
    SqlValue out = valueTransform.apply(v);
    return out == null ? SqlValue.nullValue() : out;
  }
}
