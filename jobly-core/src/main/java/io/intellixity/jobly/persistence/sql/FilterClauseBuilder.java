package io.intellixity.jobly.persistence.sql;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders recognized filter criteria into an {@code AND}-joined predicate list.
 *
 * <p>Rules are visited in their declared order, so the generated SQL and the placeholder numbering depend only
 * on which keys are present, never on how {@code criteria} iterates. Keys without a rule are ignored; no
 * matching key yields {@link SqlFragment#empty()} and the caller omits {@code WHERE}.</p>
 */
public final class FilterClauseBuilder {
  private FilterClauseBuilder() {}

  public static SqlFragment build(Map<String, SqlValue> criteria, List<FilterRule> rules) {
    if (criteria == null || criteria.isEmpty() || rules == null || rules.isEmpty()) return SqlFragment.empty();

    List<String> predicates = new ArrayList<>();
    List<SqlValue> values = new ArrayList<>();
    for (FilterRule rule : rules) {
      if (!criteria.containsKey(rule.key())) continue;
      values.add(rule.bind(criteria.get(rule.key())));
      predicates.add(rule.render(values.size()));
    }
    if (predicates.isEmpty()) return SqlFragment.empty();
    return new SqlFragment(String.join(" AND ", predicates), values);
  }
}
