package io.intellixity.jobly.persistence.sql;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class FilterClauseBuilderTest {
  private static final List<FilterRule> RULES = List.of(
      FilterRule.containsIgnoreCase("name", "name"),
      FilterRule.atLeast("min", "size"),
      FilterRule.atMost("max", "size"),
      FilterRule.greaterThanConstant("flag", "amount", SqlValue.integer(0))
  );

  @Test
  void emptyCriteriaRendersNothing() {
    SqlFragment f = FilterClauseBuilder.build(Map.of(), RULES);
    assertEquals("", f.clause());
    assertEquals(List.of(), f.values());
    assertTrue(f.isEmpty());
  }

  @Test
  void usesDeclaredOrderNotCriteriaOrder() {
    Map<String, SqlValue> criteria = new LinkedHashMap<>();
    criteria.put("max", SqlValue.integer(50));
    criteria.put("name", SqlValue.text("net"));
    criteria.put("min", SqlValue.integer(10));

    SqlFragment f = FilterClauseBuilder.build(criteria, RULES);

    assertEquals("name ILIKE '%' || $1 || '%' AND size >= $2 AND size <= $3", f.clause());
    assertEquals(List.of(SqlValue.text("net"), SqlValue.integer(10), SqlValue.integer(50)), f.values());
  }

  @Test
  void numbersOnlyMatchedRules() {
    Map<String, SqlValue> criteria = new LinkedHashMap<>();
    criteria.put("max", SqlValue.integer(5));

    SqlFragment f = FilterClauseBuilder.build(criteria, RULES);

    assertEquals("size <= $1", f.clause());
    assertEquals(List.of(SqlValue.integer(5)), f.values());
  }

  @Test
  void transformReplacesCriteriaValue() {
    SqlFragment f = FilterClauseBuilder.build(Map.of("flag", SqlValue.bool(true)), RULES);

    assertEquals("amount > $1", f.clause());
    assertEquals(List.of(SqlValue.integer(0)), f.values());
  }

  @Test
  void ignoresUnknownKeys() {
    SqlFragment f = FilterClauseBuilder.build(Map.of("color", SqlValue.text("red")), RULES);
    assertTrue(f.isEmpty());
  }

  @Test
  void sameInputSameOutput() {
    Map<String, SqlValue> criteria = Map.of("min", SqlValue.integer(1), "name", SqlValue.text("a"));
    assertEquals(FilterClauseBuilder.build(criteria, RULES), FilterClauseBuilder.build(criteria, RULES));
  }

  @Test
  void ruleTemplateMustHaveOneSlot() {
    assertThrows(IllegalArgumentException.class, () -> FilterRule.of("a", "a = 1"));
    assertThrows(IllegalArgumentException.class, () -> FilterRule.of("a", "a BETWEEN {} AND {}"));
    assertThrows(IllegalArgumentException.class, () -> FilterRule.of(" ", "a = {}"));
  }
}
