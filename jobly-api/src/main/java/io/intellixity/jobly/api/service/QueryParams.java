package io.intellixity.jobly.api.service;

import io.intellixity.jobly.api.error.BadRequestException;
import io.intellixity.jobly.persistence.sql.SqlValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Coercion of raw query-string values into filter criteria. */
final class QueryParams {
  private QueryParams() {}

  static void requireKnownKeys(Map<String, String> raw, Set<String> allowed) {
    List<String> errors = new ArrayList<>();
    for (String k : raw.keySet()) {
      if (!allowed.contains(k)) {
        errors.add("instance is not allowed to have the additional property \"" + k + "\"");
      }
    }
    if (!errors.isEmpty()) throw new BadRequestException(errors);
  }

  static SqlValue nonNegativeInt(String key, String raw) {
    String s = (raw == null) ? "" : raw.trim();
    int n;
    try {
      n = Integer.parseInt(s);
    } catch (NumberFormatException e) {
      throw new BadRequestException("instance." + key + " is not of a type(s) integer");
    }
    if (n < 0) throw new BadRequestException("instance." + key + " must be greater than or equal to 0");
    return SqlValue.integer(n);
  }

  static SqlValue text(String key, String raw) {
    if (raw == null || raw.isEmpty()) {
      throw new BadRequestException("instance." + key + " does not meet minimum length of 1");
    }
    return SqlValue.text(raw);
  }
}
