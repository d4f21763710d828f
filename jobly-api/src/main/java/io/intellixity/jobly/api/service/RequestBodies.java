package io.intellixity.jobly.api.service;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.jobly.api.error.BadRequestException;
import io.intellixity.jobly.persistence.sql.SqlValue;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validates JSON request bodies against a closed field list and converts them to {@link SqlValue}s.
 *
 * <p>Output order is the order fields appear in the body. All problems are collected and reported in one
 * {@link BadRequestException}.</p>
 */
public final class RequestBodies {
  private RequestBodies() {}

  public enum FieldKind {
    TEXT,
    NON_NEGATIVE_INT,
    /** Fraction in [0, 1], as a JSON number or a numeric string. */
    EQUITY
  }

  public record FieldSpec(String name, FieldKind kind, boolean required, boolean nullable, int maxLength) {
    public static FieldSpec required(String name, FieldKind kind) {
      return new FieldSpec(name, kind, true, false, 0);
    }

    public static FieldSpec optional(String name, FieldKind kind) {
      return new FieldSpec(name, kind, false, true, 0);
    }

    /** May be left out, but may not be cleared to null. */
    public static FieldSpec optionalNonNull(String name, FieldKind kind) {
      return new FieldSpec(name, kind, false, false, 0);
    }

    public FieldSpec maxLength(int max) {
      return new FieldSpec(name, kind, required, nullable, max);
    }
  }

  /** Create payload: required fields must be present. */
  public static Map<String, SqlValue> forCreate(JsonNode body, List<FieldSpec> specs) {
    return read(body, specs, false);
  }

  /** Patch payload: any subset of fields; emptiness is left to the update builder. */
  public static Map<String, SqlValue> forPatch(JsonNode body, List<FieldSpec> specs) {
    return read(body, specs, true);
  }

  private static Map<String, SqlValue> read(JsonNode body, List<FieldSpec> specs, boolean partial) {
    if (body == null || body.isNull() || body.isMissingNode()) {
      if (partial) return new LinkedHashMap<>();
      throw new BadRequestException("Request body is required");
    }
    if (!body.isObject()) throw new BadRequestException("Request body must be a JSON object");

    Map<String, FieldSpec> byName = new LinkedHashMap<>();
    for (FieldSpec s : specs) byName.put(s.name(), s);

    List<String> errors = new ArrayList<>();
    Map<String, SqlValue> out = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> it = body.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      FieldSpec spec = byName.get(e.getKey());
      if (spec == null) {
        errors.add("instance is not allowed to have the additional property \"" + e.getKey() + "\"");
        continue;
      }
      SqlValue v = convert(spec, e.getValue(), errors);
      if (v != null) out.put(spec.name(), v);
    }

    if (!partial) {
      for (FieldSpec s : specs) {
        if (s.required() && !out.containsKey(s.name()) && !body.has(s.name())) {
          errors.add("instance requires property \"" + s.name() + "\"");
        }
      }
    }

    if (!errors.isEmpty()) throw new BadRequestException(errors);
    return out;
  }

  private static SqlValue convert(FieldSpec spec, JsonNode node, List<String> errors) {
    String field = "instance." + spec.name();
    if (node == null || node.isNull()) {
      if (spec.nullable()) return SqlValue.nullValue();
      errors.add(field + " must not be null");
      return null;
    }

    return switch (spec.kind()) {
      case TEXT -> {
        if (!node.isTextual()) {
          errors.add(field + " is not of a type(s) string");
          yield null;
        }
        String s = node.textValue();
        if (spec.required() && s.isEmpty()) {
          errors.add(field + " does not meet minimum length of 1");
          yield null;
        }
        if (spec.maxLength() > 0 && s.length() > spec.maxLength()) {
          errors.add(field + " does not meet maximum length of " + spec.maxLength());
          yield null;
        }
        yield SqlValue.text(s);
      }
      case NON_NEGATIVE_INT -> {
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
          errors.add(field + " is not of a type(s) integer");
          yield null;
        }
        int n = node.intValue();
        if (n < 0) {
          errors.add(field + " must be greater than or equal to 0");
          yield null;
        }
        yield SqlValue.integer(n);
      }
      case EQUITY -> {
        BigDecimal d = equity(node);
        if (d == null || d.signum() < 0 || d.compareTo(BigDecimal.ONE) > 0) {
          errors.add(field + " must be a number between 0 and 1");
          yield null;
        }
        yield SqlValue.real(d.doubleValue());
      }
    };
  }

  private static BigDecimal equity(JsonNode node) {
    if (node.isNumber()) return node.decimalValue();
    if (!node.isTextual()) return null;
    try {
      return new BigDecimal(node.textValue().trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
