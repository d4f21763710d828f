package io.intellixity.jobly.persistence.sql;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Scalar bound to a positional placeholder.
 *
 * <p>Closed set: text, integer, real, boolean and null. Anything else must be converted by the caller
 * before it reaches a builder.</p>
 */
public sealed interface SqlValue permits SqlValue.Text, SqlValue.Int, SqlValue.Real, SqlValue.Bool, SqlValue.Null {

  /** Underlying Java value (String, Long, Double, Boolean or null). */
  Object raw();

  record Text(String value) implements SqlValue {
    public Text {
      Objects.requireNonNull(value, "value");
    }
    @Override public Object raw() { return value; }
  }

  record Int(long value) implements SqlValue {
    @Override public Object raw() { return value; }
  }

  record Real(double value) implements SqlValue {
    @Override public Object raw() { return value; }
  }

  record Bool(boolean value) implements SqlValue {
    @Override public Object raw() { return value; }
  }

  enum Null implements SqlValue {
    INSTANCE;
    @Override public Object raw() { return null; }
  }

  static SqlValue text(String value) {
    return value == null ? Null.INSTANCE : new Text(value);
  }

  static SqlValue integer(long value) { return new Int(value); }

  static SqlValue real(double value) { return new Real(value); }

  static SqlValue bool(boolean value) { return new Bool(value); }

  static SqlValue nullValue() { return Null.INSTANCE; }

  /**
   * Infer the tag from a runtime value.
   *
   * @throws IllegalArgumentException for types outside the closed set
   */
  static SqlValue of(Object v) {
    if (v == null) return Null.INSTANCE;
    if (v instanceof SqlValue sv) return sv;
    if (v instanceof String s) return new Text(s);
    if (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte) {
      return new Int(((Number) v).longValue());
    }
    if (v instanceof Double || v instanceof Float) return new Real(((Number) v).doubleValue());
    if (v instanceof BigDecimal bd) {
      if (bd.scale() <= 0) {
        try {
          return new Int(bd.longValueExact());
        } catch (ArithmeticException e) {
          throw new IllegalArgumentException("Integer out of range: " + bd, e);
        }
      }
      return new Real(bd.doubleValue());
    }
    if (v instanceof Boolean b) return new Bool(b);
    throw new IllegalArgumentException("Unsupported scalar type: " + v.getClass().getName());
  }
}
