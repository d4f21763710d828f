package io.intellixity.jobly.persistence.sql;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SqlValueTest {
  @Test
  void infersTagFromRuntimeValue() {
    assertEquals(new SqlValue.Text("x"), SqlValue.of("x"));
    assertEquals(new SqlValue.Int(3), SqlValue.of(3));
    assertEquals(new SqlValue.Int(3), SqlValue.of(3L));
    assertEquals(new SqlValue.Real(0.5), SqlValue.of(0.5));
    assertEquals(new SqlValue.Bool(true), SqlValue.of(Boolean.TRUE));
    assertSame(SqlValue.Null.INSTANCE, SqlValue.of(null));
  }

  @Test
  void decimalsSplitOnScale() {
    assertEquals(SqlValue.integer(42), SqlValue.of(new BigDecimal("42")));
    assertEquals(SqlValue.real(0.75), SqlValue.of(new BigDecimal("0.75")));
  }

  @Test
  void rejectsValuesOutsideClosedSet() {
    assertThrows(IllegalArgumentException.class, () -> SqlValue.of(List.of(1)));
    assertThrows(IllegalArgumentException.class, () -> SqlValue.of(new BigDecimal("1e30")));
  }

  @Test
  void nullTextIsNullValue() {
    assertSame(SqlValue.nullValue(), SqlValue.text(null));
    assertNull(SqlValue.nullValue().raw());
  }
}
