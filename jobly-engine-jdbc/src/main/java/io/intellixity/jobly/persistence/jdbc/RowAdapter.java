package io.intellixity.jobly.persistence.jdbc;

import java.math.BigDecimal;

/** Read access to the current row by column label. */
public interface RowAdapter {
  Object raw(String label);

  default String string(String label) {
    Object v = raw(label);
    return v == null ? null : String.valueOf(v);
  }

  default Integer integer(String label) {
    Object v = raw(label);
    if (v == null) return null;
    if (v instanceof Number n) return n.intValue();
    return Integer.valueOf(String.valueOf(v).trim());
  }

  default BigDecimal decimal(String label) {
    Object v = raw(label);
    if (v == null) return null;
    if (v instanceof BigDecimal bd) return bd;
    return new BigDecimal(String.valueOf(v).trim());
  }
}
