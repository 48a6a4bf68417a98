package com.gentoro.analytics.model;

import java.math.BigDecimal;
import java.util.Objects;

/** A named, typed column of a {@link Dataset}. */
public record Column(String name, ColumnKind kind) {
  public Column {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(kind, "kind");
  }

  public boolean isNumeric() {
    return kind == ColumnKind.NUMERIC;
  }

  /**
   * Text used to group and label a cell of this column: the canonical number for numeric columns
   * ({@code 10.0 -> "10"}), the plain string otherwise. Returns {@code null} for missing values,
   * including numeric cells that do not coerce.
   */
  public String keyOf(Object value) {
    if (value == null) {
      return null;
    }
    if (kind == ColumnKind.NUMERIC) {
      BigDecimal exact = NumericCoercion.toBigDecimal(value);
      return exact == null ? null : NumericCoercion.canonical(exact);
    }
    return String.valueOf(value);
  }
}
