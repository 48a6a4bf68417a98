package com.gentoro.analytics.model;

/** Classifies a column as {@link ColumnKind#NUMERIC} or {@link ColumnKind#CATEGORICAL}. */
public final class ColumnClassifier {
  private ColumnClassifier() {}

  /**
   * A column is numeric when every non-missing value coerces through {@link NumericCoercion}. A
   * column without any non-missing value is numeric as well.
   */
  public static ColumnKind classify(Iterable<?> values) {
    for (Object value : values) {
      if (value != null && !NumericCoercion.isNumeric(value)) {
        return ColumnKind.CATEGORICAL;
      }
    }
    return ColumnKind.NUMERIC;
  }
}
