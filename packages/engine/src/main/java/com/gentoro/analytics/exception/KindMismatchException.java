package com.gentoro.analytics.exception;

import java.util.Map;

/** A filter predicate was applied to a column of the other kind. */
public class KindMismatchException extends AnalyticsException {
  public KindMismatchException(String column, String expectedKind, String actualKind) {
    super(
        AnalyticsErrorCode.KIND_MISMATCH,
        "Column '"
            + column
            + "' is "
            + actualKind
            + " but the predicate requires a "
            + expectedKind
            + " column",
        null,
        Map.of("column", column, "expected", expectedKind, "actual", actualKind));
  }
}
