package com.gentoro.analytics.exception;

import java.util.Map;

/** A referenced column does not exist in the dataset schema. */
public class UnknownColumnException extends AnalyticsException {
  private final String column;

  public UnknownColumnException(String column) {
    super(
        AnalyticsErrorCode.UNKNOWN_COLUMN,
        "Unknown column '" + column + "'",
        null,
        Map.of("column", String.valueOf(column)));
    this.column = column;
  }

  public String getColumn() {
    return column;
  }
}
