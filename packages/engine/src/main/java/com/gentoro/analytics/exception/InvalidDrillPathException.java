package com.gentoro.analytics.exception;

/** The drill path is too short, too deep, repeats a column or references absent columns. */
public class InvalidDrillPathException extends AnalyticsException {
  public InvalidDrillPathException(String message) {
    super(AnalyticsErrorCode.INVALID_DRILL_PATH, message);
  }
}
