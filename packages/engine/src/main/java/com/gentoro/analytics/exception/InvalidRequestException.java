package com.gentoro.analytics.exception;

/** Structurally malformed request or argument. */
public class InvalidRequestException extends AnalyticsException {
  public InvalidRequestException(String message) {
    super(AnalyticsErrorCode.INVALID_REQUEST, message);
  }
}
