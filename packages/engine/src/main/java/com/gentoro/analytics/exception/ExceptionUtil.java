package com.gentoro.analytics.exception;

import java.time.Instant;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails} for logging or API responses. If the
   * throwable is an {@link AnalyticsException}, its code and context are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof AnalyticsException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          ex.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(),
        safeMessage(t.getMessage()),
        AnalyticsErrorCode.UNKNOWN,
        null,
        Instant.now());
  }

  /**
   * Unwrap wrapper exceptions raised by executors ({@code CompletionException}, {@code
   * ExecutionException}) and return the engine error they carry, or wrap anything else with the
   * given code.
   */
  public static AnalyticsException unwrap(Throwable t, AnalyticsErrorCode fallbackCode) {
    Throwable current = t;
    while (current != null) {
      if (current instanceof AnalyticsException ex) {
        return ex;
      }
      current = current.getCause();
    }
    return new AnalyticsException(fallbackCode, safeMessage(t.getMessage()), t);
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }
}
