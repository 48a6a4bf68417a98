package com.gentoro.analytics.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class of every error raised by the analytics engine.
 *
 * <p>Each exception carries an {@link AnalyticsErrorCode} and an optional, immutable context map
 * (column names, offending values) so callers can render structured errors through {@link
 * ExceptionUtil#toErrorDetails(Throwable)} without parsing messages.
 */
public class AnalyticsException extends RuntimeException {
  private final AnalyticsErrorCode code;
  private final Map<String, Object> context;

  public AnalyticsException(AnalyticsErrorCode code, String message) {
    this(code, message, null, Collections.emptyMap());
  }

  public AnalyticsException(AnalyticsErrorCode code, String message, Throwable cause) {
    this(code, message, cause, Collections.emptyMap());
  }

  public AnalyticsException(
      AnalyticsErrorCode code, String message, Throwable cause, Map<String, Object> context) {
    super(message, cause);
    this.code = code == null ? AnalyticsErrorCode.UNKNOWN : code;
    this.context =
        context == null || context.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(context));
  }

  public AnalyticsErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return context;
  }
}
