package com.gentoro.analytics.exception;

import java.time.Instant;
import java.util.Map;

/** Structured, serializable view of an error for API responses or logs. */
public record ErrorDetails(
    String type,
    String message,
    AnalyticsErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}
