package com.gentoro.analytics.exception;

import java.util.List;
import java.util.Map;

/**
 * Mean, Max or Min was requested for a group that holds no valid numeric measure value. Sum over
 * such a group is 0 and never raises this error.
 */
public class EmptyGroupException extends AnalyticsException {
  public EmptyGroupException(String reducer, String measure, List<String> key) {
    super(
        AnalyticsErrorCode.EMPTY_GROUP,
        reducer + " of '" + measure + "' is undefined for group " + key + " (no numeric values)",
        null,
        Map.of("reducer", reducer, "measure", measure, "key", key));
  }
}
