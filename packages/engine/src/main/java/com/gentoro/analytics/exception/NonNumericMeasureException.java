package com.gentoro.analytics.exception;

import java.util.Map;

/** The measure column of a numeric aggregation is categorical. */
public class NonNumericMeasureException extends AnalyticsException {
  public NonNumericMeasureException(String measure) {
    super(
        AnalyticsErrorCode.NON_NUMERIC_MEASURE,
        "Measure column '" + measure + "' is not numeric",
        null,
        Map.of("measure", measure));
  }
}
