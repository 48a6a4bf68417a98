package com.gentoro.analytics.aggregate;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.gentoro.analytics.exception.InvalidRequestException;
import java.util.Locale;

/** Reduction applied to a measure column within each group. */
public enum Reducer {
  /** Sum of valid numeric values; 0 for a group without any. */
  SUM,
  /** Arithmetic mean of valid numeric values; undefined for a group without any. */
  MEAN,
  /** Number of rows in the group, whether or not the measure is valid. */
  COUNT,
  MAX,
  MIN;

  /** Whether the reducer reads numeric measure values (every reducer except {@link #COUNT}). */
  public boolean requiresNumericMeasure() {
    return this != COUNT;
  }

  /** Case-insensitive lookup accepting {@code "sum"}, {@code "Mean"}, {@code "AVG"}, etc. */
  @JsonCreator
  public static Reducer parse(String name) {
    if (name == null || name.isBlank()) {
      throw new InvalidRequestException("Reducer name must not be empty");
    }
    String normalized = name.trim().toUpperCase(Locale.ROOT);
    if ("AVG".equals(normalized) || "AVERAGE".equals(normalized)) {
      return MEAN;
    }
    try {
      return valueOf(normalized);
    } catch (IllegalArgumentException e) {
      throw new InvalidRequestException("Unsupported reducer '" + name + "'");
    }
  }
}
