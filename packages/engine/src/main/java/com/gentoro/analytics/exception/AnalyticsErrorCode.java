package com.gentoro.analytics.exception;

/** Stable error codes reported by {@link AnalyticsException} and its subclasses. */
public enum AnalyticsErrorCode {
  /** A referenced column is absent from the dataset schema. */
  UNKNOWN_COLUMN,
  /** A filter predicate does not match the kind of the column it targets. */
  KIND_MISMATCH,
  /** A numeric reducer was requested over a categorical measure column. */
  NON_NUMERIC_MEASURE,
  /** Drill path has fewer than two columns, repeats a column, or references absent columns. */
  INVALID_DRILL_PATH,
  /** Mean, Max or Min requested over a group without a single valid measure value. */
  EMPTY_GROUP,
  /** Structurally malformed request (missing fields, inverted bounds, unsupported reducer). */
  INVALID_REQUEST,
  /** Configuration could not be loaded or holds an invalid value. */
  CONFIGURATION_ERROR,
  UNKNOWN
}
