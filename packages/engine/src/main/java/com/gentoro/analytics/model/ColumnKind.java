package com.gentoro.analytics.model;

/** Kind of a dataset column, fixed once at dataset construction. */
public enum ColumnKind {
  /** Every non-missing value coerces to a finite real number. */
  NUMERIC,
  /** Anything else; values are compared as exact, case-sensitive strings. */
  CATEGORICAL
}
