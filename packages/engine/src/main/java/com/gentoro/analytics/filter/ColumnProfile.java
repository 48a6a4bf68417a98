package com.gentoro.analytics.filter;

import java.util.List;

/**
 * Summary of one column's values, used to seed filter controls: the full numeric range of a
 * numeric column or the distinct values of a categorical one.
 */
public sealed interface ColumnProfile {

  String column();

  /** Cells holding the missing marker or, for numeric columns, a non-coercible value. */
  int missing();

  /**
   * Filter that the profiled rows with a value all satisfy: the full range or every distinct value.
   * Returns {@code null} for a numeric column without any valid value.
   */
  FilterSpec defaultFilter();

  record Numeric(String column, Double min, Double max, int valid, int missing)
      implements ColumnProfile {
    @Override
    public FilterSpec defaultFilter() {
      if (valid == 0) {
        return null;
      }
      return new FilterSpec.NumericRange(column, min, max);
    }
  }

  record Categorical(String column, List<String> distinctValues, int missing)
      implements ColumnProfile {
    public Categorical {
      distinctValues = List.copyOf(distinctValues);
    }

    @Override
    public FilterSpec defaultFilter() {
      return FilterSpec.CategoricalSet.of(column, distinctValues);
    }
  }
}
