package com.gentoro.analytics.filter;

import com.gentoro.analytics.model.Column;
import com.gentoro.analytics.model.Dataset;
import com.gentoro.analytics.model.Row;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** Computes {@link ColumnProfile}s in one pass per column. */
public final class DatasetProfiler {
  private DatasetProfiler() {}

  /** Profiles for every column, in schema order. */
  public static List<ColumnProfile> profile(Dataset dataset) {
    List<ColumnProfile> profiles = new ArrayList<>(dataset.columns().size());
    for (Column column : dataset.columns()) {
      profiles.add(profile(dataset, column));
    }
    return profiles;
  }

  /**
   * Permissive default filters for every column that has values, in schema order. Applying them
   * removes only rows with missing or non-coercible values in some column.
   */
  public static List<FilterSpec> defaultFilters(Dataset dataset) {
    List<FilterSpec> specs = new ArrayList<>();
    for (ColumnProfile profile : profile(dataset)) {
      FilterSpec spec = profile.defaultFilter();
      if (spec != null) {
        specs.add(spec);
      }
    }
    return specs;
  }

  public static ColumnProfile profile(Dataset dataset, Column column) {
    Objects.requireNonNull(column, "column");
    String name = column.name();
    int missing = 0;
    if (column.isNumeric()) {
      Double min = null;
      Double max = null;
      int valid = 0;
      for (Row row : dataset.rows()) {
        Double value = row.number(name);
        if (value == null) {
          missing++;
          continue;
        }
        valid++;
        min = min == null ? value : Math.min(min, value);
        max = max == null ? value : Math.max(max, value);
      }
      return new ColumnProfile.Numeric(name, min, max, valid, missing);
    }
    Set<String> distinct = new LinkedHashSet<>();
    for (Row row : dataset.rows()) {
      Object value = row.get(name);
      if (value == null) {
        missing++;
      } else {
        distinct.add(String.valueOf(value));
      }
    }
    return new ColumnProfile.Categorical(name, new ArrayList<>(distinct), missing);
  }
}
