package com.gentoro.analytics.drilldown;

import com.gentoro.analytics.exception.InvalidDrillPathException;
import com.gentoro.analytics.model.Dataset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Ordered sequence of at least two distinct drill columns, outermost first. */
public record DrillPath(List<String> columns) {
  public static final int MIN_LENGTH = 2;

  public DrillPath {
    if (columns == null || columns.size() < MIN_LENGTH) {
      throw new InvalidDrillPathException(
          "Drill path needs at least " + MIN_LENGTH + " columns, got " + columns);
    }
    Set<String> seen = new HashSet<>();
    for (String column : columns) {
      if (column == null || column.isEmpty()) {
        throw new InvalidDrillPathException("Drill path contains an empty column name");
      }
      if (!seen.add(column)) {
        throw new InvalidDrillPathException("Drill path repeats column '" + column + "'");
      }
    }
    columns = List.copyOf(columns);
  }

  public static DrillPath of(String... columns) {
    return new DrillPath(List.of(columns));
  }

  public int length() {
    return columns.size();
  }

  public String column(int level) {
    return columns.get(level);
  }

  /** Columns {@code 0..level} inclusive. */
  public List<String> prefix(int level) {
    return columns.subList(0, level + 1);
  }

  public boolean isTerminal(int level) {
    return level == columns.size() - 1;
  }

  /**
   * @throws InvalidDrillPathException if any column is absent from the dataset schema
   */
  public void requirePresentIn(Dataset dataset) {
    List<String> missing = new ArrayList<>();
    for (String column : columns) {
      if (!dataset.hasColumn(column)) {
        missing.add(column);
      }
    }
    if (!missing.isEmpty()) {
      throw new InvalidDrillPathException("Drill path columns not in dataset: " + missing);
    }
  }
}
