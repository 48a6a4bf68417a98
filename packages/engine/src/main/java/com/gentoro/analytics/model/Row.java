package com.gentoro.analytics.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One dataset row: its position in the originally loaded dataset plus column values.
 *
 * <p>{@code null} is the missing-value marker. The index survives scoping and filtering so a
 * derived row can be joined back to its source row.
 */
public final class Row {
  private final int index;
  private final Map<String, Object> values;

  public Row(int index, Map<String, ?> values) {
    this.index = index;
    Map<String, Object> copy = new LinkedHashMap<>(values);
    this.values = Collections.unmodifiableMap(copy);
  }

  public int index() {
    return index;
  }

  public Object get(String column) {
    return values.get(column);
  }

  public boolean has(String column) {
    return values.containsKey(column);
  }

  public boolean isMissing(String column) {
    return values.get(column) == null;
  }

  /** Numeric value of the cell, or {@code null} when missing or not coercible. */
  public Double number(String column) {
    return NumericCoercion.toDouble(values.get(column));
  }

  public Map<String, Object> values() {
    return values;
  }

  /** Copy restricted to the given columns, keeping this row's index. */
  public Row project(Collection<String> columns) {
    Map<String, Object> projected = new LinkedHashMap<>();
    for (String column : columns) {
      projected.put(column, values.get(column));
    }
    return new Row(index, projected);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Row other)) return false;
    return index == other.index && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return 31 * index + values.hashCode();
  }

  @Override
  public String toString() {
    return "Row{" + "index=" + index + ", values=" + values + '}';
  }
}
