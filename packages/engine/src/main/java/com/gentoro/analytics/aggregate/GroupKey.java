package com.gentoro.analytics.aggregate;

import java.util.List;

/**
 * Ordered tuple of group-by values, one per group-by column, in the text form produced by {@link
 * com.gentoro.analytics.model.Column#keyOf(Object)}.
 */
public record GroupKey(List<String> values) {
  public GroupKey {
    values = List.copyOf(values);
  }

  public static GroupKey of(String... values) {
    return new GroupKey(List.of(values));
  }

  public int size() {
    return values.size();
  }

  public String get(int index) {
    return values.get(index);
  }

  /** Value of the last group-by column. */
  public String last() {
    return values.get(values.size() - 1);
  }
}
