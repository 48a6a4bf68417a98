package com.gentoro.analytics.filter;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.gentoro.analytics.model.ColumnKind;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A single per-column predicate applied by {@link FilterEngine}.
 *
 * <p>JSON form:
 *
 * <pre>{@code
 * { "type": "range", "column": "Sales", "min": 6, "max": 100 }
 * { "type": "set", "column": "Region", "allowed": ["East", "West"] }
 * }</pre>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = FilterSpec.NumericRange.class, name = "range"),
  @JsonSubTypes.Type(value = FilterSpec.CategoricalSet.class, name = "set")
})
public sealed interface FilterSpec {

  String column();

  /** Kind of column this predicate can be applied to. */
  ColumnKind kind();

  /**
   * Inclusive numeric range {@code min <= value <= max}. Both bounds are required; {@link
   * FilterEngine#validate} rejects a range with a {@code null} bound.
   */
  record NumericRange(
      @JsonProperty("column") String column,
      @JsonProperty(value = "min", required = true) Double min,
      @JsonProperty(value = "max", required = true) Double max)
      implements FilterSpec {

    @JsonCreator
    public NumericRange {
      Objects.requireNonNull(column, "column");
    }

    public NumericRange(String column, double min, double max) {
      this(column, Double.valueOf(min), Double.valueOf(max));
    }

    @Override
    public ColumnKind kind() {
      return ColumnKind.NUMERIC;
    }

    public boolean test(double value) {
      return value >= min && value <= max;
    }
  }

  /** Exact, case-sensitive membership in a set of allowed strings. */
  record CategoricalSet(
      @JsonProperty("column") String column, @JsonProperty("allowed") Set<String> allowed)
      implements FilterSpec {

    public CategoricalSet {
      Objects.requireNonNull(column, "column");
      allowed =
          allowed == null
              ? Collections.emptySet()
              : Collections.unmodifiableSet(new LinkedHashSet<>(allowed));
    }

    public static CategoricalSet of(String column, Collection<String> allowed) {
      return new CategoricalSet(column, new LinkedHashSet<>(allowed));
    }

    @Override
    public ColumnKind kind() {
      return ColumnKind.CATEGORICAL;
    }
  }
}
