package com.gentoro.analytics.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.analytics.aggregate.Reducer;
import com.gentoro.analytics.filter.FilterSpec;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Declarative drill-down request.
 *
 * <pre>{@code
 * {
 *   "scope": ["Region", "Country", "Sales"],
 *   "filters": [{ "type": "range", "column": "Sales", "min": 6, "max": 100 }],
 *   "drill_path": ["Region", "Country"],
 *   "measure": "Sales"
 * }
 * }</pre>
 *
 * <p>{@code scope} is optional (all columns when absent). {@code reducer} defaults to {@link
 * Reducer#SUM}, the only reducer a drill-down accepts.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AggregationRequest {
  @JsonProperty("scope")
  private List<String> scope;

  @JsonProperty("filters")
  private List<FilterSpec> filters = new ArrayList<>();

  @JsonProperty("drill_path")
  private List<String> drillPath = new ArrayList<>();

  @JsonProperty("measure")
  private String measure;

  @JsonProperty("reducer")
  private Reducer reducer = Reducer.SUM;

  public AggregationRequest() {}

  public AggregationRequest(
      List<String> scope, List<FilterSpec> filters, List<String> drillPath, String measure) {
    setScope(scope);
    setFilters(filters);
    setDrillPath(drillPath);
    this.measure = measure;
  }

  public static AggregationRequest of(List<String> drillPath, String measure) {
    return new AggregationRequest(null, null, drillPath, measure);
  }

  public List<String> getScope() {
    return scope;
  }

  public void setScope(List<String> scope) {
    this.scope = scope != null ? new ArrayList<>(scope) : null;
  }

  public AggregationRequest withScope(List<String> scope) {
    setScope(scope);
    return this;
  }

  public List<FilterSpec> getFilters() {
    return filters;
  }

  public void setFilters(List<FilterSpec> filters) {
    this.filters = filters != null ? new ArrayList<>(filters) : new ArrayList<>();
  }

  public AggregationRequest withFilter(FilterSpec filter) {
    this.filters.add(filter);
    return this;
  }

  public List<String> getDrillPath() {
    return drillPath;
  }

  public void setDrillPath(List<String> drillPath) {
    this.drillPath = drillPath != null ? new ArrayList<>(drillPath) : new ArrayList<>();
  }

  public String getMeasure() {
    return measure;
  }

  public void setMeasure(String measure) {
    this.measure = measure;
  }

  public Reducer getReducer() {
    return reducer;
  }

  public void setReducer(Reducer reducer) {
    this.reducer = reducer != null ? reducer : Reducer.SUM;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    AggregationRequest that = (AggregationRequest) o;
    return Objects.equals(scope, that.scope)
        && Objects.equals(filters, that.filters)
        && Objects.equals(drillPath, that.drillPath)
        && Objects.equals(measure, that.measure)
        && reducer == that.reducer;
  }

  @Override
  public int hashCode() {
    return Objects.hash(scope, filters, drillPath, measure, reducer);
  }

  @Override
  public String toString() {
    return "AggregationRequest{"
        + "scope="
        + scope
        + ", filters="
        + filters
        + ", drillPath="
        + drillPath
        + ", measure='"
        + measure
        + '\''
        + ", reducer="
        + reducer
        + '}';
  }
}
