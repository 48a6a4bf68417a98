package com.gentoro.analytics.request;

import com.gentoro.analytics.aggregate.Reducer;
import com.gentoro.analytics.config.DrillDownSettings;
import com.gentoro.analytics.drilldown.DrillPath;
import com.gentoro.analytics.exception.InvalidDrillPathException;
import com.gentoro.analytics.exception.InvalidRequestException;
import com.gentoro.analytics.exception.NonNumericMeasureException;
import com.gentoro.analytics.filter.FilterEngine;
import com.gentoro.analytics.filter.FilterSpec;
import com.gentoro.analytics.model.Column;
import com.gentoro.analytics.model.Dataset;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Validates an {@link AggregationRequest} against a dataset schema before any row is touched.
 *
 * <p>Checks run in request order: shape of the request, scope columns, filters (column presence
 * within the scope, predicate kind, bounds), drill path (length, distinct columns, depth limit,
 * presence within the scope) and finally the measure (presence and numeric kind). The first
 * failure is thrown; nothing is computed for an invalid request.
 */
public final class RequestValidator {

  private RequestValidator() {}

  /**
   * Validate the request and return its parsed drill path.
   *
   * @throws InvalidRequestException for a malformed request
   * @throws com.gentoro.analytics.exception.UnknownColumnException for absent scope, filter or
   *     measure columns
   * @throws com.gentoro.analytics.exception.KindMismatchException for mismatched filter kinds
   * @throws InvalidDrillPathException for an invalid drill path
   * @throws NonNumericMeasureException for a categorical measure
   */
  public static DrillPath validate(
      Dataset dataset, AggregationRequest request, DrillDownSettings settings) {
    if (request == null) {
      throw new InvalidRequestException("Aggregation request must not be null");
    }
    if (request.getMeasure() == null || request.getMeasure().isBlank()) {
      throw new InvalidRequestException("Aggregation request is missing 'measure'");
    }
    if (request.getReducer() != Reducer.SUM) {
      throw new InvalidRequestException(
          "Drill-down supports only the SUM reducer, got " + request.getReducer());
    }

    Dataset schema = schemaOf(dataset, request.getScope());

    FilterEngine filters = new FilterEngine();
    for (FilterSpec spec : request.getFilters()) {
      filters.validate(schema, spec);
    }

    DrillPath path = new DrillPath(request.getDrillPath());
    int maxDepth = settings == null ? DrillDownSettings.DEFAULT_MAX_DEPTH : settings.maxDepth();
    if (path.length() > maxDepth) {
      throw new InvalidDrillPathException(
          "Drill path has "
              + path.length()
              + " columns, more than the configured maximum of "
              + maxDepth);
    }
    path.requirePresentIn(schema);

    Column measure = schema.requireColumn(request.getMeasure());
    if (!measure.isNumeric()) {
      throw new NonNumericMeasureException(measure.name());
    }
    return path;
  }

  /** Row-less dataset carrying the schema visible after scoping. */
  private static Dataset schemaOf(Dataset dataset, List<String> scope) {
    if (scope == null) {
      return dataset.withRows(List.of());
    }
    List<Column> columns = new ArrayList<>();
    for (String name : new LinkedHashSet<>(scope)) {
      columns.add(dataset.requireColumn(name));
    }
    return Dataset.of(columns, List.of());
  }
}
