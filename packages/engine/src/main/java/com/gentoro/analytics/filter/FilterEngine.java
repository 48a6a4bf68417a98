package com.gentoro.analytics.filter;

import com.gentoro.analytics.exception.InvalidRequestException;
import com.gentoro.analytics.exception.KindMismatchException;
import com.gentoro.analytics.logging.LoggingService;
import com.gentoro.analytics.model.Column;
import com.gentoro.analytics.model.Dataset;
import com.gentoro.analytics.model.Row;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Column scoping (projection) and row filtering over a {@link Dataset}.
 *
 * <p>Both operations are pure: the input dataset is never modified, row order and row indices are
 * preserved, and column kinds are carried over from the source schema.
 */
public class FilterEngine {
  private static final org.slf4j.Logger log = LoggingService.getLogger(FilterEngine.class);

  /**
   * Project the dataset to the given columns, in the order requested.
   *
   * @param columns columns to keep; {@code null} keeps every column. Repeated names are kept once.
   * @throws com.gentoro.analytics.exception.UnknownColumnException if a column is absent
   */
  public Dataset scope(Dataset dataset, List<String> columns) {
    if (columns == null) {
      return dataset;
    }
    Set<String> wanted = new LinkedHashSet<>(columns);
    List<Column> schema = new ArrayList<>(wanted.size());
    for (String name : wanted) {
      schema.add(dataset.requireColumn(name));
    }
    List<Row> rows = new ArrayList<>(dataset.size());
    for (Row row : dataset.rows()) {
      rows.add(row.project(wanted));
    }
    log.debug("Scoped dataset from {} to {} columns", dataset.columns().size(), schema.size());
    return Dataset.of(schema, rows);
  }

  /**
   * Keep the rows that satisfy every spec (logical AND).
   *
   * <p>Numeric bounds are inclusive; categorical membership is exact and case-sensitive. Missing
   * values, and numeric cells that do not coerce, never satisfy a predicate. An empty result is a
   * valid, empty dataset.
   *
   * @throws com.gentoro.analytics.exception.UnknownColumnException if a spec targets an absent
   *     column
   * @throws KindMismatchException if a spec kind differs from its column kind
   * @throws InvalidRequestException if a numeric range lacks a bound, is inverted or not finite
   */
  public Dataset filter(Dataset dataset, List<FilterSpec> specs) {
    if (specs == null || specs.isEmpty()) {
      return dataset;
    }
    for (FilterSpec spec : specs) {
      validate(dataset, spec);
    }
    List<Row> kept = new ArrayList<>();
    for (Row row : dataset.rows()) {
      if (matchesAll(row, specs)) {
        kept.add(row);
      }
    }
    log.debug(
        "Filtered {} rows down to {} using {} predicate(s)",
        dataset.size(),
        kept.size(),
        specs.size());
    return dataset.withRows(kept);
  }

  /** Checks a spec against the dataset schema without touching any row. */
  public void validate(Dataset dataset, FilterSpec spec) {
    if (spec == null) {
      throw new InvalidRequestException("Filter spec must not be null");
    }
    Column column = dataset.requireColumn(spec.column());
    if (column.kind() != spec.kind()) {
      throw new KindMismatchException(spec.column(), spec.kind().name(), column.kind().name());
    }
    if (spec instanceof FilterSpec.NumericRange range) {
      if (range.min() == null || range.max() == null) {
        throw new InvalidRequestException(
            "Range for '" + range.column() + "' needs both 'min' and 'max'");
      }
      if (!Double.isFinite(range.min()) || !Double.isFinite(range.max())) {
        throw new InvalidRequestException(
            "Range bounds for '" + range.column() + "' must be finite numbers");
      }
      if (range.min() > range.max()) {
        throw new InvalidRequestException(
            "Range for '"
                + range.column()
                + "' has min "
                + range.min()
                + " greater than max "
                + range.max());
      }
    }
  }

  private boolean matchesAll(Row row, List<FilterSpec> specs) {
    for (FilterSpec spec : specs) {
      if (!matches(row, spec)) {
        return false;
      }
    }
    return true;
  }

  private boolean matches(Row row, FilterSpec spec) {
    if (spec instanceof FilterSpec.NumericRange range) {
      Double value = row.number(range.column());
      return value != null && range.test(value);
    }
    FilterSpec.CategoricalSet set = (FilterSpec.CategoricalSet) spec;
    Object value = row.get(set.column());
    return value != null && set.allowed().contains(String.valueOf(value));
  }
}
