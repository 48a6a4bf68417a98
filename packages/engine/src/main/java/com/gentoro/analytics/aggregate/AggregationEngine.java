package com.gentoro.analytics.aggregate;

import com.gentoro.analytics.exception.EmptyGroupException;
import com.gentoro.analytics.exception.InvalidRequestException;
import com.gentoro.analytics.exception.NonNumericMeasureException;
import com.gentoro.analytics.logging.LoggingService;
import com.gentoro.analytics.model.Column;
import com.gentoro.analytics.model.ColumnKind;
import com.gentoro.analytics.model.Dataset;
import com.gentoro.analytics.model.Row;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Generic group-by-and-reduce over a {@link Dataset}.
 *
 * <p>Groups are the distinct combinations of group-by values in first-seen row order. Rows with a
 * missing value in any group-by column do not belong to any group. Within a group:
 *
 * <ul>
 *   <li>{@link Reducer#SUM}: sum of valid numeric measure values, 0 when there are none.
 *   <li>{@link Reducer#MEAN}, {@link Reducer#MAX}, {@link Reducer#MIN}: computed over valid numeric
 *       measure values; a group without any raises {@link EmptyGroupException}.
 *   <li>{@link Reducer#COUNT}: number of rows in the group, regardless of the measure.
 * </ul>
 *
 * <p>Sums accumulate in {@link BigDecimal}, so results do not depend on row order.
 */
public class AggregationEngine {
  private static final org.slf4j.Logger log = LoggingService.getLogger(AggregationEngine.class);

  /** Name of the row-count column produced by {@link #groupTable} for {@link Reducer#COUNT}. */
  public static final String COUNT_COLUMN = "Count";

  /**
   * Group {@code dataset} by {@code groupBy} and reduce {@code measure} within each group.
   *
   * @throws com.gentoro.analytics.exception.UnknownColumnException if a column is absent
   * @throws NonNumericMeasureException if a numeric reducer targets a categorical measure
   * @throws InvalidRequestException if {@code groupBy} is empty
   * @throws EmptyGroupException for Mean/Max/Min over a group without valid measure values
   */
  public List<GroupResult> groupReduce(
      Dataset dataset, List<String> groupBy, String measure, Reducer reducer) {
    List<Column> keyColumns = resolveGroupBy(dataset, groupBy);
    Column measureColumn = dataset.requireColumn(measure);
    if (reducer == null) {
      throw new InvalidRequestException("Reducer must not be null");
    }
    if (reducer.requiresNumericMeasure() && measureColumn.kind() != ColumnKind.NUMERIC) {
      throw new NonNumericMeasureException(measure);
    }

    Map<GroupKey, Accumulator[]> groups = accumulate(dataset, keyColumns, List.of(measure));
    List<GroupResult> results = new ArrayList<>(groups.size());
    for (Map.Entry<GroupKey, Accumulator[]> group : groups.entrySet()) {
      double value = group.getValue()[0].result(reducer, measure, group.getKey());
      results.add(new GroupResult(group.getKey(), value));
    }
    log.debug(
        "groupReduce {} by {} over '{}': {} rows -> {} groups",
        reducer,
        groupBy,
        measure,
        dataset.size(),
        results.size());
    return results;
  }

  /**
   * Grouped table: the group-by columns followed by, for {@link Reducer#COUNT}, a single {@value
   * #COUNT_COLUMN} column, otherwise one column per numeric column outside {@code groupBy} holding
   * the reduced value.
   */
  public Dataset groupTable(Dataset dataset, List<String> groupBy, Reducer reducer) {
    List<Column> keyColumns = resolveGroupBy(dataset, groupBy);
    if (reducer == null) {
      throw new InvalidRequestException("Reducer must not be null");
    }
    List<String> measures = new ArrayList<>();
    if (reducer == Reducer.COUNT) {
      measures.add(uniqueName(COUNT_COLUMN, groupBy));
    } else {
      for (Column column : dataset.columns()) {
        if (column.isNumeric() && !groupBy.contains(column.name())) {
          measures.add(column.name());
        }
      }
    }

    Map<GroupKey, Accumulator[]> groups =
        accumulate(dataset, keyColumns, reducer == Reducer.COUNT ? List.of() : measures);

    List<Column> schema = new ArrayList<>(keyColumns);
    for (String measure : measures) {
      schema.add(new Column(measure, ColumnKind.NUMERIC));
    }
    List<Row> rows = new ArrayList<>(groups.size());
    for (Map.Entry<GroupKey, Accumulator[]> group : groups.entrySet()) {
      Map<String, Object> values = new LinkedHashMap<>();
      for (int i = 0; i < keyColumns.size(); i++) {
        values.put(keyColumns.get(i).name(), group.getKey().get(i));
      }
      Accumulator[] accumulators = group.getValue();
      if (reducer == Reducer.COUNT) {
        values.put(measures.get(0), accumulators[0].rows);
      } else {
        for (int m = 0; m < measures.size(); m++) {
          values.put(
              measures.get(m), accumulators[m].result(reducer, measures.get(m), group.getKey()));
        }
      }
      rows.add(new Row(rows.size(), values));
    }
    return Dataset.of(schema, rows);
  }

  private List<Column> resolveGroupBy(Dataset dataset, List<String> groupBy) {
    if (groupBy == null || groupBy.isEmpty()) {
      throw new InvalidRequestException("At least one group-by column is required");
    }
    Set<String> seen = new LinkedHashSet<>();
    List<Column> columns = new ArrayList<>(groupBy.size());
    for (String name : groupBy) {
      if (!seen.add(name)) {
        throw new InvalidRequestException("Group-by column '" + name + "' is repeated");
      }
      columns.add(dataset.requireColumn(name));
    }
    return columns;
  }

  /**
   * Single pass over the rows; one accumulator per measure per group. With no measures, one
   * row-counting accumulator is kept per group.
   */
  private Map<GroupKey, Accumulator[]> accumulate(
      Dataset dataset, List<Column> keyColumns, List<String> measures) {
    int slots = Math.max(1, measures.size());
    Map<GroupKey, Accumulator[]> groups = new LinkedHashMap<>();
    for (Row row : dataset.rows()) {
      GroupKey key = keyOf(row, keyColumns);
      if (key == null) {
        continue;
      }
      Accumulator[] accumulators =
          groups.computeIfAbsent(
              key,
              k -> {
                Accumulator[] created = new Accumulator[slots];
                for (int i = 0; i < slots; i++) {
                  created[i] = new Accumulator();
                }
                return created;
              });
      for (int i = 0; i < slots; i++) {
        Double value = measures.isEmpty() ? null : row.number(measures.get(i));
        accumulators[i].add(value);
      }
    }
    return groups;
  }

  private static GroupKey keyOf(Row row, List<Column> keyColumns) {
    List<String> parts = new ArrayList<>(keyColumns.size());
    for (Column column : keyColumns) {
      String part = column.keyOf(row.get(column.name()));
      if (part == null) {
        return null;
      }
      parts.add(part);
    }
    return new GroupKey(parts);
  }

  private static String uniqueName(String base, List<String> taken) {
    String name = base;
    while (taken.contains(name)) {
      name = name + "_";
    }
    return name;
  }

  /** Running state of one measure within one group. */
  private static final class Accumulator {
    int rows;
    int valid;
    BigDecimal sum = BigDecimal.ZERO;
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;

    void add(Double value) {
      rows++;
      if (value == null) {
        return;
      }
      valid++;
      sum = sum.add(BigDecimal.valueOf(value));
      min = Math.min(min, value);
      max = Math.max(max, value);
    }

    double result(Reducer reducer, String measure, GroupKey key) {
      switch (reducer) {
        case SUM:
          return sum.doubleValue();
        case COUNT:
          return rows;
        case MEAN:
          requireValues(reducer, measure, key);
          return sum.divide(BigDecimal.valueOf(valid), MathContext.DECIMAL64).doubleValue();
        case MAX:
          requireValues(reducer, measure, key);
          return max;
        case MIN:
          requireValues(reducer, measure, key);
          return min;
        default:
          throw new InvalidRequestException("Unsupported reducer " + reducer);
      }
    }

    private void requireValues(Reducer reducer, String measure, GroupKey key) {
      if (valid == 0) {
        throw new EmptyGroupException(reducer.name(), measure, key.values());
      }
    }
  }
}
