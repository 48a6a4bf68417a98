package com.gentoro.analytics.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.analytics.exception.InvalidRequestException;
import com.gentoro.analytics.exception.UnknownColumnException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable tabular dataset: an ordered schema of uniquely named {@link Column}s and an ordered
 * list of {@link Row}s.
 *
 * <p>Every row holds a value, possibly the {@code null} missing marker, for every declared column.
 * Column kinds are decided once, when the dataset is built from raw records, and never change for
 * the lifetime of the instance. Datasets derived by scoping or filtering keep the kinds of their
 * source.
 */
public final class Dataset {
  private final List<Column> columns;
  private final Map<String, Column> byName;
  private final List<Row> rows;

  private Dataset(List<Column> columns, Map<String, Column> byName, List<Row> rows) {
    this.columns = columns;
    this.byName = byName;
    this.rows = rows;
  }

  /**
   * Build a dataset from an explicit schema and rows.
   *
   * @throws InvalidRequestException if column names repeat or a row lacks a declared column
   */
  public static Dataset of(List<Column> schema, List<Row> rows) {
    Map<String, Column> byName = new LinkedHashMap<>();
    for (Column column : schema) {
      if (byName.putIfAbsent(column.name(), column) != null) {
        throw new InvalidRequestException("Duplicate column name '" + column.name() + "'");
      }
    }
    for (Row row : rows) {
      for (String name : byName.keySet()) {
        if (!row.has(name)) {
          throw new InvalidRequestException(
              "Row " + row.index() + " has no value for column '" + name + "'");
        }
      }
    }
    return new Dataset(
        List.copyOf(schema),
        Collections.unmodifiableMap(byName),
        Collections.unmodifiableList(new ArrayList<>(rows)));
  }

  /**
   * Build a dataset from raw records, classifying every column from its values.
   *
   * @param columnNames schema order; names absent from a record are stored as missing
   * @param records raw rows keyed by column name
   */
  public static Dataset fromRecords(
      List<String> columnNames, List<? extends Map<String, ?>> records) {
    Set<String> unique = new LinkedHashSet<>(columnNames);
    if (unique.size() != columnNames.size()) {
      throw new InvalidRequestException("Duplicate column names in " + columnNames);
    }
    List<Row> rows = new ArrayList<>(records.size());
    for (int i = 0; i < records.size(); i++) {
      Map<String, ?> record = records.get(i);
      Map<String, Object> values = new LinkedHashMap<>();
      for (String name : columnNames) {
        values.put(name, record.get(name));
      }
      rows.add(new Row(i, values));
    }
    List<Column> schema = new ArrayList<>(columnNames.size());
    for (String name : columnNames) {
      List<Object> columnValues = new ArrayList<>(rows.size());
      for (Row row : rows) {
        columnValues.add(row.get(name));
      }
      schema.add(new Column(name, ColumnClassifier.classify(columnValues)));
    }
    return of(schema, rows);
  }

  /**
   * Build a dataset from a JSON array of flat objects. Columns are ordered by first appearance;
   * JSON {@code null} and absent fields are missing values.
   */
  public static Dataset fromJson(JsonNode array) {
    if (array == null || !array.isArray()) {
      throw new InvalidRequestException("Dataset JSON must be an array of objects");
    }
    Set<String> names = new LinkedHashSet<>();
    List<Map<String, Object>> records = new ArrayList<>();
    for (JsonNode item : array) {
      if (!item.isObject()) {
        throw new InvalidRequestException("Dataset JSON rows must be objects, got " + item);
      }
      Map<String, Object> record = new LinkedHashMap<>();
      for (Iterator<Map.Entry<String, JsonNode>> it = item.fields(); it.hasNext(); ) {
        Map.Entry<String, JsonNode> e = it.next();
        names.add(e.getKey());
        record.put(e.getKey(), toJavaValue(e.getValue()));
      }
      records.add(record);
    }
    return fromRecords(new ArrayList<>(names), records);
  }

  private static Object toJavaValue(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) return null;
    if (node.isNumber()) return node.numberValue();
    if (node.isBoolean()) return node.asBoolean();
    if (node.isTextual()) return node.asText();
    return node.toString();
  }

  /** Same schema, different rows. Rows are not re-validated against the schema. */
  public Dataset withRows(List<Row> newRows) {
    return new Dataset(columns, byName, Collections.unmodifiableList(new ArrayList<>(newRows)));
  }

  public List<Column> columns() {
    return columns;
  }

  public List<String> columnNames() {
    List<String> names = new ArrayList<>(columns.size());
    for (Column column : columns) {
      names.add(column.name());
    }
    return names;
  }

  public Optional<Column> column(String name) {
    return Optional.ofNullable(byName.get(name));
  }

  /**
   * @throws UnknownColumnException if the column is not part of the schema
   */
  public Column requireColumn(String name) {
    Column column = byName.get(name);
    if (column == null) {
      throw new UnknownColumnException(name);
    }
    return column;
  }

  public boolean hasColumn(String name) {
    return byName.containsKey(name);
  }

  public List<Row> rows() {
    return rows;
  }

  public int size() {
    return rows.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Dataset other)) return false;
    return columns.equals(other.columns) && rows.equals(other.rows);
  }

  @Override
  public int hashCode() {
    return 31 * columns.hashCode() + rows.hashCode();
  }

  @Override
  public String toString() {
    return "Dataset{" + "columns=" + columns + ", rows=" + rows.size() + '}';
  }
}
