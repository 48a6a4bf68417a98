package com.gentoro.analytics;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.analytics.model.Dataset;
import com.gentoro.analytics.utility.JacksonUtility;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Shared fixtures for engine tests. */
public final class TestDatasets {
  private TestDatasets() {}

  /** Region / Country / Sales rows: East-US 10, East-US 5, West-CA 7. */
  public static Dataset regionSales() {
    return Dataset.fromRecords(
        List.of("Region", "Country", "Sales"),
        List.of(
            record("Region", "East", "Country", "US", "Sales", 10),
            record("Region", "East", "Country", "US", "Sales", 5),
            record("Region", "West", "Country", "CA", "Sales", 7)));
  }

  /**
   * Six rows over Region / Country / City / Sales / Units with a string-typed number and missing
   * values, loaded from {@code datasets/sales.json}.
   */
  public static Dataset sales() {
    try (InputStream in =
        TestDatasets.class.getClassLoader().getResourceAsStream("datasets/sales.json")) {
      if (in == null) {
        throw new IllegalStateException("datasets/sales.json not on test classpath");
      }
      JsonNode json = JacksonUtility.getJsonMapper().readTree(in);
      return Dataset.fromJson(json);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /** Record from alternating name/value arguments; {@code null} values are allowed. */
  public static Map<String, Object> record(Object... namesAndValues) {
    if (namesAndValues.length % 2 != 0) {
      throw new IllegalArgumentException("Number of arguments must be even");
    }
    Map<String, Object> record = new LinkedHashMap<>();
    for (int i = 0; i < namesAndValues.length; i += 2) {
      record.put((String) namesAndValues[i], namesAndValues[i + 1]);
    }
    return record;
  }

  /** Dataset whose rows are given positionally in {@code columns} order. */
  public static Dataset table(List<String> columns, Object[]... rows) {
    List<Map<String, Object>> records = new ArrayList<>();
    for (Object[] row : rows) {
      if (row.length != columns.size()) {
        throw new IllegalArgumentException("Row " + Arrays.toString(row) + " has wrong arity");
      }
      Map<String, Object> record = new LinkedHashMap<>();
      for (int i = 0; i < row.length; i++) {
        record.put(columns.get(i), row[i]);
      }
      records.add(record);
    }
    return Dataset.fromRecords(columns, records);
  }
}
