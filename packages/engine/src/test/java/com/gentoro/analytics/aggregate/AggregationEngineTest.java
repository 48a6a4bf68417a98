package com.gentoro.analytics.aggregate;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.analytics.TestDatasets;
import com.gentoro.analytics.exception.EmptyGroupException;
import com.gentoro.analytics.exception.InvalidRequestException;
import com.gentoro.analytics.exception.NonNumericMeasureException;
import com.gentoro.analytics.exception.UnknownColumnException;
import com.gentoro.analytics.model.ColumnKind;
import com.gentoro.analytics.model.Dataset;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link AggregationEngine}. */
class AggregationEngineTest {

  private final AggregationEngine engine = new AggregationEngine();

  /** Group g1 has numeric measures, g2 has none (missing and non-numeric). */
  private static Dataset mixedMeasure() {
    return TestDatasets.table(
        Arrays.asList("Group", "Measure", "Label"),
        new Object[] {"g1", 4, "a"},
        new Object[] {"g2", null, "b"},
        new Object[] {"g1", 8, "c"},
        new Object[] {"g2", null, "d"},
        new Object[] {"g2", null, null});
  }

  @Test
  @DisplayName("sum groups in first-seen order")
  void sumFirstSeenOrder() {
    List<GroupResult> results =
        engine.groupReduce(TestDatasets.sales(), List.of("Region"), "Sales", Reducer.SUM);

    assertEquals(
        List.of(
            new GroupResult(GroupKey.of("East"), 19.5), new GroupResult(GroupKey.of("West"), 19.0)),
        results);
  }

  @Test
  @DisplayName("multi-column keys are tuples of the group-by values")
  void multiColumnKeys() {
    List<GroupResult> results =
        engine.groupReduce(
            TestDatasets.sales(), List.of("Region", "Country"), "Sales", Reducer.SUM);

    assertEquals(
        List.of(
            new GroupResult(GroupKey.of("East", "US"), 15.0),
            new GroupResult(GroupKey.of("West", "CA"), 7.0),
            new GroupResult(GroupKey.of("East", "MX"), 4.5),
            new GroupResult(GroupKey.of("West", "US"), 12.0)),
        results);
  }

  @Test
  @DisplayName("mean, max and min use valid values only")
  void meanMaxMin() {
    List<String> groupBy = List.of("Country");
    Dataset sales = TestDatasets.sales();

    assertEquals(
        new GroupResult(GroupKey.of("US"), 9.0),
        engine.groupReduce(sales, groupBy, "Sales", Reducer.MEAN).get(0));
    assertEquals(
        new GroupResult(GroupKey.of("CA"), 7.0),
        engine.groupReduce(sales, groupBy, "Sales", Reducer.MEAN).get(1));
    assertEquals(12.0, engine.groupReduce(sales, groupBy, "Sales", Reducer.MAX).get(0).value());
    assertEquals(5.0, engine.groupReduce(sales, groupBy, "Sales", Reducer.MIN).get(0).value());
  }

  @Test
  @DisplayName("count counts rows regardless of measure validity")
  void countIgnoresMeasureValidity() {
    List<GroupResult> results =
        engine.groupReduce(mixedMeasure(), List.of("Group"), "Measure", Reducer.COUNT);

    assertEquals(
        List.of(new GroupResult(GroupKey.of("g1"), 2), new GroupResult(GroupKey.of("g2"), 3)),
        results);
  }

  @Test
  @DisplayName("count accepts a categorical measure")
  void countCategoricalMeasure() {
    List<GroupResult> results =
        engine.groupReduce(mixedMeasure(), List.of("Group"), "Label", Reducer.COUNT);

    assertEquals(3.0, results.get(1).value());
  }

  @Test
  @DisplayName("sum over a group without valid values is 0")
  void sumOfEmptyGroupIsZero() {
    List<GroupResult> results =
        engine.groupReduce(mixedMeasure(), List.of("Group"), "Measure", Reducer.SUM);

    assertEquals(12.0, results.get(0).value());
    assertEquals(0.0, results.get(1).value());
  }

  @Test
  @DisplayName("mean, max and min over a group without valid values fail with EmptyGroup")
  void emptyGroupFails() {
    for (Reducer reducer : List.of(Reducer.MEAN, Reducer.MAX, Reducer.MIN)) {
      EmptyGroupException ex =
          assertThrows(
              EmptyGroupException.class,
              () -> engine.groupReduce(mixedMeasure(), List.of("Group"), "Measure", reducer));
      assertEquals(List.of("g2"), ex.getContext().get("key"));
    }
  }

  @Test
  @DisplayName("rows missing a group-by value belong to no group")
  void missingGroupValueSkipped() {
    Dataset dataset =
        TestDatasets.table(
            Arrays.asList("Region", "Sales"),
            new Object[] {"East", 1},
            new Object[] {null, 100},
            new Object[] {"East", 2});

    List<GroupResult> results =
        engine.groupReduce(dataset, List.of("Region"), "Sales", Reducer.SUM);

    assertEquals(List.of(new GroupResult(GroupKey.of("East"), 3.0)), results);
  }

  @Test
  @DisplayName("sums do not depend on row order")
  void orderIndependentSums() {
    Dataset forward =
        TestDatasets.table(
            Arrays.asList("k", "v"),
            new Object[] {"a", 0.1},
            new Object[] {"a", 0.2},
            new Object[] {"a", 0.3},
            new Object[] {"a", 1e16},
            new Object[] {"a", -1e16});
    Dataset backward =
        TestDatasets.table(
            Arrays.asList("k", "v"),
            new Object[] {"a", -1e16},
            new Object[] {"a", 1e16},
            new Object[] {"a", 0.3},
            new Object[] {"a", 0.2},
            new Object[] {"a", 0.1});

    double a = engine.groupReduce(forward, List.of("k"), "v", Reducer.SUM).get(0).value();
    double b = engine.groupReduce(backward, List.of("k"), "v", Reducer.SUM).get(0).value();

    assertEquals(a, b);
    assertEquals(0.6, a, 1e-12);
  }

  @Test
  @DisplayName("adjacent large integers form separate groups")
  void largeIntegerKeys() {
    Dataset dataset =
        TestDatasets.table(
            Arrays.asList("Id", "Sales"),
            new Object[] {9007199254740993L, 1},
            new Object[] {9007199254740992L, 2});

    List<GroupResult> results = engine.groupReduce(dataset, List.of("Id"), "Sales", Reducer.SUM);

    assertEquals(
        List.of(
            new GroupResult(GroupKey.of("9007199254740993"), 1.0),
            new GroupResult(GroupKey.of("9007199254740992"), 2.0)),
        results);
  }

  @Test
  @DisplayName("unknown group-by or measure column fails")
  void unknownColumns() {
    assertThrows(
        UnknownColumnException.class,
        () -> engine.groupReduce(TestDatasets.sales(), List.of("Nope"), "Sales", Reducer.SUM));
    assertThrows(
        UnknownColumnException.class,
        () -> engine.groupReduce(TestDatasets.sales(), List.of("Region"), "Nope", Reducer.COUNT));
  }

  @Test
  @DisplayName("numeric reducers reject a categorical measure")
  void nonNumericMeasure() {
    assertThrows(
        NonNumericMeasureException.class,
        () -> engine.groupReduce(TestDatasets.sales(), List.of("Region"), "City", Reducer.SUM));
  }

  @Test
  @DisplayName("empty group-by list is rejected")
  void emptyGroupBy() {
    assertThrows(
        InvalidRequestException.class,
        () -> engine.groupReduce(TestDatasets.sales(), List.of(), "Sales", Reducer.SUM));
  }

  @Test
  @DisplayName("group table reduces every other numeric column")
  void groupTableSum() {
    Dataset table = engine.groupTable(TestDatasets.sales(), List.of("Region"), Reducer.SUM);

    assertEquals(List.of("Region", "Sales", "Units"), table.columnNames());
    assertEquals(ColumnKind.NUMERIC, table.requireColumn("Units").kind());
    assertEquals(2, table.size());
    assertEquals("East", table.rows().get(0).get("Region"));
    assertEquals(19.5, table.rows().get(0).get("Sales"));
    assertEquals(4.0, table.rows().get(0).get("Units"));
    assertEquals(7.0, table.rows().get(1).get("Units"));
  }

  @Test
  @DisplayName("group table with count has a single Count column")
  void groupTableCount() {
    Dataset table = engine.groupTable(TestDatasets.sales(), List.of("Country"), Reducer.COUNT);

    assertEquals(List.of("Country", AggregationEngine.COUNT_COLUMN), table.columnNames());
    assertEquals(3, table.rows().get(0).get("Count"));
    assertEquals(2, table.rows().get(1).get("Count"));
    assertEquals(1, table.rows().get(2).get("Count"));
  }

  @Test
  @DisplayName("reducer names parse case-insensitively")
  void parseReducer() {
    assertEquals(Reducer.SUM, Reducer.parse("sum"));
    assertEquals(Reducer.MEAN, Reducer.parse("Average"));
    assertEquals(Reducer.MEAN, Reducer.parse("avg"));
    assertThrows(InvalidRequestException.class, () -> Reducer.parse("median"));
  }
}
