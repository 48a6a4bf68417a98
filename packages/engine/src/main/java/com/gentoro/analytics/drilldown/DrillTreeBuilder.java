package com.gentoro.analytics.drilldown;

import com.gentoro.analytics.aggregate.AggregationEngine;
import com.gentoro.analytics.aggregate.GroupResult;
import com.gentoro.analytics.aggregate.Reducer;
import com.gentoro.analytics.config.DrillDownSettings;
import com.gentoro.analytics.exception.AnalyticsErrorCode;
import com.gentoro.analytics.exception.ExceptionUtil;
import com.gentoro.analytics.exception.InvalidDrillPathException;
import com.gentoro.analytics.exception.NonNumericMeasureException;
import com.gentoro.analytics.logging.LoggingService;
import com.gentoro.analytics.model.Column;
import com.gentoro.analytics.model.Dataset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Builds a {@link DrillTree} by aggregating a numeric measure at every level of a {@link
 * DrillPath}.
 *
 * <p>Level {@code i} is an independent {@link Reducer#SUM} over the cumulative prefix {@code
 * drillPath[0..i]}, never derived from its children, so each level can be verified on its own. A
 * node's id is the full prefix and its label the value of the prefix's last column; level {@code
 * i > 0} nodes are appended to the group of the node for the prefix without the last column.
 *
 * <p>A non-terminal node gets a {@code childrenId} only when at least one of its rows has a value
 * in the next drill column. Rows missing a drill column value are left out of every level where
 * that column takes part.
 *
 * <p>With {@link DrillDownSettings#parallelLevels()} enabled, levels are aggregated concurrently on
 * the supplied executor and joined in level order, which yields the same tree as sequential mode.
 */
public class DrillTreeBuilder {
  private static final org.slf4j.Logger log = LoggingService.getLogger(DrillTreeBuilder.class);

  private final AggregationEngine aggregationEngine;
  private final DrillDownSettings settings;
  private final Executor executor;

  public DrillTreeBuilder(AggregationEngine aggregationEngine) {
    this(aggregationEngine, DrillDownSettings.defaults(), null);
  }

  /**
   * @param executor used only when {@code settings.parallelLevels()} is set; {@code null} falls
   *     back to sequential aggregation
   */
  public DrillTreeBuilder(
      AggregationEngine aggregationEngine, DrillDownSettings settings, Executor executor) {
    this.aggregationEngine = aggregationEngine;
    this.settings = settings == null ? DrillDownSettings.defaults() : settings;
    this.executor = executor;
  }

  /**
   * Check that {@code path} and {@code measure} can be built over {@code dataset}'s schema.
   *
   * @throws InvalidDrillPathException if a drill column is absent or the path is too deep
   * @throws com.gentoro.analytics.exception.UnknownColumnException if the measure is absent
   * @throws NonNumericMeasureException if the measure is categorical
   */
  public void validate(Dataset dataset, DrillPath path, String measure) {
    if (path.length() > settings.maxDepth()) {
      throw new InvalidDrillPathException(
          "Drill path has "
              + path.length()
              + " columns, more than the configured maximum of "
              + settings.maxDepth());
    }
    path.requirePresentIn(dataset);
    Column measureColumn = dataset.requireColumn(measure);
    if (!measureColumn.isNumeric()) {
      throw new NonNumericMeasureException(measure);
    }
  }

  /** Validate, then aggregate every level and assemble the tree. */
  public DrillTree build(Dataset dataset, DrillPath path, String measure) {
    validate(dataset, path, measure);
    if (dataset.isEmpty()) {
      log.debug("Empty dataset, returning empty drill tree for {}", path.columns());
      return DrillTree.empty();
    }
    long start = System.nanoTime();
    List<List<GroupResult>> levels = aggregateLevels(dataset, path, measure);
    DrillTree tree = assemble(path, levels);
    log.debug(
        "Built drill tree over {} by {} in {} ms: {} top-level nodes, {} groups",
        measure,
        path.columns(),
        (System.nanoTime() - start) / 1_000_000,
        tree.topLevel().size(),
        tree.groups().size());
    return tree;
  }

  private List<List<GroupResult>> aggregateLevels(
      Dataset dataset, DrillPath path, String measure) {
    if (!settings.parallelLevels() || executor == null) {
      List<List<GroupResult>> levels = new ArrayList<>(path.length());
      for (int level = 0; level < path.length(); level++) {
        levels.add(aggregateLevel(dataset, path, measure, level));
      }
      return levels;
    }

    List<CompletableFuture<List<GroupResult>>> futures = new ArrayList<>(path.length());
    for (int level = 0; level < path.length(); level++) {
      int current = level;
      futures.add(
          CompletableFuture.supplyAsync(
              () -> aggregateLevel(dataset, path, measure, current), executor));
    }
    List<List<GroupResult>> levels = new ArrayList<>(futures.size());
    try {
      for (CompletableFuture<List<GroupResult>> future : futures) {
        levels.add(future.join());
      }
    } catch (CompletionException e) {
      throw ExceptionUtil.unwrap(e, AnalyticsErrorCode.UNKNOWN);
    }
    return levels;
  }

  private List<GroupResult> aggregateLevel(
      Dataset dataset, DrillPath path, String measure, int level) {
    return aggregationEngine.groupReduce(dataset, path.prefix(level), measure, Reducer.SUM);
  }

  private DrillTree assemble(DrillPath path, List<List<GroupResult>> levels) {
    List<DrillNode> topLevel = new ArrayList<>();
    Map<NodeId, List<DrillNode>> groups = new LinkedHashMap<>();

    for (int level = 0; level < levels.size(); level++) {
      List<String> prefix = path.prefix(level);
      Set<NodeId> expandable =
          path.isTerminal(level)
              ? Set.of()
              : parentsOf(path.prefix(level + 1), levels.get(level + 1));

      for (GroupResult result : levels.get(level)) {
        NodeId id = NodeId.of(prefix, result.key().values());
        NodeId childrenId = expandable.contains(id) ? id : null;
        DrillNode node = new DrillNode(id, result.key().last(), result.value(), level, childrenId);
        if (level == 0) {
          topLevel.add(node);
        } else {
          groups.computeIfAbsent(id.parent(), k -> new ArrayList<>()).add(node);
        }
      }
    }
    return DrillTree.of(topLevel, groups);
  }

  private static Set<NodeId> parentsOf(List<String> childPrefix, List<GroupResult> children) {
    Set<NodeId> parents = new HashSet<>();
    for (GroupResult child : children) {
      parents.add(NodeId.of(childPrefix, child.key().values()).parent());
    }
    return parents;
  }
}
