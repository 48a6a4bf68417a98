package com.gentoro.analytics.request;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.analytics.aggregate.AggregationEngine;
import com.gentoro.analytics.config.DrillDownSettings;
import com.gentoro.analytics.drilldown.DrillPath;
import com.gentoro.analytics.drilldown.DrillTree;
import com.gentoro.analytics.drilldown.DrillTreeBuilder;
import com.gentoro.analytics.exception.InvalidRequestException;
import com.gentoro.analytics.filter.FilterEngine;
import com.gentoro.analytics.logging.LoggingService;
import com.gentoro.analytics.model.Column;
import com.gentoro.analytics.model.Dataset;
import com.gentoro.analytics.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import org.apache.commons.configuration2.Configuration;

/**
 * Entry point of the engine: scope, then filter, then build the drill-down tree.
 *
 * <p>The service holds no per-call state. A single instance can serve concurrent requests over the
 * same read-only dataset.
 */
public class DrillDownService {
  private static final org.slf4j.Logger log = LoggingService.getLogger(DrillDownService.class);

  /** Number of leading columns proposed by {@link #defaultDrillPath(Dataset)}. */
  public static final int DEFAULT_DRILL_DEPTH = 3;

  private final DrillDownSettings settings;
  private final FilterEngine filterEngine;
  private final DrillTreeBuilder treeBuilder;

  public DrillDownService() {
    this(DrillDownSettings.defaults(), null);
  }

  /**
   * Settings from {@code drilldown.*} keys; parallel mode runs on the common fork-join pool. Any
   * {@code logging.level.*} entries are applied as well.
   */
  public DrillDownService(Configuration config) {
    this(DrillDownSettings.from(config), ForkJoinPool.commonPool());
    int levels = LoggingService.applyConfiguration(config);
    log.debug("Applied {} configured log level(s)", levels);
  }

  public DrillDownService(DrillDownSettings settings, Executor executor) {
    this.settings = settings == null ? DrillDownSettings.defaults() : settings;
    this.filterEngine = new FilterEngine();
    this.treeBuilder = new DrillTreeBuilder(new AggregationEngine(), this.settings, executor);
  }

  /** Scope, filter and aggregate; returns only the tree. */
  public DrillTree buildDrillTree(Dataset dataset, AggregationRequest request) {
    return execute(dataset, request).tree();
  }

  /**
   * Scope, filter and aggregate.
   *
   * <p>The whole request is validated first; on failure no table or tree is produced.
   */
  public DrillDownResult execute(Dataset dataset, AggregationRequest request) {
    if (dataset == null) {
      throw new InvalidRequestException("Dataset must not be null");
    }
    DrillPath path = RequestValidator.validate(dataset, request, settings);
    log.debug("Executing {} over {} rows", request, dataset.size());

    Dataset scoped = filterEngine.scope(dataset, request.getScope());
    Dataset filtered = filterEngine.filter(scoped, request.getFilters());
    DrillTree tree = treeBuilder.build(filtered, path, request.getMeasure());
    return new DrillDownResult(filtered, tree);
  }

  /** Parse a JSON request (see {@link AggregationRequest}) and execute it. */
  public DrillDownResult execute(Dataset dataset, String requestJson) {
    return execute(dataset, parseRequest(requestJson));
  }

  /**
   * @throws InvalidRequestException if the JSON is malformed or does not bind to a request
   */
  public static AggregationRequest parseRequest(String requestJson) {
    if (requestJson == null || requestJson.isBlank()) {
      throw new InvalidRequestException("Request JSON must not be empty");
    }
    try {
      JsonNode node = JacksonUtility.getJsonMapper().readTree(requestJson);
      return JacksonUtility.getJsonMapper().treeToValue(node, AggregationRequest.class);
    } catch (JsonProcessingException e) {
      throw new InvalidRequestException("Invalid aggregation request: " + e.getOriginalMessage());
    }
  }

  /** Numeric columns, in schema order: the columns a drill-down can aggregate. */
  public static List<String> measureCandidates(Dataset dataset) {
    List<String> numeric = new ArrayList<>();
    for (Column column : dataset.columns()) {
      if (column.isNumeric()) {
        numeric.add(column.name());
      }
    }
    return numeric;
  }

  /** The first {@value #DEFAULT_DRILL_DEPTH} columns (fewer when the schema is narrower). */
  public static List<String> defaultDrillPath(Dataset dataset) {
    List<String> names = dataset.columnNames();
    return new ArrayList<>(names.subList(0, Math.min(DEFAULT_DRILL_DEPTH, names.size())));
  }

  public DrillDownSettings settings() {
    return settings;
  }
}
