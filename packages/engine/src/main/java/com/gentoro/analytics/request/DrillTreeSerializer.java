package com.gentoro.analytics.request;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.analytics.drilldown.DrillNode;
import com.gentoro.analytics.drilldown.DrillTree;
import com.gentoro.analytics.drilldown.NodeId;
import com.gentoro.analytics.exception.ErrorDetails;
import com.gentoro.analytics.exception.ExceptionUtil;
import com.gentoro.analytics.model.Dataset;
import com.gentoro.analytics.model.Row;
import com.gentoro.analytics.utility.JacksonUtility;
import java.util.List;
import java.util.Map;

/**
 * JSON views of engine results for a presentation layer.
 *
 * <ul>
 *   <li>{@link #toChartJson(DrillTree)}: top-level series plus drill-down series keyed by id, the
 *       layout charting libraries with drill-down support consume.
 *   <li>{@link #toNodeList(DrillTree)}: flat node list with explicit {@code parentId}.
 *   <li>{@link #toRecords(Dataset)}: the flat table as an array of row objects.
 *   <li>{@link #toErrorJson(Throwable)}: structured error body.
 * </ul>
 *
 * <p>Ids are written in their {@link NodeId#encode() encoded} form.
 */
public final class DrillTreeSerializer {

  private DrillTreeSerializer() {}

  /**
   * <pre>{@code
   * {
   *   "top_level": [{"name": "East", "y": 15.0, "drilldown": "Region=East"}],
   *   "drilldown": [{"id": "Region=East", "data": [{"name": "US", "y": 15.0}]}]
   * }
   * }</pre>
   */
  public static ObjectNode toChartJson(DrillTree tree) {
    ObjectMapper mapper = JacksonUtility.getJsonMapper();
    ObjectNode root = mapper.createObjectNode();
    root.set("top_level", points(tree.topLevel()));
    ArrayNode drilldown = root.putArray("drilldown");
    for (Map.Entry<NodeId, List<DrillNode>> group : tree.groups().entrySet()) {
      ObjectNode series = drilldown.addObject();
      series.put("id", group.getKey().encode());
      series.set("data", points(group.getValue()));
    }
    return root;
  }

  public static ArrayNode toNodeList(DrillTree tree) {
    ArrayNode nodes = JacksonUtility.getJsonMapper().createArrayNode();
    for (DrillNode node : tree.nodes()) {
      ObjectNode item = nodes.addObject();
      item.put("id", node.id().encode());
      NodeId parent = node.id().parent();
      if (parent == null) {
        item.putNull("parentId");
      } else {
        item.put("parentId", parent.encode());
      }
      item.put("label", node.label());
      item.put("value", node.value());
      item.put("level", node.level());
      item.put("expandable", node.hasChildren());
    }
    return nodes;
  }

  public static ArrayNode toRecords(Dataset dataset) {
    ObjectMapper mapper = JacksonUtility.getJsonMapper();
    ArrayNode records = mapper.createArrayNode();
    for (Row row : dataset.rows()) {
      records.add(mapper.valueToTree(row.values()));
    }
    return records;
  }

  public static ObjectNode toErrorJson(Throwable error) {
    ObjectMapper mapper = JacksonUtility.getJsonMapper();
    ErrorDetails details = ExceptionUtil.toErrorDetails(error);
    ObjectNode body = mapper.createObjectNode();
    body.put("type", details.type());
    body.put("code", details.code().name());
    body.put("message", details.message());
    if (details.context() != null && !details.context().isEmpty()) {
      body.set("context", mapper.valueToTree(details.context()));
    }
    body.put("timestamp", details.timestamp().toString());
    return body;
  }

  private static ArrayNode points(List<DrillNode> nodes) {
    ArrayNode data = JacksonUtility.getJsonMapper().createArrayNode();
    for (DrillNode node : nodes) {
      ObjectNode point = data.addObject();
      point.put("name", node.label());
      point.put("y", node.value());
      if (node.hasChildren()) {
        point.put("drilldown", node.childrenId().encode());
      }
    }
    return data;
  }
}
