package com.gentoro.analytics.drilldown;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.analytics.exception.InvalidRequestException;
import com.gentoro.analytics.utility.JacksonUtility;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DrillTreeTest {

  private static final NodeId EAST = NodeId.of("Region", "East");
  private static final NodeId WEST = NodeId.of("Region", "West");
  private static final NodeId EAST_US = EAST.child("Country", "US");

  private static DrillTree sample() {
    Map<NodeId, List<DrillNode>> groups = new LinkedHashMap<>();
    groups.put(EAST, List.of(new DrillNode(EAST_US, "US", 15, 1, null)));
    return DrillTree.of(
        List.of(new DrillNode(EAST, "East", 15, 0, EAST), new DrillNode(WEST, "West", 7, 0, null)),
        groups);
  }

  @Test
  @DisplayName("lookups by id and by encoded id")
  void lookups() {
    DrillTree tree = sample();

    assertEquals(3, tree.size());
    assertEquals(List.of("US"), tree.children(EAST).stream().map(DrillNode::label).toList());
    assertEquals(tree.children(EAST), tree.expand("Region=East"));
    assertTrue(tree.children(WEST).isEmpty());
    assertTrue(tree.expand("Region=Nowhere").isEmpty());
    assertEquals(15.0, tree.node(EAST_US).orElseThrow().value());
    assertFalse(tree.node(NodeId.of("Region", "North")).isPresent());
    assertEquals(
        List.of(EAST, WEST, EAST_US), tree.nodes().stream().map(DrillNode::id).toList());
  }

  @Test
  @DisplayName("Jackson writes top level and groups keyed by encoded id")
  void jsonForm() {
    JsonNode json = JacksonUtility.getJsonMapper().valueToTree(sample());

    assertFalse(json.has("empty"));
    assertEquals(2, json.get("topLevel").size());
    JsonNode east = json.get("topLevel").get(0);
    assertEquals("Region=East", east.get("id").asText());
    assertEquals("Region=East", east.get("childrenId").asText());
    assertFalse(json.get("topLevel").get(1).has("childrenId"));
    JsonNode children = json.get("groups").get("Region=East");
    assertEquals("Region=East/Country=US", children.get(0).get("id").asText());
    assertEquals(15.0, children.get(0).get("value").asDouble());
  }

  @Test
  @DisplayName("expanding a malformed id fails")
  void expandMalformed() {
    assertThrows(InvalidRequestException.class, () -> sample().expand("Region"));
  }

  @Test
  @DisplayName("empty tree has no nodes")
  void emptyTree() {
    assertTrue(DrillTree.empty().isEmpty());
    assertEquals(0, DrillTree.empty().size());
    assertTrue(DrillTree.empty().groups().isEmpty());
  }

  @Test
  @DisplayName("a childrenId without a group is rejected")
  void missingGroup() {
    assertThrows(
        IllegalStateException.class,
        () -> DrillTree.of(List.of(new DrillNode(EAST, "East", 15, 0, EAST)), Map.of()));
  }

  @Test
  @DisplayName("a group without a referencing node is rejected")
  void orphanGroup() {
    Map<NodeId, List<DrillNode>> groups =
        Map.of(EAST, List.of(new DrillNode(EAST_US, "US", 15, 1, null)));

    assertThrows(
        IllegalStateException.class,
        () -> DrillTree.of(List.of(new DrillNode(EAST, "East", 15, 0, null)), groups));
  }

  @Test
  @DisplayName("duplicate node ids are rejected")
  void duplicateIds() {
    assertThrows(
        IllegalStateException.class,
        () ->
            DrillTree.of(
                List.of(
                    new DrillNode(EAST, "East", 1, 0, null),
                    new DrillNode(EAST, "East", 2, 0, null)),
                Map.of()));
  }

  @Test
  @DisplayName("the tree is unmodifiable")
  void immutable() {
    DrillTree tree = sample();

    assertThrows(UnsupportedOperationException.class, () -> tree.topLevel().clear());
    assertThrows(UnsupportedOperationException.class, () -> tree.groups().clear());
    assertThrows(UnsupportedOperationException.class, () -> tree.children(EAST).clear());
  }
}
