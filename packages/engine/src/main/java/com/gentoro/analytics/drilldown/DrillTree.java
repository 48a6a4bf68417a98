package com.gentoro.analytics.drilldown;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Result of a drill-down aggregation: the level-0 nodes plus, for every expandable node, the list
 * of its children keyed by the node's {@link DrillNode#childrenId()}.
 *
 * <p>Invariants, checked on construction: every {@code childrenId} is a key of {@link #groups()},
 * and every key of {@link #groups()} is referenced by exactly one node. Lists keep first-seen
 * order. Instances are immutable.
 *
 * <p>Jackson writes a tree as {@code {"topLevel": [...], "groups": {"<encoded id>": [...]}}};
 * {@link com.gentoro.analytics.request.DrillTreeSerializer} offers the chart and node-list
 * layouts.
 */
public final class DrillTree {
  private static final DrillTree EMPTY = new DrillTree(List.of(), Map.of());

  private final List<DrillNode> topLevel;
  private final Map<NodeId, List<DrillNode>> groups;
  private final Map<NodeId, DrillNode> nodesById;

  private DrillTree(List<DrillNode> topLevel, Map<NodeId, List<DrillNode>> groups) {
    this.topLevel = topLevel;
    this.groups = groups;
    this.nodesById = index(topLevel, groups);
  }

  public static DrillTree empty() {
    return EMPTY;
  }

  /**
   * @throws IllegalStateException if the linkage invariants do not hold
   */
  public static DrillTree of(List<DrillNode> topLevel, Map<NodeId, List<DrillNode>> groups) {
    Map<NodeId, List<DrillNode>> copy = new LinkedHashMap<>();
    for (Map.Entry<NodeId, List<DrillNode>> e : groups.entrySet()) {
      copy.put(e.getKey(), List.copyOf(e.getValue()));
    }
    DrillTree tree = new DrillTree(List.copyOf(topLevel), Collections.unmodifiableMap(copy));
    tree.checkLinkage();
    return tree;
  }

  @JsonProperty("topLevel")
  public List<DrillNode> topLevel() {
    return topLevel;
  }

  @JsonProperty("groups")
  public Map<NodeId, List<DrillNode>> groups() {
    return groups;
  }

  @JsonIgnore
  public boolean isEmpty() {
    return topLevel.isEmpty();
  }

  /** Children of the node with the given id; empty for leaves and unknown ids. */
  public List<DrillNode> children(NodeId id) {
    return groups.getOrDefault(id, List.of());
  }

  /** {@link #children(NodeId)} for an id in its {@link NodeId#encode() encoded} form. */
  public List<DrillNode> expand(String encodedId) {
    return children(NodeId.decode(encodedId));
  }

  public Optional<DrillNode> node(NodeId id) {
    return Optional.ofNullable(nodesById.get(id));
  }

  /** Every node, top level first, then groups in insertion order. */
  public List<DrillNode> nodes() {
    List<DrillNode> all = new ArrayList<>(nodesById.size());
    all.addAll(topLevel);
    for (List<DrillNode> children : groups.values()) {
      all.addAll(children);
    }
    return all;
  }

  public int size() {
    return nodesById.size();
  }

  private static Map<NodeId, DrillNode> index(
      List<DrillNode> topLevel, Map<NodeId, List<DrillNode>> groups) {
    Map<NodeId, DrillNode> byId = new HashMap<>();
    for (DrillNode node : topLevel) {
      putUnique(byId, node);
    }
    for (List<DrillNode> children : groups.values()) {
      for (DrillNode node : children) {
        putUnique(byId, node);
      }
    }
    return byId;
  }

  private static void putUnique(Map<NodeId, DrillNode> byId, DrillNode node) {
    if (byId.putIfAbsent(node.id(), node) != null) {
      throw new IllegalStateException("Duplicate node id " + node.id());
    }
  }

  private void checkLinkage() {
    Set<NodeId> referenced = new HashSet<>();
    for (DrillNode node : nodesById.values()) {
      if (!node.hasChildren()) {
        continue;
      }
      if (!groups.containsKey(node.childrenId())) {
        throw new IllegalStateException(
            "Node " + node.id() + " references missing group " + node.childrenId());
      }
      if (!referenced.add(node.childrenId())) {
        throw new IllegalStateException("Group " + node.childrenId() + " is referenced twice");
      }
    }
    for (NodeId key : groups.keySet()) {
      if (!referenced.contains(key)) {
        throw new IllegalStateException("Group " + key + " is not referenced by any node");
      }
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof DrillTree other)) return false;
    return topLevel.equals(other.topLevel) && groups.equals(other.groups);
  }

  @Override
  public int hashCode() {
    return 31 * topLevel.hashCode() + groups.hashCode();
  }

  @Override
  public String toString() {
    return "DrillTree{" + "topLevel=" + topLevel.size() + ", groups=" + groups.size() + '}';
  }
}
