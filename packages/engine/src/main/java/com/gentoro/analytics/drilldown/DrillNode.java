package com.gentoro.analytics.drilldown;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Objects;
import java.util.Optional;

/**
 * One node of a {@link DrillTree}.
 *
 * @param id globally unique id of the node's drill prefix
 * @param label value of the node's own (last) drill column
 * @param value Sum of the measure over the rows matching the prefix
 * @param level 0-based depth
 * @param childrenId key of the node's children in {@link DrillTree#groups()}; {@code null} for
 *     leaves
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DrillNode(NodeId id, String label, double value, int level, NodeId childrenId) {
  public DrillNode {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(label, "label");
  }

  @JsonIgnore
  public boolean hasChildren() {
    return childrenId != null;
  }

  @JsonIgnore
  public Optional<NodeId> children() {
    return Optional.ofNullable(childrenId);
  }
}
