package com.relgraph.model;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A cycle found by the diagnostic sweep. The first and last node are the same entity.
 *
 * @param graph Which structural graph the cycle lives in
 * @param nodes The entities along the cycle, in edge order
 */
public record CyclePath(Graph graph, List<EntityRef> nodes) {

  /** The two structural graphs kept in the tuple table. */
  public enum Graph {
    /** Group to member edges ({@code relation = member}). */
    MEMBERSHIP,
    /** Child to parent edges ({@code relation = parent}). */
    RESOURCE
  }

  public CyclePath {
    nodes = ImmutableList.copyOf(nodes);
  }

  @Override
  public String toString() {
    return graph
        + ": "
        + nodes.stream().map(EntityRef::toString).collect(Collectors.joining(" -> "));
  }
}
