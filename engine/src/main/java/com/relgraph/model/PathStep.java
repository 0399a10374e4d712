package com.relgraph.model;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * One hop of a witness path returned by explain.
 *
 * @param kind How this hop contributes to the grant
 * @param relation The relation held at {@code entity}
 * @param entity The entity the hop lands on (resource, group, userset owner or parent)
 * @param chain Supporting chain: implication chain for hierarchy steps, group chain for group
 *     steps, containment chain for resource steps; empty otherwise
 * @param description Human-readable rendering of the hop
 */
public record PathStep(
    Kind kind, String relation, EntityRef entity, List<String> chain, String description) {

  public enum Kind {
    HIERARCHY,
    DIRECT,
    GROUP,
    USERSET,
    RESOURCE
  }

  public PathStep {
    chain = ImmutableList.copyOf(chain);
  }

  @Override
  public String toString() {
    return description;
  }
}
