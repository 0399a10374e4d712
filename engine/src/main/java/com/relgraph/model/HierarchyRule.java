package com.relgraph.model;

import java.time.Instant;

/**
 * A permission implication: holding {@code permission} on a resource of {@code resourceType}
 * also grants {@code implies}.
 *
 * @param id The engine-assigned rule id
 * @param namespace Either {@code global} or a tenant namespace
 * @param resourceType The resource type the rule applies to
 * @param permission The stronger permission
 * @param implies The permission it implies
 * @param createdAt When the rule was added
 */
public record HierarchyRule(
    long id,
    String namespace,
    String resourceType,
    String permission,
    String implies,
    Instant createdAt) {

  public static final String GLOBAL_NAMESPACE = "global";

  public boolean isGlobal() {
    return GLOBAL_NAMESPACE.equals(namespace);
  }

  @Override
  public String toString() {
    return namespace + "/" + resourceType + ": " + permission + " -> " + implies;
  }
}
