package com.relgraph.graph;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import com.relgraph.model.HierarchyRule;
import java.util.HashMap;
import java.util.Map;

/**
 * One consistent version of the whole graph: every namespace's tuples and hierarchy rules.
 * Queries read exactly one {@code GraphState}; writers publish a successor through {@link
 * GraphStore}.
 */
public final class GraphState {

  private static final GraphState EMPTY = new GraphState(ImmutableMap.of(), 0L);

  private final ImmutableMap<String, NamespaceGraph> namespaces;
  private final long version;

  private GraphState(ImmutableMap<String, NamespaceGraph> namespaces, long version) {
    this.namespaces = namespaces;
    this.version = version;
  }

  public static GraphState empty() {
    return EMPTY;
  }

  public long version() {
    return version;
  }

  /** The namespace's graph, or an empty graph if nothing was ever written to it. */
  public NamespaceGraph namespace(String namespace) {
    return namespaces.getOrDefault(namespace, NamespaceGraph.EMPTY);
  }

  public HierarchyGraph globalHierarchy() {
    return namespace(HierarchyRule.GLOBAL_NAMESPACE).hierarchy();
  }

  /** Tenant namespaces with any data, sorted. {@code global} is excluded. */
  public ImmutableSortedSet<String> tenantNamespaces() {
    return namespaces.keySet().stream()
        .filter(ns -> !HierarchyRule.GLOBAL_NAMESPACE.equals(ns))
        .collect(ImmutableSortedSet.toImmutableSortedSet(String::compareTo));
  }

  /** Returns the successor state with {@code namespace} replaced by {@code graph}. */
  public GraphState with(String namespace, NamespaceGraph graph) {
    Map<String, NamespaceGraph> next = new HashMap<>(namespaces);
    if (graph.isEmpty()) {
      next.remove(namespace);
    } else {
      next.put(namespace, graph);
    }
    return new GraphState(ImmutableMap.copyOf(next), version + 1);
  }
}
