package com.relgraph.graph;

import com.google.common.collect.ImmutableList;
import com.relgraph.config.EngineConfig;
import com.relgraph.model.CyclePath;
import com.relgraph.model.EntityRef;
import com.relgraph.model.RelationTuple;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.tinylog.Logger;

/**
 * Keeps the membership graph and the resource-parent graph acyclic.
 *
 * <p>Both graphs are walked upward from the proposed parent: for membership the containing
 * groups of a group, for resources the parents of a resource. Expired edges still count,
 * because re-granting or extending them would revive the edge without another check.
 */
public final class CycleGuard {

  private final EngineConfig config;

  public CycleGuard(EngineConfig config) {
    this.config = config;
  }

  /** The upper endpoint of a structural edge: the group, or the parent resource. */
  public static EntityRef upper(RelationTuple edge) {
    return edge.isMembership() ? edge.resource() : edge.subject().entity();
  }

  /** The lower endpoint of a structural edge: the member, or the child resource. */
  public static EntityRef lower(RelationTuple edge) {
    return edge.isMembership() ? edge.subject().entity() : edge.resource();
  }

  /**
   * Whether adding {@code edge} would close a cycle. Only {@code member} and {@code parent}
   * edges can; everything else returns false.
   */
  public boolean wouldCreateCycle(NamespaceGraph graph, RelationTuple edge) {
    if (!edge.isStructural()) {
      return false;
    }
    EntityRef parent = upper(edge);
    EntityRef child = lower(edge);
    if (parent.equals(child)) {
      return true;
    }
    int maxDepth = edge.isMembership() ? config.maxGroupDepth() : config.maxResourceDepth();
    Set<EntityRef> seen = new HashSet<>();
    seen.add(parent);
    List<EntityRef> frontier = List.of(parent);
    for (int depth = 0; depth < maxDepth && !frontier.isEmpty(); depth++) {
      List<EntityRef> next = new ArrayList<>();
      for (EntityRef node : frontier) {
        for (EntityRef ancestor : ancestors(graph, node, edge.isMembership())) {
          if (ancestor.equals(child)) {
            return true;
          }
          if (seen.add(ancestor)) {
            next.add(ancestor);
          }
        }
      }
      frontier = next;
    }
    if (!frontier.isEmpty()) {
      Logger.warn(
          "Cycle check for {} stopped at depth {} with {} unexplored ancestors",
          edge,
          maxDepth,
          frontier.size());
    }
    return false;
  }

  private static List<EntityRef> ancestors(
      NamespaceGraph graph, EntityRef node, boolean membership) {
    List<EntityRef> result = new ArrayList<>();
    if (membership) {
      for (RelationTuple edge : graph.edgesFrom(node)) {
        if (edge.isMembership()) {
          result.add(edge.resource());
        }
      }
    } else {
      for (RelationTuple edge : graph.edges(node, RelationTuple.PARENT)) {
        result.add(edge.subject().entity());
      }
    }
    return result;
  }

  /**
   * Enumerates the cycles present in both structural graphs of one namespace. Each cycle is
   * reported once, starting from its smallest node, in the direction the edges point (group to
   * member, child to parent).
   */
  public List<CyclePath> detectCycles(NamespaceGraph graph) {
    ImmutableList.Builder<CyclePath> found = ImmutableList.builder();
    found.addAll(cyclesIn(adjacency(graph, true), CyclePath.Graph.MEMBERSHIP));
    found.addAll(cyclesIn(adjacency(graph, false), CyclePath.Graph.RESOURCE));
    return found.build();
  }

  private static Map<EntityRef, Set<EntityRef>> adjacency(
      NamespaceGraph graph, boolean membership) {
    Map<EntityRef, Set<EntityRef>> edges = new TreeMap<>();
    graph
        .tuples()
        .filter(t -> membership ? t.isMembership() : t.isParent())
        .forEach(
            t -> {
              edges.computeIfAbsent(t.resource(), k -> new TreeSet<>()).add(t.subject().entity());
            });
    return edges;
  }

  // Iterative DFS; every back edge yields the cycle on the current stack.
  private static List<CyclePath> cyclesIn(
      Map<EntityRef, Set<EntityRef>> edges, CyclePath.Graph kind) {
    Map<EntityRef, Integer> state = new HashMap<>(); // 1 = on stack, 2 = done
    Set<List<EntityRef>> seenCycles = new HashSet<>();
    List<CyclePath> cycles = new ArrayList<>();
    for (EntityRef root : edges.keySet()) {
      if (state.containsKey(root)) {
        continue;
      }
      List<EntityRef> stack = new ArrayList<>();
      List<Iterator<EntityRef>> iterators = new ArrayList<>();
      stack.add(root);
      iterators.add(edges.getOrDefault(root, Set.of()).iterator());
      state.put(root, 1);
      while (!stack.isEmpty()) {
        Iterator<EntityRef> it = iterators.get(iterators.size() - 1);
        if (!it.hasNext()) {
          state.put(stack.remove(stack.size() - 1), 2);
          iterators.remove(iterators.size() - 1);
          continue;
        }
        EntityRef next = it.next();
        Integer nextState = state.get(next);
        if (nextState == null) {
          state.put(next, 1);
          stack.add(next);
          iterators.add(edges.getOrDefault(next, Set.of()).iterator());
        } else if (nextState == 1) {
          List<EntityRef> cycle = canonical(stack.subList(stack.indexOf(next), stack.size()));
          if (seenCycles.add(cycle)) {
            List<EntityRef> closed = new ArrayList<>(cycle);
            closed.add(cycle.get(0));
            cycles.add(new CyclePath(kind, closed));
          }
        }
      }
    }
    return cycles;
  }

  // Rotates the cycle so that its smallest node comes first.
  private static List<EntityRef> canonical(List<EntityRef> cycle) {
    int start = 0;
    for (int i = 1; i < cycle.size(); i++) {
      if (cycle.get(i).compareTo(cycle.get(start)) < 0) {
        start = i;
      }
    }
    List<EntityRef> rotated = new ArrayList<>(cycle.size());
    for (int i = 0; i < cycle.size(); i++) {
      rotated.add(cycle.get((start + i) % cycle.size()));
    }
    return ImmutableList.copyOf(rotated);
  }
}
