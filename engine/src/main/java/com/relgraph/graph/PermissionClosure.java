package com.relgraph.graph;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * The set of relations that satisfy a permission on one resource type: the permission itself
 * plus everything that implies it, over the global and tenant rules combined.
 *
 * <p>Each member remembers the implication chain that leads to the target permission, e.g.
 * {@code [admin, write, read]} for {@code admin} in the closure of {@code read}.
 */
public final class PermissionClosure {

  private final String permission;
  private final ImmutableMap<String, ImmutableList<String>> chains;

  private PermissionClosure(String permission, ImmutableMap<String, ImmutableList<String>> chains) {
    this.permission = permission;
    this.chains = chains;
  }

  /**
   * Breadth-first over reverse implication edges, at most {@code maxDepth} hops from the target.
   * Members are ordered by distance, then name, so the target itself is always first.
   */
  public static PermissionClosure of(
      HierarchyGraph global,
      HierarchyGraph tenant,
      String resourceType,
      String permission,
      int maxDepth) {
    Map<String, ImmutableList<String>> chains = new LinkedHashMap<>();
    chains.put(permission, ImmutableList.of(permission));
    List<String> frontier = List.of(permission);
    for (int depth = 0; depth < maxDepth && !frontier.isEmpty(); depth++) {
      List<String> next = new ArrayList<>();
      for (String implied : frontier) {
        Set<String> implying = new TreeSet<>(global.implying(resourceType, implied));
        implying.addAll(tenant.implying(resourceType, implied));
        for (String stronger : implying) {
          if (!chains.containsKey(stronger)) {
            chains.put(
                stronger,
                ImmutableList.<String>builder().add(stronger).addAll(chains.get(implied)).build());
            next.add(stronger);
          }
        }
      }
      frontier = next;
    }
    return new PermissionClosure(permission, ImmutableMap.copyOf(chains));
  }

  public String permission() {
    return permission;
  }

  public ImmutableSet<String> relations() {
    return chains.keySet();
  }

  public boolean contains(String relation) {
    return chains.containsKey(relation);
  }

  /** Chain from {@code relation} down to the target permission; empty if not a member. */
  public List<String> chain(String relation) {
    ImmutableList<String> chain = chains.get(relation);
    return chain == null ? ImmutableList.of() : chain;
  }

  /**
   * Everything {@code permission} implies on {@code resourceType}, itself included, bounded by
   * {@code maxDepth} hops.
   */
  public static Set<String> implied(
      HierarchyGraph global,
      HierarchyGraph tenant,
      String resourceType,
      String permission,
      int maxDepth) {
    Set<String> seen = new LinkedHashSet<>();
    seen.add(permission);
    List<String> frontier = List.of(permission);
    for (int depth = 0; depth < maxDepth && !frontier.isEmpty(); depth++) {
      List<String> next = new ArrayList<>();
      for (String stronger : frontier) {
        for (String weaker : union(global, tenant, resourceType, stronger)) {
          if (seen.add(weaker)) {
            next.add(weaker);
          }
        }
      }
      frontier = next;
    }
    return Collections.unmodifiableSet(seen);
  }

  private static Set<String> union(
      HierarchyGraph global, HierarchyGraph tenant, String resourceType, String permission) {
    Set<String> result = new TreeSet<>(global.implied(resourceType, permission));
    result.addAll(tenant.implied(resourceType, permission));
    return result;
  }

  /**
   * Searches forward implication edges from {@code from} for {@code to}, without a depth bound.
   * Used to reject rules that would close a cycle.
   *
   * @return the path {@code [from, ..., to]} if one exists
   */
  public static Optional<List<String>> findPath(
      HierarchyGraph first, HierarchyGraph second, String resourceType, String from, String to) {
    Map<String, String> predecessor = new HashMap<>();
    Deque<String> queue = new ArrayDeque<>();
    predecessor.put(from, from);
    queue.add(from);
    while (!queue.isEmpty()) {
      String node = queue.poll();
      if (node.equals(to)) {
        List<String> path = new ArrayList<>();
        for (String at = to; ; at = predecessor.get(at)) {
          path.add(at);
          if (at.equals(from)) {
            break;
          }
        }
        Collections.reverse(path);
        return Optional.of(path);
      }
      for (String next : union(first, second, resourceType, node)) {
        if (!predecessor.containsKey(next)) {
          predecessor.put(next, node);
          queue.add(next);
        }
      }
    }
    return Optional.empty();
  }
}
