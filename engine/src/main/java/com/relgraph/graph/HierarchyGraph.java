package com.relgraph.graph;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import com.relgraph.model.HierarchyRule;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * The hierarchy rules of one namespace, indexed both ways per resource type. Immutable; every
 * change returns a new instance. Rule sets are small, so indexes are rebuilt on each change.
 */
public final class HierarchyGraph {

  public static final HierarchyGraph EMPTY = new HierarchyGraph(ImmutableList.of());

  private static final Comparator<HierarchyRule> RULE_ORDER =
      Comparator.comparing(HierarchyRule::resourceType)
          .thenComparing(HierarchyRule::permission)
          .thenComparing(HierarchyRule::implies);

  private final ImmutableList<HierarchyRule> rules;
  // resourceType -> permission -> implied permissions
  private final Map<String, Map<String, ImmutableSortedSet<String>>> forward;
  // resourceType -> implied permission -> permissions that imply it
  private final Map<String, Map<String, ImmutableSortedSet<String>>> reverse;

  private HierarchyGraph(List<HierarchyRule> rules) {
    List<HierarchyRule> sorted = new ArrayList<>(rules);
    sorted.sort(RULE_ORDER);
    this.rules = ImmutableList.copyOf(sorted);
    this.forward = index(this.rules, true);
    this.reverse = index(this.rules, false);
  }

  private static Map<String, Map<String, ImmutableSortedSet<String>>> index(
      List<HierarchyRule> rules, boolean forward) {
    Map<String, Map<String, TreeSet<String>>> building = new HashMap<>();
    for (HierarchyRule rule : rules) {
      String from = forward ? rule.permission() : rule.implies();
      String to = forward ? rule.implies() : rule.permission();
      building
          .computeIfAbsent(rule.resourceType(), t -> new HashMap<>())
          .computeIfAbsent(from, f -> new TreeSet<>())
          .add(to);
    }
    Map<String, Map<String, ImmutableSortedSet<String>>> result = new HashMap<>();
    building.forEach(
        (type, edges) -> {
          Map<String, ImmutableSortedSet<String>> frozen = new HashMap<>();
          edges.forEach((k, v) -> frozen.put(k, ImmutableSortedSet.copyOf(v)));
          result.put(type, frozen);
        });
    return result;
  }

  public ImmutableList<HierarchyRule> rules() {
    return rules;
  }

  public ImmutableList<HierarchyRule> rules(String resourceType) {
    return rules.stream()
        .filter(r -> r.resourceType().equals(resourceType))
        .collect(ImmutableList.toImmutableList());
  }

  public int size() {
    return rules.size();
  }

  public Optional<HierarchyRule> find(String resourceType, String permission, String implies) {
    return rules.stream()
        .filter(
            r ->
                r.resourceType().equals(resourceType)
                    && r.permission().equals(permission)
                    && r.implies().equals(implies))
        .findFirst();
  }

  /** Permissions directly implied by {@code permission} on {@code resourceType}. */
  public Set<String> implied(String resourceType, String permission) {
    return lookup(forward, resourceType, permission);
  }

  /** Permissions that directly imply {@code permission} on {@code resourceType}. */
  public Set<String> implying(String resourceType, String permission) {
    return lookup(reverse, resourceType, permission);
  }

  private static Set<String> lookup(
      Map<String, Map<String, ImmutableSortedSet<String>>> index, String type, String key) {
    Map<String, ImmutableSortedSet<String>> byType = index.get(type);
    if (byType == null) {
      return ImmutableSet.of();
    }
    ImmutableSortedSet<String> found = byType.get(key);
    return found == null ? ImmutableSet.of() : found;
  }

  public HierarchyGraph with(HierarchyRule rule) {
    return new HierarchyGraph(
        ImmutableList.<HierarchyRule>builder().addAll(rules).add(rule).build());
  }

  public HierarchyGraph without(Predicate<HierarchyRule> removed) {
    return new HierarchyGraph(
        rules.stream().filter(removed.negate()).collect(ImmutableList.toImmutableList()));
  }

  public static HierarchyGraph of(List<HierarchyRule> rules) {
    return rules.isEmpty() ? EMPTY : new HierarchyGraph(rules);
  }
}
