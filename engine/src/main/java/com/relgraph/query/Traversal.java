package com.relgraph.query;

import com.google.common.collect.ImmutableList;
import com.relgraph.config.EngineConfig;
import com.relgraph.graph.GraphState;
import com.relgraph.graph.HierarchyGraph;
import com.relgraph.graph.NamespaceGraph;
import com.relgraph.graph.PermissionClosure;
import com.relgraph.model.EntityRef;
import com.relgraph.model.PathStep;
import com.relgraph.model.RelationTuple;
import com.relgraph.model.SubjectRef;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One subject's view of one graph snapshot. Answers "does the subject hold this permission on
 * this resource" and returns the witness path when it does.
 *
 * <p>A subject is connected to a resource via relation {@code r} when one of these holds, tried
 * in this order:
 *
 * <ol>
 *   <li>a live edge grants {@code r} to the subject itself;
 *   <li>a live edge grants {@code r} to a group the subject belongs to through plain {@code
 *       member} edges;
 *   <li>a live edge grants {@code r} to a userset {@code X#sr} and the subject holds {@code sr}
 *       on {@code X};
 *   <li>the resource has a live parent, {@code r} cascades to the resource's type, and the
 *       subject is connected to the parent via {@code r}.
 * </ol>
 *
 * <p>Results are memoized per (entity, relation) for the lifetime of the traversal. A negative
 * result is memoized only if no depth bound or recursion cycle cut the search short. Not
 * thread-safe; create one per query.
 */
public final class Traversal {

  private static final ImmutableList<PathStep> NONE = ImmutableList.of();

  private record Node(EntityRef entity, String relation, boolean permission) {}

  private final NamespaceGraph graph;
  private final HierarchyGraph global;
  private final EngineConfig config;
  private final Instant now;
  private final SubjectRef subject;

  private final Map<String, PermissionClosure> closures = new HashMap<>();
  private final Map<Node, ImmutableList<PathStep>> memo = new HashMap<>();
  private final Set<Node> inProgress = new HashSet<>();
  private Map<EntityRef, ImmutableList<EntityRef>> groups;
  private boolean groupChaseTruncated;
  private int cutoffs;

  public Traversal(
      GraphState state, String namespace, EngineConfig config, Instant now, SubjectRef subject) {
    this.graph = state.namespace(namespace);
    this.global = state.globalHierarchy();
    this.config = config;
    this.now = now;
    this.subject = subject;
  }

  public SubjectRef subject() {
    return subject;
  }

  public boolean check(String permission, EntityRef resource) {
    return !witness(permission, resource).isEmpty();
  }

  /** The first chain of edges granting {@code permission}, or an empty list if none exists. */
  public ImmutableList<PathStep> witness(String permission, EntityRef resource) {
    return resolve(resource, permission, 0);
  }

  PermissionClosure closure(String resourceType, String permission) {
    return closures.computeIfAbsent(
        resourceType + "#" + permission,
        k ->
            PermissionClosure.of(
                global, graph.hierarchy(), resourceType, permission, config.maxHierarchyDepth()));
  }

  private ImmutableList<PathStep> resolve(EntityRef resource, String permission, int usersetDepth) {
    Node node = new Node(resource, permission, true);
    ImmutableList<PathStep> cached = memo.get(node);
    if (cached != null) {
      return cached;
    }
    if (!inProgress.add(node)) {
      cutoffs++;
      return NONE;
    }
    int cutoffsBefore = cutoffs;
    try {
      PermissionClosure closure = closure(resource.type(), permission);
      for (String relation : closure.relations()) {
        ImmutableList<PathStep> found = connected(resource, relation, 0, usersetDepth);
        if (!found.isEmpty()) {
          List<String> chain = closure.chain(relation);
          ImmutableList<PathStep> result =
              chain.size() > 1 ? prepend(hierarchyStep(permission, resource, chain), found) : found;
          memo.put(node, result);
          return result;
        }
      }
      if (cutoffs == cutoffsBefore) {
        memo.put(node, NONE);
      }
      return NONE;
    } finally {
      inProgress.remove(node);
    }
  }

  private ImmutableList<PathStep> connected(
      EntityRef resource, String relation, int parentDepth, int usersetDepth) {
    Node node = new Node(resource, relation, false);
    ImmutableList<PathStep> cached = memo.get(node);
    if (cached != null) {
      return cached;
    }
    if (!inProgress.add(node)) {
      cutoffs++;
      return NONE;
    }
    int cutoffsBefore = cutoffs;
    try {
      ImmutableList<PathStep> result = search(resource, relation, parentDepth, usersetDepth);
      if (!result.isEmpty() || cutoffs == cutoffsBefore) {
        memo.put(node, result);
      }
      return result;
    } finally {
      inProgress.remove(node);
    }
  }

  private ImmutableList<PathStep> search(
      EntityRef resource, String relation, int parentDepth, int usersetDepth) {
    if (graph.find(resource, relation, subject).filter(t -> t.isLive(now)).isPresent()) {
      return ImmutableList.of(
          new PathStep(
              PathStep.Kind.DIRECT,
              relation,
              resource,
              List.of(),
              String.format("DIRECT: %s has %s on %s", subject, relation, resource)));
    }

    List<RelationTuple> usersets = new ArrayList<>();
    for (RelationTuple edge : graph.edges(resource, relation)) {
      if (!edge.isLive(now)) {
        continue;
      }
      if (edge.subject().isUserset()) {
        usersets.add(edge);
        continue;
      }
      ImmutableList<EntityRef> groupChain = groups().get(edge.subject().entity());
      if (groupChain != null) {
        return ImmutableList.of(groupStep(relation, resource, groupChain));
      }
    }
    if (groupChaseTruncated && !subject.isUserset()) {
      cutoffs++;
    }

    for (RelationTuple edge : usersets) {
      if (usersetDepth + 1 > config.maxGroupDepth()) {
        cutoffs++;
        continue;
      }
      EntityRef owner = edge.subject().entity();
      String ownerRelation = edge.subject().relation();
      ImmutableList<PathStep> inner = resolve(owner, ownerRelation, usersetDepth + 1);
      if (!inner.isEmpty()) {
        return prepend(
            new PathStep(
                PathStep.Kind.USERSET,
                ownerRelation,
                owner,
                List.of(edge.subject().toString()),
                String.format(
                    "USERSET: %s holds %s on %s, which has %s on %s",
                    subject, ownerRelation, owner, relation, resource)),
            inner);
      }
    }

    if (config.parentInheritance().cascades(resource.type(), relation)) {
      for (RelationTuple edge : graph.edges(resource, RelationTuple.PARENT)) {
        if (!edge.isLive(now)) {
          continue;
        }
        if (parentDepth + 1 > config.maxResourceDepth()) {
          cutoffs++;
          break;
        }
        EntityRef parent = edge.subject().entity();
        ImmutableList<PathStep> inner = connected(parent, relation, parentDepth + 1, usersetDepth);
        if (!inner.isEmpty()) {
          return prepend(
              new PathStep(
                  PathStep.Kind.RESOURCE,
                  relation,
                  parent,
                  List.of(parent.toString(), resource.toString()),
                  String.format(
                      "RESOURCE: %s has %s on %s which contains %s",
                      subject, relation, parent, resource)),
              inner);
        }
      }
    }
    return NONE;
  }

  /**
   * Groups the subject belongs to through live plain {@code member} edges, each with its chain
   * {@code [subject, ..., group]}. Computed once per traversal.
   */
  Map<EntityRef, ImmutableList<EntityRef>> groups() {
    if (groups != null) {
      return groups;
    }
    Map<EntityRef, ImmutableList<EntityRef>> found = new LinkedHashMap<>();
    if (!subject.isUserset()) {
      EntityRef start = subject.entity();
      List<EntityRef> frontier = List.of(start);
      Map<EntityRef, ImmutableList<EntityRef>> chains = new HashMap<>();
      chains.put(start, ImmutableList.of(start));
      for (int depth = 0; depth < config.maxGroupDepth() && !frontier.isEmpty(); depth++) {
        List<EntityRef> next = new ArrayList<>();
        for (EntityRef member : frontier) {
          for (RelationTuple edge : graph.edgesFrom(member)) {
            if (!edge.isMembership() || edge.subject().isUserset() || !edge.isLive(now)) {
              continue;
            }
            EntityRef group = edge.resource();
            if (!chains.containsKey(group)) {
              ImmutableList<EntityRef> chain =
                  ImmutableList.<EntityRef>builder().addAll(chains.get(member)).add(group).build();
              chains.put(group, chain);
              found.put(group, chain);
              next.add(group);
            }
          }
        }
        frontier = next;
      }
      groupChaseTruncated = !frontier.isEmpty();
    }
    groups = found;
    return groups;
  }

  private PathStep hierarchyStep(String permission, EntityRef resource, List<String> chain) {
    return new PathStep(
        PathStep.Kind.HIERARCHY,
        chain.get(0),
        resource,
        chain,
        String.format(
            "HIERARCHY: %s has %s (via %s) on %s",
            subject, permission, String.join(" -> ", chain), resource));
  }

  private PathStep groupStep(String relation, EntityRef resource, List<EntityRef> chain) {
    EntityRef group = chain.get(chain.size() - 1);
    List<String> rendered = chain.stream().map(EntityRef::toString).collect(Collectors.toList());
    return new PathStep(
        PathStep.Kind.GROUP,
        relation,
        group,
        rendered,
        String.format(
            "GROUP: %s is member of %s (via %s) which has %s on %s",
            subject, group, String.join(" -> ", rendered), relation, resource));
  }

  private static ImmutableList<PathStep> prepend(PathStep head, List<PathStep> tail) {
    return ImmutableList.<PathStep>builder().add(head).addAll(tail).build();
  }
}
