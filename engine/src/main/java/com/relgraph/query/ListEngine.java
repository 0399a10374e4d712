package com.relgraph.query;

import com.google.common.collect.ImmutableList;
import com.relgraph.config.EngineConfig;
import com.relgraph.graph.GraphState;
import com.relgraph.graph.HierarchyGraph;
import com.relgraph.graph.NamespaceGraph;
import com.relgraph.graph.PermissionClosure;
import com.relgraph.model.EntityRef;
import com.relgraph.model.RelationTuple;
import com.relgraph.model.SubjectRef;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import javax.annotation.Nullable;
import org.tinylog.Logger;

/**
 * Inverse queries: who holds a permission on a resource, and which resources a subject holds a
 * permission on.
 *
 * <p>Both directions first collect candidates by walking the graph without depth bounds, then
 * confirm each candidate with a {@link Traversal} in page order. Results therefore always agree
 * with {@link CheckEngine#check}, depth bounds included.
 */
public final class ListEngine {

  private static final Comparator<EntityRef> BY_ID =
      Comparator.comparing(EntityRef::id).thenComparing(EntityRef::type);

  private record Node(EntityRef entity, String relation, boolean permission) {}

  private final EngineConfig config;

  public ListEngine(EngineConfig config) {
    this.config = config;
  }

  /**
   * Subjects of {@code subjectType} holding {@code permission} on {@code resource}, sorted by id
   * and starting after {@code cursor}.
   */
  public ImmutableList<EntityRef> listSubjects(
      GraphState state,
      String namespace,
      EntityRef resource,
      String permission,
      String subjectType,
      int limit,
      @Nullable String cursor,
      Instant now) {
    NamespaceGraph graph = state.namespace(namespace);
    HierarchyGraph global = state.globalHierarchy();

    Set<EntityRef> holders = new HashSet<>();
    Set<Node> visited = new HashSet<>();
    Deque<Node> work = new ArrayDeque<>();
    work.add(new Node(resource, permission, true));
    while (!work.isEmpty()) {
      Node node = work.poll();
      if (!visited.add(node)) {
        continue;
      }
      if (node.permission()) {
        PermissionClosure closure =
            PermissionClosure.of(
                global,
                graph.hierarchy(),
                node.entity().type(),
                node.relation(),
                config.maxHierarchyDepth());
        for (String relation : closure.relations()) {
          work.add(new Node(node.entity(), relation, false));
        }
        continue;
      }
      for (RelationTuple edge : graph.edges(node.entity(), node.relation())) {
        if (!edge.isLive(now)) {
          continue;
        }
        SubjectRef holder = edge.subject();
        if (holder.isUserset()) {
          work.add(new Node(holder.entity(), holder.relation(), true));
        } else {
          addWithMembers(graph, holder.entity(), holders, now);
        }
      }
      if (config.parentInheritance().cascades(node.entity().type(), node.relation())) {
        for (RelationTuple edge : graph.edges(node.entity(), RelationTuple.PARENT)) {
          if (edge.isLive(now)) {
            work.add(new Node(edge.subject().entity(), node.relation(), false));
          }
        }
      }
    }

    TreeSet<EntityRef> candidates = new TreeSet<>(BY_ID);
    for (EntityRef holder : holders) {
      if (holder.type().equals(subjectType)
          && (cursor == null || holder.id().compareTo(cursor) > 0)) {
        candidates.add(holder);
      }
    }

    ImmutableList.Builder<EntityRef> page = ImmutableList.builder();
    int taken = 0;
    for (EntityRef candidate : candidates) {
      if (taken >= limit) {
        break;
      }
      Traversal traversal = new Traversal(state, namespace, config, now, candidate.asSubject());
      if (traversal.check(permission, resource)) {
        page.add(candidate);
        taken++;
      }
    }
    ImmutableList<EntityRef> result = page.build();
    Logger.debug(
        "listSubjects {} on {}/{} type {}: {} of {} candidates",
        permission,
        namespace,
        resource,
        subjectType,
        result.size(),
        candidates.size());
    return result;
  }

  // Adds the entity and every transitive plain member below it.
  private static void addWithMembers(
      NamespaceGraph graph, EntityRef group, Set<EntityRef> holders, Instant now) {
    Deque<EntityRef> pending = new ArrayDeque<>();
    pending.add(group);
    while (!pending.isEmpty()) {
      EntityRef current = pending.poll();
      if (!holders.add(current)) {
        continue;
      }
      for (RelationTuple edge : graph.edges(current, RelationTuple.MEMBER)) {
        if (edge.isLive(now) && !edge.subject().isUserset()) {
          pending.add(edge.subject().entity());
        }
      }
    }
  }

  /**
   * Ids of resources of {@code resourceType} on which {@code subject} holds {@code permission},
   * sorted and starting after {@code cursor}.
   */
  public ImmutableList<String> listResources(
      GraphState state,
      String namespace,
      EntityRef subject,
      String resourceType,
      String permission,
      int limit,
      @Nullable String cursor,
      Instant now) {
    NamespaceGraph graph = state.namespace(namespace);
    HierarchyGraph global = state.globalHierarchy();

    // The subject and every group above it through plain member edges.
    Set<EntityRef> sources = new HashSet<>();
    Deque<EntityRef> pending = new ArrayDeque<>();
    pending.add(subject);
    while (!pending.isEmpty()) {
      EntityRef current = pending.poll();
      if (!sources.add(current)) {
        continue;
      }
      for (RelationTuple edge : graph.edgesFrom(current)) {
        if (edge.isMembership() && !edge.subject().isUserset() && edge.isLive(now)) {
          pending.add(edge.resource());
        }
      }
    }

    Set<Node> held = new HashSet<>();
    Deque<Node> work = new ArrayDeque<>();
    for (EntityRef source : sources) {
      for (RelationTuple edge : graph.edgesFrom(source)) {
        if (!edge.subject().isUserset() && edge.isLive(now)) {
          work.add(new Node(edge.resource(), edge.relation(), false));
        }
      }
    }

    Map<String, Set<String>> impliedCache = new HashMap<>();
    while (!work.isEmpty()) {
      Node node = work.poll();
      if (!held.add(node)) {
        continue;
      }
      EntityRef entity = node.entity();
      Set<String> implied =
          impliedCache.computeIfAbsent(
              entity.type() + "#" + node.relation(),
              k ->
                  PermissionClosure.implied(
                      global,
                      graph.hierarchy(),
                      entity.type(),
                      node.relation(),
                      config.maxHierarchyDepth()));
      for (RelationTuple edge : graph.edgesFrom(entity)) {
        if (!edge.isLive(now)) {
          continue;
        }
        SubjectRef edgeSubject = edge.subject();
        if (edgeSubject.isUserset()) {
          if (implied.contains(edgeSubject.relation())) {
            work.add(new Node(edge.resource(), edge.relation(), false));
          }
        } else if (edge.isParent()) {
          EntityRef child = edge.resource();
          if (config.parentInheritance().cascades(child.type(), node.relation())) {
            work.add(new Node(child, node.relation(), false));
          }
        }
      }
    }

    PermissionClosure closure =
        PermissionClosure.of(
            global, graph.hierarchy(), resourceType, permission, config.maxHierarchyDepth());
    TreeSet<String> candidates = new TreeSet<>();
    for (Node node : held) {
      if (node.entity().type().equals(resourceType)
          && closure.contains(node.relation())
          && (cursor == null || node.entity().id().compareTo(cursor) > 0)) {
        candidates.add(node.entity().id());
      }
    }

    Traversal traversal = new Traversal(state, namespace, config, now, subject.asSubject());
    ImmutableList.Builder<String> page = ImmutableList.builder();
    int taken = 0;
    for (String id : candidates) {
      if (taken >= limit) {
        break;
      }
      if (traversal.check(permission, EntityRef.of(resourceType, id))) {
        page.add(id);
        taken++;
      }
    }
    ImmutableList<String> result = page.build();
    Logger.debug(
        "listResources {} {} for {} in {}: {} of {} candidates",
        resourceType,
        permission,
        subject,
        namespace,
        result.size(),
        candidates.size());
    return result;
  }
}
