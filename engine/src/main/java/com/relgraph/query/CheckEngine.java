package com.relgraph.query;

import com.google.common.collect.ImmutableList;
import com.relgraph.config.EngineConfig;
import com.relgraph.graph.GraphState;
import com.relgraph.model.EntityRef;
import com.relgraph.model.Explanation;
import com.relgraph.model.PathStep;
import com.relgraph.model.SubjectRef;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import org.tinylog.Logger;

/** Boolean permission checks and their explanations over a graph snapshot. */
public final class CheckEngine {

  private final EngineConfig config;

  public CheckEngine(EngineConfig config) {
    this.config = config;
  }

  public Traversal traversal(GraphState state, String namespace, SubjectRef subject, Instant now) {
    return new Traversal(state, namespace, config, now, subject);
  }

  public boolean check(
      GraphState state,
      String namespace,
      SubjectRef subject,
      String permission,
      EntityRef resource,
      Instant now) {
    boolean allowed = traversal(state, namespace, subject, now).check(permission, resource);
    Logger.debug("check {} {} on {}/{} -> {}", subject, permission, namespace, resource, allowed);
    return allowed;
  }

  /** True if any permission holds. The permissions share one traversal. */
  public boolean checkAny(
      GraphState state,
      String namespace,
      SubjectRef subject,
      Collection<String> permissions,
      EntityRef resource,
      Instant now) {
    Traversal traversal = traversal(state, namespace, subject, now);
    return permissions.stream().anyMatch(p -> traversal.check(p, resource));
  }

  /** True if every permission holds; vacuously true for no permissions. */
  public boolean checkAll(
      GraphState state,
      String namespace,
      SubjectRef subject,
      Collection<String> permissions,
      EntityRef resource,
      Instant now) {
    Traversal traversal = traversal(state, namespace, subject, now);
    return permissions.stream().allMatch(p -> traversal.check(p, resource));
  }

  /** The ids among {@code resourceIds} on which the subject holds {@code permission}, sorted. */
  public List<String> filterAuthorized(
      GraphState state,
      String namespace,
      SubjectRef subject,
      String resourceType,
      String permission,
      Collection<String> resourceIds,
      Instant now) {
    Traversal traversal = traversal(state, namespace, subject, now);
    TreeSet<String> allowed = new TreeSet<>();
    for (String id : resourceIds) {
      if (traversal.check(permission, EntityRef.of(resourceType, id))) {
        allowed.add(id);
      }
    }
    return ImmutableList.copyOf(allowed);
  }

  /** Runs the same traversal as {@link #check} and renders the witness it finds. */
  public Explanation explain(
      GraphState state,
      String namespace,
      SubjectRef subject,
      String permission,
      EntityRef resource,
      Instant now) {
    ImmutableList<PathStep> path =
        traversal(state, namespace, subject, now).witness(permission, resource);
    if (path.isEmpty()) {
      return Explanation.denied(subject, permission, resource);
    }
    return Explanation.allowed(path);
  }
}
