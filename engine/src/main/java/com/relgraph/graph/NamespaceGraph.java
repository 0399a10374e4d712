package com.relgraph.graph;

import com.google.common.collect.ImmutableList;
import com.relgraph.model.EntityRef;
import com.relgraph.model.RelationTuple;
import com.relgraph.model.SubjectRef;
import com.relgraph.model.TupleKey;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Tuples and hierarchy rules of a single namespace.
 *
 * <p>Tuples are indexed forward (resource, relation, subject) and in reverse by subject entity.
 * Instances are never mutated once built; {@link Editor} copies only the index buckets it
 * touches, so unrelated resources share structure with the previous version.
 */
public final class NamespaceGraph {

  public static final NamespaceGraph EMPTY =
      new NamespaceGraph(Map.of(), Map.of(), 0, HierarchyGraph.EMPTY);

  private final Map<EntityRef, Map<String, Map<SubjectRef, RelationTuple>>> byResource;
  private final Map<EntityRef, Map<TupleKey, RelationTuple>> bySubject;
  private final int tupleCount;
  private final HierarchyGraph hierarchy;

  private NamespaceGraph(
      Map<EntityRef, Map<String, Map<SubjectRef, RelationTuple>>> byResource,
      Map<EntityRef, Map<TupleKey, RelationTuple>> bySubject,
      int tupleCount,
      HierarchyGraph hierarchy) {
    this.byResource = byResource;
    this.bySubject = bySubject;
    this.tupleCount = tupleCount;
    this.hierarchy = hierarchy;
  }

  public HierarchyGraph hierarchy() {
    return hierarchy;
  }

  public NamespaceGraph withHierarchy(HierarchyGraph newHierarchy) {
    return new NamespaceGraph(byResource, bySubject, tupleCount, newHierarchy);
  }

  public int tupleCount() {
    return tupleCount;
  }

  public boolean isEmpty() {
    return tupleCount == 0 && hierarchy.size() == 0;
  }

  public Optional<RelationTuple> find(EntityRef resource, String relation, SubjectRef subject) {
    Map<String, Map<SubjectRef, RelationTuple>> relations = byResource.get(resource);
    if (relations == null) {
      return Optional.empty();
    }
    Map<SubjectRef, RelationTuple> subjects = relations.get(relation);
    return subjects == null ? Optional.empty() : Optional.ofNullable(subjects.get(subject));
  }

  public Optional<RelationTuple> find(TupleKey key) {
    return find(key.resource(), key.relation(), key.subject());
  }

  /** Edges on {@code resource} granting {@code relation}, expired ones included. */
  public Collection<RelationTuple> edges(EntityRef resource, String relation) {
    Map<String, Map<SubjectRef, RelationTuple>> relations = byResource.get(resource);
    if (relations == null) {
      return List.of();
    }
    Map<SubjectRef, RelationTuple> subjects = relations.get(relation);
    return subjects == null ? List.of() : subjects.values();
  }

  /** All edges on {@code resource}, expired ones included. */
  public Stream<RelationTuple> edgesOn(EntityRef resource) {
    Map<String, Map<SubjectRef, RelationTuple>> relations = byResource.get(resource);
    if (relations == null) {
      return Stream.empty();
    }
    return relations.values().stream().flatMap(m -> m.values().stream());
  }

  /** Edges whose subject entity is {@code subject}, with or without a subject relation. */
  public Collection<RelationTuple> edgesFrom(EntityRef subject) {
    Map<TupleKey, RelationTuple> edges = bySubject.get(subject);
    return edges == null ? List.of() : edges.values();
  }

  public Stream<RelationTuple> tuples() {
    return byResource.values().stream()
        .flatMap(relations -> relations.values().stream())
        .flatMap(subjects -> subjects.values().stream());
  }

  public Editor edit() {
    return new Editor(this);
  }

  /** Accumulates tuple changes against a base graph and produces its successor. */
  public static final class Editor {
    private final Map<EntityRef, Map<String, Map<SubjectRef, RelationTuple>>> byResource;
    private final Map<EntityRef, Map<TupleKey, RelationTuple>> bySubject;
    private final Set<EntityRef> copiedResources = new HashSet<>();
    private final Set<EntityRef> copiedSubjects = new HashSet<>();
    private final HierarchyGraph hierarchy;
    private int tupleCount;

    private Editor(NamespaceGraph base) {
      this.byResource = new HashMap<>(base.byResource);
      this.bySubject = new HashMap<>(base.bySubject);
      this.tupleCount = base.tupleCount;
      this.hierarchy = base.hierarchy;
    }

    /** Inserts {@code tuple}, replacing any edge with the same key. */
    public Editor put(RelationTuple tuple) {
      Map<SubjectRef, RelationTuple> subjects =
          resourceBucket(tuple.resource())
              .computeIfAbsent(tuple.relation(), r -> new LinkedHashMap<>());
      RelationTuple previous = subjects.put(tuple.subject(), tuple);
      subjectBucket(tuple.subject().entity()).put(tuple.key(), tuple);
      if (previous == null) {
        tupleCount++;
      }
      return this;
    }

    public Editor remove(RelationTuple tuple) {
      Map<String, Map<SubjectRef, RelationTuple>> existing = byResource.get(tuple.resource());
      if (existing == null
          || existing.get(tuple.relation()) == null
          || !existing.get(tuple.relation()).containsKey(tuple.subject())) {
        return this;
      }
      Map<String, Map<SubjectRef, RelationTuple>> relations = resourceBucket(tuple.resource());
      Map<SubjectRef, RelationTuple> subjects = relations.get(tuple.relation());
      subjects.remove(tuple.subject());
      if (subjects.isEmpty()) {
        relations.remove(tuple.relation());
      }
      if (relations.isEmpty()) {
        byResource.remove(tuple.resource());
      }
      EntityRef subjectEntity = tuple.subject().entity();
      Map<TupleKey, RelationTuple> reverse = subjectBucket(subjectEntity);
      reverse.remove(tuple.key());
      if (reverse.isEmpty()) {
        bySubject.remove(subjectEntity);
      }
      tupleCount--;
      return this;
    }

    public Editor removeAll(Collection<RelationTuple> tuples) {
      tuples.forEach(this::remove);
      return this;
    }

    public NamespaceGraph build() {
      return new NamespaceGraph(byResource, bySubject, tupleCount, hierarchy);
    }

    // Copy-on-first-write of the buckets for one resource.
    private Map<String, Map<SubjectRef, RelationTuple>> resourceBucket(EntityRef resource) {
      if (copiedResources.add(resource)) {
        Map<String, Map<SubjectRef, RelationTuple>> copy = new HashMap<>();
        Map<String, Map<SubjectRef, RelationTuple>> old = byResource.get(resource);
        if (old != null) {
          old.forEach((relation, subjects) -> copy.put(relation, new LinkedHashMap<>(subjects)));
        }
        byResource.put(resource, copy);
        return copy;
      }
      return byResource.computeIfAbsent(resource, r -> new HashMap<>());
    }

    private Map<TupleKey, RelationTuple> subjectBucket(EntityRef subject) {
      if (copiedSubjects.add(subject)) {
        Map<TupleKey, RelationTuple> old = bySubject.get(subject);
        Map<TupleKey, RelationTuple> copy =
            old == null ? new LinkedHashMap<>() : new LinkedHashMap<>(old);
        bySubject.put(subject, copy);
        return copy;
      }
      return bySubject.computeIfAbsent(subject, s -> new LinkedHashMap<>());
    }
  }

  /** Builds a graph from scratch, e.g. when importing a namespace. */
  public static NamespaceGraph of(Collection<RelationTuple> tuples, HierarchyGraph hierarchy) {
    Editor editor = EMPTY.withHierarchy(hierarchy).edit();
    tuples.forEach(editor::put);
    return editor.build();
  }

  public ImmutableList<RelationTuple> tupleList() {
    return tuples().collect(ImmutableList.toImmutableList());
  }
}
