package com.relgraph.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identity of a node in the relationship graph: a resource, a group, or a principal.
 *
 * @param type the entity type, e.g. {@code repo} or {@code team}
 * @param id the entity identifier within its type
 */
public record EntityRef(String type, String id) implements Comparable<EntityRef> {

  private static final Comparator<EntityRef> ORDER =
      Comparator.comparing(EntityRef::type).thenComparing(EntityRef::id);

  public EntityRef {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(id, "id");
  }

  public static EntityRef of(String type, String id) {
    return new EntityRef(type, id);
  }

  /** Returns this entity as a plain subject, i.e. without a subject relation. */
  public SubjectRef asSubject() {
    return new SubjectRef(type, id, null);
  }

  @Override
  public int compareTo(EntityRef other) {
    return ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    return type + ":" + id;
  }
}
