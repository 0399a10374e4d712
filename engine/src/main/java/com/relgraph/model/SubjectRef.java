package com.relgraph.model;

import com.google.common.base.Strings;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * The subject side of a relationship tuple.
 *
 * <p>Without a relation the subject is the entity itself. With a relation it is a userset:
 * "anyone holding {@code relation} on the entity", written {@code team:eng#member}. An empty
 * relation is normalized to {@code null} so that both spellings share one uniqueness key.
 *
 * @param type the subject entity type
 * @param id the subject entity id
 * @param relation the userset relation, or null for a plain subject
 */
public record SubjectRef(String type, String id, @Nullable String relation) {

  public SubjectRef {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(id, "id");
    relation = Strings.emptyToNull(relation);
  }

  public static SubjectRef of(String type, String id) {
    return new SubjectRef(type, id, null);
  }

  public static SubjectRef userset(String type, String id, String relation) {
    return new SubjectRef(type, id, relation);
  }

  public EntityRef entity() {
    return new EntityRef(type, id);
  }

  public boolean isUserset() {
    return relation != null;
  }

  @Override
  public String toString() {
    return relation == null ? type + ":" + id : type + ":" + id + "#" + relation;
  }
}
