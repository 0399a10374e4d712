package com.relgraph.model;

import java.time.Instant;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * One relationship edge: {@code subject} has {@code relation} on {@code resource}.
 *
 * <p>Edges with relation {@link #MEMBER} form the group-membership graph (group to member) and
 * edges with relation {@link #PARENT} form the resource hierarchy (child to parent).
 *
 * @param id The engine-assigned edge id
 * @param namespace The tenant namespace that owns the edge
 * @param resource The resource (or group, for membership edges)
 * @param relation The relation granted
 * @param subject The subject, possibly a userset
 * @param createdAt When the edge was first written
 * @param expiresAt When the edge stops counting, or null if it never expires
 */
public record RelationTuple(
    long id,
    String namespace,
    EntityRef resource,
    String relation,
    SubjectRef subject,
    Instant createdAt,
    @Nullable Instant expiresAt) {

  public static final String MEMBER = "member";
  public static final String PARENT = "parent";

  public RelationTuple {
    Objects.requireNonNull(namespace, "namespace");
    Objects.requireNonNull(resource, "resource");
    Objects.requireNonNull(relation, "relation");
    Objects.requireNonNull(subject, "subject");
    Objects.requireNonNull(createdAt, "createdAt");
  }

  public TupleKey key() {
    return new TupleKey(namespace, resource, relation, subject);
  }

  /** An edge whose expiry is not after {@code now} is treated as absent by every read. */
  public boolean isExpired(Instant now) {
    return expiresAt != null && !expiresAt.isAfter(now);
  }

  public boolean isLive(Instant now) {
    return !isExpired(now);
  }

  public boolean isMembership() {
    return MEMBER.equals(relation);
  }

  public boolean isParent() {
    return PARENT.equals(relation);
  }

  /** True for edges the cycle guard has to validate. */
  public boolean isStructural() {
    return isMembership() || isParent();
  }

  public RelationTuple withExpiresAt(@Nullable Instant newExpiresAt) {
    return new RelationTuple(id, namespace, resource, relation, subject, createdAt, newExpiresAt);
  }

  @Override
  public String toString() {
    return resource + "#" + relation + "@" + subject;
  }
}
