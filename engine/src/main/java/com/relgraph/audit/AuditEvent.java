package com.relgraph.audit;

import com.relgraph.context.RequestContext;
import com.relgraph.model.HierarchyRule;
import com.relgraph.model.RelationTuple;
import java.time.Instant;
import java.util.UUID;
import javax.annotation.Nullable;

/**
 * One audit record.
 *
 * <p>Hierarchy events reuse the tuple columns: the resource is {@code (resourceType, "*")}, the
 * relation is the implying permission and the subject is {@code ("permission", implies)}.
 *
 * @param eventId Unique id of this event
 * @param eventType What happened
 * @param eventTime When the mutation committed
 * @param actorId Who did it, from the request context
 * @param requestId Correlation id from the request context
 * @param reason Justification from the request context
 * @param namespace Namespace the mutation applied to
 * @param resourceType Resource type of the edge or rule
 * @param resourceId Resource id, {@code *} for hierarchy rules
 * @param relation Relation of the edge, or the implying permission
 * @param subjectType Subject type of the edge
 * @param subjectId Subject id of the edge, or the implied permission
 * @param subjectRelation Userset relation, if any
 * @param entryId Tuple id or hierarchy rule id
 * @param expiresAt Expiry after the mutation, for grants and expiration updates
 */
public record AuditEvent(
    UUID eventId,
    AuditEventType eventType,
    Instant eventTime,
    @Nullable String actorId,
    String requestId,
    @Nullable String reason,
    String namespace,
    String resourceType,
    String resourceId,
    String relation,
    String subjectType,
    String subjectId,
    @Nullable String subjectRelation,
    long entryId,
    @Nullable Instant expiresAt) {

  public static final String RULE_RESOURCE_ID = "*";
  public static final String RULE_SUBJECT_TYPE = "permission";

  public static AuditEvent forTuple(
      AuditEventType type, RequestContext ctx, RelationTuple tuple, Instant at) {
    return new AuditEvent(
        UUID.randomUUID(),
        type,
        at,
        ctx.actorId(),
        ctx.requestId(),
        ctx.reason(),
        tuple.namespace(),
        tuple.resource().type(),
        tuple.resource().id(),
        tuple.relation(),
        tuple.subject().type(),
        tuple.subject().id(),
        tuple.subject().relation(),
        tuple.id(),
        tuple.expiresAt());
  }

  public static AuditEvent forRule(
      AuditEventType type, RequestContext ctx, HierarchyRule rule, Instant at) {
    return new AuditEvent(
        UUID.randomUUID(),
        type,
        at,
        ctx.actorId(),
        ctx.requestId(),
        ctx.reason(),
        rule.namespace(),
        rule.resourceType(),
        RULE_RESOURCE_ID,
        rule.permission(),
        RULE_SUBJECT_TYPE,
        rule.implies(),
        null,
        rule.id(),
        null);
  }
}
