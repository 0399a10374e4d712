package com.relgraph.audit;

/** Kinds of committed mutation reported to an {@link AuditSink}. */
public enum AuditEventType {
  TUPLE_GRANTED,
  TUPLE_REVOKED,
  EXPIRATION_UPDATED,
  TUPLE_EXPIRED_CLEANUP,
  HIERARCHY_ADDED,
  HIERARCHY_REMOVED
}
