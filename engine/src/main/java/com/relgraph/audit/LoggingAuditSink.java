package com.relgraph.audit;

import com.relgraph.common.status.Status;
import org.tinylog.Logger;

/** Writes audit events to the application log at INFO. */
public final class LoggingAuditSink implements AuditSink {

  @Override
  public Status record(AuditEvent event) {
    Logger.info(
        "audit {} ns={} {}:{}#{}@{}:{}{} entry={} actor={} request={}",
        event.eventType(),
        event.namespace(),
        event.resourceType(),
        event.resourceId(),
        event.relation(),
        event.subjectType(),
        event.subjectId(),
        event.subjectRelation() == null ? "" : "#" + event.subjectRelation(),
        event.entryId(),
        event.actorId(),
        event.requestId());
    return Status.ok();
  }
}
