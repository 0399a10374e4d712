package com.relgraph.audit;

import com.relgraph.common.status.Status;

/**
 * Receives one event per committed mutation. Called after the commit; a failing sink is logged
 * by the caller and never rolls the mutation back.
 */
public interface AuditSink {

  /**
   * Records {@code event}.
   *
   * @return OK, or the reason the event could not be stored
   */
  Status record(AuditEvent event);

  /** A sink that drops everything. */
  static AuditSink discarding() {
    return event -> Status.ok();
  }
}
