package com.relgraph.audit;

import com.relgraph.common.status.Status;
import com.relgraph.common.status.StatusOr;
import com.relgraph.db.AuditEvents;
import java.sql.Connection;
import java.sql.SQLException;
import javax.sql.DataSource;

/** Appends audit events to the {@code audit_event} table, one connection per event. */
public final class JdbcAuditSink implements AuditSink {

  private final DataSource dataSource;

  public JdbcAuditSink(DataSource dataSource) {
    this.dataSource = dataSource;
  }

  @Override
  public Status record(AuditEvent event) {
    try (Connection conn = dataSource.getConnection()) {
      StatusOr<Integer> inserted = AuditEvents.insert(conn, event);
      return inserted.isOk() ? Status.ok() : inserted.getStatus();
    } catch (SQLException e) {
      return Status.internal("Failed to store audit event: " + e.getMessage(), e);
    }
  }
}
