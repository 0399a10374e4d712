package com.relgraph.db;

import com.relgraph.audit.AuditEvent;
import com.relgraph.common.status.StatusOr;
import com.relgraph.db.util.DbUtil;

import javax.annotation.Nonnull;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * DAO helper class for the 'audit_event' table.
 */
public final class AuditEvents {

    private AuditEvents() {
        // Utility class
    }

    /**
     * Appends one audit event.
     *
     * @param conn an open JDBC connection
     * @param event the event to store
     * @return StatusOr containing the number of inserted rows or an error
     */
    @Nonnull
    public static StatusOr<Integer> insert(Connection conn, AuditEvent event) {
        String sql = """
                INSERT INTO audit_event
                       (event_id, event_type, event_time, actor_id, request_id, reason,
                        namespace, resource_type, resource_id, relation,
                        subject_type, subject_id, subject_relation, entry_id, expires_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setObject(1, event.eventId());
            stmt.setString(2, event.eventType().name());
            stmt.setTimestamp(3, DbUtil.toSqlTimestamp(event.eventTime()));
            stmt.setString(4, event.actorId());
            stmt.setString(5, event.requestId());
            stmt.setString(6, event.reason());
            stmt.setString(7, event.namespace());
            stmt.setString(8, event.resourceType());
            stmt.setString(9, event.resourceId());
            stmt.setString(10, event.relation());
            stmt.setString(11, event.subjectType());
            stmt.setString(12, event.subjectId());
            stmt.setString(13, event.subjectRelation());
            stmt.setLong(14, event.entryId());
            DbUtil.setOptionalTimestamp(stmt, 15, event.expiresAt());
            return StatusOr.ofValue(stmt.executeUpdate());
        } catch (SQLException e) {
            return StatusOr.ofException(e);
        }
    }
}
