package com.relgraph.db;

import com.relgraph.common.status.StatusOr;
import com.relgraph.db.util.DbUtil;
import com.relgraph.model.EntityRef;
import com.relgraph.model.RelationTuple;
import com.relgraph.model.SubjectRef;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * DAO helper class for the 'relation_tuple' table.
 */
public final class Tuples {

    private Tuples() {
        // Utility class
    }

    /**
     * Loads every tuple of a namespace, expired ones included.
     *
     * @param conn an open JDBC connection
     * @param namespace the namespace to load
     * @return StatusOr containing the tuples ordered by id, or an error
     */
    @Nonnull
    public static StatusOr<List<RelationTuple>> loadNamespace(Connection conn, String namespace) {
        String sql = """
                SELECT tuple_id, namespace, resource_type, resource_id, relation,
                       subject_type, subject_id, subject_relation, created_at, expires_at
                  FROM relation_tuple
                 WHERE namespace = ?
                 ORDER BY tuple_id
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, namespace);
            try (ResultSet rs = stmt.executeQuery()) {
                List<RelationTuple> result = new ArrayList<>();
                while (rs.next()) {
                    StatusOr<RelationTuple> tupleOr = extractTuple(rs);
                    if (tupleOr.isNotOk()) {
                        return StatusOr.ofStatus(tupleOr.getStatus());
                    }
                    result.add(tupleOr.getValue());
                }
                return StatusOr.ofValue(ImmutableList.copyOf(result));
            }
        } catch (SQLException e) {
            return StatusOr.ofException(e);
        }
    }

    /**
     * Inserts or updates tuples (upsert on the uniqueness key).
     *
     * @param conn an open JDBC connection
     * @param tuples the tuples to save
     * @return StatusOr containing the number of affected rows or an error
     */
    @Nonnull
    public static StatusOr<Integer> saveAll(Connection conn, Collection<RelationTuple> tuples) {
        String sql = """
                INSERT INTO relation_tuple
                       (tuple_id, namespace, resource_type, resource_id, relation,
                        subject_type, subject_id, subject_relation, created_at, expires_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT (namespace, resource_type, resource_id, relation,
                             subject_type, subject_id, subject_relation)
                DO UPDATE SET expires_at = excluded.expires_at
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (RelationTuple tuple : tuples) {
                stmt.setLong(1, tuple.id());
                stmt.setString(2, tuple.namespace());
                stmt.setString(3, tuple.resource().type());
                stmt.setString(4, tuple.resource().id());
                stmt.setString(5, tuple.relation());
                stmt.setString(6, tuple.subject().type());
                stmt.setString(7, tuple.subject().id());
                stmt.setString(8, DbUtil.emptyIfNull(tuple.subject().relation()));
                stmt.setTimestamp(9, DbUtil.toSqlTimestamp(tuple.createdAt()));
                DbUtil.setOptionalTimestamp(stmt, 10, tuple.expiresAt());
                stmt.addBatch();
            }
            int rowsAffected = 0;
            for (int count : stmt.executeBatch()) {
                rowsAffected += Math.max(count, 0);
            }
            return StatusOr.ofValue(rowsAffected);
        } catch (SQLException e) {
            return StatusOr.ofException(e);
        }
    }

    /**
     * Deletes every tuple of a namespace.
     *
     * @param conn an open JDBC connection
     * @param namespace the namespace to clear
     * @return StatusOr containing the number of deleted rows or an error
     */
    @Nonnull
    public static StatusOr<Integer> deleteNamespace(Connection conn, String namespace) {
        String sql = """
                DELETE FROM relation_tuple
                 WHERE namespace = ?
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, namespace);
            return StatusOr.ofValue(stmt.executeUpdate());
        } catch (SQLException e) {
            return StatusOr.ofException(e);
        }
    }

    /**
     * Extracts a RelationTuple from the current row of a ResultSet.
     */
    @Nonnull
    private static StatusOr<RelationTuple> extractTuple(ResultSet rs) throws SQLException {
        StatusOr<Instant> createdAtOr = DbUtil.getInstant(rs, "created_at");
        if (createdAtOr.isNotOk()) {
            return StatusOr.ofStatus(createdAtOr.getStatus());
        }

        StatusOr<Optional<Instant>> expiresAtOr = DbUtil.getOptionalInstant(rs, "expires_at");
        if (expiresAtOr.isNotOk()) {
            return StatusOr.ofStatus(expiresAtOr.getStatus());
        }

        return StatusOr.ofValue(new RelationTuple(
                rs.getLong("tuple_id"),
                rs.getString("namespace"),
                EntityRef.of(rs.getString("resource_type"), rs.getString("resource_id")),
                rs.getString("relation"),
                new SubjectRef(
                        rs.getString("subject_type"),
                        rs.getString("subject_id"),
                        rs.getString("subject_relation")),
                createdAtOr.getValue(),
                expiresAtOr.getValue().orElse(null)
        ));
    }
}
