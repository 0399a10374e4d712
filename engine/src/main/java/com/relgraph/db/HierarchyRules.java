package com.relgraph.db;

import com.relgraph.common.status.StatusOr;
import com.relgraph.db.util.DbUtil;
import com.relgraph.model.HierarchyRule;
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

/**
 * DAO helper class for the 'hierarchy_rule' table.
 */
public final class HierarchyRules {

    private HierarchyRules() {
        // Utility class
    }

    /**
     * Loads the rules of one namespace ('global' included).
     *
     * @param conn an open JDBC connection
     * @param namespace the namespace to load
     * @return StatusOr containing the rules ordered by id, or an error
     */
    @Nonnull
    public static StatusOr<List<HierarchyRule>> loadNamespace(Connection conn, String namespace) {
        String sql = """
                SELECT rule_id, namespace, resource_type, permission, implies, created_at
                  FROM hierarchy_rule
                 WHERE namespace = ?
                 ORDER BY rule_id
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, namespace);
            try (ResultSet rs = stmt.executeQuery()) {
                List<HierarchyRule> result = new ArrayList<>();
                while (rs.next()) {
                    StatusOr<Instant> createdAtOr = DbUtil.getInstant(rs, "created_at");
                    if (createdAtOr.isNotOk()) {
                        return StatusOr.ofStatus(createdAtOr.getStatus());
                    }
                    result.add(new HierarchyRule(
                            rs.getLong("rule_id"),
                            rs.getString("namespace"),
                            rs.getString("resource_type"),
                            rs.getString("permission"),
                            rs.getString("implies"),
                            createdAtOr.getValue()));
                }
                return StatusOr.ofValue(ImmutableList.copyOf(result));
            }
        } catch (SQLException e) {
            return StatusOr.ofException(e);
        }
    }

    /**
     * Inserts rules, ignoring ones already present.
     *
     * @param conn an open JDBC connection
     * @param rules the rules to save
     * @return StatusOr containing the number of inserted rows or an error
     */
    @Nonnull
    public static StatusOr<Integer> saveAll(Connection conn, Collection<HierarchyRule> rules) {
        String sql = """
                INSERT INTO hierarchy_rule
                       (rule_id, namespace, resource_type, permission, implies, created_at)
                VALUES (?, ?, ?, ?, ?, ?)
                ON CONFLICT (namespace, resource_type, permission, implies) DO NOTHING
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (HierarchyRule rule : rules) {
                stmt.setLong(1, rule.id());
                stmt.setString(2, rule.namespace());
                stmt.setString(3, rule.resourceType());
                stmt.setString(4, rule.permission());
                stmt.setString(5, rule.implies());
                stmt.setTimestamp(6, DbUtil.toSqlTimestamp(rule.createdAt()));
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
     * Deletes every rule of a namespace.
     *
     * @param conn an open JDBC connection
     * @param namespace the namespace to clear
     * @return StatusOr containing the number of deleted rows or an error
     */
    @Nonnull
    public static StatusOr<Integer> deleteNamespace(Connection conn, String namespace) {
        String sql = """
                DELETE FROM hierarchy_rule
                 WHERE namespace = ?
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, namespace);
            return StatusOr.ofValue(stmt.executeUpdate());
        } catch (SQLException e) {
            return StatusOr.ofException(e);
        }
    }
}
