package com.relgraph.operations;

import com.relgraph.common.status.Status;
import com.relgraph.common.status.StatusOr;
import com.relgraph.db.HierarchyRules;
import com.relgraph.db.Tuples;
import com.relgraph.graph.HierarchyGraph;
import com.relgraph.graph.NamespaceGraph;
import com.relgraph.model.HierarchyRule;
import com.relgraph.model.RelationTuple;
import org.tinylog.Logger;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * Operation class for moving one namespace between the engine and the database.
 * Export replaces the namespace's rows in a single transaction; load reads them back as a graph.
 */
public class NamespaceSyncOperation {
    private final Connection dbConnection;

    /**
     * Creates a new NamespaceSyncOperation with the required database connection.
     *
     * @param dbConnection the database connection to use
     */
    public NamespaceSyncOperation(Connection dbConnection) {
        this.dbConnection = dbConnection;
    }

    /**
     * Row counts written or read by a sync.
     */
    public record SyncResult(String namespace, int tupleCount, int ruleCount) {}

    /**
     * Replaces the stored copy of {@code namespace} with {@code graph}.
     *
     * @return the number of rows written, or an error after rolling back
     */
    public StatusOr<SyncResult> export(String namespace, NamespaceGraph graph) {
        Logger.info("Exporting namespace {} ({} tuples, {} rules)",
                namespace, graph.tupleCount(), graph.hierarchy().size());
        try {
            boolean autoCommit = dbConnection.getAutoCommit();
            dbConnection.setAutoCommit(false);
            try {
                StatusOr<SyncResult> result = writeAll(namespace, graph);
                if (result.isOk()) {
                    dbConnection.commit();
                    Logger.info("Exported namespace {}", namespace);
                } else {
                    dbConnection.rollback();
                    Logger.warn("Export of namespace {} rolled back: {}",
                            namespace, result.getStatus());
                }
                return result;
            } catch (SQLException | RuntimeException e) {
                dbConnection.rollback();
                throw e;
            } finally {
                dbConnection.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            Logger.error(e, "Export of namespace {} failed.", namespace);
            return StatusOr.ofException(e);
        }
    }

    private StatusOr<SyncResult> writeAll(String namespace, NamespaceGraph graph) {
        StatusOr<Integer> deletedTuples = Tuples.deleteNamespace(dbConnection, namespace);
        if (deletedTuples.isNotOk()) {
            return StatusOr.ofStatus(deletedTuples.getStatus());
        }
        StatusOr<Integer> deletedRules = HierarchyRules.deleteNamespace(dbConnection, namespace);
        if (deletedRules.isNotOk()) {
            return StatusOr.ofStatus(deletedRules.getStatus());
        }
        StatusOr<Integer> savedTuples = Tuples.saveAll(dbConnection, graph.tupleList());
        if (savedTuples.isNotOk()) {
            return StatusOr.ofStatus(savedTuples.getStatus());
        }
        StatusOr<Integer> savedRules =
                HierarchyRules.saveAll(dbConnection, graph.hierarchy().rules());
        if (savedRules.isNotOk()) {
            return StatusOr.ofStatus(savedRules.getStatus());
        }
        return StatusOr.ofValue(
                new SyncResult(namespace, savedTuples.getValue(), savedRules.getValue()));
    }

    /**
     * Reads the stored copy of {@code namespace}. Performs no cycle validation; callers audit the
     * result with the cycle sweep.
     */
    public StatusOr<NamespaceGraph> load(String namespace) {
        StatusOr<List<RelationTuple>> tuplesOr = Tuples.loadNamespace(dbConnection, namespace);
        if (tuplesOr.isNotOk()) {
            Logger.error("Failed to load tuples of {}: {}",
                    namespace, tuplesOr.getStatus().getMessage());
            return StatusOr.ofStatus(tuplesOr.getStatus());
        }
        StatusOr<List<HierarchyRule>> rulesOr =
                HierarchyRules.loadNamespace(dbConnection, namespace);
        if (rulesOr.isNotOk()) {
            Logger.error("Failed to load rules of {}: {}",
                    namespace, rulesOr.getStatus().getMessage());
            return StatusOr.ofStatus(rulesOr.getStatus());
        }
        for (HierarchyRule rule : rulesOr.getValue()) {
            if (rule.permission().equals(rule.implies())) {
                return StatusOr.ofStatus(
                        Status.failedPrecondition("Stored rule implies itself: " + rule));
            }
        }
        Logger.info("Loaded namespace {} ({} tuples, {} rules)",
                namespace, tuplesOr.getValue().size(), rulesOr.getValue().size());
        return StatusOr.ofValue(
                NamespaceGraph.of(tuplesOr.getValue(), HierarchyGraph.of(rulesOr.getValue())));
    }
}
