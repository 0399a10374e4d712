/**
 * JDBC helpers for the relational copy of the graph and the audit table.
 *
 * <p>Each class is a set of static methods over one table, taking an open {@link
 * java.sql.Connection} and returning {@link com.relgraph.common.status.StatusOr}. Callers own
 * transactions. The schema lives in {@code db/01-schema.sql}.
 */
package com.relgraph.db;
