/**
 * Immutable value types of the relationship graph.
 *
 * <p>Tuples ({@link com.relgraph.model.RelationTuple}) and hierarchy rules
 * ({@link com.relgraph.model.HierarchyRule}) are the two kinds of stored facts; the remaining
 * records are query results.
 */
package com.relgraph.model;
