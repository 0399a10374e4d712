package com.relgraph.model;

/**
 * Point-in-time counters for one namespace, used for monitoring and capacity planning.
 *
 * @param namespace The namespace the counters describe
 * @param tupleCount Edges physically present, expired ones included
 * @param expiredTupleCount Edges present but logically expired (reclaimable by cleanup)
 * @param hierarchyRuleCount Hierarchy rules owned by the namespace itself
 * @param distinctSubjects Distinct subject entities across live edges
 * @param distinctResources Distinct resource entities across live edges
 */
public record NamespaceStats(
    String namespace,
    long tupleCount,
    long expiredTupleCount,
    long hierarchyRuleCount,
    long distinctSubjects,
    long distinctResources) {}
