/**
 * Status values returned by every engine operation.
 *
 * <ul>
 *   <li>{@link com.relgraph.common.status.StatusCode} - the failure taxonomy, including the
 *       graph-specific {@code CYCLE_DETECTED} and {@code SELF_IMPLICATION}</li>
 *   <li>{@link com.relgraph.common.status.Status} - a code with an optional message and cause</li>
 *   <li>{@link com.relgraph.common.status.StatusOr} - either a value or a non-OK status</li>
 * </ul>
 *
 * <p>Writes report rejected input through a status rather than an exception, and leave the
 * graph untouched when they do. Permission queries never report {@code NOT_FOUND}; a missing
 * relationship is simply {@code false} or an empty list.
 *
 * <pre>
 * StatusOr&lt;Long&gt; idOr = authz.grant(ctx, repo, "read", SubjectRef.of("user", "bob"), null);
 * if (idOr.isNotOk()) {
 *   Logger.warn("Grant rejected: {}", idOr.getStatus());
 *   return;
 * }
 * </pre>
 */
package com.relgraph.common.status;
