package com.relgraph.common.status;

/**
 * Status codes reported by the authorization engine.
 *
 * <p>The generic codes follow the gRPC vocabulary so that a transport layer placed in front of
 * the engine can translate them one-to-one. {@link #CYCLE_DETECTED} and {@link
 * #SELF_IMPLICATION} are specific to graph mutation.
 */
public enum StatusCode {
  OK,
  INVALID_ARGUMENT,
  NOT_FOUND,
  ALREADY_EXISTS,
  PERMISSION_DENIED,
  FAILED_PRECONDITION,
  ABORTED,           // commit lost too many compare-and-set races
  CYCLE_DETECTED,    // membership, parent or hierarchy edge would close a cycle
  SELF_IMPLICATION,  // hierarchy rule whose permission implies itself
  UNIMPLEMENTED,
  INTERNAL,
  UNAVAILABLE;

  /** Returns whether this status code represents a successful operation. */
  public boolean isSuccess() {
    return this == OK;
  }

  /** Returns whether this status code represents an error. */
  public boolean isError() {
    return !isSuccess();
  }

  /**
   * Returns whether the failure was caused by the shape of the graph rather than by the
   * request itself. Such writes are rejected without changing any state.
   */
  public boolean isGraphViolation() {
    return this == CYCLE_DETECTED || this == SELF_IMPLICATION;
  }
}
