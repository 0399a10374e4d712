package com.relgraph.common.status;

import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * Represents the status of an operation, possibly with additional error details. Modelled on
 * the gRPC Status concept, it gives every engine operation one way to report success or a
 * typed failure.
 */
public class Status {
  private final StatusCode code;
  private final String message;
  private final Throwable cause;

  private Status(StatusCode code, String message, Throwable cause) {
    this.code = Objects.requireNonNull(code);
    this.message = message;
    this.cause = cause;
  }

  /** Creates a new status with the given code and message. */
  public static Status of(StatusCode code, String message) {
    return new Status(code, message, null);
  }

  /** Creates a new status with the given code, message, and cause. */
  public static Status of(StatusCode code, String message, Throwable cause) {
    return new Status(code, message, cause);
  }

  /** Creates a new OK status. */
  public static Status ok() {
    return new Status(StatusCode.OK, null, null);
  }

  /** Creates a new NOT_FOUND status with the given message. */
  public static Status notFound(String message) {
    return new Status(StatusCode.NOT_FOUND, message, null);
  }

  /** Creates a new INTERNAL status with the given message and cause. */
  public static Status internal(String message, Throwable cause) {
    return new Status(StatusCode.INTERNAL, message, cause);
  }

  /** Creates a new INVALID_ARGUMENT status with the given message. */
  public static Status invalidArgument(String message) {
    return new Status(StatusCode.INVALID_ARGUMENT, message, null);
  }

  /** Creates a new PERMISSION_DENIED status with the given message. */
  public static Status permissionDenied(String message) {
    return new Status(StatusCode.PERMISSION_DENIED, message, null);
  }

  /** Creates a new FAILED_PRECONDITION status with the given message. */
  public static Status failedPrecondition(String message) {
    return new Status(StatusCode.FAILED_PRECONDITION, message, null);
  }

  /** Creates a new ABORTED status with the given message. */
  public static Status aborted(String message) {
    return new Status(StatusCode.ABORTED, message, null);
  }

  /** Creates a new CYCLE_DETECTED status with the given message. */
  public static Status cycleDetected(String message) {
    return new Status(StatusCode.CYCLE_DETECTED, message, null);
  }

  /** Creates a new SELF_IMPLICATION status with the given message. */
  public static Status selfImplication(String message) {
    return new Status(StatusCode.SELF_IMPLICATION, message, null);
  }

  /** Returns the code for this status. */
  @Nonnull
  public StatusCode getCode() {
    return code;
  }

  /** Returns the message for this status, or null if there is no message. */
  public String getMessage() {
    return message;
  }

  /** Returns the cause of this status, or null if there is no cause. */
  public Throwable getCause() {
    return cause;
  }

  /** Returns true if this status represents an error (i.e., the code is not OK). */
  public boolean isError() {
    return code != StatusCode.OK;
  }

  /** Returns true if this status is OK. */
  public boolean isOk() {
    return code == StatusCode.OK;
  }

  @Override
  public String toString() {
    if (message == null) {
      return code.toString();
    }
    return code + ": " + message;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Status other = (Status) obj;
    return code == other.code
        && Objects.equals(message, other.message)
        && Objects.equals(cause, other.cause);
  }

  @Override
  public int hashCode() {
    return Objects.hash(code, message, cause);
  }
}
