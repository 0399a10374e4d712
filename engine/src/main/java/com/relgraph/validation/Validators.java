package com.relgraph.validation;

import com.relgraph.common.status.Status;
import com.relgraph.model.EntityRef;
import com.relgraph.model.SubjectRef;
import java.time.Instant;
import java.util.List;
import java.util.regex.Pattern;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Input validation for every write and query. Each method returns {@link Status#ok()} or an
 * {@code INVALID_ARGUMENT} status whose message names the offending field.
 */
public final class Validators {

  public static final int MAX_ID_LENGTH = 1024;
  public static final int MAX_NAMESPACE_LENGTH = 1024;

  private static final Pattern IDENTIFIER = Pattern.compile("^[a-z][a-z0-9_-]*$");
  private static final Pattern NAMESPACE = Pattern.compile("^[a-z0-9][a-z0-9_-]*$");
  // Control characters other than tab, LF and CR.
  private static final Pattern CONTROL_CHARS =
      Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");

  private Validators() {
    // Utility class
  }

  /** Validates a type, relation or permission name. */
  @Nonnull
  public static Status identifier(String field, @Nullable String value) {
    if (value == null || value.isEmpty()) {
      return Status.invalidArgument(field + " is required");
    }
    if (!IDENTIFIER.matcher(value).matches()) {
      return Status.invalidArgument(
          "Invalid " + field + " '" + value + "': must match " + IDENTIFIER.pattern());
    }
    return Status.ok();
  }

  /** Validates an entity id. */
  @Nonnull
  public static Status id(String field, @Nullable String value) {
    if (value == null || value.isEmpty()) {
      return Status.invalidArgument(field + " is required");
    }
    if (value.length() > MAX_ID_LENGTH) {
      return Status.invalidArgument(
          field + " exceeds maximum length of " + MAX_ID_LENGTH + " characters");
    }
    if (CONTROL_CHARS.matcher(value).find()) {
      return Status.invalidArgument(field + " contains control characters");
    }
    if (!value.strip().equals(value)) {
      return Status.invalidArgument(field + " has leading or trailing whitespace");
    }
    return Status.ok();
  }

  /** Validates a list of ids, reporting the index of the first invalid element. */
  @Nonnull
  public static Status ids(String field, @Nullable List<String> values) {
    if (values == null) {
      return Status.invalidArgument(field + " is required");
    }
    for (int i = 0; i < values.size(); i++) {
      Status status = id(field + "[" + i + "]", values.get(i));
      if (status.isError()) {
        return Status.invalidArgument(
            "Invalid " + field + " at index " + i + ": " + status.getMessage());
      }
    }
    return Status.ok();
  }

  @Nonnull
  public static Status namespace(@Nullable String value) {
    if (value == null || value.isEmpty()) {
      return Status.invalidArgument("namespace is required");
    }
    if (value.length() > MAX_NAMESPACE_LENGTH) {
      return Status.invalidArgument(
          "namespace exceeds maximum length of " + MAX_NAMESPACE_LENGTH + " characters");
    }
    if (!NAMESPACE.matcher(value).matches()) {
      return Status.invalidArgument(
          "Invalid namespace '" + value + "': must match " + NAMESPACE.pattern());
    }
    return Status.ok();
  }

  @Nonnull
  public static Status entity(String field, @Nullable EntityRef entity) {
    if (entity == null) {
      return Status.invalidArgument(field + " is required");
    }
    Status status = identifier(field + " type", entity.type());
    if (status.isError()) {
      return status;
    }
    return id(field + " id", entity.id());
  }

  @Nonnull
  public static Status subject(@Nullable SubjectRef subject) {
    if (subject == null) {
      return Status.invalidArgument("subject is required");
    }
    Status status = entity("subject", subject.entity());
    if (status.isError()) {
      return status;
    }
    if (subject.relation() != null) {
      return identifier("subject relation", subject.relation());
    }
    return Status.ok();
  }

  /** Null means "never expires"; anything else must lie strictly after {@code now}. */
  @Nonnull
  public static Status futureExpiry(@Nullable Instant expiresAt, Instant now) {
    if (expiresAt != null && !expiresAt.isAfter(now)) {
      return Status.invalidArgument("expires_at must be in the future, got " + expiresAt);
    }
    return Status.ok();
  }

  /** Returns the first error among {@code statuses}, or OK. */
  @Nonnull
  public static Status firstError(Status... statuses) {
    for (Status status : statuses) {
      if (status.isError()) {
        return status;
      }
    }
    return Status.ok();
  }
}
