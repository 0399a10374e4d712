package com.relgraph.common.status;

import java.util.Objects;
import java.util.function.Function;
import javax.annotation.Nonnull;

/**
 * A value or the error status that prevented it. Engine operations return this for expected
 * failures such as bad input or a rejected cycle; exceptions are reserved for bugs.
 *
 * @param <T> the success type
 */
public final class StatusOr<T> {
  private final Status status;
  private final T value;

  private StatusOr(Status status, T value) {
    if (status.isOk() == (value == null)) {
      throw new IllegalArgumentException(
          "An OK result needs a value and an error result must not have one");
    }
    this.status = status;
    this.value = value;
  }

  /** Wraps a successful result. */
  public static <T> StatusOr<T> ofValue(@Nonnull T value) {
    return new StatusOr<>(Status.ok(), Objects.requireNonNull(value));
  }

  /**
   * Wraps an error.
   *
   * @throws IllegalArgumentException if {@code status} is OK
   */
  public static <T> StatusOr<T> ofStatus(@Nonnull Status status) {
    if (status.isOk()) {
      throw new IllegalArgumentException("ofStatus needs an error status");
    }
    return new StatusOr<>(status, null);
  }

  /** An INTERNAL error carrying {@code throwable} as its cause. */
  public static <T> StatusOr<T> ofException(@Nonnull Throwable throwable) {
    return ofStatus(Status.internal("Exception: " + throwable.getMessage(), throwable));
  }

  @Nonnull
  public Status getStatus() {
    return status;
  }

  /**
   * Returns the value.
   *
   * @throws IllegalStateException on an error result
   */
  @Nonnull
  public T getValue() {
    if (status.isError()) {
      throw new IllegalStateException("No value in failed result: " + status);
    }
    return value;
  }

  public boolean isOk() {
    return status.isOk();
  }

  public boolean isNotOk() {
    return status.isError();
  }

  @Nonnull
  public StatusCode getCode() {
    return status.getCode();
  }

  /** Transforms the value of an OK result; an error passes through unchanged. */
  @Nonnull
  public <U> StatusOr<U> map(@Nonnull Function<T, U> mapper) {
    return status.isOk() ? ofValue(mapper.apply(value)) : ofStatus(status);
  }

  @Override
  public String toString() {
    return status.isOk() ? "StatusOr{value=" + value + "}" : "StatusOr{status=" + status + "}";
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    StatusOr<?> other = (StatusOr<?>) obj;
    return status.equals(other.status) && Objects.equals(value, other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(status, value);
  }
}
