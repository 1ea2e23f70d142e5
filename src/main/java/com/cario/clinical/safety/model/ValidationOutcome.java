package com.cario.clinical.safety.model;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Result of a validation step: either an accepted value or exactly one {@link ValidationError}.
 *
 * <p>Expected failures travel as values so callers have to handle them; nothing here throws for a
 * rejected document.
 *
 * @param <T> type of the accepted value
 */
public final class ValidationOutcome<T> {

  private final T value;
  private final ValidationError error;

  private ValidationOutcome(T value, ValidationError error) {
    this.value = value;
    this.error = error;
  }

  public static <T> ValidationOutcome<T> accepted(T value) {
    return new ValidationOutcome<>(Objects.requireNonNull(value, "value"), null);
  }

  public static <T> ValidationOutcome<T> rejected(ValidationError error) {
    return new ValidationOutcome<>(null, Objects.requireNonNull(error, "error"));
  }

  public boolean isAccepted() {
    return error == null;
  }

  public boolean isRejected() {
    return error != null;
  }

  public Optional<T> getValue() {
    return Optional.ofNullable(value);
  }

  public Optional<ValidationError> getError() {
    return Optional.ofNullable(error);
  }

  /**
   * Returns the accepted value.
   *
   * @throws IllegalStateException if the outcome is a rejection
   */
  public T orElseThrow() {
    if (error != null) {
      throw new IllegalStateException("Outcome was rejected: " + error.describe());
    }
    return value;
  }

  /** Carries a rejection over to another value type; accepted outcomes are mapped. */
  public <R> ValidationOutcome<R> map(Function<? super T, ? extends R> fn) {
    if (error != null) {
      return rejected(error);
    }
    return accepted(fn.apply(value));
  }

  @Override
  public String toString() {
    return isAccepted() ? "accepted(" + value + ")" : "rejected(" + error + ")";
  }
}
