package com.gentoro.reportengine.expression;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of an evaluation: either a value or the {@link SafeEvalException} that prevented it.
 *
 * <p>Used by callers that process many cells and decide per cell whether to continue.
 */
public final class EvalResult<T> {

  private final T value;
  private final SafeEvalException error;

  private EvalResult(T value, SafeEvalException error) {
    this.value = value;
    this.error = error;
  }

  public static <T> EvalResult<T> success(T value) {
    return new EvalResult<>(value, null);
  }

  public static <T> EvalResult<T> failure(SafeEvalException error) {
    return new EvalResult<>(null, Objects.requireNonNull(error, "error"));
  }

  public boolean isSuccess() {
    return error == null;
  }

  /**
   * @throws IllegalStateException when this is a failure
   */
  public T value() {
    if (error != null) {
      throw new IllegalStateException("No value: evaluation failed", error);
    }
    return value;
  }

  /**
   * @throws IllegalStateException when this is a success
   */
  public SafeEvalException error() {
    if (error == null) {
      throw new IllegalStateException("No error: evaluation succeeded");
    }
    return error;
  }

  public T orElse(T fallback) {
    return error == null ? value : fallback;
  }

  public <R> EvalResult<R> map(Function<? super T, ? extends R> mapper) {
    return error == null ? success(mapper.apply(value)) : failure(error);
  }

  @Override
  public String toString() {
    return error == null
        ? "EvalResult[success=" + value + "]"
        : "EvalResult[failure=" + error.getKind() + ": " + error.getMessage() + "]";
  }
}
