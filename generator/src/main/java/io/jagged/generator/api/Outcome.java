package io.jagged.generator.api;

import java.util.Objects;
import java.util.function.Function;

/**
 * Result of a draw that may be locally unsatisfiable.
 *
 * <p>A discarded outcome asks the enclosing harness to throw the whole pass away and retry with
 * different decisions. It is not an error: programming defects are still reported by exceptions.
 *
 * @param <T> the drawn value type
 */
public final class Outcome<T> {
  private final T value;
  private final String reason;

  private Outcome(T value, String reason) {
    this.value = value;
    this.reason = reason;
  }

  public static <T> Outcome<T> success(T value) {
    return new Outcome<>(Objects.requireNonNull(value, "value"), null);
  }

  public static <T> Outcome<T> discard(String reason) {
    return new Outcome<>(null, Objects.requireNonNull(reason, "reason"));
  }

  public boolean isSuccess() {
    return reason == null;
  }

  public boolean isDiscarded() {
    return reason != null;
  }

  /**
   * Returns the drawn value.
   *
   * @return the value
   * @throws IllegalStateException if this outcome was discarded
   */
  public T get() {
    if (reason != null) {
      throw new IllegalStateException("Draw was discarded: " + reason);
    }
    return value;
  }

  /**
   * Returns why the draw was discarded.
   *
   * @return the reason, or {@code null} on success
   */
  public String reason() {
    return reason;
  }

  public <R> Outcome<R> map(Function<? super T, ? extends R> fn) {
    if (reason != null) {
      return discard(reason);
    }
    return success(fn.apply(value));
  }

  @Override
  public String toString() {
    return reason == null ? "Success[" + value + "]" : "Discard[" + reason + "]";
  }
}
