package io.jagged.generator.impl;

import io.jagged.generator.api.DecisionTape;

/**
 * Countdown of leaf elements left for one generation pass.
 *
 * <p>Each allocation is deducted for good; there is no rollback. Once the budget is exhausted every
 * allocation yields zero, so later leaves fall back to their minimal form instead of failing.
 */
public final class ScalarBudget {
  private final int total;
  private int remaining;

  public ScalarBudget(int total) {
    if (total < 0) {
      throw new IllegalArgumentException("budget must be non-negative: " + total);
    }
    this.total = total;
    this.remaining = total;
  }

  /**
   * Draws and deducts an element count.
   *
   * <p>The result never exceeds {@code maxWanted} or what remains. {@code minNeeded} is honoured
   * only while the remainder can cover it.
   *
   * @param tape the decision tape
   * @param minNeeded smallest count the caller wants
   * @param maxWanted largest count the caller wants
   * @return the allotted count
   */
  public int allocate(DecisionTape tape, int minNeeded, int maxWanted) {
    int upper = ceiling(maxWanted);
    int lower = Math.min(Math.max(minNeeded, 0), upper);
    int allotted = lower == upper ? lower : tape.drawInt(lower, upper);
    remaining -= allotted;
    return allotted;
  }

  /**
   * Returns the largest count the next allocation could grant.
   *
   * @param maxWanted the caller's own ceiling
   * @return {@code min(maxWanted, remaining)}, never negative
   */
  public int ceiling(int maxWanted) {
    return Math.max(0, Math.min(maxWanted, remaining));
  }

  public int remaining() {
    return remaining;
  }

  public int used() {
    return total - remaining;
  }

  public boolean isExhausted() {
    return remaining == 0;
  }

  @Override
  public String toString() {
    return "ScalarBudget{" + remaining + "/" + total + "}";
  }
}
