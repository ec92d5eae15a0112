package io.jagged.generator.tape;

import io.jagged.generator.api.DecisionTape;

/**
 * Base for tapes backed by a stream of raw 64-bit choices.
 *
 * <p>A raw choice {@code c} maps to {@code min + (c mod span)} using unsigned arithmetic, so a
 * choice of zero always yields the lower bound and every value of the range is reachable.
 */
public abstract class AbstractDecisionTape implements DecisionTape {
  private int consumed;

  /**
   * Supplies the next raw choice.
   *
   * @return an arbitrary 64-bit word
   */
  protected abstract long nextChoice();

  @Override
  public final long drawLong(long min, long max) {
    if (max < min) {
      throw new IllegalArgumentException("Empty range [" + min + ", " + max + "]");
    }
    long choice = nextChoice();
    consumed++;
    if (min == max) {
      return min;
    }
    long span = max - min + 1;
    if (span == 0) {
      // the range covers all 2^64 values
      return min + choice;
    }
    return min + Long.remainderUnsigned(choice, span);
  }

  /**
   * Returns how many decisions have been drawn so far.
   *
   * @return the number of draws
   */
  public int consumed() {
    return consumed;
  }
}
