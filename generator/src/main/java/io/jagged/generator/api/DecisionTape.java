package io.jagged.generator.api;

import java.util.List;

/**
 * Source of every random decision taken while generating a content tree.
 *
 * <p>The engine never touches a random number generator directly. Replaying the same tape
 * reproduces the same tree, and a tape whose decisions move towards their lower bounds produces a
 * smaller tree, which is what lets a randomized-testing harness shrink failures.
 *
 * <p>Implementations only need {@link #drawLong(long, long)}; everything else derives from it.
 */
public interface DecisionTape {

  /**
   * Draws a value in {@code [min, max]}. Lower values are considered simpler.
   *
   * @param min inclusive lower bound
   * @param max inclusive upper bound, {@code >= min}
   * @return the drawn value
   */
  long drawLong(long min, long max);

  /**
   * Draws a value in {@code [min, max]}.
   *
   * @param min inclusive lower bound
   * @param max inclusive upper bound, {@code >= min}
   * @return the drawn value
   */
  default int drawInt(int min, int max) {
    return (int) drawLong(min, max);
  }

  /**
   * Draws a coin flip. {@code false} is the simpler outcome.
   *
   * @return the drawn boolean
   */
  default boolean drawBoolean() {
    return drawLong(0, 1) == 1;
  }

  /**
   * Picks one option uniformly.
   *
   * @param options the candidates, must not be empty
   * @param <T> the option type
   * @return the chosen option
   */
  default <T> T choose(List<T> options) {
    if (options.isEmpty()) {
      throw new IllegalArgumentException("Cannot choose from an empty list");
    }
    return options.get(drawInt(0, options.size() - 1));
  }

  /**
   * Draws a permutation of {@code [0, n)}. The simplest draw is the identity.
   *
   * @param n the permutation size
   * @return the permuted positions
   */
  default int[] permutation(int n) {
    int[] perm = new int[n];
    for (int i = 0; i < n; i++) {
      perm[i] = i;
    }
    for (int i = 0; i < n - 1; i++) {
      int j = drawInt(i, n - 1);
      int tmp = perm[i];
      perm[i] = perm[j];
      perm[j] = tmp;
    }
    return perm;
  }
}
