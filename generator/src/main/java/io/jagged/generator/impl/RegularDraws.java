package io.jagged.generator.impl;

import io.jagged.generator.api.DecisionTape;
import io.jagged.generator.api.Outcome;
import io.jagged.layout.Content;
import io.jagged.layout.RegularContent;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Draws a fixed-size grouping over an already-built child.
 *
 * <p>For a non-empty child the group size is sampled uniformly among the divisors of the child
 * length up to {@link #MAX_REGULAR_SIZE}, which favours small sizes for composite lengths. An empty
 * child admits any size, and a size of zero takes a separately drawn stand-in length.
 */
public final class RegularDraws {
  public static final int MAX_REGULAR_SIZE = 5;

  private RegularDraws() {}

  /**
   * Groups {@code content}, keeping the resulting length within {@code maxLength}.
   *
   * @param tape the decision tape
   * @param content the child
   * @param maxLength ceiling on the grouping length
   * @return the grouping, or a discard when no divisor keeps the length under {@code maxLength}
   */
  public static Outcome<Content> draw(DecisionTape tape, Content content, int maxLength) {
    int contentLen = content.length();
    if (contentLen == 0) {
      int size = tape.drawInt(0, MAX_REGULAR_SIZE);
      if (size == 0) {
        int zerosLength = tape.drawInt(0, Math.min(MAX_REGULAR_SIZE, maxLength));
        return Outcome.success(new RegularContent(content, 0, zerosLength));
      }
      return Outcome.success(new RegularContent(content, size));
    }
    IntList divisors = new IntArrayList();
    for (int d = 1; d <= Math.min(contentLen, MAX_REGULAR_SIZE); d++) {
      if (contentLen % d == 0 && contentLen / d <= maxLength) {
        divisors.add(d);
      }
    }
    if (divisors.isEmpty()) {
      return Outcome.discard(
          "no group size up to "
              + MAX_REGULAR_SIZE
              + " divides "
              + contentLen
              + " into at most "
              + maxLength
              + " groups");
    }
    int size = divisors.getInt(tape.drawInt(0, divisors.size() - 1));
    return Outcome.success(new RegularContent(content, size));
  }
}
