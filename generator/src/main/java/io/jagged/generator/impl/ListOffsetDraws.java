package io.jagged.generator.impl;

import io.jagged.generator.api.DecisionTape;
import io.jagged.layout.Content;
import io.jagged.layout.ListOffsetContent;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import java.util.Arrays;

/** Draws offset-delimited lists over an already-built child. */
public final class ListOffsetDraws {
  public static final int MAX_LIST_LENGTH = 5;

  private ListOffsetDraws() {}

  public static Content draw(DecisionTape tape, Content content, int maxLength) {
    return new ListOffsetContent(drawOffsets(tape, content.length(), maxLength), content);
  }

  /**
   * Draws {@code n + 1} non-decreasing offsets over {@code [0, contentLen]}.
   *
   * <p>{@code n} is drawn from {@code [0, min(MAX_LIST_LENGTH, maxLength)]}. With at least one
   * sublist the first offset is 0 and the last is {@code contentLen}; the {@code n - 1} inner
   * offsets are sorted split points, so repeated points give empty sublists.
   *
   * @param tape the decision tape
   * @param contentLen the child length
   * @param maxLength ceiling on the number of sublists
   * @return the offsets
   */
  static long[] drawOffsets(DecisionTape tape, int contentLen, int maxLength) {
    int n = tape.drawInt(0, Math.min(MAX_LIST_LENGTH, maxLength));
    if (n == 0) {
      return new long[] {0};
    }
    if (contentLen == 0) {
      return new long[n + 1];
    }
    long[] splits = new long[n - 1];
    for (int i = 0; i < splits.length; i++) {
      splits[i] = tape.drawInt(0, contentLen);
    }
    Arrays.sort(splits);
    LongArrayList offsets = new LongArrayList(n + 1);
    offsets.add(0L);
    offsets.addElements(1, splits);
    offsets.add(contentLen);
    return offsets.toLongArray();
  }
}
