package io.jagged.generator.impl;

import io.jagged.generator.api.DecisionTape;
import io.jagged.layout.Content;
import io.jagged.layout.UnionContent;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import java.util.List;

/**
 * Draws a tagged union over already-built alternatives.
 *
 * <p>Every element of every alternative is listed once as a {@code (tag, index)} pair and the
 * pairs are shuffled. When the total exceeds {@code maxLength} the shuffled pairs are truncated,
 * leaving some alternative elements unreachable rather than rejecting the draw.
 */
public final class UnionDraws {

  private UnionDraws() {}

  /**
   * Draws a union over {@code contents}.
   *
   * @param tape the decision tape
   * @param contents the alternatives
   * @param maxLength ceiling on the union length
   * @return the union
   * @throws IllegalArgumentException if there are fewer than 2 or more than {@link
   *     UnionContent#MAX_CONTENTS} alternatives
   */
  public static Content draw(DecisionTape tape, List<Content> contents, int maxLength) {
    if (contents.size() < 2 || contents.size() > UnionContent.MAX_CONTENTS) {
      throw new IllegalArgumentException(
          "A union needs between 2 and "
              + UnionContent.MAX_CONTENTS
              + " alternatives, got "
              + contents.size());
    }
    IntArrayList tags = new IntArrayList();
    LongArrayList index = new LongArrayList();
    for (int k = 0; k < contents.size(); k++) {
      int len = contents.get(k).length();
      for (int i = 0; i < len; i++) {
        tags.add(k);
        index.add(i);
      }
    }
    int[] perm = tape.permutation(tags.size());
    int length = Math.min(perm.length, maxLength);
    byte[] shuffledTags = new byte[length];
    long[] shuffledIndex = new long[length];
    for (int i = 0; i < length; i++) {
      shuffledTags[i] = (byte) tags.getInt(perm[i]);
      shuffledIndex[i] = index.getLong(perm[i]);
    }
    return new UnionContent(shuffledTags, shuffledIndex, contents);
  }
}
