package io.jagged.generator.impl;

import io.jagged.generator.api.DecisionTape;
import io.jagged.layout.Content;
import io.jagged.layout.ListContent;
import java.util.Arrays;

/** Draws start/stop-delimited lists. Uses the same sublist layout as offset lists. */
public final class ListDraws {

  private ListDraws() {}

  public static Content draw(DecisionTape tape, Content content, int maxLength) {
    long[] offsets = ListOffsetDraws.drawOffsets(tape, content.length(), maxLength);
    long[] starts = Arrays.copyOfRange(offsets, 0, offsets.length - 1);
    long[] stops = Arrays.copyOfRange(offsets, 1, offsets.length);
    return new ListContent(starts, stops, content);
  }
}
