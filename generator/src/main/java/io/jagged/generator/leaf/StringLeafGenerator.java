package io.jagged.generator.leaf;

import io.jagged.generator.api.DecisionTape;
import io.jagged.layout.Content;
import io.jagged.layout.StringContent;
import java.util.ArrayList;
import java.util.List;

/**
 * Text leaves. Every value is built from Unicode scalar values, so it never contains an unpaired
 * surrogate.
 */
public final class StringLeafGenerator implements LeafGenerator {
  private static final int SURROGATE_COUNT = Character.MAX_SURROGATE - Character.MIN_SURROGATE + 1;

  private final int maxStringLength;

  public StringLeafGenerator(int maxStringLength) {
    this.maxStringLength = maxStringLength;
  }

  @Override
  public LeafKind kind() {
    return LeafKind.STRING;
  }

  @Override
  public Content generate(DecisionTape tape, int minSize, int maxSize) {
    int n = tape.drawInt(minSize, maxSize);
    List<String> values = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      values.add(drawString(tape));
    }
    return new StringContent(values);
  }

  private String drawString(DecisionTape tape) {
    int codePoints = tape.drawInt(0, maxStringLength);
    StringBuilder sb = new StringBuilder(codePoints);
    for (int i = 0; i < codePoints; i++) {
      sb.appendCodePoint(drawScalarValue(tape));
    }
    return sb.toString();
  }

  private static int drawScalarValue(DecisionTape tape) {
    if (!tape.drawBoolean()) {
      // printable ASCII
      return tape.drawInt(0x20, 0x7E);
    }
    int cp = tape.drawInt(0, Character.MAX_CODE_POINT - SURROGATE_COUNT);
    return cp >= Character.MIN_SURROGATE ? cp + SURROGATE_COUNT : cp;
  }
}
