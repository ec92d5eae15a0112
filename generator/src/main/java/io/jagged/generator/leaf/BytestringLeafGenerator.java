package io.jagged.generator.leaf;

import io.jagged.generator.api.DecisionTape;
import io.jagged.layout.BytestringContent;
import io.jagged.layout.Content;
import java.util.ArrayList;
import java.util.List;

/** Byte-string leaves of arbitrary octets. */
public final class BytestringLeafGenerator implements LeafGenerator {
  private final int maxStringLength;

  public BytestringLeafGenerator(int maxStringLength) {
    this.maxStringLength = maxStringLength;
  }

  @Override
  public LeafKind kind() {
    return LeafKind.BYTESTRING;
  }

  @Override
  public Content generate(DecisionTape tape, int minSize, int maxSize) {
    int n = tape.drawInt(minSize, maxSize);
    List<byte[]> values = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      byte[] b = new byte[tape.drawInt(0, maxStringLength)];
      for (int j = 0; j < b.length; j++) {
        b[j] = (byte) tape.drawInt(0, 255);
      }
      values.add(b);
    }
    return new BytestringContent(values);
  }
}
