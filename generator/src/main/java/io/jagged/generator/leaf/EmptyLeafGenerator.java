package io.jagged.generator.leaf;

import io.jagged.generator.api.DecisionTape;
import io.jagged.layout.Content;
import io.jagged.layout.EmptyContent;

/** Zero-length placeholder leaves. Only usable when the window admits zero elements. */
public final class EmptyLeafGenerator implements LeafGenerator {

  @Override
  public LeafKind kind() {
    return LeafKind.EMPTY;
  }

  @Override
  public boolean accepts(int minSize) {
    return minSize == 0;
  }

  @Override
  public Content generate(DecisionTape tape, int minSize, int maxSize) {
    if (minSize > 0) {
      throw new IllegalArgumentException("EmptyContent cannot hold " + minSize + " elements");
    }
    return EmptyContent.INSTANCE;
  }
}
