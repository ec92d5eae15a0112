package io.jagged.generator.leaf;

import io.jagged.generator.api.DecisionTape;
import io.jagged.layout.Content;

/** Produces terminal nodes whose element count lies in a requested window. */
public interface LeafGenerator {

  LeafKind kind();

  /**
   * Returns whether this generator can produce a leaf of at least {@code minSize} elements.
   *
   * @param minSize the smallest acceptable length
   * @return {@code true} if the window is satisfiable
   */
  default boolean accepts(int minSize) {
    return true;
  }

  /**
   * Generates one leaf with {@code minSize <= length() <= maxSize}.
   *
   * @param tape the decision tape
   * @param minSize smallest element count
   * @param maxSize largest element count
   * @return the leaf
   */
  Content generate(DecisionTape tape, int minSize, int maxSize);
}
