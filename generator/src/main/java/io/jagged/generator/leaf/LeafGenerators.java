package io.jagged.generator.leaf;

import io.jagged.generator.api.DecisionTape;
import io.jagged.generator.api.GeneratorOptions;
import io.jagged.generator.api.JaggedConfigurationException;
import io.jagged.layout.Content;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** The enabled leaf generators of one configuration, chosen among per draw. */
public final class LeafGenerators {
  private final List<LeafGenerator> generators;

  public LeafGenerators(List<LeafGenerator> generators) {
    if (generators.isEmpty()) {
      throw JaggedConfigurationException.noLeafKind();
    }
    this.generators = List.copyOf(generators);
  }

  /**
   * Creates the leaf generators enabled by {@code options}.
   *
   * @param options the generator options
   * @return the enabled generators
   * @throws JaggedConfigurationException if no leaf kind is enabled
   */
  public static LeafGenerators from(GeneratorOptions options) {
    List<LeafGenerator> enabled = new ArrayList<>();
    if (options.allowNumpy()) {
      enabled.add(new NumpyLeafGenerator(options.dtypes(), options.allowNan()));
    }
    if (options.allowEmpty()) {
      enabled.add(new EmptyLeafGenerator());
    }
    if (options.allowString()) {
      enabled.add(new StringLeafGenerator(options.maxStringLength()));
    }
    if (options.allowBytestring()) {
      enabled.add(new BytestringLeafGenerator(options.maxStringLength()));
    }
    return new LeafGenerators(enabled);
  }

  /**
   * Returns whether any enabled kind can hold elements. When only placeholders are enabled every
   * leaf must be empty.
   *
   * @return {@code true} if a non-empty leaf is possible
   */
  public boolean canHoldElements() {
    for (LeafGenerator g : generators) {
      if (g.accepts(1)) {
        return true;
      }
    }
    return false;
  }

  public List<LeafKind> kinds() {
    List<LeafKind> kinds = new ArrayList<>(generators.size());
    for (LeafGenerator g : generators) {
      kinds.add(g.kind());
    }
    return Collections.unmodifiableList(kinds);
  }

  /**
   * Generates a leaf from one of the kinds accepting the window.
   *
   * @param tape the decision tape
   * @param minSize smallest element count
   * @param maxSize largest element count
   * @return the leaf
   * @throws IllegalArgumentException if no enabled kind accepts {@code minSize}
   */
  public Content generate(DecisionTape tape, int minSize, int maxSize) {
    List<LeafGenerator> candidates = new ArrayList<>(generators.size());
    for (LeafGenerator g : generators) {
      if (g.accepts(minSize)) {
        candidates.add(g);
      }
    }
    if (candidates.isEmpty()) {
      throw new IllegalArgumentException("No enabled leaf kind can hold " + minSize + " elements");
    }
    return tape.choose(candidates).generate(tape, minSize, maxSize);
  }
}
