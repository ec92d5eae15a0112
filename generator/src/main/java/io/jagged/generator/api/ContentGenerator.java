package io.jagged.generator.api;

import io.jagged.generator.impl.ContentGeneratorImpl;
import io.jagged.layout.Content;
import io.jagged.layout.JaggedArray;
import java.util.List;

/**
 * Entry point generating random content trees.
 *
 * <p>A generator is immutable and may be shared. Each call to {@link #generate(DecisionTape)} is
 * one independent pass with its own scalar budget; all randomness comes from the supplied tape.
 *
 * <pre>{@code
 * ContentGenerator generator =
 *     ContentGenerator.create(GeneratorOptions.builder().maxSize(20).allowUnion(false).build());
 * Content tree = generator.generate(new RandomTape(42L));
 * }</pre>
 */
public interface ContentGenerator {

  /**
   * Creates a generator for the given options.
   *
   * @param options the generator options
   * @return a new generator
   * @throws JaggedConfigurationException if the options cannot produce any value
   */
  static ContentGenerator create(GeneratorOptions options) {
    return new ContentGeneratorImpl(options);
  }

  /**
   * Creates a generator with {@link GeneratorOptions#DEFAULT}.
   *
   * @return a new generator
   */
  static ContentGenerator create() {
    return create(GeneratorOptions.DEFAULT);
  }

  GeneratorOptions options();

  /**
   * Generates one content tree.
   *
   * @param tape the decision tape
   * @return a tree satisfying every configured limit
   */
  Content generate(DecisionTape tape);

  /**
   * Generates one content tree wrapped as an array value.
   *
   * @param tape the decision tape
   * @return the array
   */
  default JaggedArray generateArray(DecisionTape tape) {
    return JaggedArray.of(generate(tape));
  }

  /**
   * Generates between {@code minItems} and {@code maxItems} trees drawing on one shared scalar
   * budget, so their combined leaf elements stay within {@code maxSize}.
   *
   * @param tape the decision tape
   * @param minItems smallest number of trees
   * @param maxItems largest number of trees
   * @return the trees
   */
  List<Content> generateList(DecisionTape tape, int minItems, int maxItems);
}
