package io.jagged.generator.jqwik;

import io.jagged.generator.api.ContentDraws;
import io.jagged.generator.api.ContentGenerator;
import io.jagged.generator.api.GeneratorOptions;
import io.jagged.generator.api.Outcome;
import io.jagged.generator.tape.ChoiceSequenceTape;
import io.jagged.layout.Content;
import io.jagged.layout.JaggedArray;
import java.util.List;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * jqwik arbitraries for content trees.
 *
 * <p>Each value is generated from a jqwik-drawn list of raw choices replayed through a {@link
 * ChoiceSequenceTape}. jqwik shrinks that list (fewer entries, entries closer to zero), which
 * shrinks the tree towards fewer branches, shorter leaves and smaller values. Draws discarded as
 * unsatisfiable are filtered out, so jqwik retries them with fresh choices.
 *
 * <pre>{@code
 * @Provide
 * Arbitrary<Content> trees() {
 *   return ContentArbitraries.contents(GeneratorOptions.builder().maxSize(20).build());
 * }
 * }</pre>
 */
public final class ContentArbitraries {
  private static final Logger log = LoggerFactory.getLogger(ContentArbitraries.class);

  /** Longest choice sequence handed to a single pass. */
  public static final int MAX_CHOICES = 512;

  private ContentArbitraries() {}

  /**
   * Generates trees with {@link GeneratorOptions#DEFAULT}.
   *
   * @return arbitrary generating content trees
   */
  public static Arbitrary<Content> contents() {
    return contents(GeneratorOptions.DEFAULT);
  }

  /**
   * Generates trees with the given options. Invalid options fail here, before any value is drawn.
   *
   * @param options the generator options
   * @return arbitrary generating content trees
   */
  public static Arbitrary<Content> contents(GeneratorOptions options) {
    ContentGenerator generator = ContentGenerator.create(options);
    return choices().map(choices -> generator.generate(new ChoiceSequenceTape(choices)));
  }

  /**
   * Generates trees wrapped as public array values.
   *
   * @param options the generator options
   * @return arbitrary generating arrays
   */
  public static Arbitrary<JaggedArray> arrays(GeneratorOptions options) {
    return contents(options).map(JaggedArray::of);
  }

  /**
   * Generates lists of trees sharing one scalar budget.
   *
   * @param options the generator options
   * @param minItems smallest list size
   * @param maxItems largest list size
   * @return arbitrary generating lists of trees
   */
  public static Arbitrary<List<Content>> contentLists(
      GeneratorOptions options, int minItems, int maxItems) {
    ContentGenerator generator = ContentGenerator.create(options);
    return choices()
        .map(
            choices ->
                generator.generateList(new ChoiceSequenceTape(choices), minItems, maxItems));
  }

  /**
   * Wraps drawn children in a fixed-size grouping.
   *
   * @param content arbitrary for the child
   * @param maxLength ceiling on the grouping length
   * @return arbitrary generating groupings
   */
  public static Arbitrary<Content> regular(Arbitrary<Content> content, int maxLength) {
    return Combinators.combine(content, choices())
        .as((c, choices) -> ContentDraws.regular(new ChoiceSequenceTape(choices), c, maxLength))
        .filter(ContentArbitraries::accept)
        .map(Outcome::get);
  }

  public static Arbitrary<Content> regular(Arbitrary<Content> content) {
    return regular(content, GeneratorOptions.UNBOUNDED);
  }

  public static Arbitrary<Content> listOffset(Arbitrary<Content> content) {
    return Combinators.combine(content, choices())
        .as((c, choices) -> ContentDraws.listOffset(new ChoiceSequenceTape(choices), c));
  }

  public static Arbitrary<Content> list(Arbitrary<Content> content) {
    return Combinators.combine(content, choices())
        .as((c, choices) -> ContentDraws.list(new ChoiceSequenceTape(choices), c));
  }

  /**
   * Combines drawn fields into records or tuples.
   *
   * @param contents arbitrary for the fields
   * @param allowTuple whether tuples may be drawn
   * @param maxLength ceiling on the record length
   * @return arbitrary generating records
   */
  public static Arbitrary<Content> record(
      Arbitrary<List<Content>> contents, boolean allowTuple, int maxLength) {
    return Combinators.combine(contents, choices())
        .as(
            (cs, choices) ->
                ContentDraws.record(new ChoiceSequenceTape(choices), cs, allowTuple, maxLength));
  }

  /**
   * Combines drawn alternatives into tagged unions.
   *
   * @param contents arbitrary for at least two alternatives, none of them unions
   * @param maxLength ceiling on the union length
   * @return arbitrary generating unions
   */
  public static Arbitrary<Content> union(Arbitrary<List<Content>> contents, int maxLength) {
    return Combinators.combine(contents, choices())
        .as((cs, choices) -> ContentDraws.union(new ChoiceSequenceTape(choices), cs, maxLength));
  }

  private static boolean accept(Outcome<?> outcome) {
    if (outcome.isDiscarded()) {
      log.trace("Discarding draw: {}", outcome.reason());
      return false;
    }
    return true;
  }

  private static Arbitrary<List<Long>> choices() {
    return Arbitraries.longs().list().ofMaxSize(MAX_CHOICES);
  }
}
