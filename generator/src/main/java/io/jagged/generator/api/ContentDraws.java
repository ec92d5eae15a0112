package io.jagged.generator.api;

import io.jagged.generator.impl.ListDraws;
import io.jagged.generator.impl.ListOffsetDraws;
import io.jagged.generator.impl.RecordDraws;
import io.jagged.generator.impl.RegularDraws;
import io.jagged.generator.impl.UnionDraws;
import io.jagged.layout.Content;
import java.util.List;

/**
 * Single-node draws over caller-supplied children.
 *
 * <p>These are the constructors the tree builder uses, exposed for tests that want to control the
 * children themselves. Draws that can be unsatisfiable for arbitrary children return an {@link
 * Outcome}.
 */
public final class ContentDraws {

  private ContentDraws() {}

  public static Outcome<Content> regular(DecisionTape tape, Content content) {
    return regular(tape, content, GeneratorOptions.UNBOUNDED);
  }

  /**
   * Draws a fixed-size grouping of {@code content}.
   *
   * @param tape the decision tape
   * @param content the child
   * @param maxLength ceiling on the grouping length
   * @return the grouping, or a discard if no group size keeps it within {@code maxLength}
   */
  public static Outcome<Content> regular(DecisionTape tape, Content content, int maxLength) {
    return RegularDraws.draw(tape, content, maxLength);
  }

  public static Content listOffset(DecisionTape tape, Content content) {
    return ListOffsetDraws.draw(tape, content, GeneratorOptions.UNBOUNDED);
  }

  public static Content listOffset(DecisionTape tape, Content content, int maxLength) {
    return ListOffsetDraws.draw(tape, content, maxLength);
  }

  public static Content list(DecisionTape tape, Content content) {
    return ListDraws.draw(tape, content, GeneratorOptions.UNBOUNDED);
  }

  public static Content list(DecisionTape tape, Content content, int maxLength) {
    return ListDraws.draw(tape, content, maxLength);
  }

  public static Content record(DecisionTape tape, List<Content> contents) {
    return RecordDraws.draw(tape, contents, true, GeneratorOptions.UNBOUNDED);
  }

  /**
   * Draws a record over {@code contents}, named or, when allowed, a tuple.
   *
   * @param tape the decision tape
   * @param contents the fields
   * @param allowTuple whether the record may be a tuple
   * @param maxLength ceiling on the record length
   * @return the record
   */
  public static Content record(
      DecisionTape tape, List<Content> contents, boolean allowTuple, int maxLength) {
    return RecordDraws.draw(tape, contents, allowTuple, maxLength);
  }

  public static Content union(DecisionTape tape, List<Content> contents) {
    return UnionDraws.draw(tape, contents, GeneratorOptions.UNBOUNDED);
  }

  /**
   * Draws a union over at least two {@code contents}, truncated to {@code maxLength} elements.
   *
   * @param tape the decision tape
   * @param contents the alternatives, none of them a union
   * @param maxLength ceiling on the union length
   * @return the union
   * @throws IllegalArgumentException if there are fewer than 2 or more than 128 alternatives
   */
  public static Content union(DecisionTape tape, List<Content> contents, int maxLength) {
    return UnionDraws.draw(tape, contents, maxLength);
  }
}
