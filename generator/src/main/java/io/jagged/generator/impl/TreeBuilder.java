package io.jagged.generator.impl;

import io.jagged.generator.api.DecisionTape;
import io.jagged.generator.api.GeneratorOptions;
import io.jagged.generator.leaf.LeafGenerators;
import io.jagged.layout.Content;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive builder producing one content tree per pass.
 *
 * <p>The node kind is chosen before any child is built, and kinds the parent forbids are removed
 * from the candidates up front, so every child list handed to a constructor is one it accepts.
 * Children are built depth-first, left to right, which also fixes the order in which the shared
 * {@link ScalarBudget} is drawn down.
 *
 * <p>Every node respects {@code maxLength}, which keeps all constructor draws satisfiable.
 */
final class TreeBuilder {
  private final GeneratorOptions options;
  private final LeafGenerators leaves;
  private final Set<NodeKind> enabled;
  private final DecisionTape tape;
  private final ScalarBudget budget;

  TreeBuilder(
      GeneratorOptions options,
      LeafGenerators leaves,
      Set<NodeKind> enabled,
      DecisionTape tape,
      ScalarBudget budget) {
    this.options = options;
    this.leaves = leaves;
    this.enabled = enabled;
    this.tape = tape;
    this.budget = budget;
  }

  /**
   * Builds a subtree rooted at {@code depth}.
   *
   * @param depth number of branching nodes above this one
   * @param forbidden kinds that may not be chosen for this node
   * @return the subtree
   */
  Content build(int depth, Set<NodeKind> forbidden) {
    if (depth >= options.maxDepth() || budget.isExhausted() || !tape.drawBoolean()) {
      return leaf();
    }
    List<NodeKind> candidates = new ArrayList<>(enabled.size());
    for (NodeKind kind : enabled) {
      if (!forbidden.contains(kind)) {
        candidates.add(kind);
      }
    }
    if (candidates.isEmpty()) {
      return leaf();
    }
    NodeKind kind = tape.choose(candidates);
    int maxLength = options.maxLength();
    if (kind.isSingleChild()) {
      Content child = build(depth + 1, NestingRules.excludedChildren(kind));
      return switch (kind) {
        case REGULAR -> RegularDraws.draw(tape, child, maxLength).get();
        case LIST_OFFSET -> ListOffsetDraws.draw(tape, child, maxLength);
        default -> ListDraws.draw(tape, child, maxLength);
      };
    }
    if (kind == NodeKind.RECORD) {
      List<Content> fields = buildChildren(depth, kind, options.maxFields(), true);
      return RecordDraws.draw(tape, fields, options.allowTuple(), maxLength);
    }
    List<Content> alternatives = buildChildren(depth, kind, options.maxContents(), false);
    return UnionDraws.draw(tape, alternatives, maxLength);
  }

  /**
   * Builds the children of a multi-child node: the kind's minimum, then one more per "another?"
   * coin up to {@code maxChildren}.
   *
   * @param depth depth of the parent
   * @param kind the parent kind
   * @param maxChildren largest number of children
   * @param stopWhenExhausted whether an exhausted budget ends the optional children
   * @return the children, left to right
   */
  private List<Content> buildChildren(
      int depth, NodeKind kind, int maxChildren, boolean stopWhenExhausted) {
    Set<NodeKind> forbidden = NestingRules.excludedChildren(kind);
    List<Content> children = new ArrayList<>();
    while (children.size() < kind.minChildren()) {
      children.add(build(depth + 1, forbidden));
    }
    while (children.size() < maxChildren
        && !(stopWhenExhausted && budget.isExhausted())
        && tape.drawBoolean()) {
      children.add(build(depth + 1, forbidden));
    }
    return children;
  }

  Content build() {
    return build(0, EnumSet.noneOf(NodeKind.class));
  }

  private Content leaf() {
    int ceiling = leaves.canHoldElements() ? options.maxLength() : 0;
    int size = budget.allocate(tape, 0, ceiling);
    return leaves.generate(tape, size, size);
  }
}
