package io.jagged.generator.impl;

import java.util.EnumSet;
import java.util.Set;

/**
 * Which branching kinds may not appear directly beneath a parent kind.
 *
 * <p>Consulted before recursing: the builder narrows the candidate kinds for a child up front and
 * never checks a finished child after the fact. Indirect nesting, such as a union inside a record
 * inside a union, is always allowed.
 */
public final class NestingRules {

  private NestingRules() {}

  /**
   * Returns the kinds excluded as direct children of {@code parent}.
   *
   * @param parent the parent kind
   * @return a fresh set of excluded kinds
   */
  public static Set<NodeKind> excludedChildren(NodeKind parent) {
    return switch (parent) {
      case UNION -> EnumSet.of(NodeKind.UNION);
      case REGULAR, LIST_OFFSET, LIST, RECORD -> EnumSet.noneOf(NodeKind.class);
    };
  }
}
