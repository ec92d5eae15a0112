package io.jagged.generator.impl;

/** Branching node kinds, with the number of children each requires. */
public enum NodeKind {
  REGULAR(1),
  LIST_OFFSET(1),
  LIST(1),
  RECORD(1),
  UNION(2);

  private final int minChildren;

  NodeKind(int minChildren) {
    this.minChildren = minChildren;
  }

  public int minChildren() {
    return minChildren;
  }

  /**
   * Returns whether nodes of this kind wrap exactly one child.
   *
   * @return {@code true} for groupings and lists
   */
  public boolean isSingleChild() {
    return this == REGULAR || this == LIST_OFFSET || this == LIST;
  }
}
