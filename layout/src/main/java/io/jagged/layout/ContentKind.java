package io.jagged.layout;

/** Structural kind of a {@link Content} node. */
public enum ContentKind {
  NUMPY(true),
  EMPTY(true),
  STRING(true),
  BYTESTRING(true),
  REGULAR(false),
  LIST_OFFSET(false),
  LIST(false),
  RECORD(false),
  UNION(false);

  private final boolean leaf;

  ContentKind(boolean leaf) {
    this.leaf = leaf;
  }

  /**
   * Returns whether nodes of this kind are terminal.
   *
   * @return {@code true} for leaf kinds
   */
  public boolean isLeaf() {
    return leaf;
  }
}
