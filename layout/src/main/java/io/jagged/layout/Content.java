package io.jagged.layout;

import java.util.List;

/**
 * One node of a content tree describing a jagged columnar array.
 *
 * <p>The hierarchy is closed. Leaves ({@link NumpyContent}, {@link EmptyContent}, {@link
 * StringContent}, {@link BytestringContent}) hold element data; branching nodes ({@link
 * RegularContent}, {@link ListOffsetContent}, {@link ListContent}, {@link RecordContent}, {@link
 * UnionContent}) combine already-built children with index data. Every node validates its
 * arguments on construction and is immutable afterwards.
 */
public sealed interface Content
    permits NumpyContent,
        EmptyContent,
        StringContent,
        BytestringContent,
        RegularContent,
        ListOffsetContent,
        ListContent,
        RecordContent,
        UnionContent {

  /**
   * Returns the number of elements this node exposes.
   *
   * @return the node length, never negative
   */
  int length();

  /**
   * Returns the structural kind of this node.
   *
   * @return the kind
   */
  ContentKind kind();

  /**
   * Returns the direct children of this node in order.
   *
   * @return an unmodifiable list, empty for leaves
   */
  List<Content> children();

  /**
   * Returns whether this node is a leaf.
   *
   * @return {@code true} when the node has no children by kind
   */
  default boolean isLeaf() {
    return kind().isLeaf();
  }
}
