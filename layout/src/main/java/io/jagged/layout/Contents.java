package io.jagged.layout;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/** Read-only traversal helpers over content trees. */
public final class Contents {

  private Contents() {
    // Utility class - no instantiation
  }

  /**
   * Lists every node of the tree, parents before their children.
   *
   * @param root the tree root
   * @return all nodes in depth-first pre-order
   */
  public static List<Content> iterContents(Content root) {
    List<Content> out = new ArrayList<>();
    Deque<Content> stack = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      Content c = stack.pop();
      out.add(c);
      List<Content> children = c.children();
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(children.get(i));
      }
    }
    return out;
  }

  /**
   * Lists every leaf of the tree, left to right.
   *
   * @param root the tree root
   * @return the leaves
   */
  public static List<Content> iterLeafContents(Content root) {
    List<Content> out = new ArrayList<>();
    for (Content c : iterContents(root)) {
      if (c.isLeaf()) {
        out.add(c);
      }
    }
    return out;
  }

  /**
   * Sums the element counts of every leaf.
   *
   * @param root the tree root
   * @return the total number of leaf elements
   */
  public static int totalScalars(Content root) {
    int total = 0;
    for (Content leaf : iterLeafContents(root)) {
      total += leaf.length();
    }
    return total;
  }

  /**
   * Returns the largest number of branching nodes on any path from the root to a leaf.
   *
   * <p>A record without fields still counts as one level.
   *
   * @param root the tree root
   * @return the nesting depth, 0 for a single leaf
   */
  public static int nestingDepth(Content root) {
    if (root.isLeaf()) {
      return 0;
    }
    int deepest = 0;
    for (Content child : root.children()) {
      deepest = Math.max(deepest, nestingDepth(child));
    }
    return 1 + deepest;
  }

  /**
   * Returns whether any node of the tree has the given kind.
   *
   * @param root the tree root
   * @param kind the kind to look for
   * @return {@code true} if present
   */
  public static boolean containsKind(Content root, ContentKind kind) {
    for (Content c : iterContents(root)) {
      if (c.kind() == kind) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns whether any numeric leaf holds a NaN, in a floating cell or either part of a complex
   * cell.
   *
   * @param root the tree root
   * @return {@code true} if a NaN is present
   */
  public static boolean anyNan(Content root) {
    for (Content c : iterLeafContents(root)) {
      if (c instanceof NumpyContent n) {
        for (int i = 0; i < n.length(); i++) {
          if (n.isNanAt(i)) {
            return true;
          }
        }
      }
    }
    return false;
  }

  /**
   * Returns whether any numeric leaf holds a not-a-time.
   *
   * @param root the tree root
   * @return {@code true} if a NaT is present
   */
  public static boolean anyNat(Content root) {
    for (Content c : iterLeafContents(root)) {
      if (c instanceof NumpyContent n) {
        for (int i = 0; i < n.length(); i++) {
          if (n.isNatAt(i)) {
            return true;
          }
        }
      }
    }
    return false;
  }

  public static boolean anyNanOrNat(Content root) {
    return anyNan(root) || anyNat(root);
  }
}
