package io.jagged.layout;

import java.util.List;
import java.util.Objects;

/**
 * Variable-length lists delimited by a single offsets array: element {@code i} spans child
 * elements {@code [offsets[i], offsets[i + 1])}.
 */
public final class ListOffsetContent implements Content {
  private final long[] offsets;
  private final Content content;

  public ListOffsetContent(long[] offsets, Content content) {
    this.offsets = Objects.requireNonNull(offsets, "offsets").clone();
    this.content = Objects.requireNonNull(content, "content");
    if (this.offsets.length == 0) {
      throw LayoutValidationException.lengthMismatch(
          ContentKind.LIST_OFFSET, "offsets must contain at least one entry");
    }
    int bound = content.length();
    for (int i = 0; i < this.offsets.length; i++) {
      long o = this.offsets[i];
      if (o < 0 || o > bound) {
        throw LayoutValidationException.indexOutOfRange(
            ContentKind.LIST_OFFSET, "offsets", i, o, bound);
      }
      if (i > 0 && o < this.offsets[i - 1]) {
        throw LayoutValidationException.lengthMismatch(
            ContentKind.LIST_OFFSET, "offsets decrease at position " + i);
      }
    }
  }

  /**
   * Returns a copy of the offsets, one longer than this node.
   *
   * @return the offsets
   */
  public long[] offsets() {
    return offsets.clone();
  }

  public long offsetAt(int i) {
    return offsets[i];
  }

  public Content content() {
    return content;
  }

  @Override
  public int length() {
    return offsets.length - 1;
  }

  @Override
  public ContentKind kind() {
    return ContentKind.LIST_OFFSET;
  }

  @Override
  public List<Content> children() {
    return List.of(content);
  }

  @Override
  public String toString() {
    return "ListOffsetContent{length=" + length() + ", content=" + content + "}";
  }
}
