package io.jagged.layout;

import java.util.List;
import java.util.Objects;

/**
 * Tagged union of at least two alternatives: element {@code i} is element {@code index[i]} of
 * child {@code tags[i]}.
 *
 * <p>A union never has another union as a direct child.
 */
public final class UnionContent implements Content {
  /** Largest number of alternatives addressable by an 8-bit tag. */
  public static final int MAX_CONTENTS = 128;

  private final byte[] tags;
  private final long[] index;
  private final List<Content> contents;

  public UnionContent(byte[] tags, long[] index, List<Content> contents) {
    this.tags = Objects.requireNonNull(tags, "tags").clone();
    this.index = Objects.requireNonNull(index, "index").clone();
    this.contents = List.copyOf(Objects.requireNonNull(contents, "contents"));
    if (this.contents.size() < 2 || this.contents.size() > MAX_CONTENTS) {
      throw LayoutValidationException.lengthMismatch(
          ContentKind.UNION,
          "a union needs between 2 and " + MAX_CONTENTS + " contents, got " + this.contents.size());
    }
    for (Content c : this.contents) {
      if (c.kind() == ContentKind.UNION) {
        throw new LayoutValidationException(
            "a union cannot directly contain another union", ContentKind.UNION.name(), "NESTING");
      }
    }
    if (this.tags.length != this.index.length) {
      throw LayoutValidationException.lengthMismatch(
          ContentKind.UNION,
          "tags has " + this.tags.length + " entries but index has " + this.index.length);
    }
    for (int i = 0; i < this.tags.length; i++) {
      int tag = this.tags[i];
      if (tag < 0 || tag >= this.contents.size()) {
        throw LayoutValidationException.indexOutOfRange(
            ContentKind.UNION, "tags", i, tag, this.contents.size() - 1);
      }
      int bound = this.contents.get(tag).length();
      if (this.index[i] < 0 || this.index[i] >= bound) {
        throw LayoutValidationException.indexOutOfRange(
            ContentKind.UNION, "index", i, this.index[i], bound - 1);
      }
    }
  }

  public byte[] tags() {
    return tags.clone();
  }

  public long[] index() {
    return index.clone();
  }

  public int tagAt(int i) {
    return tags[i];
  }

  public long indexAt(int i) {
    return index[i];
  }

  public List<Content> contents() {
    return contents;
  }

  @Override
  public int length() {
    return tags.length;
  }

  @Override
  public ContentKind kind() {
    return ContentKind.UNION;
  }

  @Override
  public List<Content> children() {
    return contents;
  }

  @Override
  public String toString() {
    return "UnionContent{length=" + tags.length + ", contents=" + contents + "}";
  }
}
