package io.jagged.layout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** Leaf holding a sequence of byte strings. */
public final class BytestringContent implements Content {
  private final List<byte[]> values;

  public BytestringContent(List<byte[]> values) {
    Objects.requireNonNull(values, "values");
    List<byte[]> copy = new ArrayList<>(values.size());
    for (byte[] v : values) {
      copy.add(Objects.requireNonNull(v, "value").clone());
    }
    this.values = Collections.unmodifiableList(copy);
  }

  /**
   * Returns a copy of the byte string at {@code i}.
   *
   * @param i element position
   * @return the bytes
   */
  public byte[] valueAt(int i) {
    return values.get(i).clone();
  }

  @Override
  public int length() {
    return values.size();
  }

  @Override
  public ContentKind kind() {
    return ContentKind.BYTESTRING;
  }

  @Override
  public List<Content> children() {
    return List.of();
  }

  @Override
  public String toString() {
    return "BytestringContent{length=" + values.size() + "}";
  }
}
