package io.jagged.layout;

import java.util.List;
import java.util.Objects;

/** Leaf holding a sequence of text values. Each value must be well-formed UTF-16. */
public final class StringContent implements Content {
  private final List<String> values;

  public StringContent(List<String> values) {
    this.values = List.copyOf(Objects.requireNonNull(values, "values"));
    for (int i = 0; i < this.values.size(); i++) {
      if (!isWellFormed(this.values.get(i))) {
        throw new LayoutValidationException(
            "value[" + i + "] contains an unpaired surrogate", ContentKind.STRING.name(), "ENCODING");
      }
    }
  }

  static boolean isWellFormed(String s) {
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (Character.isHighSurrogate(c)) {
        if (i + 1 >= s.length() || !Character.isLowSurrogate(s.charAt(i + 1))) {
          return false;
        }
        i++;
      } else if (Character.isLowSurrogate(c)) {
        return false;
      }
    }
    return true;
  }

  public List<String> values() {
    return values;
  }

  public String valueAt(int i) {
    return values.get(i);
  }

  @Override
  public int length() {
    return values.size();
  }

  @Override
  public ContentKind kind() {
    return ContentKind.STRING;
  }

  @Override
  public List<Content> children() {
    return List.of();
  }

  @Override
  public String toString() {
    return "StringContent{length=" + values.size() + "}";
  }
}
