package io.jagged.layout;

import java.util.List;
import java.util.Objects;

/**
 * Fixed-size grouping of a child: element {@code i} spans child elements {@code [i * size, (i + 1)
 * * size)}.
 *
 * <p>The child length must be an exact multiple of {@code size}. A size of zero makes every
 * element an empty group, so the length cannot be derived and is given explicitly as {@code
 * zerosLength}.
 */
public final class RegularContent implements Content {
  private final Content content;
  private final int size;
  private final int length;

  /**
   * Groups {@code content} by a positive {@code size}.
   *
   * @param content the child
   * @param size the group size, must be {@code > 0}
   */
  public RegularContent(Content content, int size) {
    this(content, size, 0);
  }

  /**
   * Groups {@code content} by {@code size}, using {@code zerosLength} as the length when {@code
   * size} is zero.
   *
   * @param content the child
   * @param size the group size
   * @param zerosLength the stand-in length, only used when {@code size == 0}
   */
  public RegularContent(Content content, int size, int zerosLength) {
    this.content = Objects.requireNonNull(content, "content");
    if (size < 0) {
      throw LayoutValidationException.lengthMismatch(
          ContentKind.REGULAR, "size must be non-negative: " + size);
    }
    if (size == 0) {
      if (zerosLength < 0) {
        throw LayoutValidationException.lengthMismatch(
            ContentKind.REGULAR, "zerosLength must be non-negative: " + zerosLength);
      }
      this.length = zerosLength;
    } else {
      if (content.length() % size != 0) {
        throw LayoutValidationException.lengthMismatch(
            ContentKind.REGULAR,
            "content length " + content.length() + " is not a multiple of size " + size);
      }
      this.length = content.length() / size;
    }
    this.size = size;
  }

  public Content content() {
    return content;
  }

  public int size() {
    return size;
  }

  @Override
  public int length() {
    return length;
  }

  @Override
  public ContentKind kind() {
    return ContentKind.REGULAR;
  }

  @Override
  public List<Content> children() {
    return List.of(content);
  }

  @Override
  public String toString() {
    return "RegularContent{size=" + size + ", length=" + length + ", content=" + content + "}";
  }
}
