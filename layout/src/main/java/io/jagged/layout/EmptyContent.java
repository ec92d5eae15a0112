package io.jagged.layout;

import java.util.List;

/** Zero-length leaf of unknown element type. Carries no data. */
public final class EmptyContent implements Content {
  public static final EmptyContent INSTANCE = new EmptyContent();

  private EmptyContent() {}

  @Override
  public int length() {
    return 0;
  }

  @Override
  public ContentKind kind() {
    return ContentKind.EMPTY;
  }

  @Override
  public List<Content> children() {
    return List.of();
  }

  @Override
  public String toString() {
    return "EmptyContent";
  }
}
