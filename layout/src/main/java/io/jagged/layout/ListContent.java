package io.jagged.layout;

import java.util.List;
import java.util.Objects;

/**
 * Variable-length lists delimited by independent start and stop arrays: element {@code i} spans
 * child elements {@code [starts[i], stops[i])}.
 */
public final class ListContent implements Content {
  private final long[] starts;
  private final long[] stops;
  private final Content content;

  public ListContent(long[] starts, long[] stops, Content content) {
    this.starts = Objects.requireNonNull(starts, "starts").clone();
    this.stops = Objects.requireNonNull(stops, "stops").clone();
    this.content = Objects.requireNonNull(content, "content");
    if (this.starts.length != this.stops.length) {
      throw LayoutValidationException.lengthMismatch(
          ContentKind.LIST,
          "starts has " + this.starts.length + " entries but stops has " + this.stops.length);
    }
    int bound = content.length();
    for (int i = 0; i < this.starts.length; i++) {
      if (this.stops[i] < 0 || this.stops[i] > bound) {
        throw LayoutValidationException.indexOutOfRange(
            ContentKind.LIST, "stops", i, this.stops[i], bound);
      }
      if (this.starts[i] < 0 || this.starts[i] > this.stops[i]) {
        throw LayoutValidationException.indexOutOfRange(
            ContentKind.LIST, "starts", i, this.starts[i], (int) this.stops[i]);
      }
    }
  }

  public long[] starts() {
    return starts.clone();
  }

  public long[] stops() {
    return stops.clone();
  }

  public long startAt(int i) {
    return starts[i];
  }

  public long stopAt(int i) {
    return stops[i];
  }

  public Content content() {
    return content;
  }

  @Override
  public int length() {
    return starts.length;
  }

  @Override
  public ContentKind kind() {
    return ContentKind.LIST;
  }

  @Override
  public List<Content> children() {
    return List.of(content);
  }

  @Override
  public String toString() {
    return "ListContent{length=" + length() + ", content=" + content + "}";
  }
}
