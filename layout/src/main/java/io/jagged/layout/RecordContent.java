package io.jagged.layout;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Fixed set of fields sharing one length. Element {@code i} combines element {@code i} of every
 * field. Without field names the record is a tuple.
 *
 * <p>The record length defaults to the shortest field; an explicit length may be shorter but
 * never longer than any field.
 */
public final class RecordContent implements Content {
  private final List<Content> contents;
  private final List<String> fields;
  private final int length;

  /**
   * Creates a record whose length is the shortest field length, or zero with no fields.
   *
   * @param contents the field contents
   * @param fields the field names, or {@code null} for a tuple
   */
  public RecordContent(List<Content> contents, List<String> fields) {
    this(contents, fields, shortest(contents));
  }

  /**
   * Creates a record with an explicit length.
   *
   * @param contents the field contents
   * @param fields the field names, or {@code null} for a tuple
   * @param length the record length, at most the length of every field
   */
  public RecordContent(List<Content> contents, List<String> fields, int length) {
    this.contents = List.copyOf(Objects.requireNonNull(contents, "contents"));
    this.fields = fields == null ? null : List.copyOf(fields);
    if (this.fields != null) {
      if (this.fields.size() != this.contents.size()) {
        throw LayoutValidationException.lengthMismatch(
            ContentKind.RECORD,
            this.fields.size() + " field names for " + this.contents.size() + " contents");
      }
      Set<String> seen = new HashSet<>();
      for (String f : this.fields) {
        if (!seen.add(f)) {
          throw new LayoutValidationException(
              "duplicate field name '" + f + "'", ContentKind.RECORD.name(), "FIELD");
        }
      }
    }
    if (length < 0) {
      throw LayoutValidationException.lengthMismatch(
          ContentKind.RECORD, "length must be non-negative: " + length);
    }
    for (int i = 0; i < this.contents.size(); i++) {
      if (this.contents.get(i).length() < length) {
        throw LayoutValidationException.lengthMismatch(
            ContentKind.RECORD,
            "field " + i + " has length " + this.contents.get(i).length() + " < " + length);
      }
    }
    this.length = length;
  }

  private static int shortest(List<Content> contents) {
    Objects.requireNonNull(contents, "contents");
    return contents.stream().mapToInt(Content::length).min().orElse(0);
  }

  public List<Content> contents() {
    return contents;
  }

  /**
   * Returns the field names.
   *
   * @return the names, or {@code null} for a tuple
   */
  public List<String> fields() {
    return fields;
  }

  public boolean isTuple() {
    return fields == null;
  }

  /**
   * Returns the content of a named field.
   *
   * @param name the field name
   * @return the field content
   * @throws IllegalArgumentException if no such field exists
   */
  public Content field(String name) {
    int at = fields == null ? -1 : fields.indexOf(name);
    if (at < 0) {
      throw new IllegalArgumentException("no field named '" + name + "'");
    }
    return contents.get(at);
  }

  @Override
  public int length() {
    return length;
  }

  @Override
  public ContentKind kind() {
    return ContentKind.RECORD;
  }

  @Override
  public List<Content> children() {
    return contents;
  }

  @Override
  public String toString() {
    return "RecordContent{"
        + (fields == null ? "tuple" : "fields=" + fields)
        + ", length="
        + length
        + ", contents="
        + contents
        + "}";
  }
}
