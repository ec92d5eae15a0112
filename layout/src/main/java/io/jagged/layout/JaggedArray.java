package io.jagged.layout;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Public array value backed by a content tree.
 *
 * <p>Elements are materialised lazily into plain Java values: numeric elements as boxed scalars,
 * text as {@link String}, byte strings as {@code byte[]}, lists as {@link List}, named records as
 * {@link Map} in field order and tuples as {@link List}.
 */
public final class JaggedArray {
  private final Content layout;

  private JaggedArray(Content layout) {
    this.layout = layout;
  }

  public static JaggedArray of(Content layout) {
    return new JaggedArray(Objects.requireNonNull(layout, "layout"));
  }

  public Content layout() {
    return layout;
  }

  public int length() {
    return layout.length();
  }

  /**
   * Materialises element {@code i}.
   *
   * @param i element position
   * @return the element value
   * @throws IndexOutOfBoundsException if {@code i} is outside {@code [0, length())}
   */
  public Object get(int i) {
    Objects.checkIndex(i, layout.length());
    return valueAt(layout, i);
  }

  /**
   * Materialises every element.
   *
   * @return the elements in order
   */
  public List<Object> toList() {
    return range(layout, 0, layout.length());
  }

  private static List<Object> range(Content c, long start, long stop) {
    List<Object> out = new ArrayList<>((int) (stop - start));
    for (long i = start; i < stop; i++) {
      out.add(valueAt(c, (int) i));
    }
    return out;
  }

  private static Object valueAt(Content c, int i) {
    return switch (c.kind()) {
      case NUMPY -> ((NumpyContent) c).valueAt(i);
      case STRING -> ((StringContent) c).valueAt(i);
      case BYTESTRING -> ((BytestringContent) c).valueAt(i);
      case EMPTY -> throw new IndexOutOfBoundsException("EmptyContent has no elements");
      case REGULAR -> {
        RegularContent r = (RegularContent) c;
        long start = (long) i * r.size();
        yield range(r.content(), start, start + r.size());
      }
      case LIST_OFFSET -> {
        ListOffsetContent l = (ListOffsetContent) c;
        yield range(l.content(), l.offsetAt(i), l.offsetAt(i + 1));
      }
      case LIST -> {
        ListContent l = (ListContent) c;
        yield range(l.content(), l.startAt(i), l.stopAt(i));
      }
      case RECORD -> recordValueAt((RecordContent) c, i);
      case UNION -> {
        UnionContent u = (UnionContent) c;
        yield valueAt(u.contents().get(u.tagAt(i)), (int) u.indexAt(i));
      }
    };
  }

  private static Object recordValueAt(RecordContent r, int i) {
    if (r.isTuple()) {
      List<Object> slots = new ArrayList<>(r.contents().size());
      for (Content field : r.contents()) {
        slots.add(valueAt(field, i));
      }
      return slots;
    }
    Map<String, Object> named = new LinkedHashMap<>();
    for (int f = 0; f < r.contents().size(); f++) {
      named.put(r.fields().get(f), valueAt(r.contents().get(f), i));
    }
    return named;
  }

  @Override
  public String toString() {
    return "JaggedArray" + toList();
  }
}
