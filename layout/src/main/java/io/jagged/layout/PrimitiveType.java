package io.jagged.layout;

/**
 * Primitive element types a {@link NumpyContent} can hold.
 *
 * <p>Every type carries the range of the raw 64-bit word it is stored in, so that cell validation
 * and value sampling share one definition. {@code UINT64} cells are stored as the raw
 * two's-complement bit pattern; floating types as IEEE bits in the low 16, 32 or 64 bits of the
 * word. Complex types store real and imaginary parts in two words of the same width.
 */
public enum PrimitiveType {
  BOOL("bool", Category.BOOLEAN, 0, 1),
  INT8("int8", Category.SIGNED, Byte.MIN_VALUE, Byte.MAX_VALUE),
  INT16("int16", Category.SIGNED, Short.MIN_VALUE, Short.MAX_VALUE),
  INT32("int32", Category.SIGNED, Integer.MIN_VALUE, Integer.MAX_VALUE),
  INT64("int64", Category.SIGNED, Long.MIN_VALUE, Long.MAX_VALUE),
  UINT8("uint8", Category.UNSIGNED, 0, 0xFFL),
  UINT16("uint16", Category.UNSIGNED, 0, 0xFFFFL),
  UINT32("uint32", Category.UNSIGNED, 0, 0xFFFF_FFFFL),
  UINT64("uint64", Category.UNSIGNED, Long.MIN_VALUE, Long.MAX_VALUE),
  FLOAT16("float16", Category.FLOATING, 0, 0xFFFFL),
  FLOAT32("float32", Category.FLOATING, 0, 0xFFFF_FFFFL),
  FLOAT64("float64", Category.FLOATING, Long.MIN_VALUE, Long.MAX_VALUE),
  COMPLEX64("complex64", Category.COMPLEX, 0, 0xFFFF_FFFFL),
  COMPLEX128("complex128", Category.COMPLEX, Long.MIN_VALUE, Long.MAX_VALUE),
  DATETIME64("datetime64", Category.TEMPORAL, Long.MIN_VALUE, Long.MAX_VALUE),
  TIMEDELTA64("timedelta64", Category.TEMPORAL, Long.MIN_VALUE, Long.MAX_VALUE);

  /** Broad family of a primitive type. */
  public enum Category {
    BOOLEAN,
    SIGNED,
    UNSIGNED,
    FLOATING,
    COMPLEX,
    TEMPORAL
  }

  private final String typeName;
  private final Category category;
  private final long minCell;
  private final long maxCell;

  PrimitiveType(String typeName, Category category, long minCell, long maxCell) {
    this.typeName = typeName;
    this.category = category;
    this.minCell = minCell;
    this.maxCell = maxCell;
  }

  public String typeName() {
    return typeName;
  }

  public Category category() {
    return category;
  }

  /**
   * Smallest raw word a cell (or one part of a complex cell) may hold.
   *
   * @return the lower bound of stored words
   */
  public long minCell() {
    return minCell;
  }

  /**
   * Largest raw word a cell (or one part of a complex cell) may hold.
   *
   * @return the upper bound of stored words
   */
  public long maxCell() {
    return maxCell;
  }

  public boolean isTemporal() {
    return category == Category.TEMPORAL;
  }

  public boolean isComplex() {
    return category == Category.COMPLEX;
  }
}
