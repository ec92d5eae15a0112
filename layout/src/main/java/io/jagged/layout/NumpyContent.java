package io.jagged.layout;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Leaf holding a one-dimensional run of primitive scalars.
 *
 * <p>Every cell is stored as a raw 64-bit word: booleans as 0/1, integers as their value ({@code
 * uint64} as the unsigned bit pattern), {@code float16} and {@code float32} as their IEEE bits in
 * the low word, {@code float64} as its IEEE bits, temporal values as their count of units with
 * {@link #NAT} standing in for not-a-time. Complex cells keep the real part in {@link #cells()}
 * and the imaginary part, with the same encoding, in {@link #imagCells()}.
 */
public final class NumpyContent implements Content {
  /** Raw cell value of a not-a-time entry. */
  public static final long NAT = Long.MIN_VALUE;

  private final DType dtype;
  private final long[] cells;
  private final long[] imag;

  /**
   * Creates a leaf from raw cells. Complex dtypes get zero imaginary parts.
   *
   * @param dtype the element type
   * @param cells the raw cell words
   */
  public NumpyContent(DType dtype, long[] cells) {
    this(dtype, cells, null);
  }

  /**
   * Creates a leaf from raw cells and, for complex dtypes, raw imaginary parts.
   *
   * @param dtype the element type
   * @param cells the raw cell words (real parts for complex dtypes)
   * @param imag the raw imaginary words, or {@code null} for zeros or a non-complex dtype
   * @throws LayoutValidationException if a word is out of range or {@code imag} does not fit
   */
  public NumpyContent(DType dtype, long[] cells, long[] imag) {
    this.dtype = Objects.requireNonNull(dtype, "dtype");
    this.cells = Objects.requireNonNull(cells, "cells").clone();
    if (dtype.primitive().isComplex()) {
      this.imag = imag == null ? new long[cells.length] : imag.clone();
      if (this.imag.length != this.cells.length) {
        throw LayoutValidationException.lengthMismatch(
            ContentKind.NUMPY,
            "imaginary parts length " + this.imag.length + " != cells length " + cells.length);
      }
    } else {
      if (imag != null) {
        throw new LayoutValidationException(
            "imaginary parts given for " + dtype.name(), ContentKind.NUMPY.name(), "CELL");
      }
      this.imag = null;
    }
    for (int i = 0; i < this.cells.length; i++) {
      checkWord(i, this.cells[i]);
      if (this.imag != null) {
        checkWord(i, this.imag[i]);
      }
    }
  }

  private void checkWord(int position, long word) {
    PrimitiveType p = dtype.primitive();
    if (word < p.minCell() || word > p.maxCell()) {
      throw new LayoutValidationException(
          String.format("cell[%d] = %d is not a valid %s", position, word, dtype.name()),
          ContentKind.NUMPY.name(),
          "CELL");
    }
  }

  public DType dtype() {
    return dtype;
  }

  /**
   * Returns a copy of the raw cells.
   *
   * @return the raw cell words
   */
  public long[] cells() {
    return cells.clone();
  }

  /**
   * Returns the raw word stored at {@code i}.
   *
   * @param i element position
   * @return the raw cell
   */
  public long cellAt(int i) {
    return cells[i];
  }

  /**
   * Returns a copy of the raw imaginary parts.
   *
   * @return the imaginary words, all zero-length for non-complex dtypes
   */
  public long[] imagCells() {
    return imag == null ? new long[0] : imag.clone();
  }

  /**
   * Decodes the element at {@code i} into a boxed Java value.
   *
   * <p>Booleans become {@link Boolean}, integers {@link Long} ({@link BigInteger} for {@code
   * uint64}), floats {@link Float} or {@link Double}, complex values {@link Complex}, temporal
   * values {@link Long} with {@code null} for not-a-time.
   *
   * @param i element position
   * @return the decoded value
   */
  public Object valueAt(int i) {
    long cell = cells[i];
    PrimitiveType p = dtype.primitive();
    return switch (p.category()) {
      case BOOLEAN -> cell != 0;
      case SIGNED -> cell;
      case UNSIGNED ->
          p == PrimitiveType.UINT64 ? new BigInteger(Long.toUnsignedString(cell)) : cell;
      case FLOATING ->
          p == PrimitiveType.FLOAT64 ? (Object) Double.longBitsToDouble(cell) : toFloat(p, cell);
      case COMPLEX -> new Complex(partAt(p, cell), partAt(p, imag[i]));
      case TEMPORAL -> cell == NAT ? null : cell;
    };
  }

  private static Float toFloat(PrimitiveType p, long word) {
    return p == PrimitiveType.FLOAT16
        ? HalfFloat.toFloat((int) word)
        : Float.intBitsToFloat((int) word);
  }

  private static double partAt(PrimitiveType p, long word) {
    return p == PrimitiveType.COMPLEX64
        ? Float.intBitsToFloat((int) word)
        : Double.longBitsToDouble(word);
  }

  /**
   * Returns whether element {@code i} is a NaN. A complex element is NaN when either part is.
   *
   * @param i element position
   * @return {@code true} for floating or complex NaN cells
   */
  public boolean isNanAt(int i) {
    PrimitiveType p = dtype.primitive();
    return switch (p) {
      case FLOAT16 -> HalfFloat.isNaN((int) cells[i]);
      case FLOAT32 -> Float.isNaN(Float.intBitsToFloat((int) cells[i]));
      case FLOAT64 -> Double.isNaN(Double.longBitsToDouble(cells[i]));
      case COMPLEX64, COMPLEX128 ->
          Double.isNaN(partAt(p, cells[i])) || Double.isNaN(partAt(p, imag[i]));
      default -> false;
    };
  }

  /**
   * Returns whether element {@code i} is a not-a-time.
   *
   * @param i element position
   * @return {@code true} for temporal {@link #NAT} cells
   */
  public boolean isNatAt(int i) {
    return dtype.primitive().isTemporal() && cells[i] == NAT;
  }

  @Override
  public int length() {
    return cells.length;
  }

  @Override
  public ContentKind kind() {
    return ContentKind.NUMPY;
  }

  @Override
  public List<Content> children() {
    return List.of();
  }

  @Override
  public String toString() {
    return "NumpyContent{" + dtype.name() + ", length=" + cells.length + "}";
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof NumpyContent other)) {
      return false;
    }
    return dtype.equals(other.dtype)
        && Arrays.equals(cells, other.cells)
        && Arrays.equals(imag, other.imag);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * dtype.hashCode() + Arrays.hashCode(cells)) + Arrays.hashCode(imag);
  }
}
