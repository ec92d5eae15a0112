package io.jagged.layout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A concrete scalar element type: a {@link PrimitiveType} plus, for temporal types, its unit.
 *
 * <p>Names follow the familiar {@code int32}, {@code float64}, {@code datetime64[ns]} spelling.
 */
public final class DType {
  /** Every dtype a numeric leaf may carry. */
  public static final List<DType> SUPPORTED = supported();

  private final PrimitiveType primitive;
  private final DateTimeUnit unit;

  private DType(PrimitiveType primitive, DateTimeUnit unit) {
    this.primitive = primitive;
    this.unit = unit;
  }

  /**
   * Returns the dtype for a non-temporal primitive.
   *
   * @param primitive the primitive type
   * @return the dtype
   * @throws IllegalArgumentException if {@code primitive} needs a unit
   */
  public static DType of(PrimitiveType primitive) {
    Objects.requireNonNull(primitive, "primitive");
    if (primitive.isTemporal()) {
      throw new IllegalArgumentException(primitive.typeName() + " requires a unit");
    }
    return new DType(primitive, null);
  }

  /**
   * Returns the dtype for a temporal primitive with the given unit.
   *
   * @param primitive {@link PrimitiveType#DATETIME64} or {@link PrimitiveType#TIMEDELTA64}
   * @param unit the time unit
   * @return the dtype
   */
  public static DType of(PrimitiveType primitive, DateTimeUnit unit) {
    Objects.requireNonNull(primitive, "primitive");
    Objects.requireNonNull(unit, "unit");
    if (!primitive.isTemporal()) {
      throw new IllegalArgumentException(primitive.typeName() + " does not take a unit");
    }
    return new DType(primitive, unit);
  }

  private static List<DType> supported() {
    List<DType> all = new ArrayList<>();
    for (PrimitiveType p : PrimitiveType.values()) {
      if (!p.isTemporal()) {
        all.add(new DType(p, null));
      }
    }
    for (PrimitiveType p : List.of(PrimitiveType.DATETIME64, PrimitiveType.TIMEDELTA64)) {
      for (DateTimeUnit u : DateTimeUnit.values()) {
        all.add(new DType(p, u));
      }
    }
    return Collections.unmodifiableList(all);
  }

  public PrimitiveType primitive() {
    return primitive;
  }

  /**
   * Returns the time unit of a temporal dtype.
   *
   * @return the unit, or {@code null} for non-temporal dtypes
   */
  public DateTimeUnit unit() {
    return unit;
  }

  public String name() {
    return unit == null ? primitive.typeName() : primitive.typeName() + "[" + unit.code() + "]";
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DType other)) {
      return false;
    }
    return primitive == other.primitive && unit == other.unit;
  }

  @Override
  public int hashCode() {
    return Objects.hash(primitive, unit);
  }

  @Override
  public String toString() {
    return name();
  }
}
