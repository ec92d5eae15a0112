package io.jagged.generator.leaf;

import io.jagged.generator.api.DTypeSource;
import io.jagged.generator.api.DecisionTape;
import io.jagged.layout.Content;
import io.jagged.layout.DType;
import io.jagged.layout.HalfFloat;
import io.jagged.layout.NumpyContent;
import io.jagged.layout.PrimitiveType;

/**
 * Numeric leaves of one dtype per leaf.
 *
 * <p>Floating cells, and both parts of complex cells, are drawn either from a small set of boundary
 * values or from raw IEEE bits. Without {@code allowNan}, a NaN bit pattern is folded into the
 * infinity of the same sign and temporal cells never take the not-a-time value.
 */
public final class NumpyLeafGenerator implements LeafGenerator {
  private static final double[] SPECIAL_DOUBLES = {
    0.0, -0.0, 1.0, -1.0, Double.MIN_VALUE, Double.MAX_VALUE,
    Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY
  };
  private static final float[] SPECIAL_FLOATS = {
    0.0f, -0.0f, 1.0f, -1.0f, Float.MIN_VALUE, Float.MAX_VALUE,
    Float.POSITIVE_INFINITY, Float.NEGATIVE_INFINITY
  };

  private static final int[] SPECIAL_HALFS = {
    0x0000, 0x8000, 0x3C00, 0xBC00, 0x0001, 0x7BFF, 0x7C00, 0xFC00
  };
  private static final int HALF_NAN = 0x7E00;

  private final DTypeSource dtypes;
  private final boolean allowNan;

  public NumpyLeafGenerator(DTypeSource dtypes, boolean allowNan) {
    this.dtypes = dtypes;
    this.allowNan = allowNan;
  }

  @Override
  public LeafKind kind() {
    return LeafKind.NUMPY;
  }

  @Override
  public Content generate(DecisionTape tape, int minSize, int maxSize) {
    DType dtype = dtypes.draw(tape);
    PrimitiveType p = dtype.primitive();
    int n = tape.drawInt(minSize, maxSize);
    long[] cells = new long[n];
    long[] imag = p.isComplex() ? new long[n] : null;
    for (int i = 0; i < n; i++) {
      cells[i] = drawCell(tape, p);
      if (imag != null) {
        imag[i] = drawCell(tape, p);
      }
    }
    return new NumpyContent(dtype, cells, imag);
  }

  private long drawCell(DecisionTape tape, PrimitiveType p) {
    return switch (p) {
      case FLOAT16 -> drawFloat16(tape);
      case FLOAT32, COMPLEX64 -> drawFloat32(tape);
      case FLOAT64, COMPLEX128 -> drawFloat64(tape);
      case DATETIME64, TIMEDELTA64 -> drawTemporal(tape);
      default -> tape.drawLong(p.minCell(), p.maxCell());
    };
  }

  private long drawTemporal(DecisionTape tape) {
    if (allowNan && tape.drawInt(0, 7) == 7) {
      return NumpyContent.NAT;
    }
    return tape.drawLong(NumpyContent.NAT + 1, Long.MAX_VALUE);
  }

  private long drawFloat16(DecisionTape tape) {
    int pick = tape.drawInt(0, 3);
    if (pick == 1) {
      return SPECIAL_HALFS[tape.drawInt(0, SPECIAL_HALFS.length - 1)];
    }
    if (pick == 2 && allowNan) {
      return HALF_NAN;
    }
    int bits = tape.drawInt(0, 0xFFFF);
    if (!allowNan && HalfFloat.isNaN(bits)) {
      bits &= 0xFC00;
    }
    return bits;
  }

  private long drawFloat64(DecisionTape tape) {
    int pick = tape.drawInt(0, 3);
    if (pick == 1) {
      return Double.doubleToRawLongBits(SPECIAL_DOUBLES[tape.drawInt(0, SPECIAL_DOUBLES.length - 1)]);
    }
    if (pick == 2 && allowNan) {
      return Double.doubleToRawLongBits(Double.NaN);
    }
    long bits = tape.drawLong(Long.MIN_VALUE, Long.MAX_VALUE);
    if (!allowNan && Double.isNaN(Double.longBitsToDouble(bits))) {
      bits &= 0xFFF0_0000_0000_0000L;
    }
    return bits;
  }

  private long drawFloat32(DecisionTape tape) {
    int pick = tape.drawInt(0, 3);
    int bits;
    if (pick == 1) {
      bits = Float.floatToRawIntBits(SPECIAL_FLOATS[tape.drawInt(0, SPECIAL_FLOATS.length - 1)]);
    } else if (pick == 2 && allowNan) {
      bits = Float.floatToRawIntBits(Float.NaN);
    } else {
      bits = tape.drawInt(Integer.MIN_VALUE, Integer.MAX_VALUE);
      if (!allowNan && Float.isNaN(Float.intBitsToFloat(bits))) {
        bits &= 0xFF80_0000;
      }
    }
    return bits & 0xFFFF_FFFFL;
  }
}
