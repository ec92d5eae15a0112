package io.jagged.layout;

/** Decoding of IEEE 754 binary16 values held in the low 16 bits of an {@code int}. */
public final class HalfFloat {
  private static final int EXPONENT_MASK = 0x7C00;
  private static final int MANTISSA_MASK = 0x03FF;

  private HalfFloat() {}

  public static boolean isNaN(int bits) {
    return (bits & EXPONENT_MASK) == EXPONENT_MASK && (bits & MANTISSA_MASK) != 0;
  }

  /**
   * Widens a half-precision value to {@code float}. The conversion is exact.
   *
   * @param bits the binary16 bits
   * @return the same value as a float
   */
  public static float toFloat(int bits) {
    int sign = (bits & 0x8000) << 16;
    int exponent = (bits & EXPONENT_MASK) >>> 10;
    int mantissa = bits & MANTISSA_MASK;
    if (exponent == 0x1F) {
      return Float.intBitsToFloat(sign | 0x7F80_0000 | (mantissa << 13));
    }
    if (exponent == 0) {
      // zero or subnormal: mantissa * 2^-24
      float magnitude = mantissa * 0x1p-24f;
      return sign != 0 ? -magnitude : magnitude;
    }
    return Float.intBitsToFloat(sign | ((exponent + 112) << 23) | (mantissa << 13));
  }
}
