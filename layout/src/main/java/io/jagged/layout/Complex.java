package io.jagged.layout;

/**
 * Decoded value of a {@code complex64} or {@code complex128} element.
 *
 * @param real the real part
 * @param imag the imaginary part
 */
public record Complex(double real, double imag) {

  public boolean isNaN() {
    return Double.isNaN(real) || Double.isNaN(imag);
  }
}
