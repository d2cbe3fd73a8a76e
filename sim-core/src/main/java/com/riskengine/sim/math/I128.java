package com.riskengine.sim.math;

import lombok.NonNull;

import java.math.BigInteger;

/**
 * Signed 128-bit integer used for ledger amounts (position sizes, fixed-point notionals).
 * <p>
 * Every arithmetic operation is range-checked and throws {@link ArithmeticException} on overflow,
 * matching the width of the ledger's {@code i128} fields.
 */
public record I128(@NonNull BigInteger value) implements Comparable<I128> {

  public static final BigInteger MAX_VALUE = BigInteger.ONE.shiftLeft(127).subtract(BigInteger.ONE);
  public static final BigInteger MIN_VALUE = BigInteger.ONE.shiftLeft(127).negate();

  public static final I128 ZERO = new I128(BigInteger.ZERO);

  public I128 {
    checkRange(value);
  }

  public static I128 of(long value) {
    return new I128(BigInteger.valueOf(value));
  }

  public static I128 of(BigInteger value) {
    return new I128(value);
  }

  public I128 add(I128 other) {
    return new I128(value.add(other.value));
  }

  public I128 subtract(I128 other) {
    return new I128(value.subtract(other.value));
  }

  public I128 multiply(I128 other) {
    return new I128(value.multiply(other.value));
  }

  /**
   * Truncating division (rounds toward zero, like the ledger's integer division).
   */
  public I128 divide(I128 divisor) {
    if (divisor.signum() == 0) {
      throw new ArithmeticException("i128 division by zero");
    }
    return new I128(value.divide(divisor.value));
  }

  public I128 negate() {
    return new I128(value.negate());
  }

  public I128 abs() {
    return signum() < 0 ? negate() : this;
  }

  public int signum() {
    return value.signum();
  }

  public boolean isZero() {
    return value.signum() == 0;
  }

  public long longValueExact() {
    return value.longValueExact();
  }

  /**
   * Two's-complement little-endian encoding, 16 bytes.
   */
  public byte[] toLittleEndian() {
    byte[] out = new byte[16];
    BigInteger unsigned = value.signum() < 0 ? value.add(BigInteger.ONE.shiftLeft(128)) : value;
    byte[] be = unsigned.toByteArray();
    for (int i = 0; i < 16 && i < be.length; i++) {
      out[i] = be[be.length - 1 - i];
    }
    return out;
  }

  public static I128 fromLittleEndian(byte[] data, int offset) {
    if (data.length < offset + 16) {
      throw new IllegalArgumentException("need 16 bytes at offset " + offset + ", have " + (data.length - offset));
    }
    byte[] be = new byte[17];
    for (int i = 0; i < 16; i++) {
      be[16 - i] = data[offset + i];
    }
    BigInteger unsigned = new BigInteger(be);
    BigInteger signed = unsigned.testBit(127) ? unsigned.subtract(BigInteger.ONE.shiftLeft(128)) : unsigned;
    return new I128(signed);
  }

  @Override
  public int compareTo(I128 other) {
    return value.compareTo(other.value);
  }

  @Override
  public String toString() {
    return value.toString();
  }

  private static void checkRange(BigInteger v) {
    if (v.compareTo(MAX_VALUE) > 0 || v.compareTo(MIN_VALUE) < 0) {
      throw new ArithmeticException("i128 overflow: " + v);
    }
  }
}
