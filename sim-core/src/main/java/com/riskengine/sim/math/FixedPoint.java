package com.riskengine.sim.math;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Conversions between floating-point USD amounts and the ledger's 1e6 fixed-point scale.
 */
public final class FixedPoint {

  public static final int SCALE_DIGITS = 6;
  public static final long SCALE = 1_000_000L;

  private FixedPoint() {
  }

  /**
   * Rounds {@code amount × 1e6} to the nearest integer (half-up).
   */
  public static long toE6(double amount) {
    if (!Double.isFinite(amount)) {
      throw new IllegalArgumentException("not a finite amount: " + amount);
    }
    return BigDecimal.valueOf(amount)
        .movePointRight(SCALE_DIGITS)
        .setScale(0, RoundingMode.HALF_UP)
        .longValueExact();
  }

  public static double fromE6(long e6) {
    return BigDecimal.valueOf(e6).movePointLeft(SCALE_DIGITS).doubleValue();
  }

  public static double fromE6(I128 e6) {
    return new BigDecimal(e6.value()).movePointLeft(SCALE_DIGITS).doubleValue();
  }

  /**
   * Position size in base units (1e6 scale) for a USD notional at a fixed-point price:
   * {@code round(usdNotional × 1e12 / priceE6)}.
   */
  public static I128 baseUnitsForNotional(double usdNotional, long priceE6) {
    if (priceE6 <= 0) {
      throw new IllegalArgumentException("priceE6 must be positive: " + priceE6);
    }
    I128 notionalE12 = I128.of(BigDecimal.valueOf(usdNotional)
        .movePointRight(2 * SCALE_DIGITS)
        .setScale(0, RoundingMode.HALF_UP)
        .toBigIntegerExact());
    I128 price = I128.of(priceE6);
    // round half away from zero
    I128 half = price.divide(I128.of(2));
    I128 adjusted = notionalE12.signum() >= 0 ? notionalE12.add(half) : notionalE12.subtract(half);
    return adjusted.divide(price);
  }
}
