package com.riskengine.sim.ledger;

import com.riskengine.sim.math.I128;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Binary payloads for the risk-engine program. First byte is the instruction tag, the rest little-endian.
 */
public final class InstructionCodec {

  public static final byte TAG_INIT_USER = 1;
  public static final byte TAG_DEPOSIT_COLLATERAL = 3;
  public static final byte TAG_KEEPER_CRANK = 5;
  public static final byte TAG_TRADE_NO_CPI = 6;
  public static final byte TAG_PUSH_ORACLE_PRICE = 17;

  /**
   * Caller index the program treats as "permissionless caller" for cranks.
   */
  public static final int PERMISSIONLESS_CALLER = 0xFFFF;

  private InstructionCodec() {
  }

  public static byte[] encodeInitUser(long feePayment) {
    return buffer(1 + 8)
        .put(TAG_INIT_USER)
        .putLong(requireUnsigned(feePayment, "feePayment"))
        .array();
  }

  public static byte[] encodeDepositCollateral(int userIdx, long amount) {
    return buffer(1 + 2 + 8)
        .put(TAG_DEPOSIT_COLLATERAL)
        .putShort(u16(userIdx, "userIdx"))
        .putLong(requireUnsigned(amount, "amount"))
        .array();
  }

  public static byte[] encodeKeeperCrank(int callerIdx, boolean allowPanic) {
    return buffer(1 + 2 + 1)
        .put(TAG_KEEPER_CRANK)
        .putShort(u16(callerIdx, "callerIdx"))
        .put((byte) (allowPanic ? 1 : 0))
        .array();
  }

  public static byte[] encodeTradeNoCpi(int lpIdx, int userIdx, I128 size) {
    if (size.isZero()) {
      throw new IllegalArgumentException("trade size must be non-zero");
    }
    return buffer(1 + 2 + 2 + 16)
        .put(TAG_TRADE_NO_CPI)
        .putShort(u16(lpIdx, "lpIdx"))
        .putShort(u16(userIdx, "userIdx"))
        .put(size.toLittleEndian())
        .array();
  }

  public static byte[] encodePushOraclePrice(long priceE6, long timestampSeconds) {
    if (priceE6 <= 0) {
      throw new IllegalArgumentException("priceE6 must be positive: " + priceE6);
    }
    return buffer(1 + 8 + 8)
        .put(TAG_PUSH_ORACLE_PRICE)
        .putLong(priceE6)
        .putLong(timestampSeconds)
        .array();
  }

  private static ByteBuffer buffer(int size) {
    return ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
  }

  private static short u16(int value, String name) {
    if (value < 0 || value > 0xFFFF) {
      throw new IllegalArgumentException(name + " out of u16 range: " + value);
    }
    return (short) value;
  }

  private static long requireUnsigned(long value, String name) {
    if (value < 0) {
      throw new IllegalArgumentException(name + " must be non-negative: " + value);
    }
    return value;
  }
}
