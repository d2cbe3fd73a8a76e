package com.riskengine.sim.ledger;

import lombok.NonNull;

import java.util.Arrays;

/**
 * 32-byte Ed25519 account address.
 */
public final class LedgerPublicKey {

  public static final int LENGTH = 32;

  private final byte[] bytes;

  private LedgerPublicKey(byte[] bytes) {
    if (bytes.length != LENGTH) {
      throw new IllegalArgumentException("Expected " + LENGTH + "-byte public key, got len=" + bytes.length);
    }
    this.bytes = bytes;
  }

  public static LedgerPublicKey of(byte[] bytes) {
    return new LedgerPublicKey(bytes.clone());
  }

  public static LedgerPublicKey fromBase58(@NonNull String base58) {
    return new LedgerPublicKey(Base58.decode(base58.trim()));
  }

  public static LedgerPublicKey read(byte[] data, int offset) {
    return new LedgerPublicKey(Arrays.copyOfRange(data, offset, offset + LENGTH));
  }

  public byte[] toBytes() {
    return bytes.clone();
  }

  public boolean matches(byte[] data, int offset) {
    if (offset < 0 || offset + LENGTH > data.length) {
      return false;
    }
    return Arrays.equals(bytes, 0, LENGTH, data, offset, offset + LENGTH);
  }

  public String toBase58() {
    return Base58.encode(bytes);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof LedgerPublicKey other)) return false;
    return Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return toBase58();
  }
}
