package com.riskengine.sim.ledger;

import com.riskengine.sim.math.I128;

/**
 * Read-only view over a market slab account: locates participant slots by owner and reads their position size.
 * <p>
 * Slab = header, engine state (from {@link #ENGINE_OFF}), bitmap + free list, then fixed-size slot records.
 * Some builds do not pad the pre-slot region to 16 bytes; both variants are recognised by total length.
 */
public final class SlabLayout {

  static final int ENGINE_OFF = 392;
  static final int ACCOUNT_SIZE = 240;
  static final int ACCT_POSITION_SIZE_OFF = 80;
  static final int ACCT_OWNER_OFF = 184;

  private static final int[] KNOWN_CAPACITIES = {64, 256, 1024, 4096};

  private final byte[] data;
  private final int maxAccounts;
  private final int accountsBase;

  private SlabLayout(byte[] data, int maxAccounts, int accountsOffset) {
    this.data = data;
    this.maxAccounts = maxAccounts;
    this.accountsBase = ENGINE_OFF + accountsOffset;
  }

  public static SlabLayout parse(byte[] data) {
    for (int n : KNOWN_CAPACITIES) {
      int aligned = alignedAccountsOffset(n);
      if (data.length == ENGINE_OFF + aligned + n * ACCOUNT_SIZE) {
        return new SlabLayout(data, n, aligned);
      }
      int unaligned = unalignedAccountsOffset(n);
      if (data.length == ENGINE_OFF + unaligned + n * ACCOUNT_SIZE) {
        return new SlabLayout(data, n, unaligned);
      }
    }
    return new SlabLayout(data, 64, alignedAccountsOffset(64));
  }

  /**
   * Total slab length for a given capacity, aligned variant.
   */
  public static int alignedLength(int maxAccounts) {
    return ENGINE_OFF + alignedAccountsOffset(maxAccounts) + maxAccounts * ACCOUNT_SIZE;
  }

  /**
   * Slot index owned by {@code owner}, or -1.
   */
  public int findSlot(LedgerPublicKey owner) {
    for (int i = 0; i < maxAccounts; i++) {
      int base = slotBase(i);
      if (base + ACCOUNT_SIZE > data.length) break;
      if (owner.matches(data, base + ACCT_OWNER_OFF)) {
        return i;
      }
    }
    return -1;
  }

  public I128 positionSize(int slot) {
    int base = slotBase(slot);
    if (slot < 0 || base + ACCOUNT_SIZE > data.length) {
      return I128.ZERO;
    }
    return I128.fromLittleEndian(data, base + ACCT_POSITION_SIZE_OFF);
  }

  public int maxAccounts() {
    return maxAccounts;
  }

  public int slotOffset(int slot) {
    return slotBase(slot);
  }

  private int slotBase(int slot) {
    return accountsBase + slot * ACCOUNT_SIZE;
  }

  static int alignedAccountsOffset(int maxAccounts) {
    int unaligned = unalignedAccountsOffset(maxAccounts);
    return (unaligned + 15) / 16 * 16;
  }

  static int unalignedAccountsOffset(int maxAccounts) {
    int bitmapBytes = ((maxAccounts + 63) / 64) * 8;
    return 408 + bitmapBytes + 24 + maxAccounts * 2;
  }
}
