package com.riskengine.sim.ledger;

import com.riskengine.sim.math.I128;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SlabLayoutTest {

  private final LedgerPublicKey owner = TestKeys.key(42);

  @Test
  void findsOwnedSlotAndReadsPosition() {
    byte[] data = new byte[SlabLayout.alignedLength(64)];
    SlabLayout blank = SlabLayout.parse(data);
    int base = blank.slotOffset(2);
    System.arraycopy(owner.toBytes(), 0, data, base + SlabLayout.ACCT_OWNER_OFF, 32);
    byte[] size = I128.of(-2_500_000L).toLittleEndian();
    System.arraycopy(size, 0, data, base + SlabLayout.ACCT_POSITION_SIZE_OFF, 16);

    SlabLayout layout = SlabLayout.parse(data);

    assertThat(layout.maxAccounts()).isEqualTo(64);
    assertThat(layout.findSlot(owner)).isEqualTo(2);
    assertThat(layout.positionSize(2)).isEqualTo(I128.of(-2_500_000L));
    assertThat(layout.positionSize(3)).isEqualTo(I128.ZERO);
  }

  @Test
  void unknownOwnerHasNoSlot() {
    SlabLayout layout = SlabLayout.parse(new byte[SlabLayout.alignedLength(256)]);

    assertThat(layout.maxAccounts()).isEqualTo(256);
    assertThat(layout.findSlot(owner)).isEqualTo(-1);
  }

  @Test
  void recognisesUnpaddedLayout() {
    int unaligned = SlabLayout.unalignedAccountsOffset(64);
    int length = SlabLayout.ENGINE_OFF + unaligned + 64 * SlabLayout.ACCOUNT_SIZE;
    byte[] data = new byte[length];
    int base = SlabLayout.ENGINE_OFF + unaligned + 5 * SlabLayout.ACCOUNT_SIZE;
    System.arraycopy(owner.toBytes(), 0, data, base + SlabLayout.ACCT_OWNER_OFF, 32);

    assertThat(SlabLayout.parse(data).findSlot(owner)).isEqualTo(5);
  }

  @Test
  void truncatedSlabStopsScanning() {
    SlabLayout layout = SlabLayout.parse(new byte[SlabLayout.ENGINE_OFF + 100]);

    assertThat(layout.findSlot(owner)).isEqualTo(-1);
    assertThat(layout.positionSize(0)).isEqualTo(I128.ZERO);
  }
}
