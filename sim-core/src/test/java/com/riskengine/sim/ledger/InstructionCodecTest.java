package com.riskengine.sim.ledger;

import com.riskengine.sim.math.I128;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InstructionCodecTest {

  @Test
  void tradePayloadCarriesSignedSize() {
    byte[] data = InstructionCodec.encodeTradeNoCpi(0, 3, I128.of(-1));

    assertThat(data).hasSize(21);
    assertThat(data[0]).isEqualTo(InstructionCodec.TAG_TRADE_NO_CPI);
    ByteBuffer buf = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
    assertThat(buf.getShort(1)).isEqualTo((short) 0);
    assertThat(buf.getShort(3)).isEqualTo((short) 3);
    assertThat(I128.fromLittleEndian(data, 5)).isEqualTo(I128.of(-1));
  }

  @Test
  void tradeRejectsZeroSize() {
    assertThatThrownBy(() -> InstructionCodec.encodeTradeNoCpi(0, 1, I128.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void pushPriceLayout() {
    byte[] data = InstructionCodec.encodePushOraclePrice(148_250_000L, 1_700_000_000L);

    ByteBuffer buf = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
    assertThat(data).hasSize(17);
    assertThat(buf.get(0)).isEqualTo((byte) 17);
    assertThat(buf.getLong(1)).isEqualTo(148_250_000L);
    assertThat(buf.getLong(9)).isEqualTo(1_700_000_000L);
    assertThatThrownBy(() -> InstructionCodec.encodePushOraclePrice(0L, 1L))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void crankUsesPermissionlessCaller() {
    byte[] data = InstructionCodec.encodeKeeperCrank(InstructionCodec.PERMISSIONLESS_CALLER, false);

    assertThat(data).containsExactly(5, 0xFF, 0xFF, 0);
  }

  @Test
  void depositAndRegistration() {
    byte[] deposit = InstructionCodec.encodeDepositCollateral(2, 1_000_000_000L);
    ByteBuffer buf = ByteBuffer.wrap(deposit).order(ByteOrder.LITTLE_ENDIAN);
    assertThat(deposit).hasSize(11);
    assertThat(buf.get(0)).isEqualTo((byte) 3);
    assertThat(buf.getShort(1)).isEqualTo((short) 2);
    assertThat(buf.getLong(3)).isEqualTo(1_000_000_000L);

    byte[] init = InstructionCodec.encodeInitUser(1_000_000L);
    assertThat(init[0]).isEqualTo((byte) 1);
    assertThat(ByteBuffer.wrap(init).order(ByteOrder.LITTLE_ENDIAN).getLong(1)).isEqualTo(1_000_000L);
  }

  @Test
  void slotIndexMustFitU16() {
    assertThatThrownBy(() -> InstructionCodec.encodeDepositCollateral(70_000, 1L))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("u16");
  }
}
