package com.riskengine.sim.ledger;

import com.riskengine.sim.math.I128;
import lombok.NonNull;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.List;

/**
 * Builds complete instructions (program id + fixed account list + payload) for every call this service makes.
 */
public final class LedgerInstructions {

  public static final LedgerPublicKey COMPUTE_BUDGET_PROGRAM =
      LedgerPublicKey.fromBase58("ComputeBudget111111111111111111111111111111");
  public static final LedgerPublicKey TOKEN_PROGRAM =
      LedgerPublicKey.fromBase58("TokenkegQfeZyiNwAJbNbGKPFXCWuBvf9Ss623VQ5DA");
  public static final LedgerPublicKey SYSVAR_CLOCK =
      LedgerPublicKey.fromBase58("SysvarC1ock11111111111111111111111111111111");

  private static final byte COMPUTE_UNIT_LIMIT_TAG = 2;
  private static final byte COMPUTE_UNIT_PRICE_TAG = 3;
  private static final byte TOKEN_MINT_TO_TAG = 7;

  private final LedgerPublicKey programId;

  public LedgerInstructions(@NonNull LedgerPublicKey programId) {
    this.programId = programId;
  }

  public LedgerPublicKey programId() {
    return programId;
  }

  public static LedgerInstruction computeUnitLimit(int units) {
    byte[] data = ByteBuffer.allocate(5).order(ByteOrder.LITTLE_ENDIAN)
        .put(COMPUTE_UNIT_LIMIT_TAG)
        .putInt(units)
        .array();
    return new LedgerInstruction(COMPUTE_BUDGET_PROGRAM, List.of(), data);
  }

  public static LedgerInstruction computeUnitPrice(long microLamports) {
    byte[] data = ByteBuffer.allocate(9).order(ByteOrder.LITTLE_ENDIAN)
        .put(COMPUTE_UNIT_PRICE_TAG)
        .putLong(microLamports)
        .array();
    return new LedgerInstruction(COMPUTE_BUDGET_PROGRAM, List.of(), data);
  }

  public static LedgerInstruction mintTo(
      LedgerPublicKey mint,
      LedgerPublicKey destination,
      LedgerPublicKey mintAuthority,
      long amount
  ) {
    byte[] data = ByteBuffer.allocate(9).order(ByteOrder.LITTLE_ENDIAN)
        .put(TOKEN_MINT_TO_TAG)
        .putLong(amount)
        .array();
    return new LedgerInstruction(TOKEN_PROGRAM, List.of(
        AccountMeta.writable(mint),
        AccountMeta.writable(destination),
        AccountMeta.signer(mintAuthority)
    ), data);
  }

  /**
   * register-identity: user(signer), slab, user collateral account, vault, token program.
   */
  public LedgerInstruction initUser(
      LedgerPublicKey user,
      LedgerPublicKey slab,
      LedgerPublicKey userCollateral,
      LedgerPublicKey vault,
      long feePayment
  ) {
    return new LedgerInstruction(programId, List.of(
        AccountMeta.signerWritable(user),
        AccountMeta.writable(slab),
        AccountMeta.writable(userCollateral),
        AccountMeta.writable(vault),
        AccountMeta.readonly(TOKEN_PROGRAM)
    ), InstructionCodec.encodeInitUser(feePayment));
  }

  /**
   * deposit-collateral: user(signer), slab, user collateral account, vault, token program, clock.
   */
  public LedgerInstruction depositCollateral(
      LedgerPublicKey user,
      LedgerPublicKey slab,
      LedgerPublicKey userCollateral,
      LedgerPublicKey vault,
      int userIdx,
      long amount
  ) {
    return new LedgerInstruction(programId, List.of(
        AccountMeta.signerWritable(user),
        AccountMeta.writable(slab),
        AccountMeta.writable(userCollateral),
        AccountMeta.writable(vault),
        AccountMeta.readonly(TOKEN_PROGRAM),
        AccountMeta.readonly(SYSVAR_CLOCK)
    ), InstructionCodec.encodeDepositCollateral(userIdx, amount));
  }

  /**
   * execute-trade: user(signer), liquidity provider owner(signer), slab, clock, oracle.
   */
  public LedgerInstruction tradeNoCpi(
      LedgerPublicKey user,
      LedgerPublicKey lpOwner,
      LedgerPublicKey slab,
      LedgerPublicKey oracle,
      int lpIdx,
      int userIdx,
      I128 size
  ) {
    return new LedgerInstruction(programId, List.of(
        AccountMeta.signerWritable(user),
        AccountMeta.signer(lpOwner),
        AccountMeta.writable(slab),
        AccountMeta.readonly(SYSVAR_CLOCK),
        AccountMeta.readonly(oracle)
    ), InstructionCodec.encodeTradeNoCpi(lpIdx, userIdx, size));
  }

  /**
   * push-reference-price: oracle authority(signer), slab.
   */
  public LedgerInstruction pushOraclePrice(
      LedgerPublicKey authority,
      LedgerPublicKey slab,
      long priceE6,
      long timestampSeconds
  ) {
    return new LedgerInstruction(programId, List.of(
        AccountMeta.signerWritable(authority),
        AccountMeta.writable(slab)
    ), InstructionCodec.encodePushOraclePrice(priceE6, timestampSeconds));
  }

  /**
   * advance-state: caller(signer), slab, clock, oracle. Admin-oracle markets pass the slab as the oracle.
   */
  public LedgerInstruction keeperCrank(
      LedgerPublicKey caller,
      LedgerPublicKey slab,
      LedgerPublicKey oracle
  ) {
    return new LedgerInstruction(programId, List.of(
        AccountMeta.signerWritable(caller),
        AccountMeta.writable(slab),
        AccountMeta.readonly(SYSVAR_CLOCK),
        AccountMeta.readonly(oracle)
    ), InstructionCodec.encodeKeeperCrank(InstructionCodec.PERMISSIONLESS_CALLER, false));
  }
}
