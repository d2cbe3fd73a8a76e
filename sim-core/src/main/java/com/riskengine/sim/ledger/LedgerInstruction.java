package com.riskengine.sim.ledger;

import lombok.NonNull;

import java.util.List;

/**
 * One program invocation: target program, ordered account list, binary payload.
 */
public record LedgerInstruction(
    @NonNull LedgerPublicKey programId,
    @NonNull List<AccountMeta> accounts,
    byte[] data
) {

  public LedgerInstruction {
    accounts = List.copyOf(accounts);
    data = data.clone();
  }

  @Override
  public byte[] data() {
    return data.clone();
  }
}
