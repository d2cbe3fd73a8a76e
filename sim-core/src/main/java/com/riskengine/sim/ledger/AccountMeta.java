package com.riskengine.sim.ledger;

import lombok.NonNull;

public record AccountMeta(@NonNull LedgerPublicKey pubkey, boolean signer, boolean writable) {

  public static AccountMeta signerWritable(LedgerPublicKey pubkey) {
    return new AccountMeta(pubkey, true, true);
  }

  public static AccountMeta signer(LedgerPublicKey pubkey) {
    return new AccountMeta(pubkey, true, false);
  }

  public static AccountMeta writable(LedgerPublicKey pubkey) {
    return new AccountMeta(pubkey, false, true);
  }

  public static AccountMeta readonly(LedgerPublicKey pubkey) {
    return new AccountMeta(pubkey, false, false);
  }
}
