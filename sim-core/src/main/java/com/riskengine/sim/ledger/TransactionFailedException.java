package com.riskengine.sim.ledger;

import java.io.IOException;

/**
 * The transaction landed but the program rejected it.
 */
public class TransactionFailedException extends IOException {

  private final String signature;

  public TransactionFailedException(String signature, String error) {
    super("transaction failed (sig=" + signature + "): " + error);
    this.signature = signature;
  }

  public String signature() {
    return signature;
  }
}
