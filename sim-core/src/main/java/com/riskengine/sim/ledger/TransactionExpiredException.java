package com.riskengine.sim.ledger;

import java.io.IOException;

/**
 * The transaction's blockhash validity window lapsed (or confirmation polling gave up) before it was seen
 * as confirmed. It may still have landed.
 */
public class TransactionExpiredException extends IOException {

  private final String signature;

  public TransactionExpiredException(String signature, String message) {
    super(message);
    this.signature = signature;
  }

  public String signature() {
    return signature;
  }
}
