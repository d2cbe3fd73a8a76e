package com.riskengine.sim.ledger;

import java.io.IOException;

public class LedgerRpcException extends IOException {

  public LedgerRpcException(String message) {
    super(message);
  }

  public LedgerRpcException(String message, Throwable cause) {
    super(message, cause);
  }
}
