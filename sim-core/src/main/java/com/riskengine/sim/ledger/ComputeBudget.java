package com.riskengine.sim.ledger;

/**
 * Compute-unit limit and priority price prepended to every transaction.
 */
public record ComputeBudget(int unitLimit, long microLamportsPerUnit) {

  public ComputeBudget {
    if (unitLimit <= 0) {
      throw new IllegalArgumentException("unitLimit must be positive: " + unitLimit);
    }
    if (microLamportsPerUnit < 0) {
      throw new IllegalArgumentException("microLamportsPerUnit must be non-negative: " + microLamportsPerUnit);
    }
  }
}
