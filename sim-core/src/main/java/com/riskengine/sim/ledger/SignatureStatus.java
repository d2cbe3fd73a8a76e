package com.riskengine.sim.ledger;

/**
 * Ledger view of a submitted signature.
 *
 * @param confirmationStatus {@code processed}, {@code confirmed} or {@code finalized}
 * @param error              program error rendered as text, null on success
 */
public record SignatureStatus(String confirmationStatus, String error) {

  public boolean isConfirmed() {
    return "confirmed".equals(confirmationStatus) || "finalized".equals(confirmationStatus);
  }

  public boolean isFailed() {
    return error != null;
  }
}
