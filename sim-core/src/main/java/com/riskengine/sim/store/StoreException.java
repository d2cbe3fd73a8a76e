package com.riskengine.sim.store;

/**
 * A store request failed: transport error, non-2xx answer, or an unreadable body.
 */
public class StoreException extends RuntimeException {

  private final int status;

  public StoreException(String message, int status) {
    super(message);
    this.status = status;
  }

  public StoreException(String message, Throwable cause) {
    super(message, cause);
    this.status = -1;
  }

  /**
   * HTTP status, or -1 when no response was received.
   */
  public int status() {
    return status;
  }
}
