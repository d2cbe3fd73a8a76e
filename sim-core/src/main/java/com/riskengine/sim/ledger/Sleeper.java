package com.riskengine.sim.ledger;

/**
 * Pause between confirmation polls. Tests substitute a no-op.
 */
@FunctionalInterface
public interface Sleeper {

  Sleeper THREAD = Thread::sleep;

  void sleep(long millis) throws InterruptedException;
}
