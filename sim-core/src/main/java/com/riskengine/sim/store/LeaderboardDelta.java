package com.riskengine.sim.store;

/**
 * One closed trade's contribution to the standings. Amounts are 1e6 fixed point.
 */
public record LeaderboardDelta(
    String identity,
    String displayName,
    long pnlDelta,
    long depositedDelta,
    boolean win
) {
}
