package com.riskengine.sim.service.agent.strategy;

import com.riskengine.sim.math.I128;

/**
 * A strategy's request to open a position.
 *
 * @param signedSize base units, positive long / negative short, never zero
 * @param notional   USD notional before leverage
 */
public record TradeDecision(I128 signedSize, double notional, double leverage) {

    public TradeDecision {
        if (signedSize == null || signedSize.isZero()) {
            throw new IllegalArgumentException("signedSize must be non-zero");
        }
    }

    public boolean isLong() {
        return signedSize.signum() > 0;
    }
}
