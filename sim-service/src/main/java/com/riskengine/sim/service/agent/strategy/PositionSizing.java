package com.riskengine.sim.service.agent.strategy;

import com.riskengine.sim.math.FixedPoint;
import com.riskengine.sim.math.I128;

import java.util.Optional;
import java.util.Random;

final class PositionSizing {

    private PositionSizing() {
    }

    static double uniform(Random random, double min, double max) {
        return min + random.nextDouble() * (max - min);
    }

    /**
     * {@code round(notional x leverage x 1e12 / priceE6)} with the requested sign. Empty when the size rounds to zero.
     */
    static Optional<TradeDecision> decide(double notional, double leverage, long priceE6, boolean isLong) {
        I128 size = FixedPoint.baseUnitsForNotional(notional * leverage, priceE6);
        if (size.isZero()) {
            return Optional.empty();
        }
        return Optional.of(new TradeDecision(isLong ? size : size.negate(), notional, leverage));
    }
}
