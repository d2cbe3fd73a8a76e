package com.riskengine.sim.service.agent;

import com.riskengine.sim.math.I128;

import java.time.Duration;
import java.time.Instant;

/**
 * An open position. The hold target is fixed when the position opens.
 *
 * @param entryPrice adjusted price at open, approximate for recovered positions
 */
public record Position(I128 signedSize, Instant openedAt, Duration holdTarget, double entryPrice) {

    public Position {
        if (signedSize == null || signedSize.isZero()) {
            throw new IllegalArgumentException("position size must be non-zero");
        }
    }

    public boolean isLong() {
        return signedSize.signum() > 0;
    }

    public boolean isHoldElapsed(Instant now) {
        return !now.isBefore(openedAt.plus(holdTarget));
    }
}
