package com.riskengine.sim.service.executor;

import com.riskengine.sim.math.FixedPoint;
import com.riskengine.sim.service.agent.Position;

/**
 * Outcome of closing a position. Amounts are 1e6 fixed point.
 *
 * @param closedNotionalE6 {@code |size|}, the notional the position committed
 */
public record CloseResult(String signature, long realizedPnlE6, long closedNotionalE6) {

    /**
     * PnL = {@code (exit - entry) / entry x |size|/1e6}, sign flipped for shorts.
     */
    public static CloseResult of(String signature, Position position, double exitPrice) {
        long notionalE6 = position.signedSize().abs().longValueExact();
        double direction = position.isLong() ? 1.0 : -1.0;
        double priceReturn = (exitPrice - position.entryPrice()) / position.entryPrice();
        double pnl = priceReturn * FixedPoint.fromE6(position.signedSize().abs()) * direction;
        return new CloseResult(signature, FixedPoint.toE6(pnl), notionalE6);
    }

    public boolean isWin() {
        return realizedPnlE6 > 0;
    }
}
