package com.riskengine.sim.service.agent.strategy;

import com.riskengine.sim.price.ReferencePrice;
import com.riskengine.sim.scenario.ScenarioState;
import com.riskengine.sim.service.agent.PriceWindow;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Random;

/**
 * Trades in the direction of the move over the lookback window. Squeeze and trend regimes lower the threshold
 * and pin leverage at the maximum.
 */
@RequiredArgsConstructor
public class TrendFollowerStrategy implements TradingStrategy {

    static final double THRESHOLD = 0.002;
    static final double AGGRESSIVE_THRESHOLD = 0.001;
    static final double AGGRESSIVE_LEVERAGE = 8.0;
    static final double MIN_LEVERAGE = 4.0;
    static final double MAX_LEVERAGE = 8.0;
    static final double MIN_NOTIONAL = 500.0;
    static final double MAX_NOTIONAL = 2_000.0;

    private final @NonNull Random random;
    private final @NonNull Duration lookback;

    @Override
    public StrategyType type() {
        return StrategyType.TREND_FOLLOWER;
    }

    @Override
    public Optional<TradeDecision> decide(PriceWindow window, ReferencePrice price, Optional<ScenarioState> scenario, Instant now) {
        if (window.size() < 2) {
            return Optional.empty();
        }
        Optional<PriceWindow.Sample> reference = window.oldestSince(now.minus(lookback));
        if (reference.isEmpty() || reference.get().price() <= 0) {
            return Optional.empty();
        }
        double change = (price.adjustedPrice() - reference.get().price()) / reference.get().price();

        boolean aggressive = scenario.map(s -> s.type().isTrending()).orElse(false);
        double threshold = aggressive ? AGGRESSIVE_THRESHOLD : THRESHOLD;
        double leverage = aggressive ? AGGRESSIVE_LEVERAGE : PositionSizing.uniform(random, MIN_LEVERAGE, MAX_LEVERAGE);
        double notional = PositionSizing.uniform(random, MIN_NOTIONAL, MAX_NOTIONAL);

        boolean isLong;
        if (change >= threshold) {
            isLong = true;
        } else if (change <= -threshold) {
            isLong = false;
        } else {
            // below threshold: follow the micro-trend
            isLong = change >= 0;
        }
        return PositionSizing.decide(notional, leverage, price.priceE6(), isLong);
    }
}
