package com.riskengine.sim.service.agent.strategy;

import com.riskengine.sim.price.ReferencePrice;
import com.riskengine.sim.scenario.ScenarioState;
import com.riskengine.sim.service.agent.PriceWindow;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Fades deviations from the lookback mean.
 */
@RequiredArgsConstructor
public class MeanReverterStrategy implements TradingStrategy {

    static final int MIN_SAMPLES = 5;
    static final int MIN_RECENT_SAMPLES = 2;
    static final double BAND = 0.001;
    static final double MIN_LEVERAGE = 3.0;
    static final double MAX_LEVERAGE = 6.0;
    static final double MIN_NOTIONAL = 500.0;
    static final double MAX_NOTIONAL = 1_500.0;

    private final @NonNull Random random;
    private final @NonNull Duration lookback;

    @Override
    public StrategyType type() {
        return StrategyType.MEAN_REVERTER;
    }

    @Override
    public Optional<TradeDecision> decide(PriceWindow window, ReferencePrice price, Optional<ScenarioState> scenario, Instant now) {
        if (window.size() < MIN_SAMPLES) {
            return Optional.empty();
        }
        List<PriceWindow.Sample> recent = window.since(now.minus(lookback));
        if (recent.size() < MIN_RECENT_SAMPLES) {
            return Optional.empty();
        }
        double mean = recent.stream().mapToDouble(PriceWindow.Sample::price).average().orElse(0.0);
        if (mean <= 0) {
            return Optional.empty();
        }
        double deviation = (price.adjustedPrice() - mean) / mean;

        double leverage = PositionSizing.uniform(random, MIN_LEVERAGE, MAX_LEVERAGE);
        double notional = PositionSizing.uniform(random, MIN_NOTIONAL, MAX_NOTIONAL);

        boolean isLong;
        if (deviation >= BAND) {
            isLong = false;
        } else if (deviation <= -BAND) {
            isLong = true;
        } else {
            isLong = deviation < 0;
        }
        return PositionSizing.decide(notional, leverage, price.priceE6(), isLong);
    }
}
