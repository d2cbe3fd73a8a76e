package com.riskengine.sim.service.agent.strategy;

import com.riskengine.sim.price.ReferencePrice;
import com.riskengine.sim.scenario.ScenarioState;
import com.riskengine.sim.service.agent.PriceWindow;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.time.Instant;
import java.util.Optional;
import java.util.Random;

/**
 * Random side, small size, low leverage. Keeps two-sided flow on the book.
 */
@RequiredArgsConstructor
public class MarketMakerStrategy implements TradingStrategy {

    static final double MIN_LEVERAGE = 2.0;
    static final double MAX_LEVERAGE = 4.0;
    static final double MIN_NOTIONAL = 300.0;
    static final double MAX_NOTIONAL = 1_000.0;

    private final @NonNull Random random;

    @Override
    public StrategyType type() {
        return StrategyType.MARKET_MAKER;
    }

    @Override
    public Optional<TradeDecision> decide(PriceWindow window, ReferencePrice price, Optional<ScenarioState> scenario, Instant now) {
        double notional = PositionSizing.uniform(random, MIN_NOTIONAL, MAX_NOTIONAL);
        double leverage = PositionSizing.uniform(random, MIN_LEVERAGE, MAX_LEVERAGE);
        boolean isLong = random.nextDouble() > 0.5;
        return PositionSizing.decide(notional, leverage, price.priceE6(), isLong);
    }
}
