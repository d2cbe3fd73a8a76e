package com.riskengine.sim.service.agent.strategy;

import lombok.NonNull;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Random;

/**
 * One stateless strategy instance per type, shared by every agent of that type.
 */
public class TradingStrategies {

    private final Map<StrategyType, TradingStrategy> byType = new EnumMap<>(StrategyType.class);

    public TradingStrategies(@NonNull Random random, @NonNull Duration lookback) {
        register(new TrendFollowerStrategy(random, lookback));
        register(new MeanReverterStrategy(random, lookback));
        register(new MarketMakerStrategy(random));
    }

    public TradingStrategy forType(@NonNull StrategyType type) {
        TradingStrategy strategy = byType.get(type);
        if (strategy == null) {
            throw new IllegalArgumentException("No strategy registered for " + type);
        }
        return strategy;
    }

    private void register(TradingStrategy strategy) {
        byType.put(strategy.type(), strategy);
    }
}
