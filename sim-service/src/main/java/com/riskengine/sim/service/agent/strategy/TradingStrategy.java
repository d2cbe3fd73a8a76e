package com.riskengine.sim.service.agent.strategy;

import com.riskengine.sim.price.ReferencePrice;
import com.riskengine.sim.scenario.ScenarioState;
import com.riskengine.sim.service.agent.PriceWindow;

import java.time.Instant;
import java.util.Optional;

/**
 * Entry logic of one agent type. Called only while the agent is flat.
 */
public interface TradingStrategy {

    StrategyType type();

    /**
     * @param window   the agent's pruned price window, current price included
     * @param scenario the feed's published scenario, empty when none is active
     */
    Optional<TradeDecision> decide(PriceWindow window, ReferencePrice price, Optional<ScenarioState> scenario, Instant now);
}
