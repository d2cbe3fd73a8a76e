package com.riskengine.sim.service.feed;

import com.riskengine.sim.price.ReferencePrice;
import com.riskengine.sim.scenario.ScenarioState;

import java.util.Optional;

/**
 * What the feed publishes for other loops to read: the latest price per symbol and the scenario it applied.
 */
public interface PriceSnapshot {

    Optional<ReferencePrice> latestPrice(String symbol);

    Optional<ScenarioState> activeScenario();
}
