package com.riskengine.sim.store;

import com.riskengine.sim.scenario.ScenarioState;

import java.util.Optional;

public interface ScenarioRepository {

  /**
   * Most recently activated scenario with status {@code active}, regardless of expiry.
   */
  Optional<ScenarioState> findLatestActive();
}
