package com.riskengine.sim.store;

import java.time.Instant;
import java.util.Optional;

public interface LeaderboardRepository {

  Optional<LeaderboardRow> find(String identity, Instant weekStart);

  void insert(LeaderboardRow row);

  /**
   * Overwrites the mutable aggregate columns of the row with the same key.
   */
  void update(LeaderboardRow row);
}
