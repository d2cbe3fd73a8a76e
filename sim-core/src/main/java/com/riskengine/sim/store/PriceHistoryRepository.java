package com.riskengine.sim.store;

import java.util.List;

public interface PriceHistoryRepository {

  void insertBatch(List<PriceRecord> records);

  /**
   * Deletes records with {@code timestamp < cutoffEpochMillis}.
   */
  void deleteOlderThan(long cutoffEpochMillis);
}
