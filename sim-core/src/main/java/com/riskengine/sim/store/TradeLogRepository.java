package com.riskengine.sim.store;

public interface TradeLogRepository {

  void insert(TradeLogEntry entry);
}
