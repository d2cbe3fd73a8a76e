package com.riskengine.sim.store;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@RequiredArgsConstructor
public class RestTradeLogRepository implements TradeLogRepository {

  static final String TABLE = "trades";

  private final @NonNull StoreClient store;

  @Override
  public void insert(@NonNull TradeLogEntry entry) {
    Map<String, Object> row = new LinkedHashMap<>();
    row.put("slab_address", entry.slabAddress());
    row.put("trader", entry.trader());
    row.put("side", entry.side());
    row.put("size", entry.size());
    row.put("price", entry.price());
    row.put("fee", entry.fee());
    row.put("tx_signature", entry.txSignature());
    store.insert(TABLE, row);
  }
}
