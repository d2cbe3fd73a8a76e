package com.riskengine.sim.store;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RequiredArgsConstructor
public class RestPriceHistoryRepository implements PriceHistoryRepository {

  static final String TABLE = "sim_price_history";

  private final @NonNull StoreClient store;

  @Override
  public void insertBatch(@NonNull List<PriceRecord> records) {
    if (records.isEmpty()) {
      return;
    }
    store.insert(TABLE, records.stream().map(RestPriceHistoryRepository::toRow).toList());
  }

  @Override
  public void deleteOlderThan(long cutoffEpochMillis) {
    store.delete(TABLE, Map.of("timestamp", "lt." + cutoffEpochMillis));
  }

  static Map<String, Object> toRow(PriceRecord record) {
    // price columns are text
    Map<String, Object> row = new LinkedHashMap<>();
    row.put("slab_address", record.slabAddress());
    row.put("symbol", record.symbol());
    row.put("price_e6", Long.toString(record.priceE6()));
    row.put("raw_price_e6", Long.toString(record.rawPriceE6()));
    row.put("scenario_type", record.scenarioType());
    row.put("timestamp", record.timestamp());
    return row;
  }
}
