package com.riskengine.sim.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.riskengine.sim.scenario.ScenarioState;
import com.riskengine.sim.scenario.ScenarioType;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Slf4j
@RequiredArgsConstructor
public class RestScenarioRepository implements ScenarioRepository {

  static final String TABLE = "sim_scenarios";

  private final @NonNull StoreClient store;

  @Override
  public Optional<ScenarioState> findLatestActive() {
    Map<String, String> query = new LinkedHashMap<>();
    query.put("select", "id,scenario_type,activated_at,expires_at");
    query.put("status", "eq.active");
    query.put("order", "activated_at.desc");
    query.put("limit", "1");
    JsonNode rows = store.select(TABLE, query);
    if (rows.isEmpty()) {
      return Optional.empty();
    }
    return fromRow(rows.get(0));
  }

  static Optional<ScenarioState> fromRow(JsonNode row) {
    String rawType = row.path("scenario_type").asText(null);
    Optional<ScenarioType> type = ScenarioType.fromWireId(rawType);
    if (type.isEmpty()) {
      log.warn("ignoring active scenario with unknown type '{}'", rawType);
      return Optional.empty();
    }
    Instant activatedAt = StoreTimestamps.parse(row.path("activated_at"));
    if (activatedAt == null) {
      log.warn("ignoring active scenario {} without a valid activated_at", row.path("id").asText(""));
      return Optional.empty();
    }
    Instant expiresAt = StoreTimestamps.parse(row.path("expires_at"));
    if (expiresAt == null) {
      expiresAt = activatedAt.plus(type.get().defaultDuration());
    }
    return Optional.of(new ScenarioState(row.path("id").asText(""), type.get(), activatedAt, expiresAt));
  }
}
