package com.riskengine.sim.store;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@RequiredArgsConstructor
public class RestLeaderboardRepository implements LeaderboardRepository {

  static final String TABLE = "sim_leaderboard";

  private final @NonNull StoreClient store;

  @Override
  public Optional<LeaderboardRow> find(@NonNull String identity, @NonNull Instant weekStart) {
    JsonNode rows = store.select(TABLE, key(identity, weekStart));
    if (rows.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(fromRow(rows.get(0), identity, weekStart));
  }

  @Override
  public void insert(@NonNull LeaderboardRow row) {
    Map<String, Object> body = aggregateColumns(row);
    body.put("wallet", row.identity());
    body.put("display_name", row.displayName());
    body.put("week_start", row.weekStart().toString());
    store.insert(TABLE, body);
  }

  @Override
  public void update(@NonNull LeaderboardRow row) {
    store.update(TABLE, key(row.identity(), row.weekStart()), aggregateColumns(row));
  }

  static LeaderboardRow fromRow(JsonNode row, String identity, Instant weekStart) {
    long pnl = row.path("total_pnl").asLong(0);
    return new LeaderboardRow(
        identity,
        row.path("display_name").asText(null),
        weekStart,
        pnl,
        row.path("total_deposited").asLong(0),
        row.path("trade_count").asInt(0),
        row.path("win_count").asInt(0),
        row.path("liquidation_count").asInt(0),
        longOr(row.path("best_trade"), Long.MIN_VALUE),
        longOr(row.path("worst_trade"), Long.MAX_VALUE),
        StoreTimestamps.parse(row.path("last_trade_at")),
        StoreTimestamps.parse(row.path("updated_at"))
    );
  }

  private static Map<String, String> key(String identity, Instant weekStart) {
    Map<String, String> query = new LinkedHashMap<>();
    query.put("wallet", "eq." + identity);
    query.put("week_start", "eq." + weekStart);
    return query;
  }

  private static Map<String, Object> aggregateColumns(LeaderboardRow row) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("total_pnl", row.totalPnl());
    body.put("total_deposited", row.totalDeposited());
    body.put("trade_count", row.tradeCount());
    body.put("win_count", row.winCount());
    body.put("liquidation_count", row.liquidationCount());
    body.put("best_trade", row.bestTrade());
    body.put("worst_trade", row.worstTrade());
    body.put("last_trade_at", row.lastTradeAt() == null ? null : row.lastTradeAt().toString());
    body.put("updated_at", row.updatedAt() == null ? null : row.updatedAt().toString());
    return body;
  }

  private static long longOr(JsonNode node, long fallback) {
    return node.isMissingNode() || node.isNull() ? fallback : node.asLong();
  }
}
