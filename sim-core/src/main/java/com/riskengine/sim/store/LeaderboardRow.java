package com.riskengine.sim.store;

import lombok.NonNull;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/**
 * Weekly standing of one identity; keyed by {@code (identity, weekStart)}.
 */
public record LeaderboardRow(
    @NonNull String identity,
    String displayName,
    @NonNull Instant weekStart,
    long totalPnl,
    long totalDeposited,
    int tradeCount,
    int winCount,
    int liquidationCount,
    long bestTrade,
    long worstTrade,
    Instant lastTradeAt,
    Instant updatedAt
) {

  /**
   * Monday 00:00 UTC of the week containing {@code now}.
   */
  public static Instant weekStartOf(@NonNull Instant now) {
    return ZonedDateTime.ofInstant(now, ZoneOffset.UTC)
        .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY))
        .truncatedTo(ChronoUnit.DAYS)
        .toInstant();
  }

  public static LeaderboardRow first(@NonNull LeaderboardDelta delta, @NonNull Instant weekStart, @NonNull Instant now) {
    return new LeaderboardRow(
        delta.identity(),
        delta.displayName(),
        weekStart,
        delta.pnlDelta(),
        delta.depositedDelta(),
        1,
        delta.win() ? 1 : 0,
        0,
        delta.pnlDelta(),
        delta.pnlDelta(),
        now,
        now
    );
  }

  public LeaderboardRow merge(@NonNull LeaderboardDelta delta, @NonNull Instant now) {
    return new LeaderboardRow(
        identity,
        displayName != null ? displayName : delta.displayName(),
        weekStart,
        Math.addExact(totalPnl, delta.pnlDelta()),
        Math.addExact(totalDeposited, delta.depositedDelta()),
        tradeCount + 1,
        winCount + (delta.win() ? 1 : 0),
        liquidationCount,
        Math.max(bestTrade, delta.pnlDelta()),
        Math.min(worstTrade, delta.pnlDelta()),
        now,
        now
    );
  }
}
