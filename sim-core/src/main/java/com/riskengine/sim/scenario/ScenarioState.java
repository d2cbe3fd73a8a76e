package com.riskengine.sim.scenario;

import lombok.NonNull;

import java.time.Duration;
import java.time.Instant;

/**
 * An activated market scenario. Immutable; a new scenario is a new instance.
 */
public record ScenarioState(
    @NonNull String id,
    @NonNull ScenarioType type,
    @NonNull Instant activatedAt,
    @NonNull Instant expiresAt
) {

  public boolean isExpiredAt(Instant now) {
    return !now.isBefore(expiresAt);
  }

  /**
   * Elapsed fraction of the scenario's lifetime, clamped to [0, 1]. A non-positive duration counts as complete.
   */
  public double progressAt(Instant now) {
    long durationMillis = Duration.between(activatedAt, expiresAt).toMillis();
    if (durationMillis <= 0) {
      return 1.0;
    }
    long elapsedMillis = Duration.between(activatedAt, now).toMillis();
    double t = (double) elapsedMillis / durationMillis;
    return Math.max(0.0, Math.min(1.0, t));
  }
}
