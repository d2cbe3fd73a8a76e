package com.riskengine.sim.scenario;

import java.time.Duration;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum ScenarioType {
  FLASH_CRASH("flash-crash", "flash_crash", Duration.ofSeconds(60)),
  SHORT_SQUEEZE("short-squeeze", "short_squeeze", Duration.ofSeconds(120)),
  BLACK_SWAN("black-swan", "black_swan", Duration.ofMinutes(10)),
  HIGH_VOL("high-vol", "high_volatility", Duration.ofMinutes(5)),
  GENTLE_TREND("gentle-trend", "gentle_trend", Duration.ofMinutes(30));

  private final String wireId;
  private final String legacyId;
  private final Duration defaultDuration;

  ScenarioType(String wireId, String legacyId, Duration defaultDuration) {
    this.wireId = wireId;
    this.legacyId = legacyId;
    this.defaultDuration = defaultDuration;
  }

  /**
   * Identifier as stored in {@code sim_scenarios.scenario_type}.
   */
  public String wireId() {
    return wireId;
  }

  /**
   * Duration applied when a scenario row has no explicit expiry.
   */
  public Duration defaultDuration() {
    return defaultDuration;
  }

  /**
   * Accepts the kebab form, the older underscore form, and the underscore form of the kebab id.
   */
  public static Optional<ScenarioType> fromWireId(String id) {
    if (id == null || id.isBlank()) {
      return Optional.empty();
    }
    String normalized = id.trim().toLowerCase(Locale.ROOT);
    String kebab = normalized.replace('_', '-');
    return Arrays.stream(values())
        .filter(t -> t.wireId.equals(kebab) || t.legacyId.equals(normalized))
        .findFirst();
  }

  /**
   * Aggressive trend-following regimes.
   */
  public boolean isTrending() {
    return this == SHORT_SQUEEZE || this == GENTLE_TREND;
  }
}
