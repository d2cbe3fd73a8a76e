package com.riskengine.sim.scenario;

import lombok.NonNull;

import java.util.Random;

/**
 * Price multiplier curves, as a function of scenario progress {@code t} in [0, 1].
 */
public final class ScenarioMultipliers {

  static final double FLASH_CRASH_DROP = 0.30;
  static final double FLASH_CRASH_RECOVERY = 0.70;
  static final double SQUEEZE_RISE = 0.50;
  static final double BLACK_SWAN_DROP = 0.60;
  static final double HIGH_VOL_BAND = 0.20;
  static final double GENTLE_TREND_RISE = 0.15;

  private ScenarioMultipliers() {
  }

  public static double multiplier(@NonNull ScenarioType type, double t, @NonNull Random random) {
    switch (type) {
      case FLASH_CRASH:
        if (t < 0.5) {
          return 1.0 - FLASH_CRASH_DROP * (t / 0.5);
        }
        return (1.0 - FLASH_CRASH_DROP) + FLASH_CRASH_DROP * FLASH_CRASH_RECOVERY * ((t - 0.5) / 0.5);
      case SHORT_SQUEEZE:
        return 1.0 + SQUEEZE_RISE * t;
      case BLACK_SWAN:
        return 1.0 - BLACK_SWAN_DROP * Math.min(t, 1.0);
      case HIGH_VOL:
        return 1.0 + (random.nextDouble() * 2.0 - 1.0) * HIGH_VOL_BAND;
      case GENTLE_TREND:
        return 1.0 + GENTLE_TREND_RISE * t;
      default:
        return 1.0;
    }
  }
}
