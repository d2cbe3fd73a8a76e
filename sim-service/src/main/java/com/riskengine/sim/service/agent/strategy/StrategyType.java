package com.riskengine.sim.service.agent.strategy;

import java.util.Arrays;
import java.util.Locale;

public enum StrategyType {
    TREND_FOLLOWER("trend_follower", "TrendBot"),
    MEAN_REVERTER("mean_reverter", "MeanRevBot"),
    MARKET_MAKER("market_maker", "MarketMaker");

    private final String id;
    private final String displayPrefix;

    StrategyType(String id, String displayPrefix) {
        this.id = id;
        this.displayPrefix = displayPrefix;
    }

    public String id() {
        return id;
    }

    public String displayPrefix() {
        return displayPrefix;
    }

    /**
     * Accepts {@code trend_follower} and {@code trend-follower} forms.
     */
    public static StrategyType fromId(String id) {
        if (id == null) {
            throw new IllegalArgumentException("strategy type is required");
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(t -> t.id.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown strategy type: " + id));
    }
}
