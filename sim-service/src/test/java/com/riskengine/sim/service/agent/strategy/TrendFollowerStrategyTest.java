package com.riskengine.sim.service.agent.strategy;

import com.riskengine.sim.scenario.ScenarioType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.Random;

import static com.riskengine.sim.service.agent.strategy.StrategyTestSupport.NOW;
import static com.riskengine.sim.service.agent.strategy.StrategyTestSupport.price;
import static com.riskengine.sim.service.agent.strategy.StrategyTestSupport.scenario;
import static com.riskengine.sim.service.agent.strategy.StrategyTestSupport.window;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

class TrendFollowerStrategyTest {

    private final TrendFollowerStrategy strategy = new TrendFollowerStrategy(new Random(7), Duration.ofSeconds(60));

    @Test
    void needsTwoSamples() {
        assertThat(strategy.decide(window(5, 100.0), price(101.0), Optional.empty(), NOW)).isEmpty();
    }

    @Test
    void followsAnUpMove() {
        TradeDecision decision = strategy.decide(window(5, 100.0, 100.3), price(100.3), Optional.empty(), NOW).orElseThrow();

        assertThat(decision.isLong()).isTrue();
        assertThat(decision.leverage()).isBetween(TrendFollowerStrategy.MIN_LEVERAGE, TrendFollowerStrategy.MAX_LEVERAGE);
        assertThat(decision.notional()).isBetween(TrendFollowerStrategy.MIN_NOTIONAL, TrendFollowerStrategy.MAX_NOTIONAL);
    }

    @Test
    void followsADownMove() {
        TradeDecision decision = strategy.decide(window(5, 100.0, 99.5), price(99.5), Optional.empty(), NOW).orElseThrow();

        assertThat(decision.isLong()).isFalse();
    }

    @Test
    void belowThresholdFollowsMicroTrend() {
        assertThat(strategy.decide(window(5, 100.0, 100.05), price(100.05), Optional.empty(), NOW).orElseThrow().isLong())
                .isTrue();
        assertThat(strategy.decide(window(5, 100.0, 99.95), price(99.95), Optional.empty(), NOW).orElseThrow().isLong())
                .isFalse();
    }

    @Test
    void measuresAgainstOldestSampleInsideLookback() {
        // 120s-old sample at 90 is outside the lookback; 100 is the reference, so 99.7 is a down move
        TradeDecision decision = strategy.decide(window(60, 90.0, 100.0, 99.7), price(99.7), Optional.empty(), NOW)
                .orElseThrow();

        assertThat(decision.isLong()).isFalse();
    }

    @Test
    void squeezePinsMaximumLeverage() {
        TradeDecision decision = strategy.decide(
                window(5, 100.0, 100.15), price(100.15), Optional.of(scenario(ScenarioType.SHORT_SQUEEZE)), NOW).orElseThrow();

        assertThat(decision.isLong()).isTrue();
        assertThat(decision.leverage()).isEqualTo(TrendFollowerStrategy.AGGRESSIVE_LEVERAGE);
    }

    @Test
    void nonTrendingScenarioKeepsRandomLeverage() {
        for (int i = 0; i < 20; i++) {
            TradeDecision decision = strategy.decide(
                    window(5, 100.0, 101.0), price(101.0), Optional.of(scenario(ScenarioType.FLASH_CRASH)), NOW).orElseThrow();
            assertThat(decision.leverage()).isBetween(TrendFollowerStrategy.MIN_LEVERAGE, TrendFollowerStrategy.MAX_LEVERAGE);
        }
    }

    @Test
    void sizeMatchesNotionalTimesLeverage() {
        TradeDecision decision = strategy.decide(window(5, 100.0, 101.0), price(100.0), Optional.empty(), NOW)
                .orElseThrow();

        double expectedUnits = decision.notional() * decision.leverage() / 100.0 * 1_000_000;
        assertThat((double) decision.signedSize().abs().longValueExact()).isCloseTo(expectedUnits, offset(1.0));
    }
}
