package com.riskengine.sim.service.scenario;

import com.riskengine.sim.scenario.ScenarioState;
import com.riskengine.sim.scenario.ScenarioType;
import com.riskengine.sim.service.MutableClock;
import com.riskengine.sim.store.ScenarioRepository;
import com.riskengine.sim.store.StoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ScenarioEngineTest {

    private static final Instant T0 = Instant.parse("2025-03-10T12:00:00Z");

    private ScenarioRepository repository;
    private MutableClock clock;
    private ScenarioEngine engine;

    @BeforeEach
    void setUp() {
        repository = mock(ScenarioRepository.class);
        clock = new MutableClock(T0);
        engine = new ScenarioEngine(repository, clock, new Random(5), Duration.ofSeconds(10));
    }

    @Test
    void pollsStoreAtMostOncePerRefreshInterval() {
        ScenarioState crash = flashCrash(T0, T0.plusSeconds(60));
        when(repository.findLatestActive()).thenReturn(Optional.of(crash));

        assertThat(engine.activeScenario()).contains(crash);
        clock.advance(Duration.ofSeconds(9));
        assertThat(engine.activeScenario()).contains(crash);
        verify(repository, times(1)).findLatestActive();

        clock.advance(Duration.ofSeconds(1));
        engine.activeScenario();
        verify(repository, times(2)).findLatestActive();
    }

    @Test
    void expiredScenarioIsNeverReturnedFromFreshCache() {
        ScenarioState crash = flashCrash(T0.minusSeconds(55), T0.plusSeconds(5));
        when(repository.findLatestActive()).thenReturn(Optional.of(crash));

        assertThat(engine.activeScenario()).isPresent();
        clock.advance(Duration.ofSeconds(5));

        assertThat(engine.activeScenario()).isEmpty();
        verify(repository, times(1)).findLatestActive();
    }

    @Test
    void failedRefreshKeepsPreviousScenario() {
        ScenarioState crash = flashCrash(T0, T0.plusSeconds(60));
        when(repository.findLatestActive())
                .thenReturn(Optional.of(crash))
                .thenThrow(new StoreException("store unavailable", 503));

        engine.activeScenario();
        clock.advance(Duration.ofSeconds(10));

        assertThat(engine.activeScenario()).contains(crash);
        verify(repository, times(2)).findLatestActive();
    }

    @Test
    void clearsScenarioWhenStoreHasNone() {
        when(repository.findLatestActive())
                .thenReturn(Optional.of(flashCrash(T0, T0.plusSeconds(60))))
                .thenReturn(Optional.empty());

        assertThat(engine.activeScenario()).isPresent();
        clock.advance(Duration.ofSeconds(10));

        assertThat(engine.activeScenario()).isEmpty();
    }

    @Test
    void noScenarioLeavesPriceUntouched() {
        assertThat(engine.applyScenario(142.5, Optional.empty())).isEqualTo(142.5);
    }

    @Test
    void appliesMultiplierAtCurrentProgress() {
        ScenarioState crash = flashCrash(T0.minusSeconds(30), T0.plusSeconds(30));

        assertThat(engine.applyScenario(100.0, Optional.of(crash))).isCloseTo(70.0, within(1e-9));
    }

    @Test
    void expiredScenarioAppliesNoMultiplier() {
        ScenarioState crash = flashCrash(T0.minusSeconds(60), T0);

        assertThat(engine.applyScenario(100.0, Optional.of(crash))).isEqualTo(100.0);
    }

    private static ScenarioState flashCrash(Instant activatedAt, Instant expiresAt) {
        return new ScenarioState("scn-1", ScenarioType.FLASH_CRASH, activatedAt, expiresAt);
    }
}
