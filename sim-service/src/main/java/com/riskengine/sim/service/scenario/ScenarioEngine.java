package com.riskengine.sim.service.scenario;

import com.riskengine.sim.config.SimProperties;
import com.riskengine.sim.scenario.ScenarioMultipliers;
import com.riskengine.sim.scenario.ScenarioState;
import com.riskengine.sim.scenario.ScenarioType;
import com.riskengine.sim.store.ScenarioRepository;
import com.riskengine.sim.store.StoreException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Random;

/**
 * Resolves the active market scenario and turns it into a price multiplier.
 * <p>
 * The store is polled at most once per refresh interval; a failed poll keeps the previous value. A cached
 * scenario is never returned once its expiry has passed, whatever the cache age.
 */
@Slf4j
@Component
public class ScenarioEngine {

    private final ScenarioRepository repository;
    private final Clock clock;
    private final Random random;
    private final Duration refreshInterval;

    private volatile Optional<ScenarioState> cached = Optional.empty();
    private volatile Instant refreshedAt;

    @Autowired
    public ScenarioEngine(
            @NonNull ScenarioRepository repository,
            @NonNull Clock clock,
            @NonNull Random random,
            @NonNull SimProperties properties
    ) {
        this(repository, clock, random, Duration.ofMillis(properties.feed().scenarioRefreshMillis()));
    }

    public ScenarioEngine(
            @NonNull ScenarioRepository repository,
            @NonNull Clock clock,
            @NonNull Random random,
            @NonNull Duration refreshInterval
    ) {
        this.repository = repository;
        this.clock = clock;
        this.random = random;
        this.refreshInterval = refreshInterval;
    }

    public Optional<ScenarioState> activeScenario() {
        Instant now = clock.instant();
        Instant last = refreshedAt;
        if (last == null || !now.isBefore(last.plus(refreshInterval))) {
            refresh(now);
        }
        return cached.filter(s -> !s.isExpiredAt(now));
    }

    public double multiplier(@NonNull ScenarioType type, double t) {
        return ScenarioMultipliers.multiplier(type, t, random);
    }

    /**
     * Raw price when no scenario applies, otherwise raw price times the scenario's multiplier at its current
     * progress.
     */
    public double applyScenario(double rawPrice, @NonNull Optional<ScenarioState> scenario) {
        if (scenario.isEmpty()) {
            return rawPrice;
        }
        ScenarioState s = scenario.get();
        Instant now = clock.instant();
        if (s.isExpiredAt(now)) {
            return rawPrice;
        }
        return rawPrice * multiplier(s.type(), s.progressAt(now));
    }

    private synchronized void refresh(Instant now) {
        refreshedAt = now;
        try {
            Optional<ScenarioState> latest = repository.findLatestActive();
            if (!latest.equals(cached)) {
                latest.ifPresentOrElse(
                        s -> log.info("active scenario {} ({}), expires at {}", s.type().wireId(), s.id(), s.expiresAt()),
                        () -> log.info("no active scenario"));
            }
            cached = latest;
        } catch (StoreException e) {
            log.warn("scenario refresh failed, keeping previous: {}", e.getMessage());
        }
    }
}
