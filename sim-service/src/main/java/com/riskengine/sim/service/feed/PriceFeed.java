package com.riskengine.sim.service.feed;

import com.riskengine.sim.config.SimProperties;
import com.riskengine.sim.math.FixedPoint;
import com.riskengine.sim.price.ReferencePrice;
import com.riskengine.sim.price.ReferencePriceSource;
import com.riskengine.sim.scenario.ScenarioState;
import com.riskengine.sim.service.scenario.ScenarioEngine;
import com.riskengine.sim.store.PriceHistoryRepository;
import com.riskengine.sim.store.PriceRecord;
import com.riskengine.sim.store.StoreException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Reference-price loop: fetch real prices, apply the active scenario, push to every deployed market, and persist
 * the pushed prices in batches.
 * <p>
 * Runs on its own single thread. The price buffer is confined to that thread; the latest-price map and the
 * scenario snapshot are the only state other threads read.
 */
@Slf4j
@Component
public class PriceFeed implements PriceSnapshot {

    private final SimProperties.Feed config;
    private final Map<String, SimProperties.Market> markets;
    private final ReferencePriceSource priceSource;
    private final ScenarioEngine scenarioEngine;
    private final OracleGateway oracle;
    private final PriceHistoryRepository history;
    private final Clock clock;
    private final Duration shutdownGrace;

    private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "price-feed");
        t.setDaemon(true);
        return t;
    });

    private final Map<String, ReferencePrice> latestPrices = new ConcurrentHashMap<>();
    private final AtomicReference<Optional<ScenarioState>> scenarioSnapshot = new AtomicReference<>(Optional.empty());
    private final AtomicReference<Instant> lastPriceAt = new AtomicReference<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Instant createdAt;

    private final Deque<PriceRecord> buffer = new ArrayDeque<>();
    private Instant lastFlushAt;
    private Instant lastCleanupAt;

    private final Counter ticks;
    private final Counter tickFailures;
    private final Counter pushes;
    private final Counter pushFailures;
    private final Counter flushFailures;
    private final Counter droppedRecords;

    public PriceFeed(
            @NonNull SimProperties properties,
            @NonNull ReferencePriceSource priceSource,
            @NonNull ScenarioEngine scenarioEngine,
            @NonNull OracleGateway oracle,
            @NonNull PriceHistoryRepository history,
            @NonNull Clock clock,
            @NonNull MeterRegistry meterRegistry
    ) {
        this.config = properties.feed();
        this.markets = properties.markets();
        this.priceSource = priceSource;
        this.scenarioEngine = scenarioEngine;
        this.oracle = oracle;
        this.history = history;
        this.clock = clock;
        this.shutdownGrace = Duration.ofMillis(properties.shutdownGraceMillis());
        this.createdAt = clock.instant();
        this.lastFlushAt = createdAt;
        this.lastCleanupAt = createdAt;

        this.ticks = Counter.builder("sim.feed.ticks").register(meterRegistry);
        this.tickFailures = Counter.builder("sim.feed.tick.failures").register(meterRegistry);
        this.pushes = Counter.builder("sim.feed.pushes").register(meterRegistry);
        this.pushFailures = Counter.builder("sim.feed.push.failures").register(meterRegistry);
        this.flushFailures = Counter.builder("sim.feed.flush.failures").register(meterRegistry);
        this.droppedRecords = Counter.builder("sim.feed.records.dropped").register(meterRegistry);
    }

    @PostConstruct
    void startIfEnabled() {
        if (!config.enabled()) {
            log.info("price feed is disabled");
            return;
        }
        running.set(true);
        executor.scheduleWithFixedDelay(this::safeTick, 0, config.tickMillis(), TimeUnit.MILLISECONDS);
        log.info("price feed started (tickMillis={}, markets={})", config.tickMillis(), markets.keySet());
    }

    @PreDestroy
    void shutdown() {
        running.set(false);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("price feed tick still running after {} grace", shutdownGrace);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("price feed stopped");
    }

    public boolean isRunning() {
        return running.get() && !executor.isShutdown();
    }

    @Override
    public Optional<ReferencePrice> latestPrice(String symbol) {
        return Optional.ofNullable(latestPrices.get(symbol));
    }

    @Override
    public Optional<ScenarioState> activeScenario() {
        return scenarioSnapshot.get();
    }

    public Map<String, ReferencePrice> latestPrices() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(latestPrices));
    }

    public Optional<Instant> lastPriceAt() {
        return Optional.ofNullable(lastPriceAt.get());
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Duration staleness() {
        return Duration.ofMillis(config.stalenessMillis());
    }

    int bufferedRecords() {
        return buffer.size();
    }

    private void safeTick() {
        try {
            tick();
        } catch (Exception e) {
            tickFailures.increment();
            log.error("price feed tick failed, continuing loop", e);
        }
    }

    void tick() {
        ticks.increment();
        Map<String, Double> rawPrices;
        try {
            rawPrices = priceSource.fetchLatest();
        } catch (IOException e) {
            tickFailures.increment();
            log.warn("reference price fetch failed, skipping tick: {}", e.getMessage());
            return;
        }

        Optional<ScenarioState> scenario = scenarioEngine.activeScenario();
        scenarioSnapshot.set(scenario);
        String scenarioType = scenario.map(s -> s.type().wireId()).orElse(null);

        for (Map.Entry<String, SimProperties.Market> entry : markets.entrySet()) {
            String symbol = entry.getKey();
            SimProperties.Market market = entry.getValue();
            if (!market.isDeployed()) {
                continue;
            }
            Double rawPrice = rawPrices.get(symbol);
            if (rawPrice == null || rawPrice <= 0) {
                log.warn("no reference price for {}", symbol);
                continue;
            }
            publishAndPush(symbol, market, rawPrice, scenario, scenarioType);
        }

        Instant now = clock.instant();
        flushIfDue(now);
        cleanupIfDue(now);
    }

    private void publishAndPush(
            String symbol,
            SimProperties.Market market,
            double rawPrice,
            Optional<ScenarioState> scenario,
            String scenarioType
    ) {
        double adjusted = scenarioEngine.applyScenario(rawPrice, scenario);
        long priceE6;
        long rawE6;
        try {
            priceE6 = FixedPoint.toE6(adjusted);
            rawE6 = FixedPoint.toE6(rawPrice);
        } catch (IllegalArgumentException e) {
            log.warn("{} adjusted price {} not representable: {}", symbol, adjusted, e.getMessage());
            return;
        }
        if (priceE6 <= 0) {
            log.warn("{} adjusted price {} rounds to zero, skipping", symbol, adjusted);
            return;
        }

        Instant observedAt = clock.instant();
        latestPrices.put(symbol, new ReferencePrice(symbol, rawPrice, adjusted, priceE6, observedAt));
        lastPriceAt.set(observedAt);

        try {
            String sig = oracle.pushAndCrank(market, priceE6);
            pushes.increment();
            buffer.addLast(new PriceRecord(market.slab(), symbol, priceE6, rawE6, scenarioType, observedAt.toEpochMilli()));
            log.info("{} raw={} adj={} priceE6={} sig={}", symbol, String.format("%.4f", rawPrice),
                    String.format("%.4f", adjusted), priceE6, abbreviate(sig));
        } catch (Exception e) {
            pushFailures.increment();
            log.error("push/crank failed for {}: {}", symbol, e.toString());
        }
    }

    void flushIfDue(Instant now) {
        if (buffer.isEmpty()) {
            return;
        }
        boolean intervalElapsed = !now.isBefore(lastFlushAt.plusMillis(config.flushIntervalMillis()));
        if (!intervalElapsed && buffer.size() < config.flushBatchSize()) {
            return;
        }
        List<PriceRecord> batch = new ArrayList<>(Math.min(buffer.size(), config.flushBatchSize()));
        while (!buffer.isEmpty() && batch.size() < config.flushBatchSize()) {
            batch.add(buffer.pollFirst());
        }
        lastFlushAt = now;
        try {
            history.insertBatch(batch);
            log.debug("flushed {} price records", batch.size());
        } catch (StoreException e) {
            flushFailures.increment();
            log.warn("price history flush failed ({} records requeued): {}", batch.size(), e.getMessage());
            for (int i = batch.size() - 1; i >= 0; i--) {
                buffer.addFirst(batch.get(i));
            }
            int dropped = 0;
            while (buffer.size() > config.bufferCap()) {
                buffer.pollFirst();
                dropped++;
            }
            if (dropped > 0) {
                droppedRecords.increment(dropped);
                log.warn("price buffer over cap {}, dropped {} oldest records", config.bufferCap(), dropped);
            }
        }
    }

    void cleanupIfDue(Instant now) {
        if (now.isBefore(lastCleanupAt.plusMillis(config.cleanupIntervalMillis()))) {
            return;
        }
        lastCleanupAt = now;
        long cutoff = now.toEpochMilli() - config.retentionMillis();
        try {
            history.deleteOlderThan(cutoff);
            log.info("deleted price history older than {}", Instant.ofEpochMilli(cutoff));
        } catch (StoreException e) {
            log.warn("price history cleanup failed: {}", e.getMessage());
        }
    }

    private static String abbreviate(String sig) {
        return sig == null || sig.length() <= 12 ? sig : sig.substring(0, 12) + "...";
    }
}
