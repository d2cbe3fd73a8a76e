package com.riskengine.sim.service.feed;

import com.riskengine.sim.config.SimProperties;
import com.riskengine.sim.price.ReferencePriceSource;
import com.riskengine.sim.scenario.ScenarioState;
import com.riskengine.sim.scenario.ScenarioType;
import com.riskengine.sim.service.MutableClock;
import com.riskengine.sim.service.TestFixtures;
import com.riskengine.sim.service.scenario.ScenarioEngine;
import com.riskengine.sim.store.PriceHistoryRepository;
import com.riskengine.sim.store.PriceRecord;
import com.riskengine.sim.store.ScenarioRepository;
import com.riskengine.sim.store.StoreException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class PriceFeedTest {

    private static final Instant T0 = Instant.parse("2025-03-10T12:00:00Z");

    private final SimProperties.Market sol = TestFixtures.market(1);
    private final SimProperties.Market btc = new SimProperties.Market("", null, null, null, "btc pending");
    private final SimProperties.Market eth = TestFixtures.market(3);

    private ReferencePriceSource priceSource;
    private ScenarioRepository scenarios;
    private OracleGateway oracle;
    private PriceHistoryRepository history;
    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() throws Exception {
        priceSource = mock(ReferencePriceSource.class);
        scenarios = mock(ScenarioRepository.class);
        oracle = mock(OracleGateway.class);
        history = mock(PriceHistoryRepository.class);
        clock = new MutableClock(T0);
        meterRegistry = new SimpleMeterRegistry();

        when(priceSource.fetchLatest()).thenReturn(Map.of("SOL/USD", 150.0, "BTC/USD", 60_000.0, "ETH/USD", 3_000.0));
        when(oracle.pushAndCrank(any(), anyLong())).thenReturn("5xCrankSignature111111111111");
    }

    @Test
    void pushesOnlyDeployedMarkets() throws Exception {
        PriceFeed feed = feed(null);

        feed.tick();

        verify(oracle).pushAndCrank(sol, 150_000_000L);
        verify(oracle).pushAndCrank(eth, 3_000_000_000L);
        verify(oracle, never()).pushAndCrank(eq(btc), anyLong());
        assertThat(feed.latestPrice("BTC/USD")).isEmpty();
        assertThat(feed.latestPrice("SOL/USD")).hasValueSatisfying(p -> {
            assertThat(p.rawPrice()).isEqualTo(150.0);
            assertThat(p.priceE6()).isEqualTo(150_000_000L);
            assertThat(p.observedAt()).isEqualTo(T0);
        });
        assertThat(feed.lastPriceAt()).contains(T0);
        assertThat(feed.bufferedRecords()).isEqualTo(2);
    }

    @Test
    void failedFetchSkipsTheTick() throws Exception {
        when(priceSource.fetchLatest()).thenThrow(new IOException("HTTP 502"));
        PriceFeed feed = feed(null);

        feed.tick();

        verifyNoInteractions(oracle);
        assertThat(feed.latestPrices()).isEmpty();
        assertThat(feed.lastPriceAt()).isEmpty();
        assertThat(meterRegistry.counter("sim.feed.tick.failures").count()).isEqualTo(1.0);
    }

    @Test
    void failedPushDoesNotStopOtherMarkets() throws Exception {
        when(oracle.pushAndCrank(eq(sol), anyLong())).thenThrow(new IOException("blockhash not found"));
        PriceFeed feed = feed(null);

        feed.tick();

        verify(oracle).pushAndCrank(eth, 3_000_000_000L);
        assertThat(feed.latestPrice("SOL/USD")).isPresent();
        assertThat(feed.bufferedRecords()).isEqualTo(1);
        assertThat(meterRegistry.counter("sim.feed.push.failures").count()).isEqualTo(1.0);
    }

    @Test
    void appliesActiveScenarioToPushedPrice() throws Exception {
        when(scenarios.findLatestActive()).thenReturn(Optional.of(
                new ScenarioState("scn-7", ScenarioType.FLASH_CRASH, T0.minusSeconds(30), T0.plusSeconds(30))));
        PriceFeed feed = feed(null);

        feed.tick();

        verify(oracle).pushAndCrank(sol, 105_000_000L);
        assertThat(feed.activeScenario()).map(s -> s.type()).contains(ScenarioType.FLASH_CRASH);
        assertThat(feed.latestPrice("SOL/USD").orElseThrow().adjustedPrice()).isCloseTo(105.0, within(1e-9));
    }

    @Test
    void flushesOnceIntervalElapses() {
        PriceFeed feed = feed(null);

        feed.tick();
        verify(history, never()).insertBatch(anyList());

        clock.advance(Duration.ofSeconds(10));
        feed.tick();

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<PriceRecord>> batch = ArgumentCaptor.forClass(List.class);
        verify(history).insertBatch(batch.capture());
        assertThat(batch.getValue()).hasSize(4);
        PriceRecord first = batch.getValue().get(0);
        assertThat(first.symbol()).isEqualTo("SOL/USD");
        assertThat(first.slabAddress()).isEqualTo(sol.slab());
        assertThat(first.rawPriceE6()).isEqualTo(150_000_000L);
        assertThat(first.scenarioType()).isNull();
        assertThat(first.timestamp()).isEqualTo(T0.toEpochMilli());
        assertThat(feed.bufferedRecords()).isZero();
    }

    @Test
    void failedFlushRequeuesAtHeadAndDropsOldestOverCap() {
        SimProperties.Feed small = new SimProperties.Feed(null, null, null, null, null, null, null,
                3_600_000L, 2, 3, null, null, null, false);
        PriceFeed feed = feed(small, Map.of("SOL/USD", sol));
        doThrow(new StoreException("store unavailable", 503))
                .doThrow(new StoreException("store unavailable", 503))
                .doThrow(new StoreException("store unavailable", 503))
                .doNothing()
                .when(history).insertBatch(anyList());

        for (int i = 0; i < 4; i++) {
            feed.tick();
            clock.advance(Duration.ofSeconds(5));
        }
        assertThat(feed.bufferedRecords()).isEqualTo(3);
        assertThat(meterRegistry.counter("sim.feed.records.dropped").count()).isEqualTo(1.0);

        feed.tick();

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<PriceRecord>> batch = ArgumentCaptor.forClass(List.class);
        verify(history, times(4)).insertBatch(batch.capture());
        assertThat(batch.getValue()).extracting(PriceRecord::timestamp)
                .containsExactly(T0.plusSeconds(5).toEpochMilli(), T0.plusSeconds(10).toEpochMilli());
        assertThat(feed.bufferedRecords()).isEqualTo(2);
    }

    @Test
    void deletesExpiredHistoryEveryCleanupInterval() {
        PriceFeed feed = feed(null);
        doNothing().when(history).deleteOlderThan(anyLong());

        feed.tick();
        verify(history, never()).deleteOlderThan(anyLong());

        clock.advance(Duration.ofMinutes(5));
        feed.tick();

        Instant now = T0.plus(Duration.ofMinutes(5));
        verify(history).deleteOlderThan(now.minus(Duration.ofHours(24)).toEpochMilli());
    }

    private PriceFeed feed(SimProperties.Feed feedConfig) {
        Map<String, SimProperties.Market> markets = new LinkedHashMap<>();
        markets.put("SOL/USD", sol);
        markets.put("BTC/USD", btc);
        markets.put("ETH/USD", eth);
        return feed(feedConfig, markets);
    }

    private PriceFeed feed(SimProperties.Feed feedConfig, Map<String, SimProperties.Market> markets) {
        SimProperties properties = new SimProperties(null, null, feedConfig, null, null, markets, null);
        ScenarioEngine scenarioEngine = new ScenarioEngine(scenarios, clock, new Random(1), Duration.ofSeconds(10));
        return new PriceFeed(properties, priceSource, scenarioEngine, oracle, history, clock, meterRegistry);
    }
}
