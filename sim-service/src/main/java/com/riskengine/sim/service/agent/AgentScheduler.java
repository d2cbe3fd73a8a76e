package com.riskengine.sim.service.agent;

import com.riskengine.sim.config.SimProperties;
import com.riskengine.sim.math.I128;
import com.riskengine.sim.price.ReferencePrice;
import com.riskengine.sim.scenario.ScenarioState;
import com.riskengine.sim.service.agent.strategy.TradeDecision;
import com.riskengine.sim.service.agent.strategy.TradingStrategies;
import com.riskengine.sim.service.executor.AgentRegistrar;
import com.riskengine.sim.service.executor.CloseResult;
import com.riskengine.sim.service.executor.TradeExecutor;
import com.riskengine.sim.service.feed.PriceSnapshot;
import com.riskengine.sim.service.leaderboard.LeaderboardAggregator;
import com.riskengine.sim.store.LeaderboardDelta;
import com.riskengine.sim.store.StoreException;
import com.riskengine.sim.store.TradeLogEntry;
import com.riskengine.sim.store.TradeLogRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives the agent fleet. Each tick feeds the current prices into every agent's window, then lets each due agent
 * act in roster order: register if needed, close a position whose hold has elapsed, or ask its strategy for a new
 * entry. Agents run one after another on a single thread.
 */
@Slf4j
public class AgentScheduler {

    static final int JITTER_MIN_SECONDS = 5;
    static final int JITTER_MAX_SECONDS = 15;
    static final int INITIAL_MAX_SECONDS = 30;
    static final int HOLD_MIN_SECONDS = 30;
    static final int HOLD_MAX_SECONDS = 180;

    private final SimProperties.Agents config;
    private final Map<String, SimProperties.Market> markets;
    private final PriceSnapshot prices;
    private final TradingStrategies strategies;
    private final TradeExecutor executor;
    private final AgentRegistrar registrar;
    private final LeaderboardAggregator leaderboard;
    private final TradeLogRepository tradeLog;
    private final AgentRoster roster;
    private final Clock clock;
    private final Random random;
    private final Duration window;
    private final Duration shutdownGrace;

    private final ScheduledExecutorService loop = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "agent-scheduler");
        t.setDaemon(true);
        return t;
    });
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    private final Counter ticks;
    private final Counter opens;
    private final Counter closes;
    private final Counter registrations;
    private final Counter recoveries;
    private final Counter failures;

    public AgentScheduler(
            @NonNull SimProperties properties,
            @NonNull PriceSnapshot prices,
            @NonNull TradingStrategies strategies,
            @NonNull TradeExecutor executor,
            @NonNull AgentRegistrar registrar,
            @NonNull LeaderboardAggregator leaderboard,
            @NonNull TradeLogRepository tradeLog,
            @NonNull AgentRoster roster,
            @NonNull Clock clock,
            @NonNull Random random,
            @NonNull MeterRegistry meterRegistry
    ) {
        this.config = properties.agents();
        this.markets = properties.markets();
        this.prices = prices;
        this.strategies = strategies;
        this.executor = executor;
        this.registrar = registrar;
        this.leaderboard = leaderboard;
        this.tradeLog = tradeLog;
        this.roster = roster;
        this.clock = clock;
        this.random = random;
        this.window = Duration.ofMillis(config.windowMillis());
        this.shutdownGrace = Duration.ofMillis(properties.shutdownGraceMillis());

        Instant start = clock.instant();
        for (Agent agent : roster.agents()) {
            agent.scheduleNext(start.plusSeconds(randomSeconds(JITTER_MIN_SECONDS, INITIAL_MAX_SECONDS)));
        }

        this.ticks = Counter.builder("sim.agents.ticks").register(meterRegistry);
        this.opens = Counter.builder("sim.agents.opens").register(meterRegistry);
        this.closes = Counter.builder("sim.agents.closes").register(meterRegistry);
        this.registrations = Counter.builder("sim.agents.registrations").register(meterRegistry);
        this.recoveries = Counter.builder("sim.agents.recoveries").register(meterRegistry);
        this.failures = Counter.builder("sim.agents.failures").register(meterRegistry);
        Gauge.builder("sim.agents.active", roster,
                        r -> r.agents().stream().filter(a -> a.status() == AgentStatus.ACTIVE).count())
                .register(meterRegistry);
    }

    @PostConstruct
    void startIfEnabled() {
        if (!config.enabled()) {
            log.info("agents are disabled, price feed runs alone");
            return;
        }
        if (roster.size() == 0) {
            log.warn("agent roster is empty, scheduler not started");
            return;
        }
        running.set(true);
        loop.scheduleWithFixedDelay(this::safeTick, config.headStartMillis(), config.tickMillis(), TimeUnit.MILLISECONDS);
        log.info("agent scheduler started (agents={}, tickMillis={}, headStartMillis={})",
                roster.size(), config.tickMillis(), config.headStartMillis());
    }

    @PreDestroy
    void stop() {
        stopRequested.set(true);
        running.set(false);
        loop.shutdown();
        try {
            if (!loop.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("agent tick still running after {} grace", shutdownGrace);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("agent scheduler stopped");
    }

    public boolean isRunning() {
        return running.get() && !loop.isShutdown();
    }

    public int agentCount() {
        return roster.size();
    }

    private void safeTick() {
        try {
            tick();
        } catch (Exception e) {
            failures.increment();
            log.error("agent tick failed, continuing loop", e);
        }
    }

    void tick() {
        ticks.increment();
        Instant now = clock.instant();
        Instant cutoff = now.minus(window);
        for (Agent agent : roster.agents()) {
            prices.latestPrice(agent.market())
                    .ifPresent(p -> agent.window().append(p.adjustedPrice(), now));
            agent.window().prune(cutoff);
        }

        for (Agent agent : roster.agents()) {
            if (!agent.isDue(now)) {
                continue;
            }
            if (stopRequested.get()) {
                log.info("stop requested, leaving remaining agents for later");
                break;
            }
            try {
                runAgent(agent, now);
            } catch (Exception e) {
                failures.increment();
                log.error("{} failed: {}", agent.id(), e.toString());
            }
            agent.scheduleNext(now.plusSeconds(randomSeconds(JITTER_MIN_SECONDS, JITTER_MAX_SECONDS)));
        }

        try {
            leaderboard.flushIfDue(now);
        } catch (Exception e) {
            log.warn("leaderboard flush failed: {}", e.toString());
        }
    }

    private void runAgent(Agent agent, Instant now) throws Exception {
        SimProperties.Market market = markets.get(agent.market());
        if (market == null || !market.isDeployed()) {
            log.debug("{} market {} not deployed, skipping", agent.id(), agent.market());
            return;
        }
        Optional<ReferencePrice> price = prices.latestPrice(agent.market());
        if (price.isEmpty()) {
            log.debug("{} no price for {} yet", agent.id(), agent.market());
            return;
        }
        ReferencePrice current = price.get();

        if (agent.status() != AgentStatus.ACTIVE) {
            AgentRegistrar.Outcome outcome = registrar.ensureRegistered(agent, market, current.adjustedPrice(), now);
            if (outcome == AgentRegistrar.Outcome.RECOVERED) {
                recoveries.increment();
                return;
            }
            registrations.increment();
        }

        Optional<Position> open = agent.position();
        if (open.isPresent()) {
            if (open.get().isHoldElapsed(now)) {
                close(agent, market, current);
            }
            return;
        }

        Optional<ScenarioState> scenario = prices.activeScenario().filter(s -> !s.isExpiredAt(now));
        Optional<TradeDecision> decision = strategies.forType(agent.strategyType())
                .decide(agent.window(), current, scenario, now);
        if (decision.isPresent()) {
            open(agent, market, current, decision.get(), now);
        }
    }

    private void open(Agent agent, SimProperties.Market market, ReferencePrice price, TradeDecision decision, Instant now)
            throws Exception {
        I128 size = decision.signedSize();
        String sig = executor.open(agent, market, size);
        Duration hold = Duration.ofSeconds(randomSeconds(HOLD_MIN_SECONDS, HOLD_MAX_SECONDS));
        agent.openPosition(new Position(size, now, hold, price.adjustedPrice()));
        agent.recordTrade();
        opens.increment();
        log.info("{} OPEN {} size={} notional={} lev={}x @ {} hold={}s sig={}", agent.id(),
                decision.isLong() ? "LONG" : "SHORT", size, String.format("%.0f", decision.notional()),
                String.format("%.1f", decision.leverage()), String.format("%.4f", price.adjustedPrice()),
                hold.toSeconds(), sig);
        logTrade(agent, market, decision.isLong(), size, price.adjustedPrice(), sig);
    }

    private void close(Agent agent, SimProperties.Market market, ReferencePrice price) throws Exception {
        CloseResult result = executor.close(agent, market, price.adjustedPrice());
        Position closed = agent.closePosition();
        agent.recordTrade();
        closes.increment();
        log.info("{} CLOSE {} @ {} pnlE6={} sig={}", agent.id(), closed.isLong() ? "LONG" : "SHORT",
                String.format("%.4f", price.adjustedPrice()), result.realizedPnlE6(), result.signature());

        // closing a long sells, closing a short buys
        logTrade(agent, market, !closed.isLong(), closed.signedSize(), price.adjustedPrice(), result.signature());
        leaderboard.record(new LeaderboardDelta(
                agent.identity().toBase58(),
                agent.displayName(),
                result.realizedPnlE6(),
                result.closedNotionalE6(),
                result.isWin()
        ));
    }

    private void logTrade(Agent agent, SimProperties.Market market, boolean isLong, I128 size, double price, String sig) {
        try {
            tradeLog.insert(new TradeLogEntry(market.slab(), agent.identity().toBase58(), isLong ? "long" : "short",
                    size.abs().longValueExact(), price, 0.0, sig));
        } catch (StoreException | ArithmeticException e) {
            log.warn("{} trade log write failed: {}", agent.id(), e.getMessage());
        }
    }

    private long randomSeconds(int min, int max) {
        return min + random.nextInt(max - min + 1);
    }
}
