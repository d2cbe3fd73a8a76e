package com.riskengine.sim.service.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.riskengine.sim.config.SimProperties;
import com.riskengine.sim.ledger.JsonRpcLedgerClient;
import com.riskengine.sim.ledger.LedgerClient;
import com.riskengine.sim.ledger.LedgerKeypair;
import com.riskengine.sim.ledger.LedgerPublicKey;
import com.riskengine.sim.ledger.LedgerSession;
import com.riskengine.sim.ledger.Sleeper;
import com.riskengine.sim.ledger.TransactionSubmitter;
import com.riskengine.sim.price.HermesPriceClient;
import com.riskengine.sim.price.ReferencePriceSource;
import com.riskengine.sim.service.agent.AgentRoster;
import com.riskengine.sim.service.agent.AgentRosterLoader;
import com.riskengine.sim.service.agent.AgentScheduler;
import com.riskengine.sim.service.agent.strategy.TradingStrategies;
import com.riskengine.sim.service.executor.AgentRegistrar;
import com.riskengine.sim.service.executor.TradeExecutor;
import com.riskengine.sim.service.feed.LedgerOracleGateway;
import com.riskengine.sim.service.feed.OracleGateway;
import com.riskengine.sim.service.feed.PriceFeed;
import com.riskengine.sim.service.leaderboard.LeaderboardAggregator;
import com.riskengine.sim.store.LeaderboardRepository;
import com.riskengine.sim.store.PriceHistoryRepository;
import com.riskengine.sim.store.RestLeaderboardRepository;
import com.riskengine.sim.store.RestPriceHistoryRepository;
import com.riskengine.sim.store.RestScenarioRepository;
import com.riskengine.sim.store.RestTradeLogRepository;
import com.riskengine.sim.store.ScenarioRepository;
import com.riskengine.sim.store.StoreClient;
import com.riskengine.sim.store.TradeLogRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.Random;

/**
 * Wires the ledger session, the store repositories and the agent fleet from {@link SimProperties}.
 * The price feed and scenario engine are picked up by component scan.
 */
@Slf4j
@Configuration
public class SimServiceConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Random random(SimProperties properties) {
        long seed = properties.agents().seed();
        if (seed == 0) {
            return new Random();
        }
        log.info("using fixed random seed {}", seed);
        return new Random(seed);
    }

    @Bean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    // Ledger

    @Bean
    public LedgerClient ledgerClient(SimProperties properties) {
        SimProperties.Ledger ledger = properties.ledger();
        return new JsonRpcLedgerClient(URI.create(ledger.rpcUrl()), ledger.commitment());
    }

    @Bean
    public LedgerSession ledgerSession(SimProperties properties, LedgerClient ledgerClient, Clock clock) {
        return new LedgerSession(ledgerClient, LedgerPublicKey.fromBase58(properties.ledger().programId()), clock);
    }

    @Bean
    public TransactionSubmitter transactionSubmitter(SimProperties properties, LedgerClient ledgerClient) {
        SimProperties.Ledger ledger = properties.ledger();
        return new TransactionSubmitter(
                ledgerClient,
                Sleeper.THREAD,
                Duration.ofMillis(ledger.confirmPollMillis()),
                Duration.ofMillis(ledger.confirmTimeoutMillis())
        );
    }

    /**
     * Oracle authority, fee payer, collateral mint authority and liquidity-provider counterparty.
     */
    @Bean
    public LedgerKeypair operatorKeypair(SimProperties properties) {
        LedgerKeypair operator = LedgerKeypair.fromBase58(properties.ledger().adminKeypair());
        log.info("operator identity {}", operator.publicKey());
        return operator;
    }

    // Store

    @Bean
    public StoreClient storeClient(SimProperties properties, HttpClient httpClient, ObjectMapper objectMapper) {
        SimProperties.Store store = properties.store();
        return new StoreClient(httpClient, objectMapper, URI.create(store.url()), store.serviceKey());
    }

    @Bean
    public ScenarioRepository scenarioRepository(StoreClient storeClient) {
        return new RestScenarioRepository(storeClient);
    }

    @Bean
    public PriceHistoryRepository priceHistoryRepository(StoreClient storeClient) {
        return new RestPriceHistoryRepository(storeClient);
    }

    @Bean
    public TradeLogRepository tradeLogRepository(StoreClient storeClient) {
        return new RestTradeLogRepository(storeClient);
    }

    @Bean
    public LeaderboardRepository leaderboardRepository(StoreClient storeClient) {
        return new RestLeaderboardRepository(storeClient);
    }

    // Price feed

    @Bean
    public ReferencePriceSource referencePriceSource(SimProperties properties, HttpClient httpClient, ObjectMapper objectMapper) {
        SimProperties.Feed feed = properties.feed();
        return new HermesPriceClient(httpClient, objectMapper, URI.create(feed.priceUrl()), feed.priceFeedIds());
    }

    @Bean
    public OracleGateway oracleGateway(
            SimProperties properties,
            LedgerSession ledgerSession,
            TransactionSubmitter transactionSubmitter,
            LedgerKeypair operatorKeypair
    ) {
        return new LedgerOracleGateway(ledgerSession, transactionSubmitter, operatorKeypair, properties.feed());
    }

    // Agents

    @Bean
    public TradeExecutor tradeExecutor(
            SimProperties properties,
            LedgerSession ledgerSession,
            TransactionSubmitter transactionSubmitter,
            LedgerKeypair operatorKeypair,
            MeterRegistry meterRegistry
    ) {
        return new TradeExecutor(ledgerSession, transactionSubmitter, operatorKeypair, properties.agents(), meterRegistry);
    }

    @Bean
    public AgentRegistrar agentRegistrar(
            SimProperties properties,
            LedgerSession ledgerSession,
            TransactionSubmitter transactionSubmitter,
            LedgerKeypair operatorKeypair
    ) {
        return new AgentRegistrar(ledgerSession, transactionSubmitter, operatorKeypair, properties.agents());
    }

    @Bean
    public TradingStrategies tradingStrategies(SimProperties properties, Random random) {
        return new TradingStrategies(random, Duration.ofMillis(properties.agents().lookbackMillis()));
    }

    @Bean
    public AgentRoster agentRoster(SimProperties properties, ObjectMapper objectMapper) {
        if (!properties.agents().enabled()) {
            return new AgentRoster(null);
        }
        return new AgentRosterLoader(objectMapper).load(properties.agents());
    }

    @Bean
    public LeaderboardAggregator leaderboardAggregator(
            SimProperties properties,
            LeaderboardRepository leaderboardRepository,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        return new LeaderboardAggregator(properties.leaderboard(), leaderboardRepository, clock, meterRegistry);
    }

    @Bean
    public AgentScheduler agentScheduler(
            SimProperties properties,
            PriceFeed priceFeed,
            TradingStrategies tradingStrategies,
            TradeExecutor tradeExecutor,
            AgentRegistrar agentRegistrar,
            LeaderboardAggregator leaderboardAggregator,
            TradeLogRepository tradeLogRepository,
            AgentRoster agentRoster,
            Clock clock,
            Random random,
            MeterRegistry meterRegistry
    ) {
        return new AgentScheduler(properties, priceFeed, tradingStrategies, tradeExecutor, agentRegistrar,
                leaderboardAggregator, tradeLogRepository, agentRoster, clock, random, meterRegistry);
    }
}
