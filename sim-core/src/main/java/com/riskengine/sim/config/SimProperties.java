package com.riskengine.sim.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Validated
@ConfigurationProperties(prefix="sim")
public record SimProperties(
    @Valid Ledger ledger,
    @Valid Store store,
    @Valid Feed feed,
    @Valid Agents agents,
    @Valid Leaderboard leaderboard,
    Map<String, @Valid Market> markets,
    @NotNull @PositiveOrZero Long shutdownGraceMillis
) {

  public SimProperties {
    if (ledger == null) {
      ledger = new Ledger(null, null, null, null, null, null);
    }
    if (store == null) {
      store = new Store(null, null);
    }
    if (feed == null) {
      feed = new Feed(null, null, null, null, null, null, null, null, null, null, null, null, null, null);
    }
    if (agents == null) {
      agents = new Agents(null, null, null, null, null, null, null, null, null, null, null, null, null, null);
    }
    if (leaderboard == null) {
      leaderboard = new Leaderboard(null, null, null, null);
    }
    markets = markets == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(markets));
    if (shutdownGraceMillis == null) {
      shutdownGraceMillis = 2_000L;
    }
  }

  /**
   * Ledger node connection and the operator identity. The operator signs price pushes, pays fees, funds agent
   * collateral, and acts as the liquidity-provider counterparty on every trade.
   */
  public record Ledger(
      @NotBlank String rpcUrl,
      @NotBlank String commitment,
      @NotBlank String programId,
      /**
       * Base58 of the 64-byte secret key.
       */
      @NotBlank String adminKeypair,
      @NotNull @Min(100) Long confirmPollMillis,
      @NotNull @Min(1_000) Long confirmTimeoutMillis
  ) {
    public Ledger {
      if (commitment == null || commitment.isBlank()) {
        commitment = "confirmed";
      }
      if (confirmPollMillis == null) {
        confirmPollMillis = 2_000L;
      }
      if (confirmTimeoutMillis == null) {
        confirmTimeoutMillis = 60_000L;
      }
    }
  }

  /**
   * PostgREST endpoint of the relational store.
   */
  public record Store(
      @NotBlank String url,
      @NotBlank String serviceKey
  ) {
  }

  public record Feed(
      @NotNull @Min(100) Long tickMillis,
      @NotNull @Min(0) Long scenarioRefreshMillis,
      @NotBlank String priceUrl,
      /**
       * Pyth feed id per symbol.
       */
      Map<String, String> priceFeedIds,
      @NotNull @PositiveOrZero Long priorityFeeMicroLamports,
      @NotNull @Positive Integer pushComputeUnits,
      @NotNull @Positive Integer crankComputeUnits,
      @NotNull @Min(0) Long flushIntervalMillis,
      @NotNull @Positive Integer flushBatchSize,
      @NotNull @Positive Integer bufferCap,
      @NotNull @Min(1_000) Long cleanupIntervalMillis,
      @NotNull @Min(60_000) Long retentionMillis,
      /**
       * Health turns degraded when no price was produced for this long.
       */
      @NotNull @Min(1_000) Long stalenessMillis,
      @NotNull Boolean enabled
  ) {
    public Feed {
      if (tickMillis == null) {
        tickMillis = 5_000L;
      }
      if (scenarioRefreshMillis == null) {
        scenarioRefreshMillis = 10_000L;
      }
      if (priceUrl == null || priceUrl.isBlank()) {
        priceUrl = "https://hermes.pyth.network/v2/updates/price/latest";
      }
      if (priceFeedIds == null || priceFeedIds.isEmpty()) {
        priceFeedIds = defaultPriceFeedIds();
      }
      if (priorityFeeMicroLamports == null) {
        priorityFeeMicroLamports = 50_000L;
      }
      if (pushComputeUnits == null) {
        pushComputeUnits = 200_000;
      }
      if (crankComputeUnits == null) {
        crankComputeUnits = 400_000;
      }
      if (flushIntervalMillis == null) {
        flushIntervalMillis = 10_000L;
      }
      if (flushBatchSize == null) {
        flushBatchSize = 50;
      }
      if (bufferCap == null) {
        bufferCap = 200;
      }
      if (cleanupIntervalMillis == null) {
        cleanupIntervalMillis = 300_000L;
      }
      if (retentionMillis == null) {
        retentionMillis = 86_400_000L;
      }
      if (stalenessMillis == null) {
        stalenessMillis = 30_000L;
      }
      if (enabled == null) {
        enabled = true;
      }
    }
  }

  private static Map<String, String> defaultPriceFeedIds() {
    Map<String, String> ids = new LinkedHashMap<>();
    ids.put("SOL/USD", "ef0d8b6fda2ceba41da15d4095d1da392a0d2f8ed0c6c7bc0f4cfac8c280b56d");
    ids.put("BTC/USD", "e62df6c8b4a85fe1a67db44dc12de5db330f7ac66b72dc658afedf0f4a415b43");
    ids.put("ETH/USD", "ff61491a931112ddf1bd8147cd1b641375f79f5825126d665480874634fd0ace");
    return ids;
  }

  public record Agents(
      /**
       * Runs the price feed alone when set.
       */
      @NotNull Boolean disabled,
      /**
       * Roster as an inline JSON array. Takes precedence over {@code rosterFile}.
       */
      String rosterJson,
      String rosterFile,
      @NotNull @Min(100) Long tickMillis,
      @NotNull @PositiveOrZero Long headStartMillis,
      @NotNull @PositiveOrZero Long priorityFeeMicroLamports,
      @NotNull @Positive Integer tradeComputeUnits,
      @NotNull @Positive Integer setupComputeUnits,
      /**
       * Collateral deposited on registration, in token base units.
       */
      @NotNull @Positive Long initialDeposit,
      @NotNull @PositiveOrZero Long registrationFee,
      @NotNull @Min(0) Integer lpIndex,
      @NotNull @Min(60_000) Long windowMillis,
      @NotNull @Min(1_000) Long lookbackMillis,
      /**
       * Seed for every stochastic choice. 0 picks a fresh seed per process.
       */
      @NotNull @PositiveOrZero Long seed
  ) {
    public Agents {
      if (disabled == null) {
        disabled = false;
      }
      if (tickMillis == null) {
        tickMillis = 1_000L;
      }
      if (headStartMillis == null) {
        headStartMillis = 5_000L;
      }
      if (priorityFeeMicroLamports == null) {
        priorityFeeMicroLamports = 30_000L;
      }
      if (tradeComputeUnits == null) {
        tradeComputeUnits = 300_000;
      }
      if (setupComputeUnits == null) {
        setupComputeUnits = 200_000;
      }
      if (initialDeposit == null) {
        initialDeposit = 1_000_000_000L;
      }
      if (registrationFee == null) {
        registrationFee = 1_000_000L;
      }
      if (lpIndex == null) {
        lpIndex = 0;
      }
      if (windowMillis == null) {
        windowMillis = 600_000L;
      }
      if (lookbackMillis == null) {
        lookbackMillis = 60_000L;
      }
      if (seed == null) {
        seed = 0L;
      }
    }

    public boolean enabled() {
      return !disabled;
    }
  }

  public record Leaderboard(
      @NotNull @Min(0) Long flushIntervalMillis,
      @NotNull @Positive Integer flushThreshold,
      @NotNull @Positive Integer batchSize,
      @NotNull @Positive Integer bufferCap
  ) {
    public Leaderboard {
      if (flushIntervalMillis == null) {
        flushIntervalMillis = 15_000L;
      }
      if (flushThreshold == null) {
        flushThreshold = 10;
      }
      if (batchSize == null) {
        batchSize = 20;
      }
      if (bufferCap == null) {
        bufferCap = 200;
      }
    }
  }

  /**
   * One simulated market, keyed by symbol (e.g. {@code SOL/USD}). A blank slab means "not deployed yet".
   */
  public record Market(
      String slab,
      String oracle,
      String collateralMint,
      String vault,
      String name
  ) {
    public Market {
      if (slab == null) {
        slab = "";
      }
    }

    public boolean isDeployed() {
      return !slab.isBlank();
    }

    /**
     * Admin-oracle markets read the pushed price from the slab itself.
     */
    public String oracleOrSlab() {
      return oracle == null || oracle.isBlank() ? slab : oracle;
    }
  }
}
