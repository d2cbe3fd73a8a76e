package com.riskengine.sim.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

class SimPropertiesBindingTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(TestConfig.class)
      .withPropertyValues(
          "sim.ledger.rpc-url=http://localhost:8899",
          "sim.ledger.program-id=11111111111111111111111111111111",
          "sim.ledger.admin-keypair=secret",
          "sim.store.url=https://db.example.co",
          "sim.store.service-key=key"
      );

  @Test
  void appliesDefaultsWhenOnlyRequiredValuesAreSet() {
    runner.run(context -> {
      assertThat(context).hasNotFailed();
      SimProperties properties = context.getBean(SimProperties.class);

      assertThat(properties.ledger().commitment()).isEqualTo("confirmed");
      assertThat(properties.feed().tickMillis()).isEqualTo(5_000L);
      assertThat(properties.feed().flushBatchSize()).isEqualTo(50);
      assertThat(properties.feed().priceFeedIds()).containsKeys("SOL/USD", "BTC/USD", "ETH/USD");
      assertThat(properties.agents().enabled()).isTrue();
      assertThat(properties.agents().initialDeposit()).isEqualTo(1_000_000_000L);
      assertThat(properties.leaderboard().batchSize()).isEqualTo(20);
      assertThat(properties.markets()).isEmpty();
      assertThat(properties.shutdownGraceMillis()).isEqualTo(2_000L);
    });
  }

  @Test
  void bindsSymbolKeyedMarkets() {
    runner.withPropertyValues(
        "sim.markets[BTC/USD].slab=Slab2",
        "sim.markets[BTC/USD].name=BTC Perp",
        "sim.markets[SOL/USD].name=SOL Perp",
        "sim.agents.disabled=true"
    ).run(context -> {
      SimProperties properties = context.getBean(SimProperties.class);

      assertThat(properties.markets()).containsOnlyKeys("BTC/USD", "SOL/USD");
      assertThat(properties.markets().get("BTC/USD").isDeployed()).isTrue();
      assertThat(properties.markets().get("BTC/USD").oracleOrSlab()).isEqualTo("Slab2");
      assertThat(properties.markets().get("SOL/USD").isDeployed()).isFalse();
      assertThat(properties.agents().enabled()).isFalse();
    });
  }

  @Test
  void missingLedgerEndpointFailsStartup() {
    new ApplicationContextRunner()
        .withUserConfiguration(TestConfig.class)
        .withPropertyValues("sim.store.url=https://db.example.co", "sim.store.service-key=key")
        .run(context -> assertThat(context).hasFailed());
  }

  @Configuration(proxyBeanMethods=false)
  @EnableConfigurationProperties(SimProperties.class)
  static class TestConfig {
  }
}
