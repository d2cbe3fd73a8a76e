package com.riskengine.sim.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.riskengine.sim.scenario.ScenarioState;
import com.riskengine.sim.scenario.ScenarioType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RestScenarioRepositoryTest {

  private final ObjectMapper mapper = new ObjectMapper();

  @Mock
  private StoreClient store;

  @Test
  void queriesNewestActiveScenario() throws Exception {
    when(store.select(eq("sim_scenarios"), anyMap())).thenReturn(mapper.readTree("""
        [{"id":"abc","scenario_type":"flash-crash",
          "activated_at":"2025-03-10T12:00:00+00:00","expires_at":"2025-03-10T12:01:00+00:00"}]
        """));

    Optional<ScenarioState> state = new RestScenarioRepository(store).findLatestActive();

    @SuppressWarnings("unchecked")
    ArgumentCaptor<Map<String, String>> query = ArgumentCaptor.forClass(Map.class);
    verify(store).select(eq("sim_scenarios"), query.capture());
    assertThat(query.getValue())
        .containsEntry("status", "eq.active")
        .containsEntry("order", "activated_at.desc")
        .containsEntry("limit", "1");
    assertThat(state).isPresent();
    assertThat(state.get().type()).isEqualTo(ScenarioType.FLASH_CRASH);
    assertThat(state.get().expiresAt()).isEqualTo(Instant.parse("2025-03-10T12:01:00Z"));
  }

  @Test
  void missingExpiryUsesTypeDefault() throws Exception {
    JsonNode row = mapper.readTree("""
        {"id":"x","scenario_type":"short_squeeze","activated_at":"2025-03-10 12:00:00+00","expires_at":null}
        """);

    ScenarioState state = RestScenarioRepository.fromRow(row).orElseThrow();

    assertThat(state.type()).isEqualTo(ScenarioType.SHORT_SQUEEZE);
    assertThat(state.activatedAt()).isEqualTo(Instant.parse("2025-03-10T12:00:00Z"));
    assertThat(state.expiresAt()).isEqualTo(Instant.parse("2025-03-10T12:02:00Z"));
  }

  @Test
  void unknownTypeOrMissingActivationIsIgnored() throws Exception {
    assertThat(RestScenarioRepository.fromRow(mapper.readTree("""
        {"id":"x","scenario_type":"meteor","activated_at":"2025-03-10T12:00:00Z"}
        """))).isEmpty();
    assertThat(RestScenarioRepository.fromRow(mapper.readTree("""
        {"id":"x","scenario_type":"black-swan"}
        """))).isEmpty();
  }

  @Test
  void noRowsMeansNoScenario() {
    when(store.select(eq("sim_scenarios"), anyMap())).thenReturn(mapper.createArrayNode());

    assertThat(new RestScenarioRepository(store).findLatestActive()).isEmpty();
  }
}
