package com.riskengine.sim.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StoreClientTest {

  @Mock
  private HttpClient httpClient;

  @Mock
  private HttpResponse<String> response;

  private StoreClient client;

  @BeforeEach
  void setUp() {
    client = new StoreClient(httpClient, new ObjectMapper(), URI.create("https://db.example.co/"), "service-key");
  }

  @Test
  void buildsPostgrestQuery() {
    Map<String, String> query = new LinkedHashMap<>();
    query.put("wallet", "eq.AbC");
    query.put("week_start", "eq.2025-03-10T00:00:00Z");

    URI uri = client.uri("sim_leaderboard", query);

    assertThat(uri.toString()).isEqualTo(
        "https://db.example.co/rest/v1/sim_leaderboard?wallet=eq.AbC&week_start=eq.2025-03-10T00%3A00%3A00Z");
  }

  @Test
  @SuppressWarnings("unchecked")
  void selectSendsServiceKeyHeaders() throws Exception {
    when(response.statusCode()).thenReturn(200);
    when(response.body()).thenReturn("[{\"id\":1}]");
    when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenReturn(response);

    JsonNode rows = client.select("sim_scenarios", Map.of("limit", "1"));

    ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(request.capture(), any(HttpResponse.BodyHandler.class));
    assertThat(request.getValue().headers().firstValue("apikey")).contains("service-key");
    assertThat(request.getValue().headers().firstValue("Authorization")).contains("Bearer service-key");
    assertThat(rows.isArray()).isTrue();
    assertThat(rows.get(0).path("id").asInt()).isEqualTo(1);
  }

  @Test
  @SuppressWarnings("unchecked")
  void errorStatusBecomesStoreException() throws Exception {
    when(response.statusCode()).thenReturn(409);
    when(response.body()).thenReturn("{\"message\":\"duplicate key\"}");
    when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenReturn(response);

    assertThatThrownBy(() -> client.insert("trades", Map.of("side", "long")))
        .isInstanceOf(StoreException.class)
        .hasMessageContaining("HTTP 409")
        .hasMessageContaining("duplicate key")
        .satisfies(e -> assertThat(((StoreException) e).status()).isEqualTo(409));
  }

  @Test
  @SuppressWarnings("unchecked")
  void transportFailureBecomesStoreException() throws Exception {
    when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
        .thenThrow(new IOException("connection reset"));

    assertThatThrownBy(() -> client.delete("sim_price_history", Map.of("timestamp", "lt.1")))
        .isInstanceOf(StoreException.class)
        .hasMessageContaining("connection reset");
  }

  @Test
  void refusesUnfilteredDelete() {
    assertThatThrownBy(() -> client.delete("sim_price_history", Map.of()))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(httpClient);
  }
}
