package com.riskengine.sim.price;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Pyth Hermes "latest price update" client. Price = {@code price x 10^expo}.
 */
@Slf4j
public class HermesPriceClient implements ReferencePriceSource {

  private static final Duration HTTP_TIMEOUT = Duration.ofSeconds(5);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final URI endpoint;
  private final Map<String, String> symbolByFeedId;

  /**
   * @param feedIdsBySymbol e.g. {@code SOL/USD -> ef0d8b...}
   */
  public HermesPriceClient(
      @NonNull HttpClient httpClient,
      @NonNull ObjectMapper objectMapper,
      @NonNull URI latestPriceUrl,
      @NonNull Map<String, String> feedIdsBySymbol
  ) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.symbolByFeedId = new LinkedHashMap<>();
    feedIdsBySymbol.forEach((symbol, id) -> symbolByFeedId.put(normalizeId(id), symbol));
    String query = symbolByFeedId.keySet().stream()
        .map(id -> "ids[]=" + id)
        .collect(Collectors.joining("&"));
    this.endpoint = URI.create(latestPriceUrl + (query.isEmpty() ? "" : "?" + query));
  }

  @Override
  public Map<String, Double> fetchLatest() throws IOException {
    if (symbolByFeedId.isEmpty()) {
      return Map.of();
    }
    HttpRequest request = HttpRequest.newBuilder(endpoint)
        .GET()
        .timeout(HTTP_TIMEOUT)
        .header("Accept", "application/json")
        .build();
    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("interrupted fetching reference prices");
    }
    if (response.statusCode() / 100 != 2) {
      throw new IOException("Hermes HTTP " + response.statusCode());
    }
    return parse(objectMapper.readTree(response.body()));
  }

  Map<String, Double> parse(JsonNode body) {
    Map<String, Double> prices = new LinkedHashMap<>();
    for (JsonNode parsed : body.path("parsed")) {
      String symbol = symbolByFeedId.get(normalizeId(parsed.path("id").asText("")));
      if (symbol == null) {
        continue;
      }
      JsonNode price = parsed.path("price");
      String mantissa = price.path("price").asText(null);
      if (mantissa == null || mantissa.isBlank()) {
        log.debug("no price mantissa for {}", symbol);
        continue;
      }
      try {
        double value = new BigDecimal(mantissa).scaleByPowerOfTen(price.path("expo").asInt()).doubleValue();
        if (value > 0) {
          prices.put(symbol, value);
        }
      } catch (NumberFormatException e) {
        log.warn("unparseable Hermes price for {}: {}", symbol, mantissa);
      }
    }
    return prices;
  }

  private static String normalizeId(String id) {
    String trimmed = id.trim().toLowerCase(Locale.ROOT);
    return trimmed.startsWith("0x") ? trimmed.substring(2) : trimmed;
  }
}
