package com.riskengine.sim.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Minimal PostgREST client. Filters use PostgREST syntax ({@code status -> eq.active}); every request carries
 * the service key as both {@code apikey} and bearer token.
 */
@Slf4j
public class StoreClient {

  private static final Duration HTTP_TIMEOUT = Duration.ofSeconds(10);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final String restBase;
  private final String serviceKey;

  public StoreClient(
      @NonNull HttpClient httpClient,
      @NonNull ObjectMapper objectMapper,
      @NonNull URI baseUrl,
      @NonNull String serviceKey
  ) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    String base = baseUrl.toString();
    this.restBase = (base.endsWith("/") ? base.substring(0, base.length() - 1) : base) + "/rest/v1/";
    this.serviceKey = serviceKey;
  }

  /**
   * GET rows. Returns a JSON array, possibly empty.
   */
  public JsonNode select(String table, Map<String, String> query) {
    HttpRequest request = builder(table, query).GET().build();
    JsonNode body = readBody(table, send(table, request));
    return body.isArray() ? body : objectMapper.createArrayNode();
  }

  public void insert(String table, Object rows) {
    HttpRequest request = builder(table, Map.of())
        .header("Content-Type", "application/json")
        .header("Prefer", "return=minimal")
        .POST(HttpRequest.BodyPublishers.ofString(toJson(rows)))
        .build();
    send(table, request);
  }

  public void update(String table, Map<String, String> filter, Object patch) {
    HttpRequest request = builder(table, filter)
        .header("Content-Type", "application/json")
        .header("Prefer", "return=minimal")
        .method("PATCH", HttpRequest.BodyPublishers.ofString(toJson(patch)))
        .build();
    send(table, request);
  }

  public void delete(String table, Map<String, String> filter) {
    if (filter.isEmpty()) {
      throw new IllegalArgumentException("refusing unfiltered delete on " + table);
    }
    HttpRequest request = builder(table, filter).DELETE().build();
    send(table, request);
  }

  URI uri(String table, Map<String, String> query) {
    if (query.isEmpty()) {
      return URI.create(restBase + table);
    }
    String qs = query.entrySet().stream()
        .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
        .collect(Collectors.joining("&"));
    return URI.create(restBase + table + "?" + qs);
  }

  private HttpRequest.Builder builder(String table, Map<String, String> query) {
    return HttpRequest.newBuilder(uri(table, query))
        .timeout(HTTP_TIMEOUT)
        .header("Accept", "application/json")
        .header("apikey", serviceKey)
        .header("Authorization", "Bearer " + serviceKey);
  }

  private HttpResponse<String> send(String table, HttpRequest request) {
    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StoreException(request.method() + " " + table + " interrupted", e);
    } catch (IOException e) {
      throw new StoreException(request.method() + " " + table + " failed: " + e.getMessage(), e);
    }
    int status = response.statusCode();
    if (status / 100 != 2) {
      String body = response.body();
      throw new StoreException(request.method() + " " + table + " HTTP " + status
          + (body == null || body.isBlank() ? "" : ": " + abbreviate(body)), status);
    }
    log.debug("{} {} -> {}", request.method(), table, status);
    return response;
  }

  private JsonNode readBody(String table, HttpResponse<String> response) {
    String body = response.body();
    if (body == null || body.isBlank()) {
      return objectMapper.createArrayNode();
    }
    try {
      return objectMapper.readTree(body);
    } catch (JsonProcessingException e) {
      throw new StoreException("unreadable " + table + " response", e);
    }
  }

  private String toJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new StoreException("failed to serialize request body", e);
    }
  }

  private static String encode(String s) {
    return URLEncoder.encode(s, StandardCharsets.UTF_8);
  }

  private static String abbreviate(String s) {
    return s.length() <= 300 ? s : s.substring(0, 300) + "...";
  }
}
