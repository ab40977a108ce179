package com.snipebot.bridge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Sends bridge requests and folds every outcome, including transport failures, into a {@link BridgeResult}.
 */
@Slf4j
public class BridgeHttpTransport {

  static final String UNREACHABLE_MESSAGE = "Marketplace bridge not running. Restart the bridge service.";

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;

  public BridgeHttpTransport(@NonNull HttpClient httpClient, @NonNull ObjectMapper objectMapper) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  /**
   * Sends without blocking the caller. The returned future completes on the HTTP client's executor and never
   * completes exceptionally.
   */
  public CompletableFuture<BridgeResult> send(HttpRequest request) {
    CompletableFuture<HttpResponse<String>> response;
    try {
      response = httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
    } catch (RuntimeException e) {
      return CompletableFuture.completedFuture(transportFailure(request, e));
    }
    return response.handle((ok, error) -> error == null
        ? decode(ok.statusCode(), ok.body())
        : transportFailure(request, error));
  }

  BridgeResult transportFailure(HttpRequest request, Throwable error) {
    Throwable cause = error;
    while (cause instanceof CompletionException && cause.getCause() != null) {
      cause = cause.getCause();
    }
    if (cause instanceof ConnectException || cause.getCause() instanceof ConnectException) {
      log.warn("bridge unreachable uri={}", request.uri().getPath());
      return BridgeResult.failure(BridgeErrorCode.BRIDGE_UNREACHABLE, UNREACHABLE_MESSAGE);
    }
    if (cause instanceof HttpTimeoutException) {
      return BridgeResult.failure(BridgeErrorCode.REQUEST_FAILED, "Bridge request timed out");
    }
    return BridgeResult.failure(BridgeErrorCode.REQUEST_FAILED, String.valueOf(cause.getMessage()));
  }

  /**
   * Raw JSON body, or {@code null} when the call fails for any reason.
   */
  public JsonNode fetchJson(HttpRequest request) {
    try {
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      return objectMapper.readTree(response.body());
    } catch (IOException e) {
      log.debug("bridge json fetch failed uri={} error={}", request.uri().getPath(), e.toString());
      return null;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return null;
    }
  }

  public ObjectMapper objectMapper() {
    return objectMapper;
  }

  BridgeResult decode(int status, String body) {
    JsonNode json;
    try {
      json = body == null || body.isBlank() ? null : objectMapper.readTree(body);
    } catch (JsonProcessingException e) {
      json = null;
    }

    if (json != null && json.has("ok")) {
      if (json.path("ok").asBoolean(false)) {
        return BridgeResult.success(json.path("data"));
      }
      return BridgeResult.failure(
          json.path("code").asText(BridgeErrorCode.HTTP_ERROR.name()),
          json.path("message").asText(null));
    }

    if (status == 429) {
      return BridgeResult.failure(BridgeErrorCode.RATE_LIMITED, "Rate limited (HTTP 429)");
    }
    if (status == 403) {
      return BridgeResult.failure(BridgeErrorCode.FORBIDDEN, "Forbidden (HTTP 403)");
    }
    if (status == 401) {
      return BridgeResult.failure(BridgeErrorCode.SESSION_EXPIRED, "Session expired (HTTP 401)");
    }
    if (status < 200 || status >= 300) {
      return BridgeResult.failure(BridgeErrorCode.HTTP_ERROR, "HTTP " + status);
    }
    if (json == null) {
      return BridgeResult.failure(BridgeErrorCode.PARSE_ERROR, "Bridge returned a non-JSON body");
    }
    return BridgeResult.success(json);
  }
}
