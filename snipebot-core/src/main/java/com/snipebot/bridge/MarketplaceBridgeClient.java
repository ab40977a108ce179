package com.snipebot.bridge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Client for the local HTTP bridge that performs marketplace requests with a browser-like fingerprint.
 *
 * The session cookie travels in {@code X-Vinted-Cookie}; the proxy, when given, as the {@code proxy} query
 * parameter. Calls return at once; the
 * configured timeout bounds how long the returned future can stay pending.
 */
@Slf4j
public final class MarketplaceBridgeClient implements SearchClient, CheckoutClient {

  static final String COOKIE_HEADER = "X-Vinted-Cookie";
  static final String MISSING_COOKIE_MESSAGE = "No session cookie. Connect the marketplace account in settings.";

  private final BridgeRequestFactory requestFactory;
  private final BridgeHttpTransport transport;
  private final SessionCredentials credentials;
  private final Duration timeout;

  public MarketplaceBridgeClient(@NonNull URI baseUri,
                                 @NonNull BridgeHttpTransport transport,
                                 @NonNull SessionCredentials credentials,
                                 @NonNull Duration timeout) {
    this.requestFactory = new BridgeRequestFactory(Objects.requireNonNull(baseUri, "baseUri"));
    this.transport = Objects.requireNonNull(transport, "transport");
    this.credentials = Objects.requireNonNull(credentials, "credentials");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
  }

  @Override
  public CompletableFuture<BridgeResult> search(String endpointUrl, int page, String proxy) {
    Map<String, String> query = pacedQuery(proxy);
    query.put("url", endpointUrl);
    query.put("page", Integer.toString(Math.max(1, page)));

    Optional<String> cookie = credentials.cookie();
    if (cookie.isEmpty()) {
      return missingCookie();
    }
    HttpRequest request = base("/search", query, cookie.get()).GET().build();
    return transport.send(request);
  }

  @Override
  public CompletableFuture<BridgeResult> buildCheckout(long orderId, String proxy) {
    Optional<String> cookie = credentials.cookie();
    if (cookie.isEmpty()) {
      return missingCookie();
    }
    ObjectNode body = transport.objectMapper().createObjectNode();
    body.put("order_id", orderId);
    return sendJson("/checkout/build", pacedQuery(proxy), cookie.get(), "POST", body);
  }

  @Override
  public CompletableFuture<BridgeResult> putCheckoutComponents(String purchaseId, ObjectNode components,
                                                               String proxy) {
    if (purchaseId == null || purchaseId.isBlank()) {
      throw new IllegalArgumentException("purchaseId must not be blank");
    }
    Optional<String> cookie = credentials.cookie();
    if (cookie.isEmpty()) {
      return missingCookie();
    }
    ObjectNode body = transport.objectMapper().createObjectNode();
    body.set("components", components);
    return sendJson("/checkout/" + purchaseId, pacedQuery(proxy), cookie.get(), "PUT", body);
  }

  @Override
  public CompletableFuture<BridgeResult> nearbyPickupPoints(long shippingOrderId, double latitude, double longitude,
                                                            String countryCode, String proxy) {
    Map<String, String> query = pacedQuery(proxy);
    query.put("shipping_order_id", Long.toString(shippingOrderId));
    query.put("latitude", Double.toString(latitude));
    query.put("longitude", Double.toString(longitude));
    query.put("country_code", countryCode == null || countryCode.isBlank() ? "GB" : countryCode);

    Optional<String> cookie = credentials.cookie();
    if (cookie.isEmpty()) {
      return missingCookie();
    }
    HttpRequest request = base("/checkout/nearby_pickup_points", query, cookie.get()).GET().build();
    return transport.send(request);
  }

  public BridgeHealth healthCheck() {
    HttpRequest request = requestFactory.request("/health", Map.of())
        .GET()
        .timeout(Duration.ofSeconds(3))
        .header("Accept", "application/json")
        .build();
    JsonNode json = transport.fetchJson(request);
    if (json == null) {
      return new BridgeHealth(false, null);
    }
    return new BridgeHealth(json.path("ok").asBoolean(false), json.path("service").asText(null));
  }

  private CompletableFuture<BridgeResult> sendJson(String path, Map<String, String> query, String cookie,
                                                   String method, JsonNode body) {
    String payload;
    try {
      payload = transport.objectMapper().writeValueAsString(body);
    } catch (JsonProcessingException e) {
      return CompletableFuture.completedFuture(BridgeResult.failure(
          BridgeErrorCode.PARSE_ERROR, "Failed encoding request body: " + e.getOriginalMessage()));
    }
    HttpRequest request = base(path, query, cookie)
        .header("Content-Type", "application/json")
        .method(method, HttpRequest.BodyPublishers.ofString(payload))
        .build();
    return transport.send(request);
  }

  private static CompletableFuture<BridgeResult> missingCookie() {
    return CompletableFuture.completedFuture(
        BridgeResult.failure(BridgeErrorCode.MISSING_COOKIE, MISSING_COOKIE_MESSAGE));
  }

  private HttpRequest.Builder base(String path, Map<String, String> query, String cookie) {
    return requestFactory.request(path, query)
        .timeout(timeout)
        .header("Accept", "application/json")
        .header(COOKIE_HEADER, cookie);
  }

  /**
   * Bridge-side pacing is disabled; the pipeline does its own spacing between requests.
   */
  private static Map<String, String> pacedQuery(String proxy) {
    Map<String, String> query = new LinkedHashMap<>();
    query.put("base_interval", "0");
    query.put("jitter", "1");
    if (proxy != null && !proxy.isBlank()) {
      query.put("proxy", proxy);
    }
    return query;
  }
}
