package com.snipebot.listing;

import com.fasterxml.jackson.databind.JsonNode;
import com.snipebot.model.FeedItem;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a raw search payload into {@link FeedItem}s tagged with the endpoint that surfaced them.
 * Listings without a usable numeric id are dropped.
 */
@Slf4j
public final class ListingResponseNormalizer {

  private static final String DEFAULT_CURRENCY = "GBP";

  private final String marketplaceBaseUrl;

  public ListingResponseNormalizer(String marketplaceBaseUrl) {
    String base = marketplaceBaseUrl == null ? "" : marketplaceBaseUrl.trim();
    this.marketplaceBaseUrl = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
  }

  public List<FeedItem> normalize(JsonNode data, String sourceUrl, Instant fetchedAt) {
    ListingShape shape = ListingShape.detect(data);
    if (shape == ListingShape.NONE) {
      log.debug("search payload has no listings source={}", sourceUrl);
      return List.of();
    }

    List<FeedItem> out = new ArrayList<>();
    for (JsonNode raw : shape.listings(data)) {
      long id = parseId(raw.path("id"));
      if (id <= 0) {
        continue;
      }
      out.add(toItem(raw, id, sourceUrl, fetchedAt));
    }
    return out;
  }

  private FeedItem toItem(JsonNode r, long id, String sourceUrl, Instant fetchedAt) {
    String title = text(r, "title");
    if (title == null) {
      title = text(r, "name");
    }

    JsonNode priceNode = r.path("price");
    String price;
    String currency = null;
    if (priceNode.isObject()) {
      price = firstNonNull(text(priceNode, "amount"), text(priceNode, "value"), "0");
      currency = text(priceNode, "currency_code");
    } else {
      price = priceNode.isValueNode() && !priceNode.isNull() ? priceNode.asText() : "0";
    }
    if (currency == null) {
      currency = firstNonNull(text(r, "currency"), DEFAULT_CURRENCY, null);
    }

    String photo = text(r.path("photo"), "url");
    if (photo == null) {
      photo = text(r, "photo_url");
    }
    if (photo == null && r.path("photos").isArray() && !r.path("photos").isEmpty()) {
      photo = text(r.path("photos").get(0), "url");
    }

    String path = text(r, "path");
    String url = path != null ? marketplaceBaseUrl + path : text(r, "url");
    if (url == null || url.isBlank()) {
      url = marketplaceBaseUrl + "/items/" + id;
    }

    JsonNode user = r.path("user");
    Long sellerId = user.path("id").canConvertToLong() ? user.path("id").asLong() : null;
    Long orderId = r.path("order_id").canConvertToLong() ? r.path("order_id").asLong() : null;

    return new FeedItem(
        id,
        title,
        price,
        currency,
        photo == null ? "" : photo,
        url,
        text(r, "status"),
        text(r, "size_title"),
        text(r, "brand_title"),
        text(user, "login"),
        sellerId,
        orderId,
        List.of(sourceUrl),
        fetchedAt);
  }

  static long parseId(JsonNode node) {
    if (node == null || node.isMissingNode() || node.isNull()) {
      return 0L;
    }
    if (node.isIntegralNumber()) {
      return node.asLong();
    }
    if (node.isNumber()) {
      // 12.0 is an id, 12.5 is not
      BigDecimal value = node.decimalValue();
      return value.signum() > 0 && value.stripTrailingZeros().scale() <= 0 ? value.longValue() : 0L;
    }
    String s = node.asText("").trim();
    // leading digits only, "123abc" -> 123
    int end = 0;
    while (end < s.length() && Character.isDigit(s.charAt(end))) {
      end++;
    }
    if (end == 0) {
      return 0L;
    }
    try {
      return Long.parseLong(s.substring(0, end));
    } catch (NumberFormatException e) {
      return 0L;
    }
  }

  private static String text(JsonNode node, String field) {
    if (node == null) {
      return null;
    }
    JsonNode v = node.get(field);
    if (v == null || v.isNull() || v.isContainerNode()) {
      return null;
    }
    return v.asText();
  }

  private static String firstNonNull(String a, String b, String fallback) {
    if (a != null) {
      return a;
    }
    return b != null ? b : fallback;
  }
}
