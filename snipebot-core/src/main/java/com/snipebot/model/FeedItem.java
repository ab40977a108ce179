package com.snipebot.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A normalized marketplace listing as seen during one poll cycle.
 *
 * {@code sourceUrls} keeps the order in which search endpoints surfaced the item; the first entry is
 * the endpoint used to pick a sticky checkout proxy when no dedicated checkout pool is configured.
 */
public record FeedItem(
    long id,
    String title,
    String price,           // decimal string as returned upstream, e.g. "19.99"
    String currency,
    String photoUrl,
    String url,
    String condition,
    String size,
    String brand,
    String sellerLogin,
    Long sellerId,
    Long orderId,
    List<String> sourceUrls,
    Instant fetchedAt
) {

  public FeedItem {
    title = title == null ? "" : title;
    price = price == null || price.isBlank() ? "0" : price.trim();
    sourceUrls = sourceUrls == null ? List.of() : List.copyOf(new LinkedHashSet<>(sourceUrls));
  }

  /**
   * Numeric price; unparseable prices count as zero.
   */
  public BigDecimal priceValue() {
    try {
      return new BigDecimal(price);
    } catch (NumberFormatException e) {
      return BigDecimal.ZERO;
    }
  }

  /**
   * Id used to start a checkout: the listing's order id when present, else the item id.
   */
  public long checkoutOrderId() {
    return orderId != null ? orderId : id;
  }

  public String primarySourceUrl() {
    return sourceUrls.isEmpty() ? null : sourceUrls.get(0);
  }

  /**
   * Copy of this item whose source set is the union of both items' sources, this item's first.
   */
  public FeedItem mergeSources(FeedItem other) {
    Set<String> merged = new LinkedHashSet<>(sourceUrls);
    merged.addAll(other.sourceUrls());
    if (merged.size() == sourceUrls.size()) {
      return this;
    }
    return new FeedItem(id, title, price, currency, photoUrl, url, condition, size, brand,
        sellerLogin, sellerId, orderId, List.copyOf(merged), fetchedAt);
  }
}
