package com.snipebot.listing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.snipebot.model.FeedItem;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class ListingResponseNormalizerTests {

  private static final String SOURCE = "https://www.vinted.co.uk/catalog?search_text=wool";
  private static final Instant FETCHED = Instant.parse("2025-03-01T12:00:00Z");

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final ListingResponseNormalizer normalizer = new ListingResponseNormalizer("https://www.vinted.co.uk/");

  @Test
  void normalize_readsItemsShape() throws Exception {
    JsonNode data = objectMapper.readTree("""
        {
          "items": [
            {
              "id": 4242,
              "title": "Wool Jumper",
              "price": {"amount": "19.99", "currency_code": "EUR"},
              "photo": {"url": "https://img/1.jpg"},
              "path": "/items/4242-wool-jumper",
              "status": "Very good",
              "size_title": "M",
              "brand_title": "Uniqlo",
              "user": {"login": "seller1", "id": 77},
              "order_id": 9001
            }
          ]
        }
        """);

    List<FeedItem> items = normalizer.normalize(data, SOURCE, FETCHED);

    assertThat(items).hasSize(1);
    FeedItem item = items.get(0);
    assertThat(item.id()).isEqualTo(4242L);
    assertThat(item.title()).isEqualTo("Wool Jumper");
    assertThat(item.price()).isEqualTo("19.99");
    assertThat(item.currency()).isEqualTo("EUR");
    assertThat(item.photoUrl()).isEqualTo("https://img/1.jpg");
    assertThat(item.url()).isEqualTo("https://www.vinted.co.uk/items/4242-wool-jumper");
    assertThat(item.condition()).isEqualTo("Very good");
    assertThat(item.size()).isEqualTo("M");
    assertThat(item.brand()).isEqualTo("Uniqlo");
    assertThat(item.sellerLogin()).isEqualTo("seller1");
    assertThat(item.sellerId()).isEqualTo(77L);
    assertThat(item.orderId()).isEqualTo(9001L);
    assertThat(item.checkoutOrderId()).isEqualTo(9001L);
    assertThat(item.sourceUrls()).containsExactly(SOURCE);
    assertThat(item.fetchedAt()).isEqualTo(FETCHED);
  }

  @Test
  void normalize_fallsBackAcrossFieldVariants() throws Exception {
    JsonNode data = objectMapper.readTree("""
        {
          "catalog": {
            "items": [
              {"id": "17", "name": "Scarf", "price": 7.5, "currency": "USD",
               "photo_url": "https://img/scarf.jpg", "url": "https://elsewhere/17"},
              {"id": 18, "title": "Hat", "price": {"value": "3.00"}, "photos": [{"url": "https://img/hat.jpg"}]},
              {"id": 19}
            ]
          }
        }
        """);

    List<FeedItem> items = normalizer.normalize(data, SOURCE, FETCHED);

    assertThat(items).extracting(FeedItem::id).containsExactly(17L, 18L, 19L);
    assertThat(items.get(0).title()).isEqualTo("Scarf");
    assertThat(items.get(0).price()).isEqualTo("7.5");
    assertThat(items.get(0).currency()).isEqualTo("USD");
    assertThat(items.get(0).photoUrl()).isEqualTo("https://img/scarf.jpg");
    assertThat(items.get(0).url()).isEqualTo("https://elsewhere/17");
    assertThat(items.get(0).checkoutOrderId()).isEqualTo(17L);

    assertThat(items.get(1).price()).isEqualTo("3.00");
    assertThat(items.get(1).currency()).isEqualTo("GBP");
    assertThat(items.get(1).photoUrl()).isEqualTo("https://img/hat.jpg");

    FeedItem bare = items.get(2);
    assertThat(bare.title()).isEmpty();
    assertThat(bare.price()).isEqualTo("0");
    assertThat(bare.photoUrl()).isEmpty();
    assertThat(bare.url()).isEqualTo("https://www.vinted.co.uk/items/19");
    assertThat(bare.condition()).isNull();
  }

  @Test
  void normalize_prefersItemsOverOtherShapesAndSkipsMissingIds() throws Exception {
    JsonNode data = objectMapper.readTree("""
        {
          "items": [{"id": 0, "title": "zero"}, {"title": "no id"}, {"id": "abc"}, {"id": 5, "title": "kept"}],
          "products": [{"id": 6, "title": "ignored"}]
        }
        """);

    assertThat(ListingShape.detect(data)).isEqualTo(ListingShape.ITEMS);
    assertThat(normalizer.normalize(data, SOURCE, FETCHED)).extracting(FeedItem::id).containsExactly(5L);
  }

  @Test
  void normalize_skipsFractionalNumericIds() throws Exception {
    JsonNode data = objectMapper.readTree("""
        {"items": [{"id": 12.5, "title": "fractional"}, {"id": 13.0, "title": "whole"}, {"id": 14, "title": "plain"}]}
        """);

    assertThat(normalizer.normalize(data, SOURCE, FETCHED)).extracting(FeedItem::id).containsExactly(13L, 14L);
    assertThat(ListingResponseNormalizer.parseId(objectMapper.readTree("12.5"))).isZero();
  }

  @Test
  void normalize_readsProductsShape() throws Exception {
    JsonNode data = objectMapper.readTree("""
        {"products": [{"id": 6, "title": "Boots", "price": "40"}]}
        """);

    assertThat(ListingShape.detect(data)).isEqualTo(ListingShape.PRODUCTS);
    assertThat(normalizer.normalize(data, SOURCE, FETCHED)).extracting(FeedItem::title).containsExactly("Boots");
  }

  @Test
  void normalize_returnsEmptyForUnknownShape() throws Exception {
    JsonNode data = objectMapper.readTree("""
        {"results": [{"id": 1}]}
        """);

    assertThat(ListingShape.detect(data)).isEqualTo(ListingShape.NONE);
    assertThat(normalizer.normalize(data, SOURCE, FETCHED)).isEmpty();
    assertThat(normalizer.normalize(null, SOURCE, FETCHED)).isEmpty();
  }
}
