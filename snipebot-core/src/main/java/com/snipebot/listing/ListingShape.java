package com.snipebot.listing;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Where a search response keeps its listings. Checked in declaration order; the first match wins.
 */
public enum ListingShape {
  ITEMS,
  CATALOG_ITEMS,
  PRODUCTS,
  NONE;

  public static ListingShape detect(JsonNode data) {
    if (data == null || !data.isObject()) {
      return NONE;
    }
    if (data.path("items").isArray()) {
      return ITEMS;
    }
    if (data.path("catalog").path("items").isArray()) {
      return CATALOG_ITEMS;
    }
    if (data.path("products").isArray()) {
      return PRODUCTS;
    }
    return NONE;
  }

  JsonNode listings(JsonNode data) {
    return switch (this) {
      case ITEMS -> data.path("items");
      case CATALOG_ITEMS -> data.path("catalog").path("items");
      case PRODUCTS -> data.path("products");
      case NONE -> null;
    };
  }
}
