package com.snipebot.catalog;

import com.snipebot.model.SearchEndpoint;

import java.util.List;

/**
 * Source of configured search endpoints, in insertion order.
 */
public interface SearchEndpointCatalog {

  List<SearchEndpoint> all();

  default List<SearchEndpoint> enabled() {
    return all().stream().filter(SearchEndpoint::enabled).toList();
  }

  /**
   * Position of {@code url} among the enabled endpoints, or -1.
   */
  default int enabledIndexOf(String url) {
    if (url == null) {
      return -1;
    }
    List<SearchEndpoint> enabled = enabled();
    for (int i = 0; i < enabled.size(); i++) {
      if (enabled.get(i).url().equals(url)) {
        return i;
      }
    }
    return -1;
  }
}
