package com.snipebot.proxy;

import com.snipebot.catalog.SearchEndpointCatalog;
import com.snipebot.model.FeedItem;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Picks the sticky proxy a checkout session uses for all of its requests.
 *
 * Order of preference:
 * 1. checkout pool configured: {@code checkout[itemId mod size]}
 * 2. the scraping proxy that polled the item's first source endpoint in the latest cycle
 * 3. the scraping proxy currently assigned to that endpoint's index
 */
@Slf4j
public class CheckoutProxySelector {

  private final ProxyPoolManager pools;
  private final SearchEndpointCatalog endpoints;
  private final Map<String, String> lastProxyByEndpoint = new HashMap<>();

  public CheckoutProxySelector(ProxyPoolManager pools, SearchEndpointCatalog endpoints) {
    this.pools = pools;
    this.endpoints = endpoints;
  }

  public Optional<String> select(FeedItem item) {
    if (pools.size(ProxyPool.CHECKOUT) > 0) {
      return pools.assignForPollCycle(ProxyPool.CHECKOUT, item.id());
    }

    String source = item.primarySourceUrl();
    if (source == null) {
      return Optional.empty();
    }
    String remembered = lastProxyByEndpoint.get(source);
    if (remembered != null) {
      return Optional.of(remembered);
    }
    int idx = endpoints.enabledIndexOf(source);
    if (idx < 0) {
      log.debug("no enabled endpoint for item {} source {}", item.id(), source);
      return Optional.empty();
    }
    return pools.assignForPollCycle(ProxyPool.SCRAPING, idx);
  }

  /**
   * Remember which proxy polled an endpoint, so checkouts of its items keep the same identity.
   */
  public void rememberEndpointProxy(String endpointUrl, String proxyUrl) {
    if (proxyUrl == null) {
      lastProxyByEndpoint.remove(endpointUrl);
    } else {
      lastProxyByEndpoint.put(endpointUrl, proxyUrl);
    }
  }
}
