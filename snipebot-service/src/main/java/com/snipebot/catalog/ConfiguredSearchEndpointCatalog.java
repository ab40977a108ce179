package com.snipebot.catalog;

import com.snipebot.config.SnipebotProperties;
import com.snipebot.model.SearchEndpoint;

import java.util.List;

/**
 * Search endpoints as configured under {@code snipebot.search-endpoints}.
 */
public class ConfiguredSearchEndpointCatalog implements SearchEndpointCatalog {

    private final List<SearchEndpoint> endpoints;

    public ConfiguredSearchEndpointCatalog(List<SnipebotProperties.SearchEndpoint> configured) {
        this.endpoints = configured.stream()
                .map(e -> new SearchEndpoint(e.url(), e.enabled()))
                .toList();
    }

    @Override
    public List<SearchEndpoint> all() {
        return endpoints;
    }
}
