package com.snipebot.model;

/**
 * A configured catalog search URL. Position in the configured list drives proxy assignment.
 */
public record SearchEndpoint(String url, boolean enabled) {
}
