package com.snipebot.proxy;

import java.time.Instant;

/**
 * Read-only snapshot of a proxy for the dashboard. The URL has its credentials masked and is accepted as-is by
 * {@link ProxyPoolManager#unblock(String)}.
 */
public record ProxyView(
    String url,
    ProxyPool pool,
    ProxyStatus status,
    int strikeCount,
    Instant cooldownUntil,
    Instant lastSuccessAt,
    Instant lastForbiddenAt
) {
}
