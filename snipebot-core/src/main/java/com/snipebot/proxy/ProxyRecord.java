package com.snipebot.proxy;

import lombok.Getter;

import java.time.Instant;

/**
 * Mutable health state of one configured proxy. Only {@link ProxyPoolManager} mutates it.
 */
@Getter
final class ProxyRecord {

  private final String url;
  private final ProxyPool pool;
  private int strikeCount;
  private ProxyStatus status = ProxyStatus.ACTIVE;
  private Instant cooldownUntil;
  private Instant lastSuccessAt;
  private Instant lastForbiddenAt;

  ProxyRecord(String url, ProxyPool pool) {
    this.url = url;
    this.pool = pool;
  }

  /**
   * Status as seen at {@code now}: a cooldown whose expiry has passed reads as active.
   */
  ProxyStatus effectiveStatus(Instant now) {
    if (status == ProxyStatus.COOLDOWN && (cooldownUntil == null || !cooldownUntil.isAfter(now))) {
      return ProxyStatus.ACTIVE;
    }
    return status;
  }

  void strike(Instant now, ProxyStatus next, Instant until) {
    strikeCount++;
    lastForbiddenAt = now;
    status = next;
    cooldownUntil = until;
  }

  void succeeded(Instant now) {
    lastSuccessAt = now;
    if (status == ProxyStatus.BLOCKED) {
      return;
    }
    strikeCount = 0;
    status = ProxyStatus.ACTIVE;
    cooldownUntil = null;
  }

  void reset() {
    strikeCount = 0;
    status = ProxyStatus.ACTIVE;
    cooldownUntil = null;
  }

  ProxyView view(Instant now) {
    ProxyStatus effective = effectiveStatus(now);
    return new ProxyView(
        ProxyUrls.mask(url),
        pool,
        effective,
        strikeCount,
        effective == ProxyStatus.COOLDOWN ? cooldownUntil : null,
        lastSuccessAt,
        lastForbiddenAt
    );
  }
}
