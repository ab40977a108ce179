package com.snipebot.proxy;

import com.snipebot.events.PipelineEvent;
import com.snipebot.events.PipelineEventPublisher;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Health tracking and assignment for the scraping and checkout proxy pools.
 *
 * Strike ladder for scraping proxies rejected as bots:
 * 1. first strike: cooldown for 5 minutes
 * 2. second strike: cooldown for 15 minutes
 * 3. third strike: blocked until {@link #unblock(String)}
 *
 * Cooldown expiry is evaluated lazily on read; there is no background sweep. Checkout proxies are never
 * escalated. Not thread-safe: call from the pipeline thread only.
 */
@Slf4j
public class ProxyPoolManager {

  static final Duration FIRST_STRIKE_COOLDOWN = Duration.ofMinutes(5);
  static final Duration SECOND_STRIKE_COOLDOWN = Duration.ofMinutes(15);
  static final int BLOCK_AT_STRIKE = 3;

  private final Clock clock;
  private final PipelineEventPublisher events;
  private final Map<ProxyPool, Map<String, ProxyRecord>> pools = new EnumMap<>(ProxyPool.class);

  private final Counter forbiddenCounter;
  private final Counter blockedCounter;

  public ProxyPoolManager(Clock clock, PipelineEventPublisher events, MeterRegistry meterRegistry) {
    this.clock = clock;
    this.events = events;
    for (ProxyPool pool : ProxyPool.values()) {
      pools.put(pool, new LinkedHashMap<>());
    }

    this.forbiddenCounter = Counter.builder("proxy.forbidden.reports")
        .description("Forbidden responses recorded against scraping proxies")
        .register(meterRegistry);
    this.blockedCounter = Counter.builder("proxy.blocked")
        .description("Proxies escalated to blocked")
        .register(meterRegistry);
    for (ProxyPool pool : ProxyPool.values()) {
      Gauge.builder("proxy.pool.eligible", this, m -> m.eligible(pool, m.clock.instant()).size())
          .description("Proxies currently eligible for assignment")
          .tag("pool", pool.name().toLowerCase(Locale.ROOT))
          .register(meterRegistry);
    }
  }

  /**
   * Replace the configured proxy list for a pool. Health state of URLs that stay configured is kept.
   */
  public void configure(ProxyPool pool, List<String> urls) {
    Map<String, ProxyRecord> previous = pools.get(pool);
    Map<String, ProxyRecord> next = new LinkedHashMap<>();
    for (String url : urls == null ? List.<String>of() : urls) {
      if (url == null || url.isBlank()) {
        continue;
      }
      String trimmed = url.trim();
      ProxyRecord kept = previous.get(trimmed);
      next.put(trimmed, kept != null ? kept : new ProxyRecord(trimmed, pool));
    }
    pools.put(pool, next);
    log.info("proxy pool {} configured: {} proxies", pool, next.size());
  }

  /**
   * Proxy for one endpoint of a poll cycle: {@code index mod n} over the proxies eligible right now.
   */
  public Optional<String> assignForPollCycle(ProxyPool pool, long index) {
    List<ProxyRecord> eligible = eligible(pool, clock.instant());
    if (eligible.isEmpty()) {
      return Optional.empty();
    }
    int slot = (int) Math.floorMod(index, (long) eligible.size());
    return Optional.of(eligible.get(slot).getUrl());
  }

  /**
   * Best-effort proxy for one-off operations outside the polling cadence. Prefers an eligible proxy but
   * falls back to any configured one, cooldown or not.
   */
  public Optional<String> anyAvailable(ProxyPool pool) {
    List<ProxyRecord> eligible = eligible(pool, clock.instant());
    if (!eligible.isEmpty()) {
      return Optional.of(eligible.get(0).getUrl());
    }
    return pools.get(pool).values().stream().findFirst().map(ProxyRecord::getUrl);
  }

  public void reportForbidden(String proxyUrl) {
    Instant now = clock.instant();
    for (ProxyRecord record : find(proxyUrl)) {
      if (record.getPool() == ProxyPool.CHECKOUT) {
        log.debug("forbidden on checkout proxy {} ignored for escalation", ProxyUrls.mask(proxyUrl));
        continue;
      }
      if (record.getStatus() == ProxyStatus.BLOCKED) {
        continue;
      }

      int strike = record.getStrikeCount() + 1;
      Duration cooldown = durationForStrike(strike);
      if (cooldown == null) {
        record.strike(now, ProxyStatus.BLOCKED, null);
        blockedCounter.increment();
        log.warn("proxy {} blocked after {} strikes; manual unblock required", ProxyUrls.mask(proxyUrl), strike);
      } else {
        record.strike(now, ProxyStatus.COOLDOWN, now.plus(cooldown));
        log.warn("proxy {} strike {}: cooldown {}m until {}",
            ProxyUrls.mask(proxyUrl), strike, cooldown.toMinutes(), record.getCooldownUntil());
      }
      forbiddenCounter.increment();
      publishState(record);
    }
  }

  public void reportSuccess(String proxyUrl) {
    Instant now = clock.instant();
    for (ProxyRecord record : find(proxyUrl)) {
      boolean changed = record.getStrikeCount() > 0 || record.getStatus() == ProxyStatus.COOLDOWN;
      record.succeeded(now);
      if (changed && record.getStatus() == ProxyStatus.ACTIVE) {
        log.info("proxy {} recovered", ProxyUrls.mask(proxyUrl));
        publishState(record);
      }
    }
  }

  /**
   * Manual reset to active with zero strikes. Accepts either the configured URL or the masked form shown in
   * {@link #statusSnapshot(ProxyPool)}; a masked key shared by several proxies resets all of them.
   *
   * @throws IllegalArgumentException when the URL is not configured in any pool
   */
  public void unblock(String proxyUrl) {
    List<ProxyRecord> records = find(proxyUrl);
    if (records.isEmpty()) {
      records = findMasked(proxyUrl);
    }
    if (records.isEmpty()) {
      throw new IllegalArgumentException("Unknown proxy: " + ProxyUrls.mask(proxyUrl));
    }
    for (ProxyRecord record : records) {
      record.reset();
      log.info("proxy {} unblocked ({})", ProxyUrls.mask(record.getUrl()), record.getPool());
      publishState(record);
    }
  }

  public PoolStatusSnapshot statusSnapshot(ProxyPool pool) {
    Instant now = clock.instant();
    List<ProxyView> active = new ArrayList<>();
    List<ProxyView> cooldown = new ArrayList<>();
    List<ProxyView> blocked = new ArrayList<>();
    Collection<ProxyRecord> records = pools.get(pool).values();
    for (ProxyRecord record : records) {
      ProxyView view = pool == ProxyPool.CHECKOUT ? checkoutView(record, now) : record.view(now);
      switch (view.status()) {
        case ACTIVE -> active.add(view);
        case COOLDOWN -> cooldown.add(view);
        case BLOCKED -> blocked.add(view);
      }
    }
    return new PoolStatusSnapshot(pool, List.copyOf(active), List.copyOf(cooldown), List.copyOf(blocked), records.size());
  }

  public int size(ProxyPool pool) {
    return pools.get(pool).size();
  }

  /**
   * Cooldown for the given strike number, or {@code null} when the strike blocks the proxy.
   */
  static Duration durationForStrike(int strike) {
    if (strike >= BLOCK_AT_STRIKE) {
      return null;
    }
    return strike <= 1 ? FIRST_STRIKE_COOLDOWN : SECOND_STRIKE_COOLDOWN;
  }

  private List<ProxyRecord> eligible(ProxyPool pool, Instant now) {
    List<ProxyRecord> out = new ArrayList<>();
    for (ProxyRecord record : pools.get(pool).values()) {
      if (pool == ProxyPool.CHECKOUT || record.effectiveStatus(now) == ProxyStatus.ACTIVE) {
        out.add(record);
      }
    }
    return out;
  }

  private List<ProxyRecord> find(String proxyUrl) {
    if (proxyUrl == null || proxyUrl.isBlank()) {
      return List.of();
    }
    String key = proxyUrl.trim();
    List<ProxyRecord> out = new ArrayList<>(2);
    for (Map<String, ProxyRecord> records : pools.values()) {
      ProxyRecord record = records.get(key);
      if (record != null) {
        out.add(record);
      }
    }
    return out;
  }

  private List<ProxyRecord> findMasked(String maskedUrl) {
    if (maskedUrl == null || maskedUrl.isBlank()) {
      return List.of();
    }
    String key = maskedUrl.trim();
    List<ProxyRecord> out = new ArrayList<>(2);
    for (Map<String, ProxyRecord> records : pools.values()) {
      for (ProxyRecord record : records.values()) {
        if (key.equals(ProxyUrls.mask(record.getUrl()))) {
          out.add(record);
        }
      }
    }
    return out;
  }

  private static ProxyView checkoutView(ProxyRecord record, Instant now) {
    ProxyView view = record.view(now);
    return new ProxyView(view.url(), view.pool(), ProxyStatus.ACTIVE, view.strikeCount(), null,
        view.lastSuccessAt(), view.lastForbiddenAt());
  }

  private void publishState(ProxyRecord record) {
    ProxyView view = record.view(clock.instant());
    events.publish(new PipelineEvent.ProxyStateChanged(
        view.url(), view.pool(), view.status(), view.strikeCount(), view.cooldownUntil()));
  }
}
