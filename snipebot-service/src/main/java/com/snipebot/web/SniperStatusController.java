package com.snipebot.web;

import com.snipebot.bridge.MarketplaceBridgeClient;
import com.snipebot.feed.FeedAggregator;
import com.snipebot.feed.FeedPoller;
import com.snipebot.ledger.PurchaseLedger;
import com.snipebot.ledger.PurchaseRecord;
import com.snipebot.model.FeedItem;
import com.snipebot.proxy.PoolStatusSnapshot;
import com.snipebot.proxy.ProxyPool;
import com.snipebot.proxy.ProxyPoolManager;
import com.snipebot.scheduling.PipelineScheduler;
import com.snipebot.session.CookieSessionCredentials;
import com.snipebot.session.SessionMonitor;
import com.snipebot.sniper.Countdown;
import com.snipebot.sniper.SniperEngine;
import com.snipebot.sniper.SniperToggles;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/sniper")
@Validated
@RequiredArgsConstructor
@Slf4j
public class SniperStatusController {

  private final @NonNull PipelineScheduler scheduler;
  private final @NonNull FeedAggregator feedAggregator;
  private final @NonNull FeedPoller feedPoller;
  private final @NonNull SniperEngine sniperEngine;
  private final @NonNull SniperToggles toggles;
  private final @NonNull ProxyPoolManager proxyPoolManager;
  private final @NonNull PurchaseLedger purchaseLedger;
  private final @NonNull SessionMonitor sessionMonitor;
  private final @NonNull CookieSessionCredentials sessionCredentials;
  private final @NonNull MarketplaceBridgeClient bridgeClient;

  @GetMapping("/status")
  public ResponseEntity<SniperStatusResponse> status() {
    return ResponseEntity.ok(new SniperStatusResponse(
        feedPoller.isActive(),
        feedAggregator.cycle(),
        toggles.autobuyEnabled(),
        toggles.simulationMode(),
        sessionMonitor.isExpired(),
        bridgeClient.healthCheck().ok(),
        sniperEngine.pendingCountdowns().size(),
        feedAggregator.lastBatch().size()
    ));
  }

  @GetMapping("/proxies")
  public ResponseEntity<Map<ProxyPool, PoolStatusSnapshot>> proxies() {
    Map<ProxyPool, PoolStatusSnapshot> snapshot = scheduler.submit(() -> Map.of(
        ProxyPool.SCRAPING, proxyPoolManager.statusSnapshot(ProxyPool.SCRAPING),
        ProxyPool.CHECKOUT, proxyPoolManager.statusSnapshot(ProxyPool.CHECKOUT)
    )).join();
    return ResponseEntity.ok(snapshot);
  }

  @PostMapping("/proxies/unblock")
  public ResponseEntity<Void> unblock(@Valid @RequestBody UnblockRequest request) {
    Boolean known = scheduler.submit(() -> {
      try {
        proxyPoolManager.unblock(request.url());
        return true;
      } catch (IllegalArgumentException e) {
        log.info("unblock rejected: {}", e.getMessage());
        return false;
      }
    }).join();
    return known ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
  }

  @GetMapping("/countdowns")
  public ResponseEntity<List<Countdown>> countdowns() {
    return ResponseEntity.ok(sniperEngine.pendingCountdowns());
  }

  @DeleteMapping("/countdowns/{countdownId}")
  public ResponseEntity<CancelResponse> cancelCountdown(@PathVariable("countdownId") String countdownId) {
    boolean cancelled = sniperEngine.cancel(countdownId).join();
    return ResponseEntity.ok(new CancelResponse(countdownId, cancelled));
  }

  @GetMapping("/feed")
  public ResponseEntity<List<FeedItem>> recentFeed() {
    return ResponseEntity.ok(feedAggregator.lastBatch());
  }

  @GetMapping("/purchases")
  public ResponseEntity<List<PurchaseRecord>> purchases(
      @RequestParam(name = "limit", required = false, defaultValue = "100") @Min(1) @Max(1000) int limit
  ) {
    return ResponseEntity.ok(purchaseLedger.recent(limit));
  }

  @PostMapping("/polling/start")
  public ResponseEntity<Void> startPolling() {
    feedPoller.start();
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/polling/stop")
  public ResponseEntity<Void> stopPolling() {
    feedPoller.stop();
    return ResponseEntity.noContent().build();
  }

  @PutMapping("/toggles")
  public ResponseEntity<TogglesRequest> updateToggles(@RequestBody TogglesRequest request) {
    if (request.autobuyEnabled() != null) {
      toggles.setAutobuyEnabled(request.autobuyEnabled());
    }
    if (request.simulationMode() != null) {
      toggles.setSimulationMode(request.simulationMode());
    }
    log.info("sniper toggles updated autobuy={} simulation={}", toggles.autobuyEnabled(), toggles.simulationMode());
    return ResponseEntity.ok(new TogglesRequest(toggles.autobuyEnabled(), toggles.simulationMode()));
  }

  /**
   * Install a fresh session cookie and clear the expired signal.
   */
  @PutMapping("/session")
  public ResponseEntity<Void> reconnect(@Valid @RequestBody SessionRequest request) {
    sessionCredentials.update(request.cookie());
    scheduler.submit(() -> {
      sessionMonitor.markReconnected();
      return null;
    }).join();
    return ResponseEntity.noContent().build();
  }

  public record SniperStatusResponse(
      boolean pollingActive,
      long pollCycle,
      boolean autobuyEnabled,
      boolean simulationMode,
      boolean sessionExpired,
      boolean bridgeHealthy,
      int pendingCountdowns,
      int lastFeedSize
  ) {
  }

  public record UnblockRequest(@NotBlank String url) {
  }

  public record CancelResponse(String countdownId, boolean cancelled) {
  }

  public record TogglesRequest(Boolean autobuyEnabled, Boolean simulationMode) {
  }

  public record SessionRequest(@NotBlank String cookie) {
  }
}
