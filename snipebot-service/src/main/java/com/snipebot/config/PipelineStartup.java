package com.snipebot.config;

import com.snipebot.bridge.BridgeHealth;
import com.snipebot.bridge.MarketplaceBridgeClient;
import com.snipebot.feed.FeedPoller;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

@Component
@RequiredArgsConstructor
@Slf4j
public class PipelineStartup {

    private final @NonNull SnipebotProperties properties;
    private final @NonNull MarketplaceBridgeClient bridgeClient;
    private final @NonNull FeedPoller feedPoller;

    private final AtomicBoolean initOnce = new AtomicBoolean(false);

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!initOnce.compareAndSet(false, true)) {
            return;
        }

        BridgeHealth health = bridgeClient.healthCheck();
        log.info("============================================================");
        log.info("  Snipebot acquisition pipeline - Starting");
        log.info("============================================================");
        log.info("  Bridge: {} (healthy={})", properties.bridge().baseUrl(), health.ok());
        log.info("  Poll interval: {}s", properties.feed().effectivePollIntervalSeconds());
        log.info("  Autobuy: {}  Simulation: {}", properties.sniper().autobuyEnabled(), properties.sniper().simulationMode());
        log.info("  Delivery: {}", properties.checkout().deliveryType());
        log.info("============================================================");
        if (!health.ok()) {
            log.warn("marketplace bridge not reachable at startup; polls will abort until it is up");
        }

        feedPoller.start();
    }
}
