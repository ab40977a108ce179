package com.snipebot.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.snipebot.bridge.BridgeHttpTransport;
import com.snipebot.bridge.MarketplaceBridgeClient;
import com.snipebot.bridge.RateLimitRetrier;
import com.snipebot.bridge.RetryPolicy;
import com.snipebot.catalog.ConfiguredRuleCatalog;
import com.snipebot.catalog.ConfiguredSearchEndpointCatalog;
import com.snipebot.catalog.RuleCatalog;
import com.snipebot.catalog.SearchEndpointCatalog;
import com.snipebot.checkout.ApprovalOpener;
import com.snipebot.checkout.CheckoutOrchestrator;
import com.snipebot.checkout.DesktopApprovalOpener;
import com.snipebot.events.LoggingPipelineEventPublisher;
import com.snipebot.events.PipelineEventPublisher;
import com.snipebot.feed.FeedAggregator;
import com.snipebot.feed.FeedPoller;
import com.snipebot.ledger.InMemoryPurchaseLedger;
import com.snipebot.ledger.PurchaseLedger;
import com.snipebot.listing.ListingResponseNormalizer;
import com.snipebot.proxy.CheckoutProxySelector;
import com.snipebot.proxy.ProxyPool;
import com.snipebot.proxy.ProxyPoolManager;
import com.snipebot.scheduling.SingleThreadPipelineScheduler;
import com.snipebot.session.CookieSessionCredentials;
import com.snipebot.session.SessionMonitor;
import com.snipebot.sniper.SniperEngine;
import com.snipebot.sniper.SniperToggles;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.Random;

/**
 * Wires the acquisition pipeline from {@link SnipebotProperties}.
 *
 * Every pipeline service shares the single {@link SingleThreadPipelineScheduler}; the feed aggregator hands each
 * published batch to the sniper engine on that thread.
 */
@Slf4j
@Configuration
public class PipelineConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public HttpClient bridgeHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @Bean(destroyMethod = "close")
    public SingleThreadPipelineScheduler pipelineScheduler() {
        return new SingleThreadPipelineScheduler("snipebot-pipeline");
    }

    @Bean
    public PipelineEventPublisher pipelineEventPublisher() {
        return new LoggingPipelineEventPublisher();
    }

    @Bean
    public ProxyPoolManager proxyPoolManager(
            SnipebotProperties properties,
            Clock clock,
            PipelineEventPublisher events,
            MeterRegistry meterRegistry
    ) {
        SnipebotProperties.Proxies proxies = properties.proxies();
        ProxyPoolManager manager = new ProxyPoolManager(clock, events, meterRegistry);
        if (proxies.scraping().isEmpty() && !proxies.legacy().isEmpty()) {
            log.info("scraping pool empty, using {} legacy proxies", proxies.legacy().size());
        }
        manager.configure(ProxyPool.SCRAPING, proxies.effectiveScraping());
        manager.configure(ProxyPool.CHECKOUT, proxies.checkout());
        return manager;
    }

    @Bean
    public CookieSessionCredentials sessionCredentials(SnipebotProperties properties) {
        return new CookieSessionCredentials(properties.session().cookie());
    }

    @Bean
    public SessionMonitor sessionMonitor(PipelineEventPublisher events) {
        return new SessionMonitor(events);
    }

    @Bean
    public MarketplaceBridgeClient marketplaceBridgeClient(
            SnipebotProperties properties,
            HttpClient bridgeHttpClient,
            ObjectMapper objectMapper,
            CookieSessionCredentials sessionCredentials
    ) {
        SnipebotProperties.Bridge bridge = properties.bridge();
        log.info("marketplace bridge baseUrl={} timeoutMillis={}", bridge.baseUrl(), bridge.requestTimeoutMillis());
        return new MarketplaceBridgeClient(
                URI.create(bridge.baseUrl()),
                new BridgeHttpTransport(bridgeHttpClient, objectMapper),
                sessionCredentials,
                Duration.ofMillis(bridge.requestTimeoutMillis()));
    }

    @Bean
    public RateLimitRetrier rateLimitRetrier(SnipebotProperties properties, SingleThreadPipelineScheduler scheduler) {
        return new RateLimitRetrier(scheduler, RetryPolicy.from(properties.bridge().retry()));
    }

    @Bean
    public SearchEndpointCatalog searchEndpointCatalog(SnipebotProperties properties) {
        SearchEndpointCatalog catalog = new ConfiguredSearchEndpointCatalog(properties.searchEndpoints());
        log.info("search endpoints configured: {} ({} enabled)", catalog.all().size(), catalog.enabled().size());
        return catalog;
    }

    @Bean
    public RuleCatalog ruleCatalog(SnipebotProperties properties) {
        RuleCatalog catalog = new ConfiguredRuleCatalog(properties.rules());
        log.info("sniper rules configured: {} ({} enabled)", catalog.all().size(), catalog.enabled().size());
        return catalog;
    }

    @Bean
    public CheckoutProxySelector checkoutProxySelector(ProxyPoolManager proxyPoolManager,
                                                       SearchEndpointCatalog searchEndpointCatalog) {
        return new CheckoutProxySelector(proxyPoolManager, searchEndpointCatalog);
    }

    @Bean
    public PurchaseLedger purchaseLedger(Clock clock) {
        return new InMemoryPurchaseLedger(clock);
    }

    @Bean
    public SniperToggles sniperToggles(SnipebotProperties properties) {
        SnipebotProperties.Sniper sniper = properties.sniper();
        log.info("sniper autobuy={} simulation={} countdownSeconds={}",
                sniper.autobuyEnabled(), sniper.simulationMode(), sniper.countdownSeconds());
        return SniperToggles.from(sniper);
    }

    @Bean
    public ApprovalOpener approvalOpener() {
        return new DesktopApprovalOpener();
    }

    @Bean
    public CheckoutOrchestrator checkoutOrchestrator(
            SnipebotProperties properties,
            MarketplaceBridgeClient marketplaceBridgeClient,
            RateLimitRetrier rateLimitRetrier,
            ProxyPoolManager proxyPoolManager,
            PurchaseLedger purchaseLedger,
            ApprovalOpener approvalOpener,
            PipelineEventPublisher events,
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry
    ) {
        return new CheckoutOrchestrator(
                marketplaceBridgeClient,
                rateLimitRetrier,
                proxyPoolManager,
                purchaseLedger,
                approvalOpener,
                events,
                properties.checkout(),
                objectMapper,
                meterRegistry);
    }

    @Bean
    public SniperEngine sniperEngine(
            SnipebotProperties properties,
            SingleThreadPipelineScheduler scheduler,
            RuleCatalog ruleCatalog,
            PurchaseLedger purchaseLedger,
            SniperToggles sniperToggles,
            CheckoutProxySelector checkoutProxySelector,
            CheckoutOrchestrator checkoutOrchestrator,
            PipelineEventPublisher events,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        return new SniperEngine(
                scheduler,
                ruleCatalog,
                purchaseLedger,
                sniperToggles,
                checkoutProxySelector,
                checkoutOrchestrator,
                events,
                properties.sniper(),
                properties.feed(),
                clock,
                meterRegistry);
    }

    @Bean
    public FeedAggregator feedAggregator(
            SnipebotProperties properties,
            SingleThreadPipelineScheduler scheduler,
            MarketplaceBridgeClient marketplaceBridgeClient,
            ProxyPoolManager proxyPoolManager,
            SearchEndpointCatalog searchEndpointCatalog,
            SessionMonitor sessionMonitor,
            CheckoutProxySelector checkoutProxySelector,
            PipelineEventPublisher events,
            SniperEngine sniperEngine,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        FeedAggregator aggregator = new FeedAggregator(
                scheduler,
                marketplaceBridgeClient,
                proxyPoolManager,
                searchEndpointCatalog,
                new ListingResponseNormalizer(properties.bridge().marketplaceBaseUrl()),
                sessionMonitor,
                checkoutProxySelector,
                events,
                properties.feed(),
                clock,
                new Random(),
                meterRegistry);
        aggregator.addBatchListener(sniperEngine::onNewItems);
        return aggregator;
    }

    @Bean(destroyMethod = "stop")
    public FeedPoller feedPoller(SnipebotProperties properties, FeedAggregator feedAggregator,
                                 SingleThreadPipelineScheduler scheduler) {
        return new FeedPoller(feedAggregator, scheduler, properties.feed(), new Random());
    }
}
