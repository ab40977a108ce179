package com.snipebot.feed;

import com.snipebot.bridge.BridgeErrorCode;
import com.snipebot.catalog.SearchEndpointCatalog;
import com.snipebot.config.SnipebotProperties;
import com.snipebot.events.PipelineEvent;
import com.snipebot.listing.ListingResponseNormalizer;
import com.snipebot.model.FeedItem;
import com.snipebot.model.SearchEndpoint;
import com.snipebot.proxy.CheckoutProxySelector;
import com.snipebot.proxy.ProxyPool;
import com.snipebot.proxy.ProxyPoolManager;
import com.snipebot.proxy.ProxyView;
import com.snipebot.scheduling.VirtualTimePipelineScheduler;
import com.snipebot.session.SessionMonitor;
import com.snipebot.support.RecordingEventPublisher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class FeedAggregatorTest {

    private static final Instant START = Instant.parse("2025-03-01T12:00:00Z");
    private static final String URL_A = "https://www.vinted.co.uk/catalog?search_text=wool";
    private static final String URL_B = "https://www.vinted.co.uk/catalog?search_text=boots";
    private static final String P0 = "http://10.0.0.1:8000";
    private static final String P1 = "http://10.0.0.2:8000";

    private VirtualTimePipelineScheduler scheduler;
    private RecordingEventPublisher events;
    private ProxyPoolManager proxies;
    private StubSearchClient search;
    private SimpleMeterRegistry meterRegistry;
    private FeedAggregator aggregator;
    private final List<List<FeedItem>> batches = new ArrayList<>();

    @BeforeEach
    void setUp() {
        scheduler = new VirtualTimePipelineScheduler(START);
        events = new RecordingEventPublisher();
        meterRegistry = new SimpleMeterRegistry();
        proxies = new ProxyPoolManager(scheduler.clock(), events, meterRegistry);
        proxies.configure(ProxyPool.SCRAPING, List.of(P0, P1));
        search = new StubSearchClient();

        SearchEndpointCatalog endpoints = () -> List.of(
                new SearchEndpoint(URL_A, true),
                new SearchEndpoint("https://www.vinted.co.uk/catalog?search_text=disabled", false),
                new SearchEndpoint(URL_B, true));
        SnipebotProperties.Feed feed = new SnipebotProperties.Feed(5, 0.3, 3, 1_000L, 1_000L, 5_000, 2_000);

        aggregator = new FeedAggregator(
                scheduler,
                search,
                proxies,
                endpoints,
                new ListingResponseNormalizer("https://www.vinted.co.uk"),
                new SessionMonitor(events),
                new CheckoutProxySelector(proxies, endpoints),
                events,
                feed,
                scheduler.clock(),
                new Random(7),
                meterRegistry);
        aggregator.addBatchListener(batches::add);
    }

    @Test
    void mergesDuplicatesAcrossEndpointsNewestFirst() {
        search.items(URL_A, 1, 1, 2).items(URL_B, 1, 2, 3);

        PollCycleReport report = runCycle();

        assertThat(report.aborted()).isFalse();
        assertThat(report.cycle()).isZero();
        assertThat(report.items()).extracting(FeedItem::id).containsExactly(3L, 1L, 2L);
        FeedItem shared = report.items().get(2);
        assertThat(shared.sourceUrls()).containsExactly(URL_A, URL_B);
        assertThat(report.newItemCount()).isEqualTo(3);
        assertThat(aggregator.cycle()).isEqualTo(1);
        assertThat(batches).hasSize(1);
        assertThat(events.ofType(PipelineEvent.FeedPublished.class)).hasSize(1);
        assertThat(search.calls()).hasSize(6);
        assertThat(search.callsFor(URL_A)).extracting(StubSearchClient.Call::page).containsExactly(1, 2, 3);
    }

    @Test
    void pausesBetweenEndpointsButNotBetweenPages() {
        search.items(URL_A, 1, 1).items(URL_B, 1, 2);

        CompletableFuture<PollCycleReport> cycle = aggregator.runPollCycle();
        scheduler.runDue();

        assertThat(search.callsFor(URL_A)).hasSize(3);
        assertThat(search.callsFor(URL_B)).isEmpty();
        assertThat(cycle).isNotDone();

        scheduler.advance(Duration.ofMillis(999));
        assertThat(search.callsFor(URL_B)).isEmpty();
        scheduler.advance(Duration.ofMillis(1));
        assertThat(search.callsFor(URL_B)).hasSize(3);
        assertThat(cycle).isCompleted();
    }

    @Test
    void repeatedCycleIsIdempotentAndRotatesProxies() {
        search.items(URL_A, 1, 1, 2).items(URL_B, 1, 3);

        PollCycleReport first = runCycle();
        PollCycleReport second = runCycle();

        assertThat(second.items()).extracting(FeedItem::id)
                .containsExactlyElementsOf(first.items().stream().map(FeedItem::id).toList());
        assertThat(second.newItemCount()).isZero();
        assertThat(second.cycle()).isEqualTo(1);

        assertThat(search.callsFor(URL_A).get(0).proxy()).isEqualTo(P0);
        assertThat(search.callsFor(URL_B).get(0).proxy()).isEqualTo(P1);
        assertThat(search.callsFor(URL_A).get(3).proxy()).isEqualTo(P1);
        assertThat(search.callsFor(URL_B).get(3).proxy()).isEqualTo(P0);
    }

    @Test
    void forbiddenStopsEndpointAndPenalisesItsProxy() {
        search.error(URL_A, 1, BridgeErrorCode.FORBIDDEN).items(URL_B, 1, 9);

        PollCycleReport report = runCycle();

        assertThat(search.callsFor(URL_A)).hasSize(1);
        assertThat(search.callsFor(URL_B).get(0).proxy()).isEqualTo(P1);
        assertThat(report.items()).extracting(FeedItem::id).containsExactly(9L);
        assertThat(proxies.statusSnapshot(ProxyPool.SCRAPING).cooldown()).extracting(ProxyView::url).containsExactly(P0);
        assertThat(meterRegistry.counter("feed.endpoint.failures").count()).isEqualTo(1.0);
    }

    @Test
    void sessionExpiryIsSignalledOnceWithoutProxyPenalty() {
        search.error(URL_A, 1, BridgeErrorCode.SESSION_EXPIRED).error(URL_B, 1, BridgeErrorCode.MISSING_COOKIE);

        PollCycleReport report = runCycle();

        assertThat(report.items()).isEmpty();
        assertThat(report.aborted()).isFalse();
        assertThat(events.ofType(PipelineEvent.SessionExpired.class)).hasSize(1);
        assertThat(proxies.statusSnapshot(ProxyPool.SCRAPING).active()).hasSize(2);
    }

    @Test
    void unreachableBridgeAbortsCycleWithoutPublishing() {
        search.error(URL_A, 1, BridgeErrorCode.BRIDGE_UNREACHABLE).items(URL_B, 1, 4);

        PollCycleReport report = runCycle();

        assertThat(report.aborted()).isTrue();
        assertThat(search.callsFor(URL_B)).isEmpty();
        assertThat(aggregator.cycle()).isZero();
        assertThat(batches).isEmpty();
        assertThat(events.ofType(PipelineEvent.FeedPublished.class)).isEmpty();
        assertThat(proxies.statusSnapshot(ProxyPool.SCRAPING).active()).hasSize(2);
    }

    @Test
    void pageErrorKeepsEarlierPagesAndStopsEndpoint() {
        search.items(URL_A, 1, 1).error(URL_A, 2, BridgeErrorCode.HTTP_ERROR).items(URL_B, 1, 2);

        PollCycleReport report = runCycle();

        assertThat(search.callsFor(URL_A)).extracting(StubSearchClient.Call::page).containsExactly(1, 2);
        assertThat(report.items()).extracting(FeedItem::id).containsExactlyInAnyOrder(1L, 2L);
    }

    @Test
    void endpointExceptionDoesNotAbortCycle() {
        search.throwing(URL_A, new IllegalStateException("boom")).items(URL_B, 1, 5);

        PollCycleReport report = runCycle();

        assertThat(report.aborted()).isFalse();
        assertThat(report.items()).extracting(FeedItem::id).containsExactly(5L);
        assertThat(batches).hasSize(1);
    }

    @Test
    void dedupeKeepsFirstSeenFieldsAndUnionsSources() {
        FeedItem a = item(1, URL_A, START);
        FeedItem b = item(1, URL_B, START.plusSeconds(5));
        FeedItem c = item(2, URL_B, START.plusSeconds(1));

        List<FeedItem> merged = FeedAggregator.dedupeAndSort(List.of(a, b, c));

        assertThat(merged).extracting(FeedItem::id).containsExactly(2L, 1L);
        assertThat(merged.get(1).sourceUrls()).containsExactly(URL_A, URL_B);
        assertThat(merged.get(1).fetchedAt()).isEqualTo(START);
    }

    private PollCycleReport runCycle() {
        CompletableFuture<PollCycleReport> future = aggregator.runPollCycle();
        scheduler.advance(Duration.ofSeconds(10));
        assertThat(future).isCompleted();
        return future.join();
    }

    private static FeedItem item(long id, String source, Instant fetchedAt) {
        return new FeedItem(id, "Item " + id, "1.00", "GBP", "", "", null, null, null, null, null, null,
                List.of(source), fetchedAt);
    }
}
