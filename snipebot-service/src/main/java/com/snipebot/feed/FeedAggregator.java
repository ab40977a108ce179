package com.snipebot.feed;

import com.snipebot.bridge.BridgeErrorCode;
import com.snipebot.bridge.SearchClient;
import com.snipebot.catalog.SearchEndpointCatalog;
import com.snipebot.config.SnipebotProperties;
import com.snipebot.events.PipelineEvent;
import com.snipebot.events.PipelineEventPublisher;
import com.snipebot.listing.ListingResponseNormalizer;
import com.snipebot.listing.RecentlySeenIds;
import com.snipebot.model.FeedItem;
import com.snipebot.model.SearchEndpoint;
import com.snipebot.proxy.CheckoutProxySelector;
import com.snipebot.proxy.ProxyPool;
import com.snipebot.proxy.ProxyPoolManager;
import com.snipebot.proxy.ProxyUrls;
import com.snipebot.scheduling.PipelineScheduler;
import com.snipebot.session.SessionMonitor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Sweeps every enabled search endpoint once per cycle and publishes the merged, newest-first batch.
 *
 * Each endpoint gets the scraping proxy at {@code endpointIndex + cycle}, so a given endpoint drifts across the
 * pool from cycle to cycle. Pages of one endpoint are fetched back to back; endpoints are separated by a random
 * pause. Bookkeeping runs on the pipeline thread; search requests are in flight off it.
 */
@Slf4j
public class FeedAggregator {

    private final PipelineScheduler scheduler;
    private final SearchClient searchClient;
    private final ProxyPoolManager proxies;
    private final SearchEndpointCatalog endpoints;
    private final ListingResponseNormalizer normalizer;
    private final SessionMonitor sessionMonitor;
    private final CheckoutProxySelector stickyProxies;
    private final PipelineEventPublisher events;
    private final SnipebotProperties.Feed config;
    private final Clock clock;
    private final Random random;

    private final RecentlySeenIds recentlySeen;
    private final List<Consumer<List<FeedItem>>> batchListeners = new CopyOnWriteArrayList<>();
    private volatile List<FeedItem> lastBatch = List.of();
    private long cycle;

    private final Counter cyclesCounter;
    private final Counter abortedCyclesCounter;
    private final Counter itemsPublishedCounter;
    private final Counter newItemsCounter;
    private final Counter endpointFailuresCounter;

    public FeedAggregator(
            PipelineScheduler scheduler,
            SearchClient searchClient,
            ProxyPoolManager proxies,
            SearchEndpointCatalog endpoints,
            ListingResponseNormalizer normalizer,
            SessionMonitor sessionMonitor,
            CheckoutProxySelector stickyProxies,
            PipelineEventPublisher events,
            SnipebotProperties.Feed config,
            Clock clock,
            Random random,
            MeterRegistry meterRegistry
    ) {
        this.scheduler = scheduler;
        this.searchClient = searchClient;
        this.proxies = proxies;
        this.endpoints = endpoints;
        this.normalizer = normalizer;
        this.sessionMonitor = sessionMonitor;
        this.stickyProxies = stickyProxies;
        this.events = events;
        this.config = config;
        this.clock = clock;
        this.random = random;
        this.recentlySeen = new RecentlySeenIds(config.seenMaxSize(), config.seenRetain());

        this.cyclesCounter = Counter.builder("feed.poll.cycles")
                .description("Completed poll cycles")
                .register(meterRegistry);
        this.abortedCyclesCounter = Counter.builder("feed.poll.cycles.aborted")
                .description("Poll cycles abandoned because the bridge was unreachable")
                .register(meterRegistry);
        this.itemsPublishedCounter = Counter.builder("feed.items.published")
                .description("Items published after dedupe")
                .register(meterRegistry);
        this.newItemsCounter = Counter.builder("feed.items.new")
                .description("Published items not seen in recent cycles")
                .register(meterRegistry);
        this.endpointFailuresCounter = Counter.builder("feed.endpoint.failures")
                .description("Endpoint polls that stopped on an error")
                .register(meterRegistry);
    }

    /**
     * Receives each published batch, newest first.
     */
    public void addBatchListener(Consumer<List<FeedItem>> listener) {
        batchListeners.add(listener);
    }

    public CompletableFuture<PollCycleReport> runPollCycle() {
        return scheduler.submit(() -> {
            List<SearchEndpoint> enabled = endpoints.enabled();
            if (enabled.isEmpty()) {
                log.debug("feed poll skipped: no enabled search endpoints");
                return CompletableFuture.completedFuture(new PollCycleReport(cycle, 0, List.of(), 0, false));
            }
            return sweep(enabled, 0, new ArrayList<>());
        }).thenCompose(f -> f);
    }

    public long cycle() {
        return cycle;
    }

    public List<FeedItem> lastBatch() {
        return lastBatch;
    }

    private CompletableFuture<PollCycleReport> sweep(List<SearchEndpoint> enabled, int index, List<FeedItem> collected) {
        SearchEndpoint endpoint = enabled.get(index);
        CompletableFuture<EndpointPoll> poll;
        try {
            poll = pollEndpoint(endpoint.url(), index);
        } catch (RuntimeException e) {
            poll = CompletableFuture.failedFuture(e);
        }

        return poll.exceptionally(e -> {
            endpointFailuresCounter.increment();
            log.error("feed poll exception url={}", endpoint.url(), unwrap(e));
            return EndpointPoll.EMPTY;
        }).thenCompose(result -> {
            if (result.unreachable()) {
                abortedCyclesCounter.increment();
                log.warn("feed poll aborted: bridge unreachable cycle={} url={}", cycle, endpoint.url());
                return CompletableFuture.completedFuture(PollCycleReport.aborted(cycle, enabled.size()));
            }
            collected.addAll(result.items());

            if (index + 1 >= enabled.size()) {
                return CompletableFuture.completedFuture(publish(enabled.size(), collected));
            }
            return scheduler.delay(endpointPause())
                    .thenCompose(ignored -> sweep(enabled, index + 1, collected));
        });
    }

    private CompletableFuture<EndpointPoll> pollEndpoint(String url, int endpointIndex) {
        String proxy = proxies.assignForPollCycle(ProxyPool.SCRAPING, endpointIndex + cycle).orElse(null);
        stickyProxies.rememberEndpointProxy(url, proxy);
        return fetchPage(new EndpointProgress(url, proxy), 1);
    }

    /**
     * Pages are fetched back to back; each response is handled on the pipeline thread.
     */
    private CompletableFuture<EndpointPoll> fetchPage(EndpointProgress progress, int page) {
        if (page > config.pagesPerEndpoint()) {
            return CompletableFuture.completedFuture(progress.finish());
        }
        return scheduler.resume(searchClient.search(progress.url, page, progress.proxy)).thenCompose(result -> {
            if (result.ok()) {
                progress.succeeded = true;
                progress.items.addAll(normalizer.normalize(result.data(), progress.url, clock.instant()));
                return fetchPage(progress, page + 1);
            }

            BridgeErrorCode code = result.errorCode();
            if (code.isConnectivity()) {
                return CompletableFuture.completedFuture(EndpointPoll.UNREACHABLE);
            }
            endpointFailuresCounter.increment();
            log.warn("feed poll error url={} page={} proxy={} code={} message={}",
                    progress.url, page, ProxyUrls.mask(progress.proxy), result.code(), result.message());
            if (code.isIdentityDamaging() && progress.proxy != null) {
                proxies.reportForbidden(progress.proxy);
                progress.penalised = true;
            } else if (code.isSessionLevel()) {
                sessionMonitor.markExpired(result.code(), result.message());
            }
            return CompletableFuture.completedFuture(progress.finish());
        });
    }

    private PollCycleReport publish(int endpointCount, List<FeedItem> collected) {
        List<FeedItem> batch = dedupeAndSort(collected);
        int fresh = 0;
        for (FeedItem item : batch) {
            if (recentlySeen.add(item.id())) {
                fresh++;
            }
        }

        long publishedCycle = cycle;
        lastBatch = batch;
        events.publish(new PipelineEvent.FeedPublished(publishedCycle, endpointCount, fresh, batch));
        for (Consumer<List<FeedItem>> listener : batchListeners) {
            try {
                listener.accept(batch);
            } catch (Exception e) {
                log.error("feed batch listener failed cycle={}", publishedCycle, e);
            }
        }
        cycle++;

        cyclesCounter.increment();
        itemsPublishedCounter.increment(batch.size());
        newItemsCounter.increment(fresh);
        log.info("feed poll complete cycle={} endpoints={} items={} new={}",
                publishedCycle, endpointCount, batch.size(), fresh);
        return new PollCycleReport(publishedCycle, endpointCount, batch, fresh, false);
    }

    /**
     * One item per id with the union of its sources, newest {@code fetchedAt} first. Items fetched at the same
     * instant keep discovery order.
     */
    static List<FeedItem> dedupeAndSort(List<FeedItem> items) {
        Map<Long, FeedItem> byId = new LinkedHashMap<>();
        for (FeedItem item : items) {
            byId.merge(item.id(), item, FeedItem::mergeSources);
        }
        List<FeedItem> out = new ArrayList<>(byId.values());
        out.sort(Comparator.comparing(FeedItem::fetchedAt, Comparator.nullsLast(Comparator.reverseOrder())));
        return List.copyOf(out);
    }

    private Duration endpointPause() {
        long min = config.endpointPauseMinMillis();
        long max = config.endpointPauseMaxMillis();
        long span = max - min;
        long millis = span <= 0 ? min : min + (long) (random.nextDouble() * span);
        return Duration.ofMillis(millis);
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private final class EndpointProgress {
        private final String url;
        private final String proxy;
        private final List<FeedItem> items = new ArrayList<>();
        private boolean succeeded;
        private boolean penalised;

        private EndpointProgress(String url, String proxy) {
            this.url = url;
            this.proxy = proxy;
        }

        private EndpointPoll finish() {
            if (succeeded && !penalised && proxy != null) {
                proxies.reportSuccess(proxy);
            }
            return new EndpointPoll(items, false);
        }
    }

    private record EndpointPoll(List<FeedItem> items, boolean unreachable) {
        static final EndpointPoll EMPTY = new EndpointPoll(List.of(), false);
        static final EndpointPoll UNREACHABLE = new EndpointPoll(List.of(), true);
    }
}
