package com.snipebot.sniper;

import com.snipebot.catalog.RuleCatalog;
import com.snipebot.checkout.CheckoutOrchestrator;
import com.snipebot.checkout.CheckoutResult;
import com.snipebot.config.SnipebotProperties;
import com.snipebot.events.PipelineEvent;
import com.snipebot.events.PipelineEventPublisher;
import com.snipebot.ledger.PurchaseLedger;
import com.snipebot.listing.RecentlySeenIds;
import com.snipebot.model.AcquisitionRule;
import com.snipebot.model.FeedItem;
import com.snipebot.proxy.CheckoutProxySelector;
import com.snipebot.scheduling.PipelineScheduler;
import com.snipebot.scheduling.ScheduledHandle;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Matches newly seen items against enabled rules and arms a short countdown before each purchase.
 *
 * Items are processed once: the engine keeps its own recently-seen set. Countdowns are created synchronously in
 * item order then rule order. Mutations happen on the pipeline thread; {@link #pendingCountdowns()} may be read
 * from anywhere.
 */
@Slf4j
public class SniperEngine {

    static final String SIMULATION_MESSAGE = "[Simulation] Would have bought: %s (£%s)";

    private final PipelineScheduler scheduler;
    private final RuleCatalog rules;
    private final PurchaseLedger ledger;
    private final SniperToggles toggles;
    private final CheckoutProxySelector proxySelector;
    private final CheckoutOrchestrator checkout;
    private final PipelineEventPublisher events;
    private final Duration countdownWindow;
    private final Clock clock;

    private final RecentlySeenIds seen;
    private final Map<String, Pending> pending = new ConcurrentHashMap<>();

    private final Counter matchesCounter;
    private final Counter budgetSkipsCounter;
    private final Counter countdownsStartedCounter;
    private final Counter countdownsCancelledCounter;
    private final Counter simulatedCounter;

    public SniperEngine(
            PipelineScheduler scheduler,
            RuleCatalog rules,
            PurchaseLedger ledger,
            SniperToggles toggles,
            CheckoutProxySelector proxySelector,
            CheckoutOrchestrator checkout,
            PipelineEventPublisher events,
            SnipebotProperties.Sniper sniperConfig,
            SnipebotProperties.Feed feedConfig,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        this.scheduler = scheduler;
        this.rules = rules;
        this.ledger = ledger;
        this.toggles = toggles;
        this.proxySelector = proxySelector;
        this.checkout = checkout;
        this.events = events;
        this.countdownWindow = Duration.ofSeconds(sniperConfig.countdownSeconds());
        this.clock = clock;
        this.seen = new RecentlySeenIds(feedConfig.seenMaxSize(), feedConfig.seenRetain());

        this.matchesCounter = Counter.builder("sniper.matches")
                .description("Item/rule matches")
                .register(meterRegistry);
        this.budgetSkipsCounter = Counter.builder("sniper.budget.skips")
                .description("Matches skipped because the rule budget would be exceeded")
                .register(meterRegistry);
        this.countdownsStartedCounter = Counter.builder("sniper.countdowns.started")
                .register(meterRegistry);
        this.countdownsCancelledCounter = Counter.builder("sniper.countdowns.cancelled")
                .register(meterRegistry);
        this.simulatedCounter = Counter.builder("sniper.purchases.simulated")
                .register(meterRegistry);
    }

    /**
     * Entry point for each published feed batch. Must run on the pipeline thread.
     */
    public void onNewItems(List<FeedItem> items) {
        List<AcquisitionRule> enabled = rules.enabled();
        if (enabled.isEmpty()) {
            return;
        }

        List<FeedItem> fresh = new ArrayList<>();
        for (FeedItem item : items) {
            if (!seen.contains(item.id())) {
                fresh.add(item);
            }
        }
        for (FeedItem item : fresh) {
            seen.add(item.id());
        }

        for (FeedItem item : fresh) {
            for (AcquisitionRule rule : enabled) {
                try {
                    evaluate(item, rule);
                } catch (RuntimeException e) {
                    log.error("sniper evaluation failed ruleId={} itemId={}", rule.id(), item.id(), e);
                }
            }
        }
    }

    /**
     * Cancel a countdown that has not fired yet.
     *
     * @return completes with false when the countdown is unknown or already fired
     */
    public CompletableFuture<Boolean> cancel(String countdownId) {
        return scheduler.submit(() -> cancelNow(countdownId));
    }

    boolean cancelNow(String countdownId) {
        Pending p = pending.get(countdownId);
        if (p == null || !p.handle().cancel()) {
            return false;
        }
        pending.remove(countdownId);
        countdownsCancelledCounter.increment();
        log.info("sniper countdown cancelled id={}", countdownId);
        events.publish(new PipelineEvent.CountdownCancelled(countdownId));
        return true;
    }

    public List<Countdown> pendingCountdowns() {
        return pending.values().stream()
                .map(Pending::countdown)
                .sorted(Comparator.comparing(Countdown::startedAt))
                .toList();
    }

    private void evaluate(FeedItem item, AcquisitionRule rule) {
        if (!RuleMatcher.matches(item, rule)) {
            return;
        }
        matchesCounter.increment();

        BigDecimal price = item.priceValue();
        BigDecimal spent = spentSafe(rule.id());
        if (rule.hasBudgetLimit() && spent.add(price).compareTo(rule.budgetLimit()) > 0) {
            budgetSkipsCounter.increment();
            log.info("sniper budget exceeded ruleId={} itemId={} spent={} price={} limit={}",
                    rule.id(), item.id(), spent, price, rule.budgetLimit());
            events.publish(new PipelineEvent.MatchSkipped(rule.id(), item.id(), "budget exceeded"));
            return;
        }

        if (!toggles.autobuyEnabled()) {
            log.info("sniper matched but autobuy off ruleId={} itemId={}", rule.id(), item.id());
            events.publish(new PipelineEvent.MatchSkipped(rule.id(), item.id(), "autobuy off"));
            return;
        }

        boolean alreadyLive = pending.values().stream()
                .anyMatch(p -> p.countdown().ruleId() == rule.id() && p.countdown().item().id() == item.id());
        if (alreadyLive) {
            log.debug("sniper countdown already live ruleId={} itemId={}", rule.id(), item.id());
            return;
        }

        startCountdown(item, rule);
    }

    private void startCountdown(FeedItem item, AcquisitionRule rule) {
        Instant now = clock.instant();
        Countdown countdown = new Countdown(
                Countdown.idFor(rule.id(), item.id(), now), item, rule.id(), rule.name(), now, now.plus(countdownWindow));

        ScheduledHandle handle = scheduler.schedule(countdownWindow, () -> onExpiry(countdown));
        pending.put(countdown.id(), new Pending(countdown, handle));
        countdownsStartedCounter.increment();
        log.info("sniper countdown started id={} ruleId={} itemId={} price={}",
                countdown.id(), rule.id(), item.id(), item.price());
        events.publish(new PipelineEvent.CountdownStarted(
                countdown.id(), item, rule.id(), rule.name(), (int) countdownWindow.toSeconds()));
    }

    private void onExpiry(Countdown countdown) {
        if (pending.remove(countdown.id()) == null) {
            return;
        }
        FeedItem item = countdown.item();

        if (toggles.simulationMode()) {
            simulatedCounter.increment();
            String message = SIMULATION_MESSAGE.formatted(item.title(), item.price());
            log.info("sniper would have bought ruleId={} ruleName={} itemId={} title={} price={}",
                    countdown.ruleId(), countdown.ruleName(), item.id(), item.title(), item.price());
            events.publish(new PipelineEvent.CountdownFinished(countdown.id(), true, true, message));
            return;
        }

        String proxy = proxySelector.select(item).orElse(null);
        checkout.runCheckout(item, proxy, countdown.ruleId()).whenComplete((result, error) -> {
            CheckoutResult outcome = error == null
                    ? result
                    : CheckoutResult.failed(null, "Checkout failed: " + error.getMessage());
            events.publish(new PipelineEvent.CountdownFinished(countdown.id(), false, outcome.ok(), outcome.message()));
        });
    }

    private BigDecimal spentSafe(long ruleId) {
        try {
            BigDecimal spent = ledger.spentForRule(ruleId);
            return spent == null ? BigDecimal.ZERO : spent;
        } catch (RuntimeException e) {
            log.warn("sniper spend lookup failed ruleId={}, assuming 0: {}", ruleId, e.toString());
            return BigDecimal.ZERO;
        }
    }

    private record Pending(Countdown countdown, ScheduledHandle handle) {
    }
}
