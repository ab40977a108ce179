package com.snipebot.feed;

import com.snipebot.config.SnipebotProperties;
import com.snipebot.scheduling.PipelineScheduler;
import com.snipebot.scheduling.ScheduledHandle;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Random;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives {@link FeedAggregator#runPollCycle()} on a jittered timer.
 *
 * The first cycle runs immediately on {@link #start()}. Each following delay is the base interval (never below
 * 3 s) scaled by a fresh uniform factor in {@code [1 - jitter, 1 + jitter]}. A tick that finds the previous cycle
 * still running is skipped.
 */
@Slf4j
public class FeedPoller {

    private final FeedAggregator aggregator;
    private final PipelineScheduler scheduler;
    private final SnipebotProperties.Feed config;
    private final Random random;

    private final AtomicBoolean active = new AtomicBoolean(false);
    private final AtomicBoolean cycleInFlight = new AtomicBoolean(false);
    private volatile ScheduledHandle nextTick;

    public FeedPoller(FeedAggregator aggregator, PipelineScheduler scheduler, SnipebotProperties.Feed config,
                      Random random) {
        this.aggregator = aggregator;
        this.scheduler = scheduler;
        this.config = config;
        this.random = random;
    }

    public void start() {
        if (!active.compareAndSet(false, true)) {
            return;
        }
        log.info("feed polling started intervalSeconds={} jitter={}",
                config.effectivePollIntervalSeconds(), config.pollJitterFraction());
        nextTick = scheduler.schedule(Duration.ZERO, this::tick);
    }

    public void stop() {
        if (!active.compareAndSet(true, false)) {
            return;
        }
        ScheduledHandle handle = nextTick;
        if (handle != null) {
            handle.cancel();
        }
        log.info("feed polling stopped");
    }

    public boolean isActive() {
        return active.get();
    }

    Duration nextInterval() {
        long baseMillis = config.effectivePollIntervalSeconds() * 1000L;
        double jitter = config.pollJitterFraction();
        double factor = 1.0 + (random.nextDouble() * 2.0 - 1.0) * jitter;
        return Duration.ofMillis(Math.round(baseMillis * factor));
    }

    private void tick() {
        if (!active.get()) {
            return;
        }
        if (cycleInFlight.compareAndSet(false, true)) {
            aggregator.runPollCycle().whenComplete((report, error) -> {
                cycleInFlight.set(false);
                if (error != null) {
                    log.error("feed poll cycle failed", error);
                }
            });
        } else {
            log.debug("feed poll tick skipped: previous cycle still running");
        }
        if (active.get()) {
            nextTick = scheduler.schedule(nextInterval(), this::tick);
        }
    }
}
