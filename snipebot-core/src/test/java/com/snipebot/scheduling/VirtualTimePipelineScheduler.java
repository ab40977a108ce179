package com.snipebot.scheduling;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.PriorityQueue;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Deterministic scheduler driven by a virtual clock. Nothing runs until {@link #runDue()} or
 * {@link #advance(Duration)} is called on the driving thread, which then plays the role of the pipeline thread.
 *
 * Used for replaying pipeline timing (countdowns, pauses, backoff) without waiting in real time.
 */
public class VirtualTimePipelineScheduler implements PipelineScheduler {

  private final PriorityQueue<Task> queue = new PriorityQueue<>(
      Comparator.comparing((Task t) -> t.dueAt).thenComparingLong(t -> t.seq));
  private final Clock clock = new VirtualClock(ZoneOffset.UTC);
  private Instant now;
  private long seq;

  public VirtualTimePipelineScheduler(Instant start) {
    this.now = start;
  }

  @Override
  public ScheduledHandle schedule(Duration delay, Runnable runnable) {
    Duration d = delay == null || delay.isNegative() ? Duration.ZERO : delay;
    Task task = new Task(now.plus(d), seq++, runnable);
    queue.add(task);
    return task;
  }

  @Override
  public <T> CompletableFuture<T> submit(Supplier<T> supplier) {
    CompletableFuture<T> future = new CompletableFuture<>();
    schedule(Duration.ZERO, () -> {
      try {
        future.complete(supplier.get());
      } catch (RuntimeException e) {
        future.completeExceptionally(e);
      }
    });
    return future;
  }

  /**
   * Run every task due at the current instant, including ones those tasks schedule for now.
   */
  public void runDue() {
    advanceTo(now);
  }

  public void advance(Duration duration) {
    advanceTo(now.plus(duration));
  }

  /**
   * Run tasks in due order up to {@code target}, moving the clock to each task's due time as it runs.
   */
  public void advanceTo(Instant target) {
    while (!queue.isEmpty() && !queue.peek().dueAt.isAfter(target)) {
      Task task = queue.poll();
      if (task.dueAt.isAfter(now)) {
        now = task.dueAt;
      }
      if (!task.cancelled) {
        task.done = true;
        task.runnable.run();
      }
    }
    if (target.isAfter(now)) {
      now = target;
    }
  }

  public int pendingTaskCount() {
    return (int) queue.stream().filter(t -> !t.cancelled).count();
  }

  public Instant now() {
    return now;
  }

  public Clock clock() {
    return clock;
  }

  private static final class Task implements ScheduledHandle {
    private final Instant dueAt;
    private final long seq;
    private final Runnable runnable;
    private boolean cancelled;
    private boolean done;

    private Task(Instant dueAt, long seq, Runnable runnable) {
      this.dueAt = dueAt;
      this.seq = seq;
      this.runnable = runnable;
    }

    @Override
    public boolean cancel() {
      if (done || cancelled) {
        return false;
      }
      cancelled = true;
      return true;
    }

    @Override
    public boolean isPending() {
      return !done && !cancelled;
    }
  }

  private final class VirtualClock extends Clock {
    private final ZoneId zone;

    private VirtualClock(ZoneId zone) {
      this.zone = zone;
    }

    @Override
    public ZoneId getZone() {
      return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return new VirtualClock(zone);
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}
