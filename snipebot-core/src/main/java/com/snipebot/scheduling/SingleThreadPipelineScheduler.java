package com.snipebot.scheduling;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

@Slf4j
public class SingleThreadPipelineScheduler implements PipelineScheduler, AutoCloseable {

  private final ScheduledExecutorService executor;

  public SingleThreadPipelineScheduler(String threadName) {
    this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, threadName);
      t.setDaemon(true);
      return t;
    });
  }

  @Override
  public ScheduledHandle schedule(Duration delay, Runnable task) {
    long millis = Math.max(0L, delay.toMillis());
    ScheduledFuture<?> future = executor.schedule(() -> runSafely(task), millis, TimeUnit.MILLISECONDS);
    return new ScheduledHandle() {
      @Override
      public boolean cancel() {
        return future.cancel(false);
      }

      @Override
      public boolean isPending() {
        return !future.isDone();
      }
    };
  }

  @Override
  public <T> CompletableFuture<T> submit(Supplier<T> task) {
    return CompletableFuture.supplyAsync(task, executor);
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }

  private static void runSafely(Runnable task) {
    try {
      task.run();
    } catch (Exception e) {
      log.error("pipeline task failed, continuing scheduler loop", e);
    }
  }
}
