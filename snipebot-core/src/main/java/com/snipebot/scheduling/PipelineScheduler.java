package com.snipebot.scheduling;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * The single logical thread every pipeline task runs on.
 *
 * Proxy health, seen-item sets and pending countdowns are only touched from tasks submitted here, so they
 * need no locking. Delays (poll timer, countdown window, endpoint pause, retry backoff) are expressed as
 * scheduled tasks instead of sleeps.
 */
public interface PipelineScheduler {

  /**
   * Run {@code task} on the pipeline thread once {@code delay} has elapsed.
   */
  ScheduledHandle schedule(Duration delay, Runnable task);

  /**
   * Run {@code task} on the pipeline thread as soon as possible and expose its result.
   */
  <T> CompletableFuture<T> submit(Supplier<T> task);

  /**
   * A future completed on the pipeline thread after {@code delay}.
   */
  default CompletableFuture<Void> delay(Duration delay) {
    CompletableFuture<Void> done = new CompletableFuture<>();
    schedule(delay, () -> done.complete(null));
    return done;
  }

  /**
   * Mirrors {@code stage} into a future whose dependents run on the pipeline thread. Used to bring I/O results
   * completed on another executor back onto the pipeline.
   */
  default <T> CompletableFuture<T> resume(CompletionStage<T> stage) {
    CompletableFuture<T> resumed = new CompletableFuture<>();
    stage.whenComplete((value, error) -> schedule(Duration.ZERO, () -> {
      if (error != null) {
        resumed.completeExceptionally(error);
      } else {
        resumed.complete(value);
      }
    }));
    return resumed;
  }
}
