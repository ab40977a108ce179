package com.snipebot.bridge;

import com.snipebot.scheduling.PipelineScheduler;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Re-runs a bridge call while it reports {@link BridgeErrorCode#RATE_LIMITED}. Backoff is a scheduled wait on
 * the pipeline thread; any other outcome is returned as-is.
 *
 * The call is started on the pipeline thread and its result is handed back there, so the HTTP round trip never
 * occupies the pipeline.
 */
@Slf4j
public class RateLimitRetrier {

  private final PipelineScheduler scheduler;
  private final RetryPolicy policy;

  public RateLimitRetrier(PipelineScheduler scheduler, RetryPolicy policy) {
    this.scheduler = scheduler;
    this.policy = policy;
  }

  public CompletableFuture<BridgeResult> call(String operation, Supplier<CompletableFuture<BridgeResult>> call) {
    return attempt(operation, call, 1);
  }

  private CompletableFuture<BridgeResult> attempt(String operation, Supplier<CompletableFuture<BridgeResult>> call,
                                                  int attempt) {
    return scheduler.submit(call).thenCompose(scheduler::resume).thenCompose(result -> {
      if (result.ok() || !result.errorCode().isRetryable() || attempt >= policy.maxAttempts()) {
        if (!result.ok() && result.errorCode().isRetryable()) {
          log.warn("{} still rate limited after {} attempts", operation, attempt);
        }
        return CompletableFuture.completedFuture(result);
      }
      Duration backoff = policy.backoffAfter(attempt);
      log.info("{} rate limited (attempt {}/{}), retrying in {}ms",
          operation, attempt, policy.maxAttempts(), backoff.toMillis());
      return scheduler.delay(backoff).thenCompose(ignored -> attempt(operation, call, attempt + 1));
    });
  }
}
