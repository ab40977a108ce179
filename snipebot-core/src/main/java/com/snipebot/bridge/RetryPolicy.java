package com.snipebot.bridge;

import com.snipebot.config.SnipebotProperties;

import java.time.Duration;

/**
 * Bounded exponential backoff: attempt {@code n} (1-based) that fails waits
 * {@code initialBackoff * multiplier^(n-1)} before the next attempt.
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier) {

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    if (initialBackoff == null || initialBackoff.isNegative()) {
      throw new IllegalArgumentException("initialBackoff must be >= 0");
    }
    if (multiplier < 1.0) {
      throw new IllegalArgumentException("multiplier must be >= 1");
    }
  }

  public static RetryPolicy from(SnipebotProperties.Retry retry) {
    return new RetryPolicy(retry.maxAttempts(), Duration.ofMillis(retry.initialBackoffMillis()), retry.multiplier());
  }

  public Duration backoffAfter(int failedAttempt) {
    double factor = Math.pow(multiplier, Math.max(0, failedAttempt - 1));
    return Duration.ofMillis(Math.round(initialBackoff.toMillis() * factor));
  }
}
