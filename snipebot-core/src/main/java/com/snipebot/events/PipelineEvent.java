package com.snipebot.events;

import com.snipebot.model.FeedItem;
import com.snipebot.proxy.ProxyPool;
import com.snipebot.proxy.ProxyStatus;

import java.time.Instant;
import java.util.List;

/**
 * Structured events for the log viewer and live dashboard (proxy table, countdown modal).
 */
public interface PipelineEvent {

  String type();

  record FeedPublished(long cycle, int endpointCount, int newItemCount, List<FeedItem> items) implements PipelineEvent {
    @Override
    public String type() {
      return "feed.items";
    }
  }

  record SessionExpired(String code, String message) implements PipelineEvent {
    @Override
    public String type() {
      return "session.expired";
    }
  }

  record SessionReconnected() implements PipelineEvent {
    @Override
    public String type() {
      return "session.reconnected";
    }
  }

  record ProxyStateChanged(
      String proxy,          // credentials masked
      ProxyPool pool,
      ProxyStatus status,
      int strikeCount,
      Instant cooldownUntil
  ) implements PipelineEvent {
    @Override
    public String type() {
      return "proxy.state";
    }
  }

  record MatchSkipped(long ruleId, long itemId, String reason) implements PipelineEvent {
    @Override
    public String type() {
      return "sniper.match-skipped";
    }
  }

  record CountdownStarted(String countdownId, FeedItem item, long ruleId, String ruleName, int secondsLeft) implements PipelineEvent {
    @Override
    public String type() {
      return "sniper.countdown";
    }
  }

  record CountdownCancelled(String countdownId) implements PipelineEvent {
    @Override
    public String type() {
      return "sniper.countdown-cancelled";
    }
  }

  record CountdownFinished(String countdownId, boolean simulated, boolean ok, String message) implements PipelineEvent {
    @Override
    public String type() {
      return "sniper.countdown-done";
    }
  }

  record CheckoutProgress(long itemId, String step, String message) implements PipelineEvent {
    @Override
    public String type() {
      return "checkout.progress";
    }
  }

  record ApprovalRequired(long itemId, String purchaseId, String redirectUrl) implements PipelineEvent {
    @Override
    public String type() {
      return "checkout.approval-required";
    }
  }
}
