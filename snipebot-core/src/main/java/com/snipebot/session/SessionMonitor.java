package com.snipebot.session;

import com.snipebot.events.PipelineEvent;
import com.snipebot.events.PipelineEventPublisher;
import lombok.extern.slf4j.Slf4j;

/**
 * Raises the session-expired signal once per outage. A reconnect re-arms it.
 */
@Slf4j
public class SessionMonitor {

  private final PipelineEventPublisher events;
  private volatile boolean expiredSignalled;

  public SessionMonitor(PipelineEventPublisher events) {
    this.events = events;
  }

  /**
   * @return true when this call emitted the signal, false when it had already been raised
   */
  public boolean markExpired(String code, String message) {
    if (expiredSignalled) {
      log.debug("session expired again code={}, already signalled", code);
      return false;
    }
    expiredSignalled = true;
    log.warn("session expired code={} message={}", code, message);
    events.publish(new PipelineEvent.SessionExpired(code, message));
    return true;
  }

  public void markReconnected() {
    boolean wasExpired = expiredSignalled;
    expiredSignalled = false;
    if (wasExpired) {
      log.info("session reconnected");
    }
    events.publish(new PipelineEvent.SessionReconnected());
  }

  public boolean isExpired() {
    return expiredSignalled;
  }
}
